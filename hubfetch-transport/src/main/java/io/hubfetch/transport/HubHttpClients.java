package io.hubfetch.transport;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import okhttp3.ConnectionPool;
import okhttp3.Credentials;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/// Builds the OkHttp clients used to talk to the hub.
///
/// Transfers of large products can stall for minutes while the hub stages data, so the read
/// timeout is generous. Request concurrency is bounded by the download core, not by OkHttp, so
/// the dispatcher limits are set high enough never to interfere.
public final class HubHttpClients {

    /// Default connect timeout
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(30);
    /// Default read timeout
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofMinutes(5);

    static final String USER_AGENT = "hubfetch/0.1";

    private HubHttpClients() {
    }

    /// @param user the hub user name, or null for anonymous access
    /// @param password the hub password
    /// @return a client sending basic credentials with every request
    public static OkHttpClient create(String user, String password) {
        return create(user, password, DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
    }

    /// @param user the hub user name, or null for anonymous access
    /// @param password the hub password
    /// @param connectTimeout the connect timeout
    /// @param readTimeout the read timeout, applied between received bytes
    /// @return a client sending basic credentials with every request
    public static OkHttpClient create(String user, String password, Duration connectTimeout, Duration readTimeout) {
        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequests(128);
        dispatcher.setMaxRequestsPerHost(64);

        String credentials = user == null ? null : Credentials.basic(user, password == null ? "" : password);
        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(16, 5, TimeUnit.MINUTES))
            .dispatcher(dispatcher)
            .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .writeTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .followRedirects(true)
            .retryOnConnectionFailure(true)
            .addInterceptor(chain -> {
                Request.Builder request = chain.request().newBuilder().header("User-Agent", USER_AGENT);
                if (credentials != null) {
                    request.header("Authorization", credentials);
                }
                return chain.proceed(request.build());
            })
            .build();
    }
}
