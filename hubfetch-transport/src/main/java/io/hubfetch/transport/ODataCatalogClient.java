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

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.hubfetch.api.catalog.CatalogClient;
import io.hubfetch.api.catalog.Checksum;
import io.hubfetch.api.catalog.NodeDescriptor;
import io.hubfetch.api.catalog.ProductDescriptor;
import io.hubfetch.api.errors.DataHubException;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/// {@link CatalogClient} for the OData interface of a data hub.
///
/// All URLs are derived from the API root, e.g. `https://hub.example.org/`:
/// - metadata: `<api>odata/v1/Products('<id>')?$format=json`
/// - online flag: `<api>odata/v1/Products('<id>')/Online/$value`
/// - quicklook: `<api>odata/v1/Products('<id>')/Products('Quicklook')/$value`
/// - package files: `<api>odata/v1/Products('<id>')/Nodes('<title>.SAFE')/Nodes('dir')/Nodes('file')/$value`
public class ODataCatalogClient implements CatalogClient {
    private static final Logger logger = LogManager.getLogger(ODataCatalogClient.class);
    private static final Gson gson = new Gson();

    static final String ARCHIVE_SUFFIX = ".zip";
    static final String PACKAGE_SUFFIX = ".SAFE";
    static final String MANIFEST_PATH = "manifest.safe";

    private final OkHttpClient http;
    private final String apiUrl;

    /// @param http the client, usually from {@link HubHttpClients}
    /// @param apiUrl the API root URL
    public ODataCatalogClient(OkHttpClient http, String apiUrl) {
        if (apiUrl == null || apiUrl.isBlank()) {
            throw new IllegalArgumentException("API URL is required");
        }
        this.http = http;
        this.apiUrl = apiUrl.endsWith("/") ? apiUrl : apiUrl + "/";
    }

    /// @return the API root URL, ending with a slash
    public String getApiUrl() {
        return apiUrl;
    }

    String productUrl(String id) {
        return apiUrl + "odata/v1/Products('" + id + "')";
    }

    @Override
    public ProductDescriptor getProductMetadata(String id) throws IOException {
        String what = "Metadata request for " + id;
        ODataModel.ProductEnvelope envelope =
            parse(fetchString(productUrl(id) + "?$format=json", what), ODataModel.ProductEnvelope.class, what);
        ODataModel.ProductEntry entry = envelope == null ? null : envelope.d;
        if (entry == null || entry.id == null || entry.name == null) {
            throw new DataHubException("Invalid API response for " + what + ": product entry is missing");
        }

        Checksum checksum = entry.checksum == null
            ? null
            : Checksum.ofHubValues(entry.checksum.algorithm, entry.checksum.value);
        if (checksum == null) {
            logger.debug("{} declares no supported checksum", id);
        }
        String url = entry.metadata != null && entry.metadata.mediaSrc != null
            ? entry.metadata.mediaSrc
            : productUrl(entry.id) + "/$value";
        boolean online = entry.online == null || entry.online;

        return new ProductDescriptor(entry.id, entry.name, parseLength(entry.contentLength, what), checksum, online, url,
            productUrl(entry.id) + "/Products('Quicklook')/$value");
    }

    @Override
    public boolean isOnline(String id) throws IOException {
        String what = "Online status request for " + id;
        String value = fetchString(productUrl(id) + "/Online/$value", what).trim();
        if ("true".equals(value)) {
            return true;
        }
        if ("false".equals(value)) {
            return false;
        }
        throw new DataHubException("Could not verify whether product " + id + " is online: '" + value + "'");
    }

    /// Uses the `Content-Disposition` of the archive download for online products and the
    /// `Filename` attribute otherwise. Falls back to `<title>.zip`.
    @Override
    public String resolveLocalFilename(ProductDescriptor product) throws IOException {
        if (product.online()) {
            Request head = new Request.Builder().url(product.url()).head().build();
            try (Response response = http.newCall(head).execute()) {
                ResponseChecks.check(response, "File name request for " + product.id());
                String filename = filenameFromDisposition(response.header("Content-Disposition"));
                if (filename != null) {
                    return filename;
                }
            }
        } else {
            Request get = new Request.Builder()
                .url(productUrl(product.id()) + "/Attributes('Filename')/Value/$value")
                .get()
                .build();
            try (Response response = http.newCall(get).execute()) {
                ResponseBody body = response.body();
                if (response.isSuccessful() && body != null) {
                    String filename = body.string().trim();
                    if (!filename.isEmpty()) {
                        return filename.endsWith(PACKAGE_SUFFIX)
                            ? filename.substring(0, filename.length() - PACKAGE_SUFFIX.length()) + ARCHIVE_SUFFIX
                            : filename;
                    }
                } else {
                    logger.debug("No Filename attribute for {} (HTTP {})", product.id(), response.code());
                }
            }
        }
        return product.title() + ARCHIVE_SUFFIX;
    }

    @Override
    public NodeDescriptor getManifestNode(ProductDescriptor product) throws IOException {
        String nodeBase = packageUrl(product) + "/Nodes('" + MANIFEST_PATH + "')";
        String what = "Manifest request for " + product.id();
        ODataModel.NodeEnvelope envelope =
            parse(fetchString(nodeBase + "?$format=json", what), ODataModel.NodeEnvelope.class, what);
        if (envelope == null || envelope.d == null) {
            throw new DataHubException("Invalid API response for " + what + ": node entry is missing");
        }
        return new NodeDescriptor(product.id(), "./" + MANIFEST_PATH, parseLength(envelope.d.contentLength, what), null,
            nodeBase + "/$value");
    }

    @Override
    public String nodeUrl(ProductDescriptor product, String nodePath) {
        String relative = nodePath.startsWith("./") ? nodePath.substring(2) : nodePath;
        String nodes = Arrays.stream(relative.split("/"))
            .filter(segment -> !segment.isEmpty())
            .map(segment -> "Nodes('" + segment + "')")
            .collect(Collectors.joining("/"));
        return packageUrl(product) + "/" + nodes + "/$value";
    }

    private String packageUrl(ProductDescriptor product) {
        return productUrl(product.id()) + "/Nodes('" + product.title() + PACKAGE_SUFFIX + "')";
    }

    private String fetchString(String url, String what) throws IOException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = http.newCall(request).execute()) {
            ResponseChecks.check(response, what);
            ResponseBody body = response.body();
            return body == null ? "" : body.string();
        }
    }

    private static <T> T parse(String json, Class<T> type, String what) {
        try {
            return gson.fromJson(json, type);
        } catch (JsonParseException e) {
            throw new DataHubException("Invalid API response for " + what + ": " + e.getMessage(), e);
        }
    }

    private static long parseLength(String contentLength, String what) {
        if (contentLength == null) {
            throw new DataHubException("Invalid API response for " + what + ": ContentLength is missing");
        }
        long length;
        try {
            length = Long.parseLong(contentLength.trim());
        } catch (NumberFormatException e) {
            throw new DataHubException("Invalid API response for " + what + ": ContentLength '" + contentLength + "'", e);
        }
        if (length < 0) {
            throw new DataHubException("Invalid API response for " + what + ": negative ContentLength " + length);
        }
        return length;
    }

    static String filenameFromDisposition(String disposition) {
        if (disposition == null) {
            return null;
        }
        for (String part : disposition.split(";")) {
            String trimmed = part.trim();
            if (trimmed.toLowerCase(Locale.ROOT).startsWith("filename=")) {
                String value = trimmed.substring("filename=".length()).trim();
                if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                    value = value.substring(1, value.length() - 1);
                }
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }
}
