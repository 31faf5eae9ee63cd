package io.hubfetch.command;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/// Command line settings read from `settings.yaml` in the configuration directory.
///
/// ```yaml
/// api_url: https://hub.example.org/
/// user: jdoe
/// password_env: HUBFETCH_PASSWORD
/// concurrent_downloads: 2
/// concurrent_triggers: 1
/// max_attempts: 10
/// lta_retry_delay: 60s
/// lta_timeout: 2h
/// ```
///
/// Every key is optional. Durations are seconds, or a number with an `s`, `m` or `h` suffix.
/// The password itself is never stored in the file, only the name of the environment variable
/// holding it.
///
/// @param apiUrl the API root URL
/// @param user the user name, or null
/// @param passwordEnv the environment variable holding the password
/// @param concurrentDownloads the number of concurrent transfers
/// @param concurrentTriggers the number of concurrent archive retrieval requests
/// @param maxAttempts the number of transfer attempts per product
/// @param ltaRetryDelay the delay between archive retrieval requests
/// @param ltaTimeout the longest wait for an archived product, or null
public record HubSettings(
    String apiUrl,
    String user,
    String passwordEnv,
    int concurrentDownloads,
    int concurrentTriggers,
    int maxAttempts,
    Duration ltaRetryDelay,
    Duration ltaTimeout
) {
    private static final Logger logger = LogManager.getLogger(HubSettings.class);

    /// Name of the settings file inside the configuration directory
    public static final String SETTINGS_FILE = "settings.yaml";
    /// Default API root
    public static final String DEFAULT_API_URL = "https://apihub.copernicus.eu/apihub/";
    /// Default password variable
    public static final String DEFAULT_PASSWORD_ENV = "HUBFETCH_PASSWORD";

    private static final Set<String> KEYS = Set.of("api_url", "user", "password_env", "concurrent_downloads",
        "concurrent_triggers", "max_attempts", "lta_retry_delay", "lta_timeout");

    /// @return the settings used when no settings file exists
    public static HubSettings defaults() {
        return new HubSettings(DEFAULT_API_URL, null, DEFAULT_PASSWORD_ENV, 2, 1, 10, Duration.ofSeconds(60), null);
    }

    /// Loads `settings.yaml` from a configuration directory.
    ///
    /// @param configdir the configuration directory
    /// @return the settings, or the defaults if the file does not exist
    /// @throws IllegalArgumentException if the file is not valid
    public static HubSettings load(Path configdir) {
        Path file = configdir.resolve(SETTINGS_FILE);
        if (!Files.exists(file)) {
            logger.debug("No {} found, using default settings", file);
            return defaults();
        }
        try {
            LoadSettings loadSettings = LoadSettings.builder().build();
            Load yaml = new Load(loadSettings);
            Object loaded = yaml.loadFromString(Files.readString(file));
            if (loaded == null) {
                return defaults();
            }
            if (!(loaded instanceof Map)) {
                throw new IllegalArgumentException(file + " must be a map of settings");
            }
            return fromMap((Map<?, ?>) loaded);
        } catch (IOException e) {
            throw new RuntimeException("Unable to read " + file + ": " + e.getMessage(), e);
        } catch (YamlEngineException e) {
            throw new IllegalArgumentException("Invalid YAML in " + file + ": " + e.getMessage(), e);
        }
    }

    /// @param values the settings as loaded from YAML
    /// @return the settings, with defaults for missing keys
    /// @throws IllegalArgumentException if a value has the wrong type
    public static HubSettings fromMap(Map<?, ?> values) {
        for (Object key : values.keySet()) {
            if (!KEYS.contains(String.valueOf(key))) {
                logger.warn("Ignoring unknown setting '{}'", key);
            }
        }
        HubSettings defaults = defaults();
        return new HubSettings(
            stringValue(values, "api_url", defaults.apiUrl()),
            stringValue(values, "user", defaults.user()),
            stringValue(values, "password_env", defaults.passwordEnv()),
            intValue(values, "concurrent_downloads", defaults.concurrentDownloads()),
            intValue(values, "concurrent_triggers", defaults.concurrentTriggers()),
            intValue(values, "max_attempts", defaults.maxAttempts()),
            durationValue(values, "lta_retry_delay", defaults.ltaRetryDelay()),
            durationValue(values, "lta_timeout", defaults.ltaTimeout()));
    }

    /// @return the password from the configured environment variable, or null if it is not set
    public String password() {
        return passwordEnv == null ? null : System.getenv(passwordEnv);
    }

    private static String stringValue(Map<?, ?> values, String key, String fallback) {
        Object value = values.get(key);
        return value == null ? fallback : value.toString();
    }

    private static int intValue(Map<?, ?> values, String key, int fallback) {
        Object value = values.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + key + "' must be a number: " + value, e);
        }
    }

    private static Duration durationValue(Map<?, ?> values, String key, Duration fallback) {
        Object value = values.get(key);
        if (value == null) {
            return fallback;
        }
        try {
            return parseDuration(value.toString());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Setting '" + key + "' must be a duration: " + value, e);
        }
    }

    /// @param text seconds, or a number with an `s`, `m` or `h` suffix
    /// @return the duration
    /// @throws IllegalArgumentException if the text is not a duration
    public static Duration parseDuration(String text) {
        String trimmed = text.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Empty duration");
        }
        char unit = trimmed.charAt(trimmed.length() - 1);
        String number = Character.isDigit(unit) ? trimmed : trimmed.substring(0, trimmed.length() - 1).trim();
        long amount = Long.parseLong(number);
        switch (unit) {
            case 'h':
                return Duration.ofHours(amount);
            case 'm':
                return Duration.ofMinutes(amount);
            case 's':
                return Duration.ofSeconds(amount);
            default:
                if (Character.isDigit(unit)) {
                    return Duration.ofSeconds(amount);
                }
                throw new IllegalArgumentException("Unknown duration unit '" + unit + "' in " + text);
        }
    }
}
