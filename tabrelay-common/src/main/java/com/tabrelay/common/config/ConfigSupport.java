package com.tabrelay.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Shared helpers for reading raw config files and applying environment overrides.
 */
@Slf4j
final class ConfigSupport {

    private static final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private ConfigSupport() {
    }

    /**
     * Read a JSON config file. A missing file yields {@code null}; an unreadable one is an error.
     */
    static <T> T readJson(Path path, Class<T> type) throws IOException {
        if (path == null || !Files.isRegularFile(path)) {
            return null;
        }
        return mapper.readValue(path.toFile(), type);
    }

    static String envString(Map<String, String> env, String key) {
        if (env == null) return null;
        String value = env.get(key);
        return value != null && !value.isBlank() ? value.trim() : null;
    }

    static Integer envInt(Map<String, String> env, String key) {
        String value = envString(env, key);
        if (value == null) return null;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}={}", key, value);
            return null;
        }
    }

    static Long envLong(Map<String, String> env, String key) {
        String value = envString(env, key);
        if (value == null) return null;
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}={}", key, value);
            return null;
        }
    }

    static long normalizeTimeoutMs(Long raw, long fallback) {
        if (raw == null || raw <= 0) return fallback;
        return raw;
    }

    static int normalizePort(Integer raw, int fallback) {
        if (raw == null || raw < 0 || raw > 65535) return fallback;
        return raw;
    }

    static int normalizePositive(Integer raw, int fallback) {
        if (raw == null || raw <= 0) return fallback;
        return raw;
    }
}
