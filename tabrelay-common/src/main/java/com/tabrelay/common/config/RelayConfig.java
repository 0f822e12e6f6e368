package com.tabrelay.common.config;

import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Relay server configuration, resolved from defaults, an optional JSON file and
 * {@code TABRELAY_*} environment variables (highest precedence).
 */
@Data
@Builder
public class RelayConfig {

    public static final String ENV_HOST = "TABRELAY_HOST";
    public static final String ENV_PORT = "TABRELAY_PORT";
    public static final String ENV_COMMAND_TIMEOUT_MS = "TABRELAY_COMMAND_TIMEOUT_MS";
    public static final String ENV_HANDSHAKE_TIMEOUT_MS = "TABRELAY_HANDSHAKE_TIMEOUT_MS";

    private String host;
    private int port;
    private long commandTimeoutMs;
    private long handshakeTimeoutMs;
    private int maxFrameBytes;

    /** Raw file shape; every field optional. */
    @Data
    @NoArgsConstructor
    public static class RawRelayConfig {
        private String host;
        private Integer port;
        private Long commandTimeoutMs;
        private Long handshakeTimeoutMs;
        private Integer maxFrameBytes;
    }

    public static RelayConfig defaults() {
        return resolve(null, Map.of());
    }

    /**
     * Load from a JSON file (may be absent) and the process environment.
     */
    public static RelayConfig load(Path file) throws IOException {
        return resolve(ConfigSupport.readJson(file, RawRelayConfig.class), System.getenv());
    }

    public static RelayConfig resolve(RawRelayConfig raw, Map<String, String> env) {
        String host = RelayConstants.DEFAULT_HOST;
        Integer port = null;
        Long commandTimeoutMs = null;
        Long handshakeTimeoutMs = null;
        Integer maxFrameBytes = null;

        if (raw != null) {
            if (raw.getHost() != null && !raw.getHost().isBlank()) host = raw.getHost().trim();
            port = raw.getPort();
            commandTimeoutMs = raw.getCommandTimeoutMs();
            handshakeTimeoutMs = raw.getHandshakeTimeoutMs();
            maxFrameBytes = raw.getMaxFrameBytes();
        }

        String envHost = ConfigSupport.envString(env, ENV_HOST);
        if (envHost != null) host = envHost;
        Integer envPort = ConfigSupport.envInt(env, ENV_PORT);
        if (envPort != null) port = envPort;
        Long envCommandTimeout = ConfigSupport.envLong(env, ENV_COMMAND_TIMEOUT_MS);
        if (envCommandTimeout != null) commandTimeoutMs = envCommandTimeout;
        Long envHandshakeTimeout = ConfigSupport.envLong(env, ENV_HANDSHAKE_TIMEOUT_MS);
        if (envHandshakeTimeout != null) handshakeTimeoutMs = envHandshakeTimeout;

        return RelayConfig.builder()
                .host(host)
                .port(ConfigSupport.normalizePort(port, RelayConstants.DEFAULT_PORT))
                .commandTimeoutMs(ConfigSupport.normalizeTimeoutMs(commandTimeoutMs,
                        RelayConstants.DEFAULT_COMMAND_TIMEOUT_MS))
                .handshakeTimeoutMs(ConfigSupport.normalizeTimeoutMs(handshakeTimeoutMs,
                        RelayConstants.DEFAULT_HANDSHAKE_TIMEOUT_MS))
                .maxFrameBytes(ConfigSupport.normalizePositive(maxFrameBytes,
                        RelayConstants.DEFAULT_MAX_FRAME_BYTES))
                .build();
    }
}
