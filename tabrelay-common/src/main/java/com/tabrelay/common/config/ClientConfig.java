package com.tabrelay.common.config;

import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Automation-client configuration for connecting to a relay.
 */
@Data
@Builder
public class ClientConfig {

    public static final String ENV_RELAY_URL = "TABRELAY_URL";
    public static final String ENV_COMMAND_TIMEOUT_MS = "TABRELAY_COMMAND_TIMEOUT_MS";

    private String relayUrl;
    private long commandTimeoutMs;
    private long connectStepTimeoutMs;
    private long loadStateDelayMs;
    private int eventQueueCapacity;

    @Data
    @NoArgsConstructor
    public static class RawClientConfig {
        private String relayUrl;
        private Long commandTimeoutMs;
        private Long connectStepTimeoutMs;
        private Long loadStateDelayMs;
        private Integer eventQueueCapacity;
    }

    public static ClientConfig defaults() {
        return resolve(null, Map.of());
    }

    public static ClientConfig load(Path file) throws IOException {
        return resolve(ConfigSupport.readJson(file, RawClientConfig.class), System.getenv());
    }

    public static ClientConfig resolve(RawClientConfig raw, Map<String, String> env) {
        String relayUrl = RelayConstants.DEFAULT_RELAY_URL;
        Long commandTimeoutMs = null;
        Long connectStepTimeoutMs = null;
        Long loadStateDelayMs = null;
        Integer eventQueueCapacity = null;

        if (raw != null) {
            if (raw.getRelayUrl() != null && !raw.getRelayUrl().isBlank()) relayUrl = raw.getRelayUrl().trim();
            commandTimeoutMs = raw.getCommandTimeoutMs();
            connectStepTimeoutMs = raw.getConnectStepTimeoutMs();
            loadStateDelayMs = raw.getLoadStateDelayMs();
            eventQueueCapacity = raw.getEventQueueCapacity();
        }

        String envUrl = ConfigSupport.envString(env, ENV_RELAY_URL);
        if (envUrl != null) relayUrl = envUrl;
        Long envTimeout = ConfigSupport.envLong(env, ENV_COMMAND_TIMEOUT_MS);
        if (envTimeout != null) commandTimeoutMs = envTimeout;

        long loadDelay = loadStateDelayMs != null && loadStateDelayMs >= 0
                ? loadStateDelayMs : RelayConstants.DEFAULT_LOAD_STATE_DELAY_MS;

        return ClientConfig.builder()
                .relayUrl(relayUrl)
                .commandTimeoutMs(ConfigSupport.normalizeTimeoutMs(commandTimeoutMs,
                        RelayConstants.DEFAULT_COMMAND_TIMEOUT_MS))
                .connectStepTimeoutMs(ConfigSupport.normalizeTimeoutMs(connectStepTimeoutMs,
                        RelayConstants.DEFAULT_CONNECT_STEP_TIMEOUT_MS))
                .loadStateDelayMs(loadDelay)
                .eventQueueCapacity(ConfigSupport.normalizePositive(eventQueueCapacity,
                        RelayConstants.DEFAULT_EVENT_QUEUE_CAPACITY))
                .build();
    }
}
