package com.tabrelay.common.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RelayConfig and ClientConfig resolution.
 */
class RelayConfigTest {

    @Test
    void resolve_defaults_whenNoConfig() {
        RelayConfig config = RelayConfig.defaults();

        assertEquals(RelayConstants.DEFAULT_HOST, config.getHost());
        assertEquals(RelayConstants.DEFAULT_PORT, config.getPort());
        assertEquals(30_000, config.getCommandTimeoutMs());
        assertEquals(5_000, config.getHandshakeTimeoutMs());
    }

    @Test
    void resolve_envOverridesFile() {
        RelayConfig.RawRelayConfig raw = new RelayConfig.RawRelayConfig();
        raw.setPort(9000);
        raw.setCommandTimeoutMs(10_000L);

        RelayConfig config = RelayConfig.resolve(raw, Map.of(RelayConfig.ENV_PORT, "9100"));

        assertEquals(9100, config.getPort());
        assertEquals(10_000, config.getCommandTimeoutMs());
    }

    @Test
    void resolve_normalizesBadValues() {
        RelayConfig.RawRelayConfig raw = new RelayConfig.RawRelayConfig();
        raw.setPort(70_000);
        raw.setHandshakeTimeoutMs(-1L);

        RelayConfig config = RelayConfig.resolve(raw, Map.of(RelayConfig.ENV_COMMAND_TIMEOUT_MS, "abc"));

        assertEquals(RelayConstants.DEFAULT_PORT, config.getPort());
        assertEquals(RelayConstants.DEFAULT_HANDSHAKE_TIMEOUT_MS, config.getHandshakeTimeoutMs());
        assertEquals(RelayConstants.DEFAULT_COMMAND_TIMEOUT_MS, config.getCommandTimeoutMs());
    }

    @Test
    void readJson_missingFile_isNull(@TempDir Path dir) throws Exception {
        assertNull(ConfigSupport.readJson(dir.resolve("absent.json"), RelayConfig.RawRelayConfig.class));
    }

    @Test
    void readJson_parsesFileAndIgnoresUnknownKeys(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("relay.json");
        Files.writeString(file, "{\"host\":\"127.0.0.1\",\"port\":8800,\"comment\":\"x\"}");

        RelayConfig config = RelayConfig.resolve(
                ConfigSupport.readJson(file, RelayConfig.RawRelayConfig.class), Map.of());

        assertEquals("127.0.0.1", config.getHost());
        assertEquals(8800, config.getPort());
    }

    @Test
    void clientConfig_defaultsAndEnv() {
        ClientConfig defaults = ClientConfig.defaults();
        assertEquals("ws://localhost:8766", defaults.getRelayUrl());
        assertEquals(RelayConstants.DEFAULT_EVENT_QUEUE_CAPACITY, defaults.getEventQueueCapacity());

        ClientConfig overridden = ClientConfig.resolve(null, Map.of(ClientConfig.ENV_RELAY_URL, "ws://127.0.0.1:9999"));
        assertEquals("ws://127.0.0.1:9999", overridden.getRelayUrl());
    }
}
