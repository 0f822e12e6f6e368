package com.tabrelay.common.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.common.error.ProtocolException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RelayEnvelope parsing and the relay-authored frame shapes.
 */
class RelayEnvelopeTest {

    @Test
    void parse_correlatedCommand() throws Exception {
        RelayEnvelope env = RelayEnvelope.parse(
                "{\"id\":\"r1\",\"type\":\"NAVIGATE\",\"tabId\":7,\"url\":\"https://example.com\"}");

        assertEquals(MessageTypes.NAVIGATE, env.type());
        assertEquals("r1", env.id().orElseThrow());
        assertEquals("7", env.tabId().orElseThrow());
        assertTrue(env.isCorrelated());
        assertEquals("https://example.com", env.text("url", null));
    }

    @Test
    void parse_fireAndForget_hasNoId() throws Exception {
        RelayEnvelope env = RelayEnvelope.parse("{\"type\":\"INIT\"}");

        assertFalse(env.isCorrelated());
        assertTrue(env.tabId().isEmpty());
    }

    @Test
    void parse_rejectsMalformedFrames() {
        assertThrows(ProtocolException.class, () -> RelayEnvelope.parse("not json"));
        assertThrows(ProtocolException.class, () -> RelayEnvelope.parse("[1,2]"));
        assertThrows(ProtocolException.class, () -> RelayEnvelope.parse("{\"id\":\"x\"}"));
        assertThrows(ProtocolException.class, () -> RelayEnvelope.parse(""));
    }

    @Test
    void raw_isPreservedVerbatim() throws Exception {
        String text = "{\"type\":\"CDP_COMMAND\",\"id\":\"c1\",\"method\":\"Page.enable\",\"params\":{}}";
        assertEquals(text, RelayEnvelope.parse(text).raw());
    }

    @Test
    void connectedMessage_usesSnakeCaseFields() throws Exception {
        String json = RelayJson.write(RelayProtocolTypes.ConnectedMessage.builder()
                .sessionId("s-1").extensionConnected(true).build());
        JsonNode node = RelayJson.mapper().readTree(json);

        assertEquals("CONNECTED", node.get("type").asText());
        assertEquals("s-1", node.get("session_id").asText());
        assertTrue(node.get("extension_connected").asBoolean());
    }

    @Test
    void responseMessage_failureOmitsResult() throws Exception {
        JsonNode node = RelayJson.mapper().readTree(RelayJson.write(
                RelayProtocolTypes.ResponseMessage.failure("r9", "nope")));

        assertEquals("RESPONSE", node.get("type").asText());
        assertFalse(node.get("success").asBoolean());
        assertEquals("nope", node.get("error").asText());
        assertFalse(node.has("result"));
    }

    @Test
    void quote_escapesForScriptLiterals() {
        assertEquals("\"a'b\\\"c\"", RelayJson.quote("a'b\"c"));
    }
}
