package com.tabrelay.client.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.common.protocol.RelayEnvelope;

/**
 * The browser-side executor of relayed commands.
 */
@FunctionalInterface
public interface ExtensionAgent {

    /**
     * Execute one command.
     *
     * @param command the command frame exactly as the client sent it
     * @return the result carried back in a successful RESPONSE (may be null)
     * @throws Exception any failure; its message becomes the RESPONSE error
     */
    JsonNode handle(RelayEnvelope command) throws Exception;
}
