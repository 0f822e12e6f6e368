package com.tabrelay.common.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Frames authored by the relay itself. Everything else is forwarded verbatim.
 *
 * <p>Protocol overview:
 * <ul>
 *   <li>Relay → Client: {@link ConnectedMessage}, {@link ErrorMessage}, {@link ResponseMessage},
 *       {@link ExtensionDisconnectedMessage}, plus forwarded CDP_EVENT / DEBUGGER_DETACHED / TAB_CLOSED</li>
 *   <li>Relay → Extension: forwarded client commands, {@link PongMessage}</li>
 *   <li>Extension → Relay: EXTENSION_READY, PING, {@link ResponseMessage}, CDP_EVENT, notifications</li>
 * </ul>
 */
public final class RelayProtocolTypes {

    private RelayProtocolTypes() {
    }

    /** Welcome sent to a freshly classified client session. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ConnectedMessage {
        @Builder.Default
        private String type = MessageTypes.CONNECTED;
        @JsonProperty("session_id")
        private String sessionId;
        @JsonProperty("extension_connected")
        private boolean extensionConnected;
    }

    /** Uncorrelated failure report to a client session. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ErrorMessage {
        @Builder.Default
        private String type = MessageTypes.ERROR;
        private String id;
        private String error;

        public static ErrorMessage of(String error) {
            return ErrorMessage.builder().error(error).build();
        }
    }

    /** Correlated outcome of a command, in both directions. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ResponseMessage {
        @Builder.Default
        private String type = MessageTypes.RESPONSE;
        private String id;
        private boolean success;
        private JsonNode result;
        private String error;

        public static ResponseMessage success(String id, JsonNode result) {
            return ResponseMessage.builder().id(id).success(true).result(result).build();
        }

        public static ResponseMessage failure(String id, String error) {
            return ResponseMessage.builder().id(id).success(false).error(error).build();
        }
    }

    /** Broadcast when the extension agent connection goes away. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtensionDisconnectedMessage {
        @Builder.Default
        private String type = MessageTypes.EXTENSION_DISCONNECTED;
        private String error;
    }

    /** Keepalive answer to the extension's PING. */
    @Data
    @NoArgsConstructor
    public static class PongMessage {
        private final String type = MessageTypes.PONG;
    }
}
