package com.tabrelay.relay;

import com.fasterxml.jackson.databind.JsonNode;
import com.tabrelay.common.config.RelayConfig;
import com.tabrelay.common.error.SessionClosedException;
import com.tabrelay.common.protocol.MessageTypes;
import com.tabrelay.common.protocol.RelayEnvelope;
import com.tabrelay.relay.session.ClientSession;
import com.tabrelay.relay.session.ExtensionConnection;
import com.tabrelay.relay.session.RelayConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RelayRouter: classification, correlation, fan-out and disconnect handling.
 */
class RelayRouterTest {

    private ScheduledExecutorService scheduler;
    private RelayRouter router;
    private FakePeer extensionPeer;
    private ExtensionConnection extension;

    @BeforeEach
    void setUp() throws Exception {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        router = new RelayRouter(RelayConfig.defaults(), scheduler);
        extensionPeer = new FakePeer("extension");
        extension = (ExtensionConnection) router.accept(extensionPeer, env("{\"type\":\"EXTENSION_READY\"}"));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    // ==================== Classification ====================

    @Test
    void accept_extensionReady_becomesExtensionConnection() {
        assertTrue(router.isExtensionConnected());
        assertEquals(0, router.sessionCount());
        assertTrue(extensionPeer.sent().isEmpty());
    }

    @Test
    void accept_initFrame_opensSession_withoutForwarding() throws Exception {
        FakePeer clientPeer = new FakePeer("client");
        ClientSession session = openSession(clientPeer);

        assertEquals(1, router.sessionCount());
        assertEquals(MessageTypes.CONNECTED, clientPeer.frames().get(0).get("type").asText());
        assertEquals(1, clientPeer.sent().size());
        assertTrue(extensionPeer.sent().isEmpty());
        assertTrue(session.tabId().isEmpty());
    }

    @Test
    void accept_otherFirstFrame_opensSession_andProcessesThatFrame() throws Exception {
        FakePeer clientPeer = new FakePeer("client");
        RelayConnection connection = router.accept(clientPeer,
                env("{\"id\":\"r0\",\"type\":\"GET_ACTIVE_TAB\"}"));

        ClientSession session = assertInstanceOf(ClientSession.class, connection);
        assertEquals(1, router.sessionCount());

        JsonNode welcome = clientPeer.frames().get(0);
        assertEquals("CONNECTED", welcome.get("type").asText());
        assertEquals(session.getSessionId(), welcome.get("session_id").asText());
        assertTrue(welcome.get("extension_connected").asBoolean());

        // the classifying frame was forwarded, not lost
        assertEquals(1, extensionPeer.sent().size());
        assertEquals("GET_ACTIVE_TAB", extensionPeer.frames().get(0).get("type").asText());
        assertTrue(session.getPending().contains("r0"));
    }

    // ==================== Correlation ====================

    @Test
    void navigate_roundTrip_returnsResult_andClearsPending() throws Exception {
        FakePeer clientPeer = new FakePeer("client");
        ClientSession session = openSession(clientPeer);

        String command = "{\"id\":\"r1\",\"type\":\"NAVIGATE\",\"tabId\":7,\"url\":\"https://example.com\"}";
        session.onFrame(command);

        assertEquals(command, extensionPeer.sent().get(0));
        assertEquals("7", session.tabId().orElseThrow());

        extension.onFrame("{\"id\":\"r1\",\"type\":\"RESPONSE\",\"success\":true,\"result\":{\"ok\":true}}");

        JsonNode response = clientPeer.awaitResponse("r1", 1_000);
        assertTrue(response.get("success").asBoolean());
        assertTrue(response.get("result").get("ok").asBoolean());
        assertFalse(session.getPending().contains("r1"));
    }

    @Test
    void failedResponse_isRelayedAsError() throws Exception {
        FakePeer clientPeer = new FakePeer("client");
        ClientSession session = openSession(clientPeer);

        session.onFrame("{\"id\":\"r2\",\"type\":\"ATTACH_DEBUGGER\",\"tabId\":3}");
        extension.onFrame("{\"id\":\"r2\",\"type\":\"RESPONSE\",\"success\":false,"
                + "\"error\":\"Cannot access a chrome:// URL\"}");

        JsonNode response = clientPeer.awaitResponse("r2", 1_000);
        assertFalse(response.get("success").asBoolean());
        assertEquals("Cannot access a chrome:// URL", response.get("error").asText());
    }

    @Test
    void unknownResponseId_isDropped_andOthersUntouched() throws Exception {
        FakePeer clientPeer = new FakePeer("client");
        ClientSession session = openSession(clientPeer);
        session.onFrame("{\"id\":\"live\",\"type\":\"EVALUATE\",\"script\":\"1\"}");

        assertFalse(router.routeResponse("ghost",
                env("{\"id\":\"ghost\",\"type\":\"RESPONSE\",\"success\":true,\"result\":1}")));

        assertTrue(session.getPending().contains("live"));
        assertEquals(1, session.getPending().size());
        assertTrue(clientPeer.framesOfType("RESPONSE").isEmpty());
    }

    @Test
    void timeout_sendsFailure_andLateResponseIsDropped() throws Exception {
        FakePeer clientPeer = new FakePeer("client");
        ClientSession session = openSession(clientPeer);

        CompletableFuture<JsonNode> future = router.forwardWithResponse(session, "slow",
                env("{\"id\":\"slow\",\"type\":\"GET_TAB_INFO\",\"tabId\":1}"), 50);

        JsonNode response = clientPeer.awaitResponse("slow", 2_000);
        assertFalse(response.get("success").asBoolean());
        assertTrue(response.get("error").asText().contains("timed out"));
        assertTrue(future.isCompletedExceptionally());
        assertFalse(session.getPending().contains("slow"));

        extension.onFrame("{\"id\":\"slow\",\"type\":\"RESPONSE\",\"success\":true,\"result\":{}}");
        assertEquals(1, clientPeer.framesOfType("RESPONSE").size());
    }

    @Test
    void outOfOrderResponses_routeByCorrelationId() throws Exception {
        FakePeer clientPeer = new FakePeer("client");
        ClientSession session = openSession(clientPeer);
        session.onFrame("{\"id\":\"A\",\"type\":\"EVALUATE\",\"script\":\"'a'\"}");
        session.onFrame("{\"id\":\"B\",\"type\":\"EVALUATE\",\"script\":\"'b'\"}");

        extension.onFrame("{\"id\":\"B\",\"type\":\"RESPONSE\",\"success\":true,\"result\":\"b\"}");
        extension.onFrame("{\"id\":\"A\",\"type\":\"RESPONSE\",\"success\":true,\"result\":\"a\"}");

        var responses = clientPeer.framesOfType("RESPONSE");
        assertEquals("B", responses.get(0).get("id").asText());
        assertEquals("b", responses.get(0).get("result").asText());
        assertEquals("A", responses.get(1).get("id").asText());
        assertEquals("a", responses.get(1).get("result").asText());
    }

    @Test
    void duplicatePendingId_isRejectedWithoutForwarding() throws Exception {
        FakePeer clientPeer = new FakePeer("client");
        ClientSession session = openSession(clientPeer);
        session.onFrame("{\"id\":\"x\",\"type\":\"EVALUATE\",\"script\":\"1\"}");
        session.onFrame("{\"id\":\"x\",\"type\":\"EVALUATE\",\"script\":\"2\"}");

        assertEquals(1, extensionPeer.sent().size());
        JsonNode error = clientPeer.framesOfType(MessageTypes.ERROR).get(0);
        assertEquals("x", error.get("id").asText());
        assertTrue(clientPeer.framesOfType(MessageTypes.RESPONSE).isEmpty());
        assertTrue(session.getPending().contains("x"));

        // the original request still receives its own result
        extension.onFrame("{\"id\":\"x\",\"type\":\"RESPONSE\",\"success\":true,\"result\":1}");
        JsonNode response = clientPeer.awaitResponse("x", 1_000);
        assertTrue(response.get("success").asBoolean());
        assertEquals(1, response.get("result").asInt());
    }

    @Test
    void fireAndForget_isForwardedVerbatim() throws Exception {
        FakePeer clientPeer = new FakePeer("client");
        ClientSession session = openSession(clientPeer);

        String frame = "{\"type\":\"UNREGISTER_CDP_LISTENER\",\"tabId\":4,\"eventName\":\"Page.loadEventFired\"}";
        session.onFrame(frame);

        assertEquals(frame, extensionPeer.sent().get(0));
        assertTrue(session.getPending().isEmpty());
    }

    // ==================== Tab affiliation ====================

    @Test
    void tabBinding_isSetOnce() throws Exception {
        ClientSession session = openSession(new FakePeer("client"));

        session.onFrame("{\"type\":\"GET_TAB_INFO\",\"tabId\":5}");
        session.onFrame("{\"type\":\"GET_TAB_INFO\",\"tabId\":9}");

        assertEquals("5", session.tabId().orElseThrow());
    }

    @Test
    void cdpEvent_reachesBoundTabAndUnboundSessions_only() throws Exception {
        FakePeer tab7 = new FakePeer("tab7");
        FakePeer tab3 = new FakePeer("tab3");
        FakePeer unbound = new FakePeer("unbound");
        openSession(tab7).bindTab("7");
        openSession(tab3).bindTab("3");
        openSession(unbound);

        extension.onFrame("{\"type\":\"CDP_EVENT\",\"tabId\":7,\"method\":\"Page.loadEventFired\",\"params\":{}}");

        assertEquals(1, tab7.framesOfType(MessageTypes.CDP_EVENT).size());
        assertEquals(1, unbound.framesOfType(MessageTypes.CDP_EVENT).size());
        assertTrue(tab3.framesOfType(MessageTypes.CDP_EVENT).isEmpty());
    }

    @Test
    void cdpEvent_deliveryFailure_doesNotAbortBroadcast() throws Exception {
        FakePeer closed = new FakePeer("closed");
        FakePeer live = new FakePeer("live");
        openSession(closed);
        openSession(live);
        closed.close();

        int delivered = router.forwardCdpEvent(env("{\"type\":\"CDP_EVENT\",\"tabId\":1,\"method\":\"X\"}"));

        assertEquals(1, delivered);
        assertEquals(1, live.framesOfType(MessageTypes.CDP_EVENT).size());
    }

    @Test
    void notifications_areBroadcastToAllSessions() throws Exception {
        FakePeer a = new FakePeer("a");
        FakePeer b = new FakePeer("b");
        openSession(a).bindTab("1");
        openSession(b).bindTab("2");

        extension.onFrame("{\"type\":\"TAB_CLOSED\",\"tabId\":1}");

        assertEquals(1, a.framesOfType(MessageTypes.TAB_CLOSED).size());
        assertEquals(1, b.framesOfType(MessageTypes.TAB_CLOSED).size());
    }

    @Test
    void ping_isAnsweredWithPong() {
        extension.onFrame("{\"type\":\"PING\"}");

        assertEquals("PONG", extensionPeer.frames().get(0).get("type").asText());
    }

    @Test
    void malformedExtensionFrame_isDropped() {
        extension.onFrame("{not json");

        assertTrue(router.isExtensionConnected());
        assertTrue(extensionPeer.sent().isEmpty());
    }

    @Test
    void malformedClientFrame_getsError_andSessionStaysUsable() throws Exception {
        FakePeer clientPeer = new FakePeer("client");
        ClientSession session = openSession(clientPeer);

        session.onFrame("garbage");
        assertEquals("Invalid JSON", clientPeer.framesOfType(MessageTypes.ERROR).get(0).get("error").asText());

        session.onFrame("{\"id\":\"ok\",\"type\":\"GET_ACTIVE_TAB\"}");
        assertTrue(session.getPending().contains("ok"));
    }

    // ==================== Disconnects ====================

    @Test
    void extensionDisconnect_failsPendingInEverySession_andLaterCommandsFailFast() throws Exception {
        FakePeer peerA = new FakePeer("a");
        FakePeer peerB = new FakePeer("b");
        ClientSession a = openSession(peerA);
        ClientSession b = openSession(peerB);
        a.onFrame("{\"id\":\"a1\",\"type\":\"EVALUATE\",\"script\":\"1\"}");
        b.onFrame("{\"id\":\"b1\",\"type\":\"EVALUATE\",\"script\":\"1\"}");
        int forwarded = extensionPeer.sent().size();

        extensionPeer.close();
        extension.onClosed();

        assertFalse(router.isExtensionConnected());
        assertEquals("Chrome extension disconnected", peerA.awaitResponse("a1", 1_000).get("error").asText());
        assertEquals("Chrome extension disconnected", peerB.awaitResponse("b1", 1_000).get("error").asText());
        assertEquals(1, peerA.framesOfType(MessageTypes.EXTENSION_DISCONNECTED).size());
        assertEquals(1, peerB.framesOfType(MessageTypes.EXTENSION_DISCONNECTED).size());

        a.onFrame("{\"id\":\"a2\",\"type\":\"EVALUATE\",\"script\":\"1\"}");
        JsonNode immediate = peerA.awaitResponse("a2", 100);
        assertFalse(immediate.get("success").asBoolean());
        assertEquals("Chrome extension not connected", immediate.get("error").asText());
        assertEquals(forwarded, extensionPeer.sent().size());
        assertTrue(a.getPending().isEmpty());
    }

    @Test
    void commandWithoutExtension_failsImmediately() throws Exception {
        RelayRouter bare = new RelayRouter(RelayConfig.defaults(), scheduler);
        FakePeer clientPeer = new FakePeer("client");
        bare.accept(clientPeer, env("{\"type\":\"INIT\"}"));

        JsonNode welcome = clientPeer.frames().get(0);
        assertFalse(welcome.get("extension_connected").asBoolean());
        assertEquals("Chrome extension not connected",
                clientPeer.framesOfType(MessageTypes.ERROR).get(0).get("error").asText());
    }

    @Test
    void sessionClose_failsPendingWithSessionClosed_andRemovesSession() throws Exception {
        ClientSession session = openSession(new FakePeer("client"));
        CompletableFuture<JsonNode> first = router.forwardWithResponse(session, "p1",
                env("{\"id\":\"p1\",\"type\":\"EVALUATE\"}"));
        CompletableFuture<JsonNode> second = router.forwardWithResponse(session, "p2",
                env("{\"id\":\"p2\",\"type\":\"EVALUATE\"}"));

        session.peer().close();
        session.onClosed();

        for (CompletableFuture<JsonNode> f : List.of(first, second)) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(1, TimeUnit.SECONDS));
            assertInstanceOf(SessionClosedException.class, e.getCause());
        }
        assertTrue(router.session(session.getSessionId()).isEmpty());
        assertEquals(0, router.sessionCount());
    }

    @Test
    void secondExtension_replacesFirst_andStaleCloseKeepsNewOne() throws Exception {
        FakePeer newPeer = new FakePeer("extension-2");
        ExtensionConnection replacement = (ExtensionConnection) router.accept(newPeer,
                env("{\"type\":\"EXTENSION_READY\"}"));

        FakePeer clientPeer = new FakePeer("client");
        openSession(clientPeer).onFrame("{\"id\":\"n1\",\"type\":\"GET_ACTIVE_TAB\"}");
        assertEquals(1, newPeer.sent().size());
        assertTrue(extensionPeer.sent().isEmpty());

        extensionPeer.close();
        extension.onClosed();

        assertTrue(router.isExtensionConnected());
        assertTrue(clientPeer.framesOfType(MessageTypes.EXTENSION_DISCONNECTED).isEmpty());

        replacement.onFrame("{\"id\":\"n1\",\"type\":\"RESPONSE\",\"success\":true,\"result\":{\"tabId\":1}}");
        assertTrue(clientPeer.awaitResponse("n1", 1_000).get("success").asBoolean());
    }

    @Test
    void closeSession_closesSocket() throws Exception {
        FakePeer clientPeer = new FakePeer("client");
        ClientSession session = openSession(clientPeer);

        assertTrue(router.closeSession(session.getSessionId()));

        assertFalse(clientPeer.isOpen());
        assertEquals(0, router.sessionCount());
        assertFalse(router.closeSession(session.getSessionId()));
    }

    // ==================== Helpers ====================

    private ClientSession openSession(FakePeer peer) throws Exception {
        return (ClientSession) router.accept(peer, env("{\"type\":\"INIT\"}"));
    }

    private static RelayEnvelope env(String json) throws Exception {
        return RelayEnvelope.parse(json);
    }
}
