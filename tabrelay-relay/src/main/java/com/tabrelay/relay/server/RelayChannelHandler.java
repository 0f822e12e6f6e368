package com.tabrelay.relay.server;

import com.tabrelay.common.config.RelayConfig;
import com.tabrelay.common.error.ProtocolException;
import com.tabrelay.common.protocol.RelayEnvelope;
import com.tabrelay.common.protocol.RelayJson;
import com.tabrelay.relay.RelayRouter;
import com.tabrelay.relay.session.RelayConnection;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrameAggregator;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketServerHandshakerFactory;
import io.netty.util.CharsetUtil;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Per-channel handler: HTTP status endpoints, WebSocket upgrade, first-frame
 * classification, then delegation of every frame to the classified connection.
 */
@Slf4j
class RelayChannelHandler extends SimpleChannelInboundHandler<Object> {

    private final RelayRouter router;
    private final RelayConfig config;

    private WebSocketServerHandshaker handshaker;
    private NettyRelayPeer peer;
    private RelayConnection connection;
    private ScheduledFuture<?> classifyTimeout;

    RelayChannelHandler(RelayRouter router, RelayConfig config) {
        this.router = router;
        this.config = config;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
        if (msg instanceof FullHttpRequest request) {
            handleHttpRequest(ctx, request);
        } else if (msg instanceof WebSocketFrame frame) {
            handleWebSocketFrame(ctx, frame);
        }
    }

    // ==================== HTTP ====================

    private void handleHttpRequest(ChannelHandlerContext ctx, FullHttpRequest req) {
        String path = URI.create(req.uri()).getPath();

        if (req.headers().contains(HttpHeaderNames.UPGRADE, HttpHeaderValues.WEBSOCKET, true)) {
            handleWebSocketUpgrade(ctx, req);
            return;
        }

        if ("/".equals(path)) {
            sendResponse(ctx, HttpResponseStatus.OK, req.method() == HttpMethod.HEAD ? "" : "OK");
            return;
        }

        if ("/extension/status".equals(path)) {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("connected", router.isExtensionConnected());
            status.put("sessions", router.sessionCount());
            sendJsonResponse(ctx, HttpResponseStatus.OK, RelayJson.write(status));
            return;
        }

        sendResponse(ctx, HttpResponseStatus.NOT_FOUND, "not found");
    }

    private void handleWebSocketUpgrade(ChannelHandlerContext ctx, FullHttpRequest req) {
        InetSocketAddress remote = (InetSocketAddress) ctx.channel().remoteAddress();
        if (remote == null || !isLoopback(remote.getAddress().getHostAddress())) {
            sendResponse(ctx, HttpResponseStatus.FORBIDDEN, "Forbidden");
            return;
        }

        // browsers may only connect from the extension itself
        String origin = req.headers().get(HttpHeaderNames.ORIGIN);
        if (origin != null && !origin.startsWith("chrome-extension://")) {
            sendResponse(ctx, HttpResponseStatus.FORBIDDEN, "Forbidden: invalid origin");
            return;
        }

        WebSocketServerHandshakerFactory wsFactory = new WebSocketServerHandshakerFactory(
                "ws://" + req.headers().get(HttpHeaderNames.HOST) + req.uri(), null, true,
                config.getMaxFrameBytes());
        handshaker = wsFactory.newHandshaker(req);
        if (handshaker == null) {
            WebSocketServerHandshakerFactory.sendUnsupportedVersionResponse(ctx.channel());
            return;
        }
        handshaker.handshake(ctx.channel(), req).addListener(f -> {
            if (f.isSuccess()) {
                ctx.pipeline().addBefore(ctx.name(), "ws-aggregator",
                        new WebSocketFrameAggregator(config.getMaxFrameBytes()));
                startClassificationWindow(ctx);
            } else {
                log.debug("WebSocket handshake failed: {}", f.cause() != null ? f.cause().getMessage() : "");
                ctx.close();
            }
        });
    }

    // ==================== WebSocket ====================

    private void startClassificationWindow(ChannelHandlerContext ctx) {
        peer = new NettyRelayPeer(ctx.channel());
        classifyTimeout = ctx.executor().schedule(() -> {
            if (connection == null) {
                log.error("Client {} didn't send initial message in time", peer.describe());
                ctx.close();
            }
        }, config.getHandshakeTimeoutMs(), TimeUnit.MILLISECONDS);
    }

    private void handleWebSocketFrame(ChannelHandlerContext ctx, WebSocketFrame frame) {
        if (frame instanceof CloseWebSocketFrame) {
            handshaker.close(ctx.channel(), (CloseWebSocketFrame) frame.retain());
            return;
        }
        if (frame instanceof PingWebSocketFrame) {
            ctx.writeAndFlush(new PongWebSocketFrame(frame.content().retain()));
            return;
        }
        if (!(frame instanceof TextWebSocketFrame textFrame)) return;

        String text = textFrame.text();
        if (connection != null) {
            connection.onFrame(text);
            return;
        }

        RelayEnvelope first;
        try {
            first = RelayEnvelope.parse(text);
        } catch (ProtocolException e) {
            log.warn("Dropping unclassifiable frame from {}: {}", peer.describe(), e.getMessage());
            return;
        }
        if (classifyTimeout != null) {
            classifyTimeout.cancel(false);
        }
        connection = router.accept(peer, first);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        if (classifyTimeout != null) {
            classifyTimeout.cancel(false);
        }
        if (connection != null) {
            connection.onClosed();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.debug("Relay handler error: {}", cause.getMessage());
        ctx.close();
    }

    // ==================== Helpers ====================

    private static void sendResponse(ChannelHandlerContext ctx, HttpResponseStatus status, String body) {
        FullHttpResponse resp = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer(body, CharsetUtil.UTF_8));
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/plain; charset=utf-8");
        resp.headers().set(HttpHeaderNames.CONTENT_LENGTH, resp.content().readableBytes());
        resp.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.CLOSE);
        ctx.writeAndFlush(resp);
    }

    private static void sendJsonResponse(ChannelHandlerContext ctx, HttpResponseStatus status, String json) {
        FullHttpResponse resp = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1, status,
                Unpooled.copiedBuffer(json, CharsetUtil.UTF_8));
        resp.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json");
        resp.headers().set(HttpHeaderNames.CONTENT_LENGTH, resp.content().readableBytes());
        ctx.writeAndFlush(resp);
    }

    static boolean isLoopback(String ip) {
        if (ip == null) return false;
        return ip.startsWith("127.")
                || ip.equals("::1") || ip.startsWith("::ffff:127.")
                || ip.equals("0:0:0:0:0:0:0:1");
    }
}
