package com.tabrelay.client.transport;

import com.tabrelay.common.error.ConnectTimeoutException;
import com.tabrelay.common.error.RelayException;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * WebSocket connection to a relay over OkHttp. OkHttp reads frames on one thread per
 * socket, which serves as the client's receive loop.
 */
@Slf4j
public final class OkHttpRelayTransport extends AbstractRelayTransport {

    private final String url;
    private final OkHttpClient client;
    private final CompletableFuture<Void> opened = new CompletableFuture<>();
    private volatile WebSocket webSocket;

    private OkHttpRelayTransport(String url) {
        this.url = url;
        this.client = new OkHttpClient.Builder()
                .readTimeout(0, TimeUnit.MILLISECONDS) // WebSocket: no read timeout
                .build();
    }

    /**
     * Open a WebSocket to {@code url} and wait for the handshake to finish.
     */
    public static OkHttpRelayTransport connect(String url, long handshakeTimeoutMs) throws RelayException {
        OkHttpRelayTransport transport = new OkHttpRelayTransport(url);
        transport.open(handshakeTimeoutMs);
        return transport;
    }

    private void open(long handshakeTimeoutMs) throws RelayException {
        Request request = new Request.Builder().url(url).build();
        WebSocket ws = client.newWebSocket(request, new WebSocketListener() {
            @Override
            public void onOpen(WebSocket socket, Response response) {
                opened.complete(null);
            }

            @Override
            public void onMessage(WebSocket socket, String text) {
                dispatchFrame(text);
            }

            @Override
            public void onClosing(WebSocket socket, int code, String reason) {
                socket.close(1000, null);
            }

            @Override
            public void onClosed(WebSocket socket, int code, String reason) {
                dispatchClosed("closed (" + code + (reason.isEmpty() ? "" : " " + reason) + ")");
                release();
            }

            @Override
            public void onFailure(WebSocket socket, Throwable t, Response response) {
                opened.completeExceptionally(t);
                dispatchClosed("failed: " + t.getMessage());
                release();
            }
        });
        webSocket = ws;

        try {
            opened.get(handshakeTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            ws.cancel();
            release();
            throw new ConnectTimeoutException("Relay WebSocket handshake timeout: " + url);
        } catch (ExecutionException e) {
            release();
            throw new RelayException("Relay connection failed: " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ws.cancel();
            release();
            throw new RelayException("Relay connection interrupted");
        }
        log.debug("Connected to relay at {}", url);
    }

    @Override
    public boolean send(String text) {
        WebSocket ws = webSocket;
        return ws != null && !isClosed() && ws.send(text);
    }

    @Override
    public boolean isOpen() {
        return opened.isDone() && !opened.isCompletedExceptionally() && !isClosed();
    }

    @Override
    public String describe() {
        return url;
    }

    @Override
    public void close() {
        WebSocket ws = webSocket;
        if (ws != null && !isClosed()) {
            ws.close(1000, "done");
        }
        dispatchClosed("closed locally");
    }

    private void release() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
