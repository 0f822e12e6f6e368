package com.tabrelay.relay.server;

import com.tabrelay.relay.session.RelayPeer;
import io.netty.channel.Channel;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link RelayPeer} over a Netty WebSocket channel.
 */
@Slf4j
class NettyRelayPeer implements RelayPeer {

    private final Channel channel;
    private final String description;

    NettyRelayPeer(Channel channel) {
        this.channel = channel;
        this.description = channel.id().asShortText() + "/" + channel.remoteAddress();
    }

    @Override
    public String describe() {
        return description;
    }

    @Override
    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public boolean send(String text) {
        if (!channel.isActive()) return false;
        channel.writeAndFlush(new TextWebSocketFrame(text)).addListener(f -> {
            if (!f.isSuccess()) {
                log.debug("Write to {} failed: {}", description, f.cause() != null ? f.cause().getMessage() : "cancelled");
            }
        });
        return true;
    }

    @Override
    public void close() {
        channel.close();
    }
}
