package com.tabrelay.relay.server;

import com.tabrelay.common.config.RelayConfig;
import com.tabrelay.relay.RelayRouter;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;

/**
 * Relay server: Netty HTTP + WebSocket listener shared by the extension agent and
 * client sessions on a single port.
 *
 * <p>All channels are served by one worker event loop, and pending-request timeouts
 * are scheduled on that same loop, so routing state is only ever touched by one thread.</p>
 */
@Slf4j
public class RelayServer implements AutoCloseable {

    @Getter private final RelayConfig config;

    private Channel serverChannel;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    @Getter private RelayRouter router;

    public RelayServer(RelayConfig config) {
        this.config = config;
    }

    /**
     * Bind and start accepting connections.
     */
    public void start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup(1);
        router = new RelayRouter(config, workerGroup.next());

        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(
                                new HttpServerCodec(),
                                new HttpObjectAggregator(65536),
                                new RelayChannelHandler(router, config));
                    }
                });

        try {
            serverChannel = b.bind(config.getHost(), config.getPort()).sync().channel();
        } catch (Exception e) {
            shutdownGroups();
            throw e;
        }
        log.info("Relay started on ws://{}:{}", config.getHost(), getBoundPort());
    }

    /**
     * The port actually bound; differs from the configured one when that is 0.
     */
    public int getBoundPort() {
        if (serverChannel == null) return -1;
        return ((InetSocketAddress) serverChannel.localAddress()).getPort();
    }

    public String getUrl() {
        return "ws://" + config.getHost() + ":" + getBoundPort();
    }

    public boolean isExtensionConnected() {
        return router != null && router.isExtensionConnected();
    }

    /**
     * Stop the server, closing all connections and failing anything still pending.
     */
    public void stop() {
        if (router != null && workerGroup != null && !workerGroup.isShuttingDown()) {
            try {
                workerGroup.next().submit(router::shutdown).sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (serverChannel != null) {
            try {
                serverChannel.close().sync();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        shutdownGroups();
        log.info("Relay stopped");
    }

    @Override
    public void close() {
        stop();
    }

    private void shutdownGroups() {
        if (bossGroup != null) bossGroup.shutdownGracefully();
        if (workerGroup != null) workerGroup.shutdownGracefully();
    }
}
