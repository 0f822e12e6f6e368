package com.tabrelay.relay;

import com.tabrelay.common.config.RelayConfig;
import com.tabrelay.relay.server.RelayServer;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Standalone relay entry point. Optional first argument: path to a JSON config file.
 */
@Slf4j
public final class RelayMain {

    private RelayMain() {
    }

    public static void main(String[] args) throws Exception {
        Path configFile = args.length > 0 ? Path.of(args[0]) : null;
        RelayConfig config = RelayConfig.load(configFile);

        RelayServer server = new RelayServer(config);
        server.start();
        log.info("Extension connects to {}, clients connect to {}", server.getUrl(), server.getUrl());

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Relay stopped by user");
            server.stop();
            stopped.countDown();
        }, "tabrelay-shutdown"));
        stopped.await();
    }
}
