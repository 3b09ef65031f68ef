package paytask;

import paytask.gateway.config.GatewayConfig;
import paytask.gateway.server.GatewayNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway entry point.
 * 
 * Reads configuration from the environment, starts the HTTP server and
 * blocks until it is shut down.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        GatewayConfig config = GatewayConfig.fromEnv();
        int port = config.serverPort();

        log.info("Starting gateway on port {}...", port);
        if (!GatewayNettyServer.start(port, config)) {
            log.error("Gateway did not start");
            System.exit(1);
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            GatewayNettyServer.stop();
        }, "paytask-shutdown"));

        GatewayNettyServer.awaitTermination();
    }
}
