package flowescrow;

import flowescrow.escrow.config.Dependencies;
import flowescrow.escrow.config.EscrowConfig;
import flowescrow.escrow.server.EscrowNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Escrow server entry point.
 *
 * Wires dependencies from the environment, starts the HTTP server and
 * stops both on JVM shutdown.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        EscrowConfig config = EscrowConfig.fromEnv();
        Dependencies dependencies = Dependencies.create(config);
        EscrowNettyServer server = new EscrowNettyServer(dependencies);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Application closing, stopping server...");
            server.stop();
            dependencies.close();
        }, "flowescrow-shutdown"));

        if (!server.start(config.serverHost(), config.serverPort())) {
            log.error("Escrow server did not start on port {}", config.serverPort());
            dependencies.close();
            System.exit(1);
        }
        server.awaitClose();
    }
}
