package fr.lapetina.mesh;

import fr.lapetina.mesh.api.MeshHttpServer;
import fr.lapetina.mesh.infrastructure.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of the mesh gateway.
 */
public class MeshGatewayApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MeshGatewayApplication.class);

    private final MeshFactory factory;
    private final MeshHttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public MeshGatewayApplication(String configPath) throws Exception {
        this(MeshFactory.create(configPath));
    }

    MeshGatewayApplication(MeshFactory factory) throws Exception {
        log.info("Starting mesh gateway...");
        this.factory = factory.start();
        this.httpServer = new MeshHttpServer(factory);
        log.info("Mesh gateway initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Mesh gateway started: port={}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public MeshFactory getFactory() {
        return factory;
    }

    public MeshHttpServer getHttpServer() {
        return httpServer;
    }

    @Override
    public void close() {
        log.info("Shutting down mesh gateway...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Mesh gateway shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            MeshGatewayApplication app = new MeshGatewayApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }, "mesh-shutdown"));

            app.start();
            app.awaitShutdown();

        } catch (ConfigLoader.ConfigurationException e) {
            log.error("Invalid configuration, aborting: path={}, reason={}", configPath, e.getMessage(), e);
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for shutdown");
        } catch (Exception e) {
            log.error("Failed to start mesh gateway", e);
            System.exit(1);
        }
    }
}
