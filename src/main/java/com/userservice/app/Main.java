package com.userservice.app;

import com.userservice.config.ServiceConfig;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point. Reads the configuration from the environment, starts the service
 * and registers a shutdown hook that closes the pool.
 */
public class Main {
    private static final Logger logger = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        configureLogging();
        logger.info("=== User Service Starting ===");

        try {
            ServiceConfig config = ServiceConfig.fromEnvironment();
            UserServiceApp app = new UserServiceApp(config);
            app.start();
            addShutdownHook(app);

            logger.info("=== User Service is running on port " + app.getPort() + " ===");
            logger.info("Press Ctrl+C to stop");
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Fatal error during startup", e);
            System.exit(1);
        }
    }

    private static void addShutdownHook(UserServiceApp app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("=== Shutdown signal received ===");
            app.stop();
            logger.info("=== User Service Stopped ===");
        }, "Shutdown-Hook"));

        logger.info("Shutdown hook registered");
    }

    private static void configureLogging() {
        // An explicit -Djava.util.logging.config.file wins over the bundled defaults
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }
}
