package com.userservice.app;

import com.userservice.config.ServiceConfig;
import com.userservice.db.Database;
import com.userservice.db.SchemaInitializer;
import com.userservice.db.UserRepository;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wires the service together: pool, table bootstrap, HTTP server.
 *
 * <p>{@link #start()} runs the stages in order and undoes the ones that already
 * succeeded if a later stage fails. {@link #stop()} tears down in reverse order:
 * the HTTP listener first so no request can borrow a connection from a closed pool.</p>
 */
public class UserServiceApp {
    private static final Logger logger = Logger.getLogger(UserServiceApp.class.getName());

    private final ServiceConfig config;
    private Database database;
    private UserServer userServer;

    public UserServiceApp(ServiceConfig config) {
        this.config = config;
    }

    /**
     * @throws RuntimeException naming the stage that failed, with the original cause attached
     */
    public synchronized void start() {
        logger.info("Starting with " + config);
        try {
            initializeDatabase();
            ensureTables();
            startServer();
        } catch (RuntimeException e) {
            stop();
            throw e;
        }
    }

    public synchronized void stop() {
        if (userServer != null) {
            try {
                logger.info("Shutting down HTTP server...");
                userServer.stop();
            } catch (Exception e) {
                logger.log(Level.WARNING, "Error shutting down HTTP server", e);
            }
            userServer = null;
        }

        if (database != null) {
            logger.info("Pool at shutdown: " + database.stats());
            database.close();
            database = null;
        }
    }

    public synchronized int getPort() {
        if (userServer == null) {
            throw new IllegalStateException("Service not started");
        }
        return userServer.getPort();
    }

    synchronized Database getDatabase() {
        return database;
    }

    private void initializeDatabase() {
        try {
            logger.info("Initializing database pool...");
            database = new Database(config);
            database.initialize();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to initialize database pool", e);
            throw new RuntimeException("Database initialization failed", e);
        }
    }

    private void ensureTables() {
        try {
            new SchemaInitializer(database).ensureTables();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to create tables", e);
            throw new RuntimeException("Schema initialization failed", e);
        }
    }

    private void startServer() {
        try {
            userServer = new UserServer(new UserRepository(database), config.getHttpPort(), config.getHttpThreads());
            userServer.start();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to start HTTP server", e);
            userServer = null;
            throw new RuntimeException("HTTP server initialization failed", e);
        }
    }
}
