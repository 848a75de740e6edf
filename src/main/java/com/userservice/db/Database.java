package com.userservice.db;

import com.userservice.config.ServiceConfig;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded JDBC connection pool shared by the whole service.
 *
 * <p>{@link #initialize()} opens {@code POOL_MIN_SIZE} connections up front. Further
 * connections are opened on demand until {@code POOL_MAX_SIZE} are open; after that
 * callers wait up to the command timeout for one to be returned.</p>
 *
 * <p>Connections handed out by {@link #getConnection()} are proxies: closing one
 * returns the physical connection to the pool, and every statement created through
 * it carries the command timeout as its query timeout. Idle connections that sat
 * unused longer than the max-inactive lifetime are closed, but the pool never
 * shrinks below its minimum size that way.</p>
 */
public class Database {
    private static final Logger logger = Logger.getLogger(Database.class.getName());
    private static final int VALIDATION_TIMEOUT_SECONDS = 2;
    private static final long WAIT_SLICE_MILLIS = 100;

    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final int minSize;
    private final int maxSize;
    private final int commandTimeoutSeconds;
    private final long maxInactiveMillis;

    // Most recently returned connection at the head, oldest idle at the tail
    private final LinkedBlockingDeque<IdleConnection> idleConnections = new LinkedBlockingDeque<>();
    private final AtomicInteger openConnections = new AtomicInteger();
    private volatile boolean initialized = false;
    private volatile boolean closed = false;

    public Database(ServiceConfig config) {
        this.jdbcUrl = config.getJdbcUrl();
        this.user = config.getDbUser();
        this.password = config.getDbPassword();
        this.minSize = config.getPoolMinSize();
        this.maxSize = config.getPoolMaxSize();
        this.commandTimeoutSeconds = config.getCommandTimeoutSeconds();
        this.maxInactiveMillis = TimeUnit.SECONDS.toMillis(config.getMaxInactiveSeconds());
    }

    /**
     * Open the minimum number of connections. Calling this twice is a no-op.
     *
     * @throws SQLException if a connection cannot be opened; connections opened
     *                      before the failure are closed again
     */
    public synchronized void initialize() throws SQLException {
        if (initialized) {
            logger.info("Database pool already initialized");
            return;
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }

        logger.info("Initializing database connection pool (" + minSize + ".." + maxSize + ") for " + jdbcUrl);

        List<Connection> opened = new ArrayList<>();
        try {
            for (int i = 0; i < minSize; i++) {
                opened.add(createConnection());
            }
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to open initial connections", e);
            opened.forEach(this::closeConnectionSilently);
            throw e;
        }

        for (Connection conn : opened) {
            openConnections.incrementAndGet();
            idleConnections.offerFirst(new IdleConnection(conn));
        }

        initialized = true;
        logger.info("Connection pool created with " + opened.size() + " connections");
    }

    /**
     * Borrow a connection. Close it to give it back.
     *
     * @return a pooled connection
     * @throws SQLException if the pool is not initialized or already closed, if no
     *                      connection frees up within the command timeout, or if the
     *                      driver fails to open a new connection
     */
    public Connection getConnection() throws SQLException {
        ensureUsable();
        evictExpired();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(commandTimeoutSeconds);
        try {
            while (true) {
                ensureUsable();

                IdleConnection idle = idleConnections.pollFirst();
                if (idle == null) {
                    Connection created = tryCreateConnection();
                    if (created != null) {
                        return handOut(created);
                    }

                    long remainingNanos = deadline - System.nanoTime();
                    if (remainingNanos <= 0) {
                        throw new SQLException("Timeout waiting for available connection");
                    }
                    // Wait in slices so capacity freed by discarded connections is noticed
                    long waitNanos = Math.min(remainingNanos, TimeUnit.MILLISECONDS.toNanos(WAIT_SLICE_MILLIS));
                    idle = idleConnections.pollFirst(waitNanos, TimeUnit.NANOSECONDS);
                    if (idle == null) {
                        continue;
                    }
                }

                if (isHealthy(idle.connection)) {
                    return handOut(idle.connection);
                }
                logger.warning("Pooled connection invalid, discarding it");
                discard(idle.connection);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SQLException("Interrupted while waiting for connection", e);
        }
    }

    // close() may have run since ensureUsable(); holding the pool lock keeps it from running during the check
    private synchronized Connection handOut(Connection physical) throws SQLException {
        if (closed) {
            discard(physical);
            throw new SQLException("Database has been closed");
        }
        return wrap(physical);
    }

    // Called by the pooled connection proxy on close()
    synchronized void returnConnection(Connection connection) {
        if (closed) {
            discard(connection);
            return;
        }

        try {
            if (connection.isClosed()) {
                logger.warning("Returned connection was already closed, dropping it");
                discard(connection);
                return;
            }
            if (!connection.getAutoCommit()) {
                connection.rollback();
                connection.setAutoCommit(true);
            }
            idleConnections.offerFirst(new IdleConnection(connection));
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Error returning connection to pool, discarding it", e);
            discard(connection);
        }
    }

    /**
     * Close every idle connection and mark the pool closed. Connections still
     * borrowed are closed when they are returned. Idempotent.
     */
    public synchronized void close() {
        if (closed) {
            logger.info("Database already closed");
            return;
        }

        logger.info("Closing database connections...");
        closed = true;

        int closedCount = 0;
        IdleConnection idle;
        while ((idle = idleConnections.pollFirst()) != null) {
            discard(idle.connection);
            closedCount++;
        }

        logger.info("Closed " + closedCount + " idle connections, " + openConnections.get() + " still borrowed");
    }

    public boolean isInitialized() {
        return initialized;
    }

    public boolean isClosed() {
        return closed;
    }

    public int getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }

    public PoolStats stats() {
        return new PoolStats(minSize, maxSize, openConnections.get(), idleConnections.size());
    }

    private void ensureUsable() throws SQLException {
        if (!initialized) {
            throw new SQLException("Database not initialized. Call initialize() first.");
        }
        if (closed) {
            throw new SQLException("Database has been closed");
        }
    }

    private Connection createConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, user, password);
    }

    // Reserves a slot before opening so concurrent callers cannot overshoot maxSize
    private Connection tryCreateConnection() throws SQLException {
        int current;
        do {
            current = openConnections.get();
            if (current >= maxSize) {
                return null;
            }
        } while (!openConnections.compareAndSet(current, current + 1));

        try {
            return createConnection();
        } catch (SQLException e) {
            openConnections.decrementAndGet();
            throw e;
        }
    }

    // The open count is decremented before the idle entry is removed, so concurrent
    // evictions cannot together take the pool below minSize
    private void evictExpired() {
        long now = System.currentTimeMillis();
        while (true) {
            IdleConnection oldest = idleConnections.peekLast();
            if (oldest == null || now - oldest.idleSinceMillis <= maxInactiveMillis) {
                return;
            }
            int current = openConnections.get();
            if (current <= minSize) {
                return;
            }
            if (!openConnections.compareAndSet(current, current - 1)) {
                continue;
            }
            if (idleConnections.removeLastOccurrence(oldest)) {
                logger.fine("Closing connection idle for " + (now - oldest.idleSinceMillis) + " ms");
                closeConnectionSilently(oldest.connection);
            } else {
                // Borrowed by someone else in the meantime; give the slot back
                openConnections.incrementAndGet();
            }
        }
    }

    private boolean isHealthy(Connection connection) {
        try {
            return !connection.isClosed() && connection.isValid(VALIDATION_TIMEOUT_SECONDS);
        } catch (SQLException e) {
            logger.log(Level.FINE, "Connection validation failed", e);
            return false;
        }
    }

    private void discard(Connection connection) {
        closeConnectionSilently(connection);
        openConnections.decrementAndGet();
    }

    private void closeConnectionSilently(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            logger.log(Level.WARNING, "Failed to close connection", e);
        }
    }

    private Connection wrap(Connection physical) {
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class<?>[] {Connection.class},
                new PooledConnectionHandler(physical));
    }

    private static final class IdleConnection {
        private final Connection connection;
        private final long idleSinceMillis;

        IdleConnection(Connection connection) {
            this.connection = connection;
            this.idleSinceMillis = System.currentTimeMillis();
        }
    }

    private final class PooledConnectionHandler implements InvocationHandler {
        private final Connection delegate;
        private final AtomicBoolean released = new AtomicBoolean(false);

        PooledConnectionHandler(Connection delegate) {
            this.delegate = delegate;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            switch (method.getName()) {
                case "close":
                    if (released.compareAndSet(false, true)) {
                        returnConnection(delegate);
                    }
                    return null;
                case "isClosed":
                    return released.get() || delegate.isClosed();
                case "equals":
                    return proxy == args[0];
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "toString":
                    return "PooledConnection[" + delegate + "]";
                default:
                    break;
            }

            if (released.get()) {
                throw new SQLException("Connection has already been returned to the pool");
            }

            Object result;
            try {
                result = method.invoke(delegate, args);
            } catch (InvocationTargetException e) {
                throw e.getCause();
            }

            if (result instanceof Statement) {
                Statement statement = (Statement) result;
                statement.setQueryTimeout(commandTimeoutSeconds);
                return wrapStatement(statement, method.getReturnType(), (Connection) proxy);
            }
            return result;
        }
    }

    // Statement.getConnection() must answer the pooled proxy, not the physical connection
    private static Object wrapStatement(Statement statement, Class<?> statementType, Connection pooled) {
        InvocationHandler handler = (proxy, method, args) -> {
            switch (method.getName()) {
                case "getConnection":
                    return pooled;
                case "equals":
                    return proxy == args[0];
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "toString":
                    return "PooledStatement[" + statement + "]";
                default:
                    break;
            }
            try {
                return method.invoke(statement, args);
            } catch (InvocationTargetException e) {
                throw e.getCause();
            }
        };
        return Proxy.newProxyInstance(
                Statement.class.getClassLoader(),
                new Class<?>[] {statementType},
                handler);
    }
}
