package com.userservice.db;

/**
 * Point-in-time view of the connection pool counters.
 * Counters are read one by one, so they may be slightly inconsistent under load.
 */
public final class PoolStats {
    private final int minSize;
    private final int maxSize;
    private final int openConnections;
    private final int idleConnections;

    PoolStats(int minSize, int maxSize, int openConnections, int idleConnections) {
        this.minSize = minSize;
        this.maxSize = maxSize;
        this.openConnections = openConnections;
        this.idleConnections = idleConnections;
    }

    public int getMinSize() {
        return minSize;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public int getOpenConnections() {
        return openConnections;
    }

    public int getIdleConnections() {
        return idleConnections;
    }

    public int getInUseConnections() {
        return Math.max(0, openConnections - idleConnections);
    }

    @Override
    public String toString() {
        return "PoolStats{min=" + minSize + ", max=" + maxSize + ", open=" + openConnections
                + ", idle=" + idleConnections + ", inUse=" + getInUseConnections() + "}";
    }
}
