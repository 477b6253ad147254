package com.mimecast.dispatch.smtp.pool;

import com.mimecast.dispatch.smtp.connection.Transport;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive lease on a pooled connection.
 *
 * <p>Released exactly once; further calls are ignored.
 * <br>Use with try-with-resources so every exit path returns the lease.
 * <p>A connection marked unhealthy, closed, or left mid-transaction is destroyed on release.
 */
public class PooledConnection implements AutoCloseable {

    private final ConnectionPool pool;
    private final ConnectionPool.Entry entry;
    private final AtomicBoolean released = new AtomicBoolean();
    private volatile boolean unhealthy;

    PooledConnection(ConnectionPool pool, ConnectionPool.Entry entry) {
        this.pool = pool;
        this.entry = entry;
    }

    public Transport getTransport() {
        return entry.transport;
    }

    /**
     * Marks the connection for destruction on release.
     */
    public void markUnhealthy() {
        this.unhealthy = true;
    }

    public boolean isUnhealthy() {
        return unhealthy;
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Returns the connection to the pool.
     */
    public void release() {
        if (released.compareAndSet(false, true)) {
            pool.release(entry, !unhealthy);
        }
    }

    @Override
    public void close() {
        release();
    }

    @Override
    public String toString() {
        return "PooledConnection{" + entry.transport + (unhealthy ? ", unhealthy" : "") + "}";
    }
}
