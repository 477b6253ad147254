package com.mimecast.dispatch.smtp.pool;

import com.mimecast.dispatch.config.client.PoolConfig;
import com.mimecast.dispatch.config.client.SmtpConfig;
import com.mimecast.dispatch.smtp.ProtocolEngine;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.connection.Transport;
import com.mimecast.dispatch.smtp.connection.TransportFactory;
import com.mimecast.dispatch.smtp.metrics.ClientMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Bounded SMTP connection pool.
 *
 * <p>Never holds more than the configured maximum of live connections.
 * <br>Acquire hands out an idle connection, opens a new one below the maximum, or queues the caller
 * <br>until a release or the acquire timeout, whichever comes first.
 * <p>Waits are timers on the scheduler and connects run on the worker pool, so no caller thread blocks.
 * <p>The lock is never held across network I/O and futures are completed outside it.
 */
public class ConnectionPool implements Closeable {
    private static final Logger log = LogManager.getLogger(ConnectionPool.class);

    private final SmtpConfig config;
    private final PoolConfig poolConfig;
    private final TransportFactory factory;
    private final ProtocolEngine engine;
    private final ClientMetrics metrics;
    private final ExecutorService worker;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;

    private final Object lock = new Object();
    private final Deque<Entry> idle = new ArrayDeque<>();
    private final Deque<CompletableFuture<PooledConnection>> waiters = new ArrayDeque<>();
    private int total;
    private int leased;
    private boolean closed;
    private ScheduledFuture<?> healthCheck;

    /**
     * Constructs a new ConnectionPool instance.
     *
     * @param config    SmtpConfig instance.
     * @param factory   TransportFactory instance.
     * @param engine    ProtocolEngine used to prepare, probe and close connections.
     * @param metrics   ClientMetrics instance.
     * @param worker    Executor running blocking connection work.
     * @param scheduler Scheduler for acquire timeouts and health checks.
     * @param clock     Clock for idle and lifetime accounting.
     */
    public ConnectionPool(SmtpConfig config, TransportFactory factory, ProtocolEngine engine, ClientMetrics metrics,
                          ExecutorService worker, ScheduledExecutorService scheduler, Clock clock) {
        this.config = config;
        this.poolConfig = config.getPool();
        this.factory = factory;
        this.engine = engine;
        this.metrics = metrics;
        this.worker = worker;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    /**
     * Starts the background health check if enabled.
     */
    public void start() {
        if (poolConfig.isHealthCheckEnabled()) {
            long interval = poolConfig.getHealthCheckInterval().toMillis();
            healthCheck = scheduler.scheduleAtFixedRate(() -> submit(this::runHealthCheck), interval, interval, TimeUnit.MILLISECONDS);
        }
        log.info("Connection pool started for {}:{} with max={}, minIdle={}, healthCheck={}",
                config.getHost(), config.getPort(), poolConfig.getMaxConnections(), poolConfig.getMinIdle(),
                poolConfig.isHealthCheckEnabled());
    }

    /**
     * Acquires a connection lease.
     *
     * @return Future completed with a lease, or failed with ACQUIRE_TIMEOUT, POOL_CLOSED or a connect error.
     */
    public CompletableFuture<PooledConnection> acquire() {
        CompletableFuture<PooledConnection> future = new CompletableFuture<>();
        List<Entry> expired = new ArrayList<>();
        Entry entry = null;
        boolean create = false;

        synchronized (lock) {
            if (closed) {
                future.completeExceptionally(new SmtpException(SmtpErrorKind.POOL_CLOSED, "Connection pool is closed"));
                return future;
            }

            entry = pollUsable(expired);
            if (entry != null) {
                leased++;
            }

            if (entry == null) {
                if (total < poolConfig.getMaxConnections()) {
                    total++;
                    leased++;
                    create = true;
                } else {
                    waiters.addLast(future);
                    log.debug("Connection pool exhausted, waiting for a connection (max: {}, waiting: {})",
                            poolConfig.getMaxConnections(), waiters.size());
                }
            }
        }

        expired.forEach(e -> destroy(e, true));

        if (entry != null) {
            log.trace("Reusing idle connection {}", entry.transport);
            future.complete(new PooledConnection(this, entry));
        } else if (create) {
            open(future);
        } else {
            scheduleTimeout(future);
        }
        return future;
    }

    private void scheduleTimeout(CompletableFuture<PooledConnection> future) {
        Duration timeout = poolConfig.getAcquireTimeout();
        ScheduledFuture<?> timer;
        try {
            timer = scheduler.schedule(() -> {
                boolean removed;
                synchronized (lock) {
                    removed = waiters.remove(future);
                }
                if (removed) {
                    log.warn("Timeout waiting for a connection after {}ms", timeout.toMillis());
                    future.completeExceptionally(new SmtpException(SmtpErrorKind.ACQUIRE_TIMEOUT,
                            "Could not acquire a connection within " + timeout.toMillis() + "ms"));
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            synchronized (lock) {
                waiters.remove(future);
            }
            future.completeExceptionally(new SmtpException(SmtpErrorKind.POOL_CLOSED, "Connection pool is closed", e));
            return;
        }

        future.whenComplete((connection, error) -> {
            timer.cancel(false);
            if (future.isCancelled()) {
                synchronized (lock) {
                    waiters.remove(future);
                }
            }
        });
    }

    /**
     * Opens a new connection for a reserved slot and completes the future with it.
     */
    private void open(CompletableFuture<PooledConnection> future) {
        CompletableFuture.supplyAsync(this::connect, worker).whenComplete((transport, error) -> {
            if (error != null) {
                synchronized (lock) {
                    total--;
                    leased--;
                }
                future.completeExceptionally(unwrap(error));
                serveWaiters();
                return;
            }

            Entry entry = new Entry(transport, clock.instant());
            PooledConnection connection = new PooledConnection(this, entry);
            if (!future.complete(connection)) {
                // Caller gave up while connecting.
                connection.release();
            }
        });
    }

    private Transport connect() {
        try {
            Transport transport = factory.connect(config);
            metrics.recordConnectionCreated();
            log.debug("Opened connection to {}:{}", config.getHost(), config.getPort());
            return transport;
        } catch (IOException e) {
            throw new CompletionException(SmtpException.fromIOException(e, "connect"));
        }
    }

    /**
     * Returns a leased connection.
     * <p>Healthy ready connections go to the first waiter or back to the idle set; anything else is destroyed.
     *
     * @param entry   Pool entry.
     * @param healthy Healthy according to the lease holder.
     */
    void release(Entry entry, boolean healthy) {
        boolean keep = healthy
                && entry.transport.isOpen()
                && entry.transport.getState().isReady()
                && !isExpired(entry);

        boolean destroy;
        synchronized (lock) {
            leased--;
            destroy = !keep || closed;
            if (destroy) {
                total--;
            } else {
                entry.lastUsed = clock.instant();
                idle.addFirst(entry);
            }
        }

        if (destroy) {
            log.debug("Destroying connection {} on release (healthy: {})", entry.transport, healthy);
            destroy(entry, keep);
        } else {
            log.trace("Released connection {}", entry.transport);
        }
        serveWaiters();
    }

    /**
     * Hands idle connections to waiters, or opens connections for them while below the maximum.
     */
    private void serveWaiters() {
        while (true) {
            CompletableFuture<PooledConnection> waiter;
            Entry entry;
            List<Entry> expired = new ArrayList<>();

            synchronized (lock) {
                waiter = waiters.peekFirst();
                if (waiter == null || closed) {
                    return;
                }
                entry = pollUsable(expired);
                if (entry != null) {
                    leased++;
                } else if (total < poolConfig.getMaxConnections()) {
                    total++;
                    leased++;
                } else {
                    waiter = null;
                }
                if (waiter != null) {
                    waiters.pollFirst();
                }
            }

            expired.forEach(e -> destroy(e, true));
            if (waiter == null) {
                return;
            }

            if (entry != null) {
                PooledConnection connection = new PooledConnection(this, entry);
                if (!waiter.complete(connection)) {
                    connection.release();
                }
            } else {
                open(waiter);
            }
        }
    }

    /**
     * Evicts idle connections past their idle timeout or lifetime, probes the rest and pre-warms up to min idle.
     */
    void runHealthCheck() {
        List<Entry> evicted = new ArrayList<>();
        List<Entry> probe = new ArrayList<>();

        synchronized (lock) {
            if (closed) {
                return;
            }
            Instant now = clock.instant();
            for (Iterator<Entry> it = idle.iterator(); it.hasNext(); ) {
                Entry entry = it.next();
                it.remove();
                if (isStale(entry, now)) {
                    total--;
                    evicted.add(entry);
                } else {
                    leased++;
                    probe.add(entry);
                }
            }
        }

        evicted.forEach(e -> destroy(e, true));
        if (!evicted.isEmpty()) {
            log.debug("Health check evicted {} idle connections", evicted.size());
        }

        for (Entry entry : probe) {
            boolean healthy = engine.isHealthy(entry.transport);
            if (!healthy) {
                log.warn("Health check failed for {}", entry.transport);
            }
            release(entry, healthy);
        }

        prewarm();
    }

    private void prewarm() {
        int needed;
        synchronized (lock) {
            if (closed) {
                return;
            }
            needed = Math.min(poolConfig.getMinIdle() - idle.size(), poolConfig.getMaxConnections() - total);
            if (needed <= 0) {
                return;
            }
            total += needed;
            leased += needed;
        }

        log.debug("Pre-warming {} connections", needed);
        for (int i = 0; i < needed; i++) {
            Entry entry = null;
            try {
                entry = new Entry(connect(), clock.instant());
                engine.ensureReady(entry.transport);
                release(entry, true);
            } catch (CompletionException | IOException e) {
                log.warn("Pre-warm connection failed: {}", unwrap(e).getMessage());
                if (entry != null) {
                    release(entry, false);
                } else {
                    synchronized (lock) {
                        total--;
                        leased--;
                    }
                }
            }
        }
    }

    /**
     * Takes the first usable idle connection, moving stale or closed ones to the expired list.
     * <p>Caller holds the lock.
     */
    private Entry pollUsable(List<Entry> expired) {
        Instant now = clock.instant();
        while (!idle.isEmpty()) {
            Entry candidate = idle.pollFirst();
            if (isStale(candidate, now) || !candidate.transport.isOpen()) {
                total--;
                expired.add(candidate);
            } else {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Past its maximum lifetime or idle for the idle timeout or longer.
     */
    private boolean isStale(Entry entry, Instant now) {
        return isExpired(entry) || Duration.between(entry.lastUsed, now).compareTo(poolConfig.getIdleTimeout()) >= 0;
    }

    private boolean isExpired(Entry entry) {
        return Duration.between(entry.createdAt, clock.instant()).compareTo(poolConfig.getMaxLifetime()) >= 0;
    }

    /**
     * Destroys a connection, politely with QUIT when the session is in a known state.
     */
    private void destroy(Entry entry, boolean quit) {
        if (quit && entry.transport.isOpen()) {
            submit(() -> engine.close(entry.transport));
        } else {
            entry.transport.close();
        }
    }

    private void submit(Runnable task) {
        try {
            worker.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Worker unavailable, running inline: {}", e.getMessage());
            task.run();
        }
    }

    /**
     * Gets point in time status.
     *
     * @return PoolStatus instance.
     */
    public PoolStatus getStatus() {
        synchronized (lock) {
            return new PoolStatus(total, idle.size(), leased, waiters.size(), poolConfig.getMaxConnections());
        }
    }

    /**
     * Closes the pool.
     * <p>Waiters fail with POOL_CLOSED, idle connections are closed with QUIT
     * <br>and leased connections are destroyed when released.
     */
    @Override
    public void close() {
        List<Entry> toClose;
        List<CompletableFuture<PooledConnection>> toReject;

        synchronized (lock) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(idle);
            total -= idle.size();
            idle.clear();
            toReject = new ArrayList<>(waiters);
            waiters.clear();
        }

        if (healthCheck != null) {
            healthCheck.cancel(false);
        }
        toReject.forEach(w -> w.completeExceptionally(new SmtpException(SmtpErrorKind.POOL_CLOSED, "Connection pool is closed")));
        toClose.forEach(e -> engine.close(e.transport));

        log.info("Connection pool closed for {}:{}, {} idle connections closed, {} waiters rejected",
                config.getHost(), config.getPort(), toClose.size(), toReject.size());
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    /**
     * Pool bookkeeping for one connection.
     */
    static final class Entry {
        final Transport transport;
        final Instant createdAt;
        volatile Instant lastUsed;

        Entry(Transport transport, Instant createdAt) {
            this.transport = transport;
            this.createdAt = createdAt;
            this.lastUsed = createdAt;
        }
    }
}
