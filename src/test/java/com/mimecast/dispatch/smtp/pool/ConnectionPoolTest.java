package com.mimecast.dispatch.smtp.pool;

import com.mimecast.dispatch.config.client.SmtpConfig;
import com.mimecast.dispatch.resilience.MutableClock;
import com.mimecast.dispatch.smtp.ProtocolEngine;
import com.mimecast.dispatch.smtp.connection.MockTransport;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.metrics.MicrometerClientMetrics;
import com.mimecast.dispatch.smtp.session.TransactionState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionPoolTest {

    private final List<MockTransport> created = new CopyOnWriteArrayList<>();
    private volatile IOException connectFailure;

    private ExecutorService worker;
    private ScheduledExecutorService scheduler;
    private MutableClock clock;
    private MicrometerClientMetrics metrics;
    private ConnectionPool pool;

    @BeforeEach
    void setUp() {
        worker = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        clock = new MutableClock();
        metrics = new MicrometerClientMetrics(new SimpleMeterRegistry());
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
        worker.shutdownNow();
        scheduler.shutdownNow();
    }

    private ConnectionPool pool(Map<String, Object> poolOverrides, Supplier<MockTransport> transports) {
        Map<String, Object> poolMap = new HashMap<>();
        poolMap.put("maxConnections", 2);
        poolMap.put("minIdle", 0);
        poolMap.put("acquireTimeout", 1);
        poolMap.put("idleTimeout", 60);
        poolMap.put("maxLifetime", 600);
        poolMap.put("healthCheckEnabled", false);
        poolMap.putAll(poolOverrides);

        Map<String, Object> map = new HashMap<>();
        map.put("host", "mx.example.com");
        map.put("tls", Map.of("mode", "none"));
        map.put("pool", poolMap);
        SmtpConfig config = new SmtpConfig(map);

        pool = new ConnectionPool(config, c -> {
            if (connectFailure != null) {
                throw connectFailure;
            }
            MockTransport transport = transports.get();
            created.add(transport);
            return transport;
        }, new ProtocolEngine(config, null, metrics), metrics, worker, scheduler, clock);
        pool.start();
        return pool;
    }

    private ConnectionPool pool(Map<String, Object> poolOverrides) {
        return pool(poolOverrides, MockTransport::new);
    }

    private static PooledConnection get(CompletableFuture<PooledConnection> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private static void ready(PooledConnection connection) {
        connection.getTransport().setState(TransactionState.GREETED);
    }

    @Test
    void testAcquireOpensNewConnection() throws Exception {
        pool(Map.of());

        PooledConnection connection = get(pool.acquire());

        assertNotNull(connection.getTransport());
        assertEquals(1, created.size());
        assertEquals(1, metrics.snapshot().connectionsCreated());
        PoolStatus status = pool.getStatus();
        assertEquals(1, status.total());
        assertEquals(1, status.inUse());
        assertEquals(0, status.idle());
    }

    @Test
    void testReleasedConnectionIsReused() throws Exception {
        pool(Map.of());

        PooledConnection first = get(pool.acquire());
        ready(first);
        first.release();
        assertEquals(1, pool.getStatus().idle());

        PooledConnection second = get(pool.acquire());
        assertSame(first.getTransport(), second.getTransport());
        assertEquals(1, created.size());
    }

    @Test
    void testReleaseIsIdempotent() throws Exception {
        pool(Map.of());

        PooledConnection connection = get(pool.acquire());
        ready(connection);
        connection.release();
        connection.close();

        assertTrue(connection.isReleased());
        assertEquals(1, pool.getStatus().idle());
        assertEquals(0, pool.getStatus().inUse());
    }

    @Test
    void testUnhealthyConnectionDestroyedOnRelease() throws Exception {
        pool(Map.of());

        PooledConnection connection = get(pool.acquire());
        ready(connection);
        connection.markUnhealthy();
        connection.release();

        assertFalse(connection.getTransport().isOpen());
        assertEquals(0, pool.getStatus().total());
    }

    @Test
    void testConnectionLeftMidTransactionDestroyed() throws Exception {
        pool(Map.of());

        PooledConnection connection = get(pool.acquire());
        connection.getTransport().setState(TransactionState.RECIPIENTS_ADDED);
        connection.release();

        assertEquals(0, pool.getStatus().total());
        assertEquals(0, pool.getStatus().idle());
    }

    @Test
    void testNeverExceedsMaximum() throws Exception {
        pool(Map.of());

        PooledConnection first = get(pool.acquire());
        PooledConnection second = get(pool.acquire());
        CompletableFuture<PooledConnection> third = pool.acquire();

        assertFalse(third.isDone());
        assertEquals(2, created.size());
        PoolStatus status = pool.getStatus();
        assertEquals(2, status.total());
        assertEquals(1, status.pending());
        assertEquals(2, status.maxSize());

        ready(first);
        first.release();

        PooledConnection served = get(third);
        assertSame(first.getTransport(), served.getTransport());
        assertEquals(2, created.size());
        assertEquals(0, pool.getStatus().pending());
        second.release();
        served.release();
    }

    @Test
    void testWaiterGetsNewConnectionWhenLeaseDestroyed() throws Exception {
        pool(Map.of("maxConnections", 1));

        PooledConnection first = get(pool.acquire());
        CompletableFuture<PooledConnection> waiter = pool.acquire();
        first.markUnhealthy();
        first.release();

        PooledConnection served = get(waiter);
        assertNotSame(first.getTransport(), served.getTransport());
        assertEquals(2, created.size());
        assertEquals(1, pool.getStatus().total());
    }

    @Test
    void testAcquireTimeout() throws Exception {
        pool(Map.of("maxConnections", 1));

        get(pool.acquire());
        CompletableFuture<PooledConnection> waiter = pool.acquire();

        ExecutionException e = assertThrows(ExecutionException.class, () -> waiter.get(5, TimeUnit.SECONDS));
        assertInstanceOf(SmtpException.class, e.getCause());
        assertEquals(SmtpErrorKind.ACQUIRE_TIMEOUT, ((SmtpException) e.getCause()).getKind());
        assertEquals(0, pool.getStatus().pending());
    }

    @Test
    void testConnectFailureFreesSlot() throws Exception {
        pool(Map.of("maxConnections", 1));
        connectFailure = new ConnectException("Connection refused");

        CompletableFuture<PooledConnection> future = pool.acquire();

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertEquals(SmtpErrorKind.CONNECTION_REFUSED, ((SmtpException) e.getCause()).getKind());
        assertEquals(0, pool.getStatus().total());
        assertEquals(0, pool.getStatus().inUse());

        connectFailure = null;
        assertNotNull(get(pool.acquire()));
    }

    @Test
    void testCloseRejectsWaitersAndNewAcquires() throws Exception {
        pool(Map.of("maxConnections", 1, "acquireTimeout", 30));

        PooledConnection leased = get(pool.acquire());
        CompletableFuture<PooledConnection> waiter = pool.acquire();

        pool.close();

        ExecutionException e = assertThrows(ExecutionException.class, () -> waiter.get(5, TimeUnit.SECONDS));
        assertEquals(SmtpErrorKind.POOL_CLOSED, ((SmtpException) e.getCause()).getKind());

        e = assertThrows(ExecutionException.class, () -> pool.acquire().get(5, TimeUnit.SECONDS));
        assertEquals(SmtpErrorKind.POOL_CLOSED, ((SmtpException) e.getCause()).getKind());

        // Leased connections are destroyed when they come back.
        ready(leased);
        leased.release();
        assertEquals(0, pool.getStatus().total());
    }

    @Test
    void testCloseQuitsIdleConnections() throws Exception {
        pool(Map.of());

        PooledConnection connection = get(pool.acquire());
        MockTransport transport = (MockTransport) connection.getTransport();
        transport.reply("221 2.0.0 Bye");
        ready(connection);
        connection.release();

        pool.close();

        assertEquals("QUIT", transport.getLastCommand());
        assertFalse(transport.isOpen());
        assertEquals(0, pool.getStatus().total());
    }

    @Test
    void testExpiredConnectionNotReused() throws Exception {
        pool(Map.of("maxLifetime", 60));

        PooledConnection first = get(pool.acquire());
        ready(first);
        first.release();

        clock.advance(Duration.ofSeconds(61));
        PooledConnection second = get(pool.acquire());

        assertNotSame(first.getTransport(), second.getTransport());
        assertEquals(2, created.size());
        assertEquals(1, pool.getStatus().total());
    }

    @Test
    void testIdleTimedOutConnectionNotReusedWithoutHealthCheck() throws Exception {
        pool(Map.of("idleTimeout", 30));

        PooledConnection first = get(pool.acquire());
        ready(first);
        first.release();
        assertEquals(1, pool.getStatus().idle());

        clock.advance(Duration.ofSeconds(120));
        PooledConnection second = get(pool.acquire());

        assertNotSame(first.getTransport(), second.getTransport());
        assertEquals(2, created.size());
        assertEquals(1, pool.getStatus().total());
        assertEquals(0, pool.getStatus().idle());
    }

    @Test
    void testConnectionIdleBelowTimeoutIsReused() throws Exception {
        pool(Map.of("idleTimeout", 30));

        PooledConnection first = get(pool.acquire());
        ready(first);
        first.release();

        clock.advance(Duration.ofSeconds(29));
        PooledConnection second = get(pool.acquire());

        assertSame(first.getTransport(), second.getTransport());
        assertEquals(1, created.size());
    }

    @Test
    void testHealthCheckEvictsIdleConnections() throws Exception {
        pool(Map.of("idleTimeout", 30));

        PooledConnection connection = get(pool.acquire());
        ready(connection);
        connection.release();

        clock.advance(Duration.ofSeconds(31));
        pool.runHealthCheck();

        assertEquals(0, pool.getStatus().total());
        assertEquals(0, pool.getStatus().idle());
    }

    @Test
    void testHealthCheckProbesIdleConnections() throws Exception {
        pool(Map.of());

        PooledConnection healthy = get(pool.acquire());
        PooledConnection broken = get(pool.acquire());
        ((MockTransport) healthy.getTransport()).reply("250 2.0.0 Ok");
        ready(healthy);
        ready(broken);
        healthy.release();
        broken.release();

        pool.runHealthCheck();

        assertEquals(1, pool.getStatus().total());
        assertEquals(1, pool.getStatus().idle());
        assertEquals("NOOP", ((MockTransport) healthy.getTransport()).getLastCommand());
        assertTrue(healthy.getTransport().isOpen());
        assertFalse(broken.getTransport().isOpen());
    }

    @Test
    void testHealthCheckPrewarmsToMinIdle() {
        pool(Map.of("minIdle", 2, "maxConnections", 3), () -> new MockTransport()
                .reply("220 mx.example.com ESMTP")
                .reply("250 mx.example.com"));

        pool.runHealthCheck();

        PoolStatus status = pool.getStatus();
        assertEquals(2, status.total());
        assertEquals(2, status.idle());
        assertEquals(0, status.inUse());
        created.forEach(t -> assertEquals(TransactionState.GREETED, t.getState()));
    }
}
