package com.mimecast.dispatch.smtp;

import com.mimecast.dispatch.config.client.SmtpConfig;
import com.mimecast.dispatch.mime.Address;
import com.mimecast.dispatch.mime.Email;
import com.mimecast.dispatch.mime.EmailBuilder;
import com.mimecast.dispatch.mime.MessageEncoder;
import com.mimecast.dispatch.resilience.CircuitBreaker;
import com.mimecast.dispatch.resilience.CircuitState;
import com.mimecast.dispatch.resilience.RateLimiter;
import com.mimecast.dispatch.resilience.ResilienceOrchestrator;
import com.mimecast.dispatch.resilience.RetryPolicy;
import com.mimecast.dispatch.smtp.auth.CredentialProvider;
import com.mimecast.dispatch.smtp.auth.Credentials;
import com.mimecast.dispatch.smtp.auth.StaticCredentialProvider;
import com.mimecast.dispatch.smtp.connection.SmtpErrorKind;
import com.mimecast.dispatch.smtp.connection.SmtpException;
import com.mimecast.dispatch.smtp.connection.SocketTransport;
import com.mimecast.dispatch.smtp.connection.Transport;
import com.mimecast.dispatch.smtp.connection.TransportFactory;
import com.mimecast.dispatch.smtp.metrics.ClientMetrics;
import com.mimecast.dispatch.smtp.metrics.MetricsSnapshot;
import com.mimecast.dispatch.smtp.metrics.NoopClientMetrics;
import com.mimecast.dispatch.smtp.pool.ConnectionPool;
import com.mimecast.dispatch.smtp.pool.PoolStatus;
import com.mimecast.dispatch.smtp.pool.PooledConnection;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * SMTP client.
 *
 * <p>Composes the connection pool, the resilience orchestrator and the protocol engine.
 * <p>Each send is admitted by the rate limiter, then attempted through the circuit breaker
 * <br>with retries, each attempt leasing a pooled connection that is prepared once and reused.
 * <p>Blocking I/O runs on an internal worker pool; waits are scheduler timers.
 * <br>The async methods never block the caller, the blocking ones wait on them.
 * <p>Example:
 * <pre>
 * try (SmtpClient client = new SmtpClient(SmtpConfig.load("cfg/client.json5"))) {
 *     SendResult result = client.send(Email.builder()
 *             .from("sender@example.com")
 *             .to("recipient@example.com")
 *             .subject("Hello")
 *             .text("Hello world")
 *             .build());
 * }
 * </pre>
 */
public class SmtpClient implements Closeable {
    private static final Logger log = LogManager.getLogger(SmtpClient.class);

    private final SmtpConfig config;
    private final ClientMetrics metrics;
    private final MessageEncoder encoder;
    private final TransportFactory transportFactory;
    private final Clock clock;

    private final ExecutorService worker;
    private final ScheduledExecutorService scheduler;
    private final ProtocolEngine engine;
    private final ConnectionPool pool;
    private final ResilienceOrchestrator orchestrator;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Constructs a new SmtpClient instance with credentials from configuration.
     *
     * @param config SmtpConfig instance.
     * @throws SmtpException Invalid configuration.
     */
    public SmtpClient(SmtpConfig config) throws SmtpException {
        this(config, new NoopClientMetrics());
    }

    /**
     * Constructs a new SmtpClient instance with credentials from configuration and a metrics sink.
     *
     * @param config  SmtpConfig instance.
     * @param metrics ClientMetrics instance.
     * @throws SmtpException Invalid configuration.
     */
    public SmtpClient(SmtpConfig config, ClientMetrics metrics) throws SmtpException {
        this(config, staticProvider(config.getCredentials()), metrics);
    }

    /**
     * Constructs a new SmtpClient instance with a credential provider.
     *
     * @param config             SmtpConfig instance.
     * @param credentialProvider CredentialProvider instance or null for no authentication.
     * @param metrics            ClientMetrics instance.
     * @throws SmtpException Invalid configuration.
     */
    public SmtpClient(SmtpConfig config, CredentialProvider credentialProvider, ClientMetrics metrics) throws SmtpException {
        this(config, credentialProvider, metrics, new EmailBuilder(config.getClientId()), SocketTransport::connect, Clock.systemUTC());
    }

    /**
     * Constructs a new SmtpClient instance with every collaborator supplied.
     *
     * @param config             SmtpConfig instance.
     * @param credentialProvider CredentialProvider instance or null for no authentication.
     * @param metrics            ClientMetrics instance.
     * @param encoder            MessageEncoder instance.
     * @param transportFactory   TransportFactory instance.
     * @param clock              Clock instance.
     * @throws SmtpException Invalid configuration.
     */
    public SmtpClient(SmtpConfig config, CredentialProvider credentialProvider, ClientMetrics metrics,
                      MessageEncoder encoder, TransportFactory transportFactory, Clock clock) throws SmtpException {
        config.validate();
        this.config = config;
        this.metrics = metrics != null ? metrics : new NoopClientMetrics();
        this.encoder = encoder;
        this.transportFactory = transportFactory;
        this.clock = clock;

        AtomicInteger workerCount = new AtomicInteger();
        this.worker = Executors.newFixedThreadPool(config.getPool().getMaxConnections() + 2, r -> {
            Thread thread = new Thread(r, "SmtpClient-Worker-" + workerCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "SmtpClient-Scheduler");
            thread.setDaemon(true);
            return thread;
        });

        this.engine = new ProtocolEngine(config, credentialProvider, this.metrics);
        this.pool = new ConnectionPool(config, transportFactory, engine, this.metrics, worker, scheduler, clock);
        this.orchestrator = new ResilienceOrchestrator(
                new RateLimiter(config.getRateLimit(), clock),
                new CircuitBreaker(config.getCircuitBreaker(), clock),
                new RetryPolicy(config.getRetry()),
                scheduler,
                this.metrics);

        pool.start();
        log.info("SMTP client started for {}:{} (tls: {}, auth: {})",
                config.getHost(), config.getPort(), config.getTls().getMode(), credentialProvider != null);
    }

    private static CredentialProvider staticProvider(Credentials credentials) {
        return credentials != null ? new StaticCredentialProvider(credentials) : null;
    }

    /**
     * Sends an email.
     *
     * @param email Email instance.
     * @return Future completed with the SendResult or failed with an SmtpException.
     */
    public CompletableFuture<SendResult> sendAsync(Email email) {
        String messageId = email.getMessageId() != null ? email.getMessageId() : encoder.generateMessageId();
        byte[] payload;
        try {
            payload = encoder.encode(email, messageId);
        } catch (SmtpException e) {
            metrics.recordSendFailure();
            log.error("Unable to encode message {}: {}", messageId, e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        return submit(email.getFrom().email(), email.getAllRecipients(), payload, messageId);
    }

    /**
     * Sends an email and waits for the outcome.
     *
     * @param email Email instance.
     * @return SendResult instance.
     * @throws SmtpException Terminal failure.
     */
    public SendResult send(Email email) throws SmtpException {
        return await(sendAsync(email));
    }

    /**
     * Sends pre-encoded message bytes.
     *
     * @param from       Envelope sender.
     * @param recipients Envelope recipients.
     * @param payload    RFC 5322 message bytes, not dot-stuffed.
     * @return Future completed with the SendResult or failed with an SmtpException.
     */
    public CompletableFuture<SendResult> sendRawAsync(String from, List<String> recipients, byte[] payload) {
        List<String> envelope = new ArrayList<>();
        String sender;
        try {
            sender = Address.parse(from, SmtpErrorKind.INVALID_FROM_ADDRESS).email();
            for (String recipient : recipients) {
                envelope.add(Address.parse(recipient, SmtpErrorKind.INVALID_RECIPIENT_ADDRESS).email());
            }
            if (envelope.isEmpty()) {
                throw new SmtpException(SmtpErrorKind.INVALID_RECIPIENT_ADDRESS, "At least one recipient is required");
            }
        } catch (SmtpException e) {
            metrics.recordSendFailure();
            return CompletableFuture.failedFuture(e);
        }
        return submit(sender, envelope, payload, null);
    }

    /**
     * Sends pre-encoded message bytes and waits for the outcome.
     *
     * @param from       Envelope sender.
     * @param recipients Envelope recipients.
     * @param payload    RFC 5322 message bytes, not dot-stuffed.
     * @return SendResult instance.
     * @throws SmtpException Terminal failure.
     */
    public SendResult sendRaw(String from, List<String> recipients, byte[] payload) throws SmtpException {
        return await(sendRawAsync(from, recipients, payload));
    }

    /**
     * Sends emails one after another.
     * <p>A failure only affects its own item; this never throws.
     *
     * @param emails Emails.
     * @return BatchSendResult instance.
     */
    public BatchSendResult sendBatch(List<Email> emails) {
        Instant start = clock.instant();
        List<BatchSendResult.Item> items = new ArrayList<>();
        for (int i = 0; i < emails.size(); i++) {
            try {
                items.add(BatchSendResult.Item.success(i, send(emails.get(i))));
            } catch (SmtpException e) {
                items.add(BatchSendResult.Item.failure(i, e));
            }
        }
        BatchSendResult result = new BatchSendResult(items, Duration.between(start, clock.instant()));
        log.info("Batch complete: {}", result);
        return result;
    }

    private CompletableFuture<SendResult> submit(String from, List<String> recipients, byte[] payload, String messageId) {
        if (closed.get()) {
            return CompletableFuture.failedFuture(new SmtpException(SmtpErrorKind.POOL_CLOSED, "Client is closed"));
        }

        Instant start = clock.instant();
        CompletableFuture<SendResult> future = orchestrator.execute(() -> attempt(from, recipients, payload, messageId, start));
        future.whenComplete((result, error) -> {
            if (error == null) {
                metrics.recordSendSuccess();
                log.info("Message {} sent to {} recipients ({} rejected) in {}ms",
                        messageId, result.accepted().size(), result.rejected().size(), result.duration().toMillis());
            } else {
                metrics.recordSendFailure();
                log.error("Message {} failed: {}", messageId, ResilienceOrchestrator.unwrap(error).getMessage());
            }
        });
        return future;
    }

    /**
     * One attempt: lease a connection, prepare it, run the transaction.
     */
    private CompletableFuture<SendResult> attempt(String from, List<String> recipients, byte[] payload, String messageId, Instant start) {
        CompletableFuture<SendResult> result = new CompletableFuture<>();
        CompletableFuture<PooledConnection> lease = pool.acquire();
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                lease.cancel(false);
            }
        });

        lease.whenComplete((connection, error) -> {
            if (error != null) {
                result.completeExceptionally(ResilienceOrchestrator.unwrap(error));
                return;
            }

            // Started: claimed by the worker, or by a cancel before it runs.
            // Committed: claimed by the worker before MAIL FROM, or by a cancel that stops it there.
            AtomicBoolean started = new AtomicBoolean();
            AtomicBoolean committed = new AtomicBoolean();
            result.whenComplete((value, failure) -> {
                if (!result.isCancelled()) {
                    return;
                }
                if (started.compareAndSet(false, true)) {
                    connection.release();
                } else if (committed.compareAndSet(false, true)) {
                    log.debug("Message {} cancelled while preparing {}", messageId, connection);
                } else if (connection.getTransport().getState().isInTransaction()) {
                    // Abort the blocked exchange; the worker releases the lease once its I/O fails.
                    connection.markUnhealthy();
                    connection.getTransport().close();
                }
            });

            try {
                worker.execute(() -> {
                    if (started.compareAndSet(false, true)) {
                        runTransaction(connection, from, recipients, payload, messageId, start, committed, result);
                    }
                });
            } catch (RejectedExecutionException e) {
                connection.release();
                result.completeExceptionally(new SmtpException(SmtpErrorKind.POOL_CLOSED, "Client is closed", e));
            }
        });
        return result;
    }

    private void runTransaction(PooledConnection connection, String from, List<String> recipients, byte[] payload,
                                String messageId, Instant start, AtomicBoolean committed,
                                CompletableFuture<SendResult> result) {
        Transport transport = connection.getTransport();
        SendResult sendResult = null;
        SmtpException failure = null;
        try {
            if (committed.get()) {
                return;
            }
            engine.ensureReady(transport);
            if (!committed.compareAndSet(false, true)) {
                // Cancelled during greeting, STARTTLS or AUTH; a ready session goes back to the pool.
                log.debug("Message {} cancelled before MAIL FROM", messageId);
                return;
            }
            TransactionOutcome outcome = engine.runTransaction(transport, from, recipients, payload);
            sendResult = new SendResult(messageId, outcome.accepted(), outcome.rejected(), outcome.response(),
                    outcome.serverId(), Duration.between(start, clock.instant()));
        } catch (IOException e) {
            failure = SmtpException.fromIOException(e, "send");
            // Message level failures happen on a prepared session that was reset or completed.
            if (failure.getCategory() != SmtpErrorKind.Category.MESSAGE) {
                connection.markUnhealthy();
            }
        } catch (RuntimeException e) {
            connection.markUnhealthy();
            failure = new SmtpException(SmtpErrorKind.UNKNOWN, "Unexpected failure: " + e.getMessage(), e);
        } finally {
            connection.release();
        }

        if (failure != null) {
            result.completeExceptionally(failure);
        } else {
            result.complete(sendResult);
        }
    }

    /**
     * Verifies an address with VRFY on a pooled connection.
     *
     * @param address Address to verify.
     * @return SmtpResponse instance.
     * @throws SmtpException Unable to verify.
     */
    public SmtpResponse verify(String address) throws SmtpException {
        return await(pool.acquire().thenApplyAsync(connection -> {
            try {
                engine.ensureReady(connection.getTransport());
                return engine.verify(connection.getTransport(), address);
            } catch (IOException e) {
                connection.markUnhealthy();
                throw new CompletionException(SmtpException.fromIOException(e, "VRFY"));
            } finally {
                connection.release();
            }
        }, worker));
    }

    /**
     * Probes the server on a dedicated connection.
     * <p>Negotiates greeting and TLS and, with credentials, tries to authenticate.
     * <br>An authentication failure is reported as no authenticated user.
     *
     * @return ConnectionInfo instance.
     * @throws SmtpException Unable to connect or negotiate.
     */
    public ConnectionInfo testConnection() throws SmtpException {
        return await(CompletableFuture.supplyAsync(() -> {
            try {
                return probe();
            } catch (IOException e) {
                throw new CompletionException(SmtpException.fromIOException(e, "probe"));
            }
        }, worker));
    }

    private ConnectionInfo probe() throws IOException {
        Transport transport = transportFactory.connect(config);
        try {
            engine.negotiate(transport);
            if (engine.hasCredentials()) {
                try {
                    engine.authenticate(transport);
                } catch (SmtpException e) {
                    if (e.getCategory() != SmtpErrorKind.Category.AUTHENTICATION) {
                        throw e;
                    }
                    log.warn("Probe authentication failed: {}", e.getMessage());
                }
            }
            SmtpResponse banner = transport.getBanner();
            ConnectionInfo info = new ConnectionInfo(config.getHost(), config.getPort(), transport.isEncrypted(),
                    transport.getTlsProtocol(), transport.getCapabilities(),
                    banner != null ? banner.getMessage() : null, transport.getAuthenticatedUser());
            log.info("Connection test succeeded: {}", info);
            return info;
        } finally {
            engine.close(transport);
        }
    }

    private static <T> T await(CompletableFuture<T> future) throws SmtpException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = ResilienceOrchestrator.unwrap(e);
            if (cause instanceof SmtpException smtpException) {
                throw smtpException;
            }
            throw new SmtpException(SmtpErrorKind.UNKNOWN, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new SmtpException(SmtpErrorKind.CANCELLED, "Interrupted while waiting", e);
        }
    }

    public PoolStatus getPoolStatus() {
        return pool.getStatus();
    }

    public CircuitState getCircuitState() {
        return orchestrator.getCircuitBreaker().getState();
    }

    public MetricsSnapshot getMetrics() {
        return metrics.snapshot();
    }

    public SmtpConfig getConfig() {
        return config;
    }

    /**
     * Resets the circuit breaker and the rate limiter.
     */
    public void resetResilience() {
        orchestrator.reset();
    }

    /**
     * Closes the pool and stops the executors.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        pool.close();
        scheduler.shutdownNow();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("SMTP client closed for {}:{}", config.getHost(), config.getPort());
    }
}
