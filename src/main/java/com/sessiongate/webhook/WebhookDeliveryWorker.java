package com.sessiongate.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sessiongate.observability.GatewayMetrics;
import com.sessiongate.observability.GatewayObservabilitySink;
import com.sessiongate.sessions.WebhookConfigProvider;
import com.sessiongate.shared.config.WebhookDeliveryConfig;
import com.sessiongate.shared.model.DeliveryStatus;
import com.sessiongate.shared.model.WebhookDeliveryTask;
import com.sessiongate.shared.util.DaemonThreadFactory;
import com.sessiongate.supervisor.BackoffPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Delivers events to tenant webhooks at least once, retrying failed calls with
 * exponential backoff on a fixed pool. A task that fails {@code maxAttempts} times is
 * marked exhausted and reported once to the observability sink.
 */
public class WebhookDeliveryWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WebhookDeliveryWorker.class);

    static final String SIGNATURE_HEADER = "X-SessionGate-Signature";
    static final String EVENT_HEADER = "X-SessionGate-Event";
    static final String DELIVERY_HEADER = "X-SessionGate-Delivery";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final WebhookDeliveryConfig config;
    private final WebhookTransport transport;
    private final DeliveryJournal journal;
    private final WebhookConfigProvider configProvider;
    private final BackoffPolicy backoff;
    private final GatewayMetrics metrics;
    private final GatewayObservabilitySink observability;
    private final ScheduledThreadPoolExecutor executor;
    private final AtomicInteger outstanding = new AtomicInteger();

    public WebhookDeliveryWorker(WebhookDeliveryConfig config, WebhookTransport transport,
                                 DeliveryJournal journal, WebhookConfigProvider configProvider,
                                 BackoffPolicy backoff, GatewayMetrics metrics,
                                 GatewayObservabilitySink observability) {
        if (config.workers() < 1) {
            throw new IllegalArgumentException("webhook.workers must be >= 1");
        }
        if (config.maxAttempts() < 1) {
            throw new IllegalArgumentException("webhook.max-attempts must be >= 1");
        }
        this.config = config;
        this.transport = transport;
        this.journal = journal;
        this.configProvider = configProvider;
        this.backoff = backoff;
        this.metrics = metrics;
        this.observability = observability;
        this.executor = new ScheduledThreadPoolExecutor(config.workers(), new DaemonThreadFactory("webhook-"));
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        this.executor.setRemoveOnCancelPolicy(true);
    }

    /** Journals a new task and schedules its first attempt. Never blocks on the network. */
    public void submit(WebhookDeliveryTask task) {
        journal.record(task);
        schedule(task);
    }

    /**
     * Reschedules journaled tasks left pending by a previous run. Tasks whose session no
     * longer has a webhook at the same URL are skipped.
     *
     * @return number of tasks resumed
     */
    public int resume() {
        int resumed = 0;
        for (var stored : journal.pending()) {
            var sessionId = stored.event().sessionId();
            var current = configProvider.getWebhookConfig(sessionId)
                    .filter(c -> c.url().equals(stored.url()));
            if (current.isEmpty()) {
                log.warn("Skipping journaled delivery {}: webhook no longer configured", stored.taskId());
                continue;
            }
            schedule(new WebhookDeliveryTask(stored.event(), stored.url(), current.get().secret(),
                    stored.attempts(), stored.nextAttemptAt(), DeliveryStatus.PENDING, stored.lastStatusCode()));
            resumed++;
        }
        if (resumed > 0) {
            log.info("Resumed {} pending webhook deliveries", resumed);
        }
        return resumed;
    }

    /** Tasks submitted and not yet delivered or exhausted. */
    public int outstanding() {
        return outstanding.get();
    }

    private void schedule(WebhookDeliveryTask task) {
        outstanding.incrementAndGet();
        long delayMs = Math.max(0, Duration.between(Instant.now(), task.nextAttemptAt()).toMillis());
        try {
            executor.schedule(() -> attempt(task), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            outstanding.decrementAndGet();
            log.warn("Webhook worker closed, {} left pending in the journal", task.taskId());
        }
    }

    private void attempt(WebhookDeliveryTask task) {
        int status;
        var started = System.nanoTime();
        try {
            var body = MAPPER.writeValueAsString(body(task));
            var headers = new LinkedHashMap<String, String>();
            headers.put(EVENT_HEADER, task.event().kind().name());
            headers.put(DELIVERY_HEADER, task.event().deliveryKey());
            if (task.secret() != null && !task.secret().isEmpty()) {
                headers.put(SIGNATURE_HEADER, WebhookSigner.sign(task.secret(), body));
            }
            status = transport.post(task.url(), headers, body, Duration.ofMillis(config.timeoutMs()));
        } catch (InterruptedException e) {
            // shutting down; the journal still has the task as pending
            Thread.currentThread().interrupt();
            outstanding.decrementAndGet();
            return;
        } catch (Exception e) {
            log.warn("Webhook {} attempt {} failed: {}", task.taskId(), task.attempts() + 1, e.getMessage());
            status = 0;
        } finally {
            metrics.webhookLatency().record(System.nanoTime() - started, TimeUnit.NANOSECONDS);
        }
        try {
            settle(task, status);
        } catch (RuntimeException e) {
            log.error("Webhook {} could not be settled", task.taskId(), e);
            outstanding.decrementAndGet();
        }
    }

    private void settle(WebhookDeliveryTask task, int status) {
        int attempt = task.attempts() + 1;
        if (status >= 200 && status < 300) {
            journal.record(task.attempted(status, Instant.now()).withStatus(DeliveryStatus.DELIVERED));
            metrics.webhookDelivered().increment();
            log.debug("Webhook {} delivered on attempt {}", task.taskId(), attempt);
            outstanding.decrementAndGet();
            return;
        }
        if (attempt >= config.maxAttempts()) {
            var exhausted = task.attempted(status, Instant.now()).withStatus(DeliveryStatus.EXHAUSTED);
            journal.record(exhausted);
            metrics.webhookExhausted().increment();
            observability.onDeliveryExhausted(exhausted);
            outstanding.decrementAndGet();
            return;
        }
        long delayMs = backoff.computeDelayMs(attempt);
        var retry = task.attempted(status, Instant.now().plusMillis(delayMs));
        log.warn("Webhook {} got status {}, retry {} in {}ms", task.taskId(), status, attempt + 1, delayMs);
        journal.record(retry);
        schedule(retry);
        outstanding.decrementAndGet();
    }

    private static Map<String, Object> body(WebhookDeliveryTask task) {
        var event = task.event();
        var body = new LinkedHashMap<String, Object>();
        body.put("sessionId", event.sessionId());
        body.put("sequence", event.sequence());
        body.put("kind", event.kind().name());
        body.put("payload", event.payload());
        body.put("receivedAt", event.receivedAt());
        return body;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(config.timeoutMs(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
