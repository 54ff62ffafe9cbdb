package com.di.datapipe.bus;

import com.di.datapipe.exception.FailureCategory;
import com.di.datapipe.metrics.PipelineMetrics;
import com.di.datapipe.util.MdcKeys;
import com.di.datapipe.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process push subscription with at-least-once delivery.
 *
 * <pre>
 *   deliver ──► attempt n ──► handler returns            ──► ack
 *                   │
 *                   ├──► handler throws / ack deadline   ──► backoff(n) ──► attempt n+1
 *                   │
 *                   └──► not retryable, or n == max      ──► dead letter
 * </pre>
 *
 * An attempt that outlives its ack deadline is abandoned, not interrupted: it keeps running and may
 * race with its own redelivery. Handlers are expected to be safe under that race.
 */
@Slf4j
public class PushSubscription implements AutoCloseable {

    private static final int PREVIEW_CHARS = 2000;

    private final String name;
    private final MessageHandler handler;
    private final SubscriptionSettings settings;
    private final DeadLetterSink deadLetters;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final ExecutorService handlerPool;
    private final ScheduledExecutorService timers;

    private final AtomicInteger outstanding = new AtomicInteger();
    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong acked = new AtomicLong();
    private volatile boolean closed;

    public PushSubscription(String name,
                            MessageHandler handler,
                            SubscriptionSettings settings,
                            DeadLetterSink deadLetters,
                            PipelineMetrics metrics) {
        this.name = name;
        this.handler = handler;
        this.settings = settings;
        this.deadLetters = deadLetters;
        this.metrics = metrics;
        this.clock = Clock.systemUTC();
        this.handlerPool = MdcPropagation.wrapExecutor(
                Executors.newFixedThreadPool(Math.max(1, settings.getMaxConcurrency()), threadFactory(name + "-handler")));
        this.timers = Executors.newSingleThreadScheduledExecutor(threadFactory(name + "-timer"));
    }

    public String name() {
        return name;
    }

    /** Accepts a newly published message. */
    public void deliver(PushMessage message) {
        if (closed) {
            log.warn("[BUS] subscription={} closed; dropping messageId={}", name, message.getMessageId());
            return;
        }
        outstanding.incrementAndGet();
        attempt(message, 1);
    }

    private void attempt(PushMessage message, int attemptNo) {
        if (closed) {
            outstanding.decrementAndGet();
            return;
        }
        attempts.incrementAndGet();
        PushMessage delivery = message.withDeliveryAttempt(attemptNo);
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(() -> invoke(delivery), handlerPool);
        } catch (RejectedExecutionException e) {
            log.warn("[BUS] subscription={} rejected messageId={} during shutdown", name, message.getMessageId());
            outstanding.decrementAndGet();
            return;
        }
        future.orTimeout(settings.getAckDeadline().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, error) -> {
                    if (error == null) {
                        acked.incrementAndGet();
                        metrics.recordDelivery(name, "acked");
                        outstanding.decrementAndGet();
                    } else {
                        nack(message, attemptNo, unwrap(error));
                    }
                });
    }

    private void invoke(PushMessage delivery) {
        MDC.put(MdcKeys.SUBSCRIPTION, name);
        MDC.put(MdcKeys.MESSAGE_ID, delivery.getMessageId());
        try {
            log.debug("[BUS] delivering messageId={} attempt={}", delivery.getMessageId(), delivery.getDeliveryAttempt());
            handler.handle(delivery);
        } finally {
            MDC.remove(MdcKeys.SUBSCRIPTION);
            MDC.remove(MdcKeys.MESSAGE_ID);
        }
    }

    private void nack(PushMessage message, int attemptNo, Throwable error) {
        boolean expired = error instanceof TimeoutException;
        FailureCategory category = FailureCategory.categorize(error);
        metrics.recordDelivery(name, expired ? "expired" : "nacked");

        String reason = expired
                ? "ack deadline of " + settings.getAckDeadline() + " elapsed"
                : error.getClass().getSimpleName() + ": " + error.getMessage();

        if (!category.isRetryable() || attemptNo >= settings.getMaxDeliveryAttempts()) {
            deadLetter(message, attemptNo, category, reason);
            return;
        }

        Duration delay = settings.backoffFor(attemptNo);
        log.warn("[BUS] subscription={} messageId={} attempt={} failed [{}] {}; redelivering in {}ms",
                name, message.getMessageId(), attemptNo, category.name(), reason, delay.toMillis());
        try {
            timers.schedule(() -> attempt(message, attemptNo + 1), delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("[BUS] subscription={} closed before redelivery of messageId={}", name, message.getMessageId());
            outstanding.decrementAndGet();
        }
    }

    private void deadLetter(PushMessage message, int attemptNo, FailureCategory category, String reason) {
        metrics.recordDelivery(name, "dead_lettered");
        metrics.recordDeadLetter(name, category.name());
        try {
            deadLetters.accept(DeadLetter.builder()
                    .subscription(name)
                    .messageId(message.getMessageId())
                    .attempts(attemptNo)
                    .category(category.name())
                    .reason(reason)
                    .payload(message.preview(PREVIEW_CHARS))
                    .deadLetteredAt(clock.instant())
                    .build());
        } finally {
            outstanding.decrementAndGet();
        }
    }

    /** Messages accepted but not yet acked or dead-lettered. */
    public int outstanding() {
        return outstanding.get();
    }

    public long deliveryAttempts() {
        return attempts.get();
    }

    public long ackedCount() {
        return acked.get();
    }

    /**
     * Waits until every accepted message has been acked or dead-lettered.
     *
     * @return true when idle before the timeout
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (outstanding.get() > 0) {
            if (System.nanoTime() > deadline) {
                return false;
            }
            Thread.sleep(10);
        }
        return true;
    }

    @Override
    public void close() {
        closed = true;
        timers.shutdownNow();
        handlerPool.shutdown();
        try {
            if (!handlerPool.awaitTermination(settings.getAckDeadline().toMillis(), TimeUnit.MILLISECONDS)) {
                handlerPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handlerPool.shutdownNow();
        }
        log.info("[BUS] subscription={} closed (attempts={}, acked={})", name, attempts.get(), acked.get());
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
