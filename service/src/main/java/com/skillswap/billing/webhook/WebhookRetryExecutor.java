package com.skillswap.billing.webhook;

import com.skillswap.billing.config.BillingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Threads that run webhook processing attempts and the delayed retries between them, so the
 * servlet thread is released while a webhook waits for its next attempt.
 *
 * <p>Started before the web server accepts requests and stopped after it; on stop, attempts
 * already running get a short grace period.
 */
@Component
@Slf4j
public class WebhookRetryExecutor implements SmartLifecycle {

    private static final long SHUTDOWN_GRACE_SECONDS = 10;

    private final int threads;
    private volatile ScheduledExecutorService scheduler;

    public WebhookRetryExecutor(BillingProperties properties) {
        this.threads = properties.webhook().retryThreads();
    }

    public ScheduledExecutorService scheduler() {
        ScheduledExecutorService current = scheduler;
        if (current == null) {
            throw new IllegalStateException("Webhook retry executor is not running");
        }
        return current;
    }

    @Override
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newScheduledThreadPool(threads, new NamedThreadFactory());
        log.info("Webhook retry executor started: threads={}", threads);
    }

    @Override
    public synchronized void stop() {
        ScheduledExecutorService current = scheduler;
        if (current == null) {
            return;
        }
        scheduler = null;
        current.shutdown();
        try {
            if (!current.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Webhook retry executor did not terminate in {}s, pending retries dropped", SHUTDOWN_GRACE_SECONDS);
                current.shutdownNow();
            }
        } catch (InterruptedException e) {
            current.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Webhook retry executor stopped");
    }

    @Override
    public boolean isRunning() {
        return scheduler != null;
    }

    /**
     * Ahead of the embedded web server.
     */
    @Override
    public int getPhase() {
        return 0;
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "webhook-retry-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
