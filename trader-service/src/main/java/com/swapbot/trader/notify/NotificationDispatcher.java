package com.swapbot.trader.notify;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Queues alerts and delivers them to every notifier on a dedicated thread, so slow or throttled channels never
 * hold up trading. Alerts arriving while the queue is full are dropped and counted.
 */
@Slf4j
public class NotificationDispatcher implements TradeAlertPublisher {

    private static final long DRAIN_MILLIS = 10_000L;

    private final List<TradeNotifier> notifiers;
    private final BlockingQueue<Runnable> queue;
    private final ThreadPoolExecutor worker;
    private final Counter deliveredCounter;
    private final Counter failedCounter;
    private final Counter droppedCounter;

    public NotificationDispatcher(List<TradeNotifier> notifiers, int queueCapacity, MeterRegistry meterRegistry) {
        this.notifiers = List.copyOf(notifiers);
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, queue, r -> {
            Thread t = new Thread(r, "notification-dispatcher");
            t.setDaemon(true);
            return t;
        });

        this.deliveredCounter = Counter.builder("swapbot.notifications.delivered")
                .description("Alerts delivered to a notifier")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("swapbot.notifications.failed")
                .description("Alert deliveries that failed after retries")
                .register(meterRegistry);
        this.droppedCounter = Counter.builder("swapbot.notifications.dropped")
                .description("Alerts dropped because the queue was full or the dispatcher stopped")
                .register(meterRegistry);
        Gauge.builder("swapbot.notifications.pending", queue, BlockingQueue::size)
                .description("Alerts waiting for delivery")
                .register(meterRegistry);
    }

    @Override
    public void publish(TradeAlert alert) {
        try {
            worker.execute(() -> deliver(alert));
        } catch (RejectedExecutionException e) {
            droppedCounter.increment();
            log.warn("dropping {} alert for {}: dispatcher {}", alert.type(), alert.symbol(),
                    worker.isShutdown() ? "stopped" : "queue full");
        }
    }

    /**
     * Sends {@code alert} to every notifier on the calling thread. One failing channel does not stop the others.
     */
    void deliver(TradeAlert alert) {
        for (TradeNotifier notifier : notifiers) {
            try {
                notifier.send(alert);
                deliveredCounter.increment();
            } catch (Exception e) {
                failedCounter.increment();
                log.warn("notifier {} failed to deliver {} for {}: {}", notifier.name(), alert.type(), alert.symbol(), e.toString());
            }
        }
    }

    public int pendingCount() {
        return queue.size();
    }

    public void shutdown() {
        stop(DRAIN_MILLIS);
    }

    /**
     * Stops accepting alerts and waits for queued ones to be delivered.
     */
    public void stop(long timeoutMillis) {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("notification dispatcher did not drain within {} ms, {} alert(s) pending", timeoutMillis, queue.size());
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.shutdownNow();
        }
    }
}
