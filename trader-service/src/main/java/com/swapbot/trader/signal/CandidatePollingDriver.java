package com.swapbot.trader.signal;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls one {@link CandidateSource} on its own thread and forwards symbols that were not in the previous poll.
 * A symbol that drops out of the feed and reappears is reported again.
 */
@Slf4j
public class CandidatePollingDriver {

    private final CandidateSource source;
    private final CandidateListener listener;
    private final ScheduledExecutorService executor;
    private final AtomicBoolean started = new AtomicBoolean();
    private final Counter candidatesCounter;
    private final Counter pollFailuresCounter;

    private Set<String> knownSymbols = Set.of();

    public CandidatePollingDriver(CandidateSource source, CandidateListener listener, MeterRegistry meterRegistry) {
        this.source = Objects.requireNonNull(source, "source");
        this.listener = Objects.requireNonNull(listener, "listener");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "candidates-" + source.name());
            t.setDaemon(true);
            return t;
        });
        this.candidatesCounter = Counter.builder("swapbot.candidates.detected")
                .description("New candidate assets forwarded to the trading engine")
                .tag("source", source.name())
                .register(meterRegistry);
        this.pollFailuresCounter = Counter.builder("swapbot.candidates.poll.failures")
                .description("Failed polls of a candidate source")
                .tag("source", source.name())
                .register(meterRegistry);
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        long periodMs = Math.max(1_000L, source.pollInterval().toMillis());
        executor.execute(this::initializeSource);
        executor.scheduleWithFixedDelay(this::safePoll, 0, periodMs, TimeUnit.MILLISECONDS);
        log.info("candidate source {} started (pollMillis={})", source.name(), periodMs);
    }

    public void stop() {
        if (!started.get()) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        } finally {
            source.teardown();
            log.info("candidate source {} stopped", source.name());
        }
    }

    public boolean isRunning() {
        return started.get() && !executor.isShutdown();
    }

    /**
     * Runs one poll on the calling thread.
     *
     * @return the candidates forwarded to the listener
     */
    public List<CandidateAsset> pollOnce() throws Exception {
        List<CandidateAsset> candidates = source.extractCandidates();
        Set<String> current = new HashSet<>();
        List<CandidateAsset> fresh = new ArrayList<>();
        for (CandidateAsset candidate : candidates) {
            if (candidate == null || candidate.symbol() == null || candidate.symbol().isEmpty()) {
                continue;
            }
            if (!candidate.hasAddress()) {
                log.debug("{}: ignoring {} without an address", source.name(), candidate.symbol());
                continue;
            }
            if (current.add(candidate.symbol()) && !knownSymbols.contains(candidate.symbol())) {
                fresh.add(candidate);
            }
        }
        knownSymbols = Set.copyOf(current);

        for (CandidateAsset candidate : fresh) {
            log.info("{}: new candidate {} ({})", source.name(), candidate.symbol(), candidate.address());
            candidatesCounter.increment();
            try {
                listener.onCandidateAsset(candidate);
            } catch (Exception e) {
                log.error("{}: listener failed for {}: {}", source.name(), candidate.symbol(), e.toString());
            }
        }
        return fresh;
    }

    private void initializeSource() {
        try {
            source.initialize();
        } catch (Exception e) {
            log.error("candidate source {} failed to initialize", source.name(), e);
        }
    }

    private void safePoll() {
        try {
            pollOnce();
        } catch (Exception e) {
            pollFailuresCounter.increment();
            log.warn("candidate source {} poll failed: {}", source.name(), e.toString());
        }
    }
}
