package com.swapbot.trader.position;

import com.swapbot.trader.control.TradeParameters;
import com.swapbot.trader.control.TradingSettings;
import com.swapbot.trader.execution.ExecutionResult;
import com.swapbot.trader.execution.TradeExecutor;
import com.swapbot.trader.notify.TradeAlert;
import com.swapbot.trader.notify.TradeAlertPublisher;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the open positions and re-prices them on a fixed cadence, selling part of a position once its profit
 * target is reached.
 *
 * All mutation happens on the single monitor thread: scheduled cycles and buys submitted through
 * {@link #submitBuy(String, String)} are serialized on it. Other threads only see the immutable snapshot
 * list published after every change.
 */
@Slf4j
public class PositionMonitor {

    private final TradeExecutor executor;
    private final TradingSettings settings;
    private final TradeAlertPublisher alerts;
    private final Clock clock;
    private final Duration interval;

    // monitor thread only
    private final Map<String, Position> positions = new LinkedHashMap<>();

    private final AtomicReference<List<PositionSnapshot>> snapshots = new AtomicReference<>(List.of());
    private final AtomicBoolean running = new AtomicBoolean();
    private final ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "position-monitor");
        t.setDaemon(true);
        return t;
    });

    private final Counter buysOpenedCounter;
    private final Counter buysFailedCounter;
    private final Counter buysSkippedCounter;
    private final Counter exitsExecutedCounter;
    private final Counter exitsFailedCounter;
    private final Counter positionsClosedCounter;

    public PositionMonitor(
            TradeExecutor executor,
            TradingSettings settings,
            TradeAlertPublisher alerts,
            Clock clock,
            Duration interval,
            MeterRegistry meterRegistry
    ) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.alerts = Objects.requireNonNull(alerts, "alerts");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");

        this.buysOpenedCounter = Counter.builder("swapbot.buys.opened")
                .description("Buys that opened a position")
                .register(meterRegistry);
        this.buysFailedCounter = Counter.builder("swapbot.buys.failed")
                .description("Buys aborted by a quote, swap, submission or confirmation failure")
                .register(meterRegistry);
        this.buysSkippedCounter = Counter.builder("swapbot.buys.skipped")
                .description("Buy requests refused (auto-trading disabled, already trading, invalid)")
                .register(meterRegistry);
        this.exitsExecutedCounter = Counter.builder("swapbot.exits.executed")
                .description("Partial exits confirmed by the wallet")
                .register(meterRegistry);
        this.exitsFailedCounter = Counter.builder("swapbot.exits.failed")
                .description("Partial exits that failed and left the position untouched")
                .register(meterRegistry);
        this.positionsClosedCounter = Counter.builder("swapbot.positions.closed")
                .description("Positions fully sold and evicted")
                .register(meterRegistry);
        Gauge.builder("swapbot.positions.open", snapshots, ref -> ref.get().size())
                .description("Open positions")
                .register(meterRegistry);
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        long periodMs = Math.max(100L, interval.toMillis());
        loop.scheduleAtFixedRate(this::safeCycle, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("position monitor started (intervalMillis={})", periodMs);
    }

    /**
     * Stops scheduling cycles. A cycle or buy already running finishes; queued buys are still executed.
     */
    public void stop() {
        running.set(false);
        loop.shutdown();
        try {
            if (!loop.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("position monitor did not stop within 60s, interrupting");
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            loop.shutdownNow();
        }
        log.info("position monitor stopped with {} open position(s)", snapshots.get().size());
    }

    public boolean isRunning() {
        return running.get() && !loop.isShutdown();
    }

    public List<PositionSnapshot> snapshot() {
        return snapshots.get();
    }

    public int openPositionCount() {
        return snapshots.get().size();
    }

    /**
     * Queues a buy on the monitor thread.
     */
    public CompletableFuture<BuyResult> submitBuy(String symbol, String address) {
        try {
            return CompletableFuture.supplyAsync(() -> buy(symbol, address), loop);
        } catch (RejectedExecutionException e) {
            buysSkippedCounter.increment();
            return CompletableFuture.completedFuture(
                    BuyResult.of(BuyResult.BuyStatus.REJECTED, symbol, "position monitor is stopped"));
        }
    }

    /**
     * Buys {@code symbol} with the current buy amount and opens a position for the confirmed amount.
     * Must run on the monitor thread; use {@link #submitBuy(String, String)} from anywhere else.
     */
    public BuyResult buy(String symbol, String address) {
        if (symbol == null || symbol.isBlank() || address == null || address.isBlank()) {
            buysSkippedCounter.increment();
            return BuyResult.of(BuyResult.BuyStatus.REJECTED, symbol, "symbol and address are required");
        }
        String key = symbol.trim();
        TradeParameters params = settings.current();
        if (!params.autoTradeEnabled()) {
            buysSkippedCounter.increment();
            log.info("not buying {}: auto-trading is disabled", key);
            return BuyResult.of(BuyResult.BuyStatus.AUTO_TRADE_DISABLED, key, "auto-trading is disabled");
        }
        if (positions.containsKey(key)) {
            buysSkippedCounter.increment();
            log.info("not buying {}: already trading", key);
            return BuyResult.of(BuyResult.BuyStatus.ALREADY_TRADING, key, "already trading " + key);
        }

        log.info("buying {} ({}) with {} SOL", key, address, params.buyAmount().toPlainString());
        ExecutionResult result;
        try {
            result = executor.buy(address.trim(), params.buyAmount(), params.slippageBps());
        } catch (RuntimeException e) {
            log.error("buy of {} failed unexpectedly", key, e);
            result = ExecutionResult.failure("unexpected error");
        }
        if (!result.success()) {
            return buyFailed(key, result.reason());
        }

        Position position;
        try {
            position = Position.open(key, address.trim(), result.tokenAmount(), result.price(),
                    params.targetMultiplier(), params.sellFraction(), clock.instant());
        } catch (IllegalArgumentException e) {
            log.error("buy of {} executed ({}) but cannot open a position: {}", key, result.signature(), e.getMessage());
            return buyFailed(key, "executed amounts are invalid");
        }
        positions.put(key, position);
        publishSnapshots();
        buysOpenedCounter.increment();

        PositionSnapshot snapshot = position.snapshot();
        log.info("bought {} {} at {} SOL ({})", snapshot.heldAmount().toPlainString(), key,
                snapshot.entryPrice().toPlainString(), result.signature());
        alerts.publish(new TradeAlert(TradeAlert.Type.BUY_EXECUTED, key,
                "bought %s %s for %s SOL".formatted(snapshot.heldAmount().toPlainString(), key, params.buyAmount().toPlainString()),
                clock.instant(),
                Map.of("address", address.trim(), "entryPrice", snapshot.entryPrice().toPlainString(),
                        "signature", String.valueOf(result.signature()))));
        return BuyResult.opened(snapshot);
    }

    /**
     * One sweep over the open positions. Must run on the monitor thread.
     */
    public void runCycle() {
        if (positions.isEmpty()) {
            return;
        }
        int slippageBps = settings.current().slippageBps();
        List<Position> active = new ArrayList<>(positions.values());
        for (Position position : active) {
            if (position.status() != PositionStatus.ACTIVE) {
                continue;
            }
            try {
                evaluate(position, slippageBps);
            } catch (Exception e) {
                log.error("error evaluating {}: {}", position.symbol(), e.toString());
            }
        }
        evictCompleted();
        publishSnapshots();
    }

    private void evaluate(Position position, int slippageBps) {
        Optional<BigDecimal> price = executor.price(position.address(), slippageBps);
        if (price.isEmpty()) {
            log.warn("no price for {}, retrying next cycle", position.symbol());
            return;
        }
        Instant now = clock.instant();
        position.updatePrice(price.get(), now);
        log.debug("{}: price={} value={} profit={}%", position.symbol(), position.currentPrice().toPlainString(),
                position.currentValue().toPlainString(), position.profitPercent().setScale(2, RoundingMode.HALF_UP));

        if (!position.isTargetReached()) {
            return;
        }
        BigDecimal exitAmount = position.exitAmount();
        log.info("target reached for {}: {}%, selling {}", position.symbol(),
                position.profitPercent().setScale(2, RoundingMode.HALF_UP), exitAmount.toPlainString());
        alerts.publish(TradeAlert.of(TradeAlert.Type.TARGET_REACHED, position.symbol(),
                "target reached at %s%% profit, selling %s".formatted(
                        position.profitPercent().setScale(2, RoundingMode.HALF_UP).toPlainString(), exitAmount.toPlainString()),
                now));

        ExecutionResult result = executor.sell(position.address(), exitAmount, slippageBps);
        if (!result.success()) {
            exitsFailedCounter.increment();
            log.error("exit of {} failed: {}", position.symbol(), result.reason());
            alerts.publish(TradeAlert.of(TradeAlert.Type.EXIT_FAILED, position.symbol(),
                    "sell failed: " + result.reason(), clock.instant()));
            return;
        }
        position.applyPartialExit(result.tokenAmount(), clock.instant());
        exitsExecutedCounter.increment();
        log.info("sold {} {} at {} SOL, {} left", result.tokenAmount().toPlainString(), position.symbol(),
                result.price().toPlainString(), position.heldAmount().toPlainString());
        alerts.publish(new TradeAlert(TradeAlert.Type.EXIT_EXECUTED, position.symbol(),
                "sold %s %s, %s left".formatted(result.tokenAmount().toPlainString(), position.symbol(),
                        position.heldAmount().toPlainString()),
                clock.instant(),
                Map.of("price", result.price().toPlainString(), "signature", String.valueOf(result.signature()))));
    }

    private BuyResult buyFailed(String symbol, String reason) {
        buysFailedCounter.increment();
        log.error("buy of {} failed: {}", symbol, reason);
        alerts.publish(TradeAlert.of(TradeAlert.Type.BUY_FAILED, symbol, "buy failed: " + reason, clock.instant()));
        return BuyResult.of(BuyResult.BuyStatus.FAILED, symbol, "buy of " + symbol + " failed: " + reason);
    }

    private void evictCompleted() {
        Iterator<Position> it = positions.values().iterator();
        while (it.hasNext()) {
            Position position = it.next();
            if (position.status() == PositionStatus.COMPLETED) {
                it.remove();
                positionsClosedCounter.increment();
                log.info("position {} closed", position.symbol());
                alerts.publish(TradeAlert.of(TradeAlert.Type.POSITION_CLOSED, position.symbol(),
                        "position fully sold", clock.instant()));
            }
        }
    }

    private void publishSnapshots() {
        List<PositionSnapshot> list = new ArrayList<>(positions.size());
        for (Position position : positions.values()) {
            list.add(position.snapshot());
        }
        snapshots.set(List.copyOf(list));
    }

    private void safeCycle() {
        if (!running.get()) {
            return;
        }
        try {
            runCycle();
        } catch (Exception e) {
            log.error("position monitor cycle failed, continuing scheduler loop", e);
        }
    }
}
