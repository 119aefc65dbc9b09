package com.swapbot.trader.engine;

import com.swapbot.jupiter.TokenDecimals;
import com.swapbot.trader.control.TradingSettings;
import com.swapbot.trader.notify.TradeAlert;
import com.swapbot.trader.notify.TradeAlertPublisher;
import com.swapbot.trader.position.BuyResult;
import com.swapbot.trader.position.PositionMonitor;
import com.swapbot.trader.signal.CandidateAsset;
import com.swapbot.trader.signal.CandidateListener;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;

/**
 * Turns candidate assets from signal sources into buy commands for the position monitor.
 */
@Slf4j
@RequiredArgsConstructor
public class TradingEngine implements CandidateListener {

    private final @NonNull PositionMonitor monitor;
    private final @NonNull TradingSettings settings;
    private final @NonNull TokenDecimals decimals;
    private final @NonNull TradeAlertPublisher alerts;
    private final @NonNull Clock clock;

    @Override
    public void onCandidateAsset(CandidateAsset candidate) {
        if (candidate == null || !candidate.hasAddress()) {
            return;
        }
        if (candidate.decimals() != null) {
            decimals.register(candidate.address(), candidate.decimals());
        }

        Map<String, String> details = new HashMap<>();
        details.put("address", candidate.address());
        details.put("source", String.valueOf(candidate.source()));
        if (candidate.price() != null) {
            details.put("price", candidate.price().toPlainString());
        }
        alerts.publish(new TradeAlert(TradeAlert.Type.CANDIDATE_DETECTED, candidate.symbol(),
                "new token " + candidate.symbol() + " from " + candidate.source(), clock.instant(), details));

        if (!settings.current().autoTradeEnabled()) {
            log.debug("auto-trading disabled, not buying candidate {}", candidate.symbol());
            return;
        }
        monitor.submitBuy(candidate.symbol(), candidate.address())
                .whenComplete((result, error) -> logOutcome(candidate, result, error));
    }

    private void logOutcome(CandidateAsset candidate, BuyResult result, Throwable error) {
        if (error != null) {
            log.error("buy of candidate {} failed: {}", candidate.symbol(), error.toString());
        } else if (!result.success()) {
            log.info("candidate {} not bought: {}", candidate.symbol(), result.message());
        }
    }
}
