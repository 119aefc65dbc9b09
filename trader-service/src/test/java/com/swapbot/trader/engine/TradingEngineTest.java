package com.swapbot.trader.engine;

import com.swapbot.jupiter.TokenDecimals;
import com.swapbot.trader.control.TradeParameters;
import com.swapbot.trader.control.TradingSettings;
import com.swapbot.trader.notify.TradeAlert;
import com.swapbot.trader.position.BuyResult;
import com.swapbot.trader.position.PositionMonitor;
import com.swapbot.trader.signal.CandidateAsset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TradingEngineTest {

    @Mock
    private PositionMonitor monitor;

    private final List<TradeAlert> alerts = new ArrayList<>();
    private final TokenDecimals decimals = new TokenDecimals(9, Map.of());
    private TradingSettings settings;
    private TradingEngine engine;

    @BeforeEach
    void setUp() {
        settings = new TradingSettings(new TradeParameters(true, new BigDecimal("0.1"), new BigDecimal("2"), new BigDecimal("80"), 50));
        engine = new TradingEngine(monitor, settings, decimals, alerts::add,
                Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneId.of("UTC")));
    }

    @Test
    void candidateIsAnnouncedAndBought() {
        when(monitor.submitBuy("WIF", "WifMint"))
                .thenReturn(CompletableFuture.completedFuture(BuyResult.of(BuyResult.BuyStatus.FAILED, "WIF", "buy of WIF failed")));

        engine.onCandidateAsset(new CandidateAsset("WIF", "WifMint", "jupiter-token-feed", new BigDecimal("0.01"), 6, null));

        verify(monitor).submitBuy("WIF", "WifMint");
        assertThat(decimals.known("WifMint")).hasValue(6);
        assertThat(alerts).singleElement().satisfies(alert -> {
            assertThat(alert.type()).isEqualTo(TradeAlert.Type.CANDIDATE_DETECTED);
            assertThat(alert.details()).containsEntry("price", "0.01").containsEntry("source", "jupiter-token-feed");
        });
    }

    @Test
    void candidateIsOnlyAnnouncedWhenAutoTradingIsOff() {
        settings.setAutoTradeEnabled(false);

        engine.onCandidateAsset(new CandidateAsset("WIF", "WifMint", "jupiter-token-feed", null, null, null));

        assertThat(alerts).hasSize(1);
        verify(monitor, never()).submitBuy(any(), any());
    }

    @Test
    void candidateWithoutAddressIsIgnored() {
        engine.onCandidateAsset(new CandidateAsset("WIF", " ", "jupiter-token-feed", null, null, null));

        assertThat(alerts).isEmpty();
        verify(monitor, never()).submitBuy(any(), any());
    }
}
