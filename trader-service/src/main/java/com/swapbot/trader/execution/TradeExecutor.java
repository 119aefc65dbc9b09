package com.swapbot.trader.execution;

import com.swapbot.http.ExternalCallException;
import com.swapbot.http.Sleeper;
import com.swapbot.jupiter.JupiterClient;
import com.swapbot.jupiter.SwapQuote;
import com.swapbot.jupiter.SwapTransaction;
import com.swapbot.solana.TokenHolding;
import com.swapbot.trader.wallet.WalletGateway;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Optional;

/**
 * Quote, swap and submit against the base currency, confirming the traded amount through the wallet.
 *
 * The executed amount is the change in wallet holdings across the trade, not the quoted amount. After submission
 * the transaction is followed until it lands, then holdings are read until they move. A trade whose holdings never
 * moved counts as failed.
 */
@Slf4j
@RequiredArgsConstructor
public class TradeExecutor {

    private final @NonNull JupiterClient jupiter;
    private final @NonNull TransactionSubmitter submitter;
    private final @NonNull WalletGateway wallet;
    private final @NonNull ConfirmationPolicy confirmation;
    private final @NonNull Sleeper sleeper;

    /**
     * Spends {@code baseAmount} of the base currency on {@code address}.
     */
    public ExecutionResult buy(String address, BigDecimal baseAmount, int slippageBps) {
        try {
            TokenHolding before = holding(address);

            Optional<SwapQuote> quote = jupiter.getQuote(JupiterClient.BASE_SENTINEL, address, baseAmount, slippageBps);
            if (quote.isEmpty()) {
                return ExecutionResult.failure("no quote available");
            }
            Optional<SwapTransaction> swap = jupiter.getSwapTransaction(quote.get(), wallet.publicKey());
            if (swap.isEmpty()) {
                return ExecutionResult.failure("no swap transaction available");
            }
            SubmissionResult submitted = submitter.submit(swap.get());
            if (!submitted.success()) {
                return ExecutionResult.failure(submitted.reason());
            }
            Optional<String> unsettled = settle(swap.get(), submitted.signature());
            if (unsettled.isPresent()) {
                return ExecutionResult.failure(unsettled.get());
            }

            TokenHolding after = awaitHoldingChange(address, before, true);
            BigInteger received = after.rawAmount().subtract(before.rawAmount());
            if (received.signum() <= 0) {
                log.error("buy of {} submitted ({}) but wallet holdings did not increase", address, submitted.signature());
                return ExecutionResult.failure("purchase could not be confirmed in the wallet");
            }
            jupiter.decimals().register(address, after.decimals());
            BigDecimal amount = new BigDecimal(received).movePointLeft(after.decimals());
            BigDecimal price = quote.get().inAmountUi().divide(amount, MathContext.DECIMAL64);
            return ExecutionResult.success(amount, price, submitted.signature());
        } catch (ExternalCallException e) {
            log.error("buy of {} aborted ({}): {}", address, e.category(), e.getMessage());
            return ExecutionResult.failure(FailureReasons.describe("buy", e));
        }
    }

    /**
     * Sells up to {@code tokenAmount} of {@code address} for the base currency. The confirmed amount never exceeds
     * the requested one.
     */
    public ExecutionResult sell(String address, BigDecimal tokenAmount, int slippageBps) {
        try {
            TokenHolding before = holding(address);
            if (before.rawAmount().signum() <= 0) {
                return ExecutionResult.failure("nothing to sell in the wallet");
            }

            Optional<SwapQuote> quote = jupiter.getQuote(address, JupiterClient.BASE_SENTINEL, tokenAmount, slippageBps);
            if (quote.isEmpty()) {
                return ExecutionResult.failure("no quote available");
            }
            Optional<SwapTransaction> swap = jupiter.getSwapTransaction(quote.get(), wallet.publicKey());
            if (swap.isEmpty()) {
                return ExecutionResult.failure("no swap transaction available");
            }
            SubmissionResult submitted = submitter.submit(swap.get());
            if (!submitted.success()) {
                return ExecutionResult.failure(submitted.reason());
            }
            Optional<String> unsettled = settle(swap.get(), submitted.signature());
            if (unsettled.isPresent()) {
                return ExecutionResult.failure(unsettled.get());
            }

            TokenHolding after = awaitHoldingChange(address, before, false);
            BigInteger sentRaw = before.rawAmount().subtract(after.rawAmount());
            if (sentRaw.signum() <= 0) {
                log.error("sell of {} submitted ({}) but wallet holdings did not decrease", address, submitted.signature());
                return ExecutionResult.failure("sale could not be confirmed in the wallet");
            }
            BigDecimal sold = new BigDecimal(sentRaw).movePointLeft(before.decimals());
            if (sold.compareTo(tokenAmount) > 0) {
                sold = tokenAmount;
            }
            BigDecimal quotedIn = new BigDecimal(quote.get().inAmount()).movePointLeft(before.decimals());
            BigDecimal price = quote.get().outAmountUi().divide(quotedIn, MathContext.DECIMAL64);
            return ExecutionResult.success(sold, price, submitted.signature());
        } catch (ExternalCallException e) {
            log.error("sell of {} aborted ({}): {}", address, e.category(), e.getMessage());
            return ExecutionResult.failure(FailureReasons.describe("sell", e));
        }
    }

    public Optional<BigDecimal> price(String address, int slippageBps) {
        return jupiter.getPrice(address, slippageBps);
    }

    /**
     * Returns a failure reason when the submitted transaction is known not to have landed. An unknown outcome is
     * left to the wallet reads.
     */
    private Optional<String> settle(SwapTransaction swap, String signature) {
        Confirmation outcome = submitter.awaitConfirmation(swap, signature);
        switch (outcome) {
            case FAILED:
                return Optional.of("transaction failed on chain");
            case EXPIRED:
                return Optional.of("transaction expired before landing");
            case UNKNOWN:
                log.warn("transaction {} not confirmed yet, checking wallet holdings", signature);
                break;
            default:
                break;
        }
        return Optional.empty();
    }

    private TokenHolding awaitHoldingChange(String address, TokenHolding before, boolean increase) {
        TokenHolding current = holding(address);
        for (int read = 1; read < confirmation.maxHoldingsReads() && !moved(before, current, increase); read++) {
            try {
                sleeper.sleep(confirmation.pollInterval());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return current;
            }
            current = holding(address);
        }
        return current;
    }

    private static boolean moved(TokenHolding before, TokenHolding current, boolean increase) {
        int direction = current.rawAmount().compareTo(before.rawAmount());
        return increase ? direction > 0 : direction < 0;
    }

    private TokenHolding holding(String address) {
        return wallet.tokenHolding(address)
                .orElseGet(() -> TokenHolding.empty(address, jupiter.decimals().decimalsOf(address)));
    }
}
