package com.swapbot.trader.execution;

import com.swapbot.jupiter.JupiterClient;
import com.swapbot.jupiter.SwapQuote;
import com.swapbot.jupiter.SwapTransaction;
import com.swapbot.solana.TokenHolding;
import com.swapbot.trader.wallet.WalletGateway;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simulated settlement for PAPER mode: real quotes, in-memory wallet. A swap debits the quote's input amount
 * and credits its output amount, both in smallest units.
 */
@Slf4j
public class PaperTradingVenue implements TransactionSubmitter, WalletGateway {

    public static final String PAPER_WALLET = "paper-wallet";

    private final Map<String, Balance> balances = new HashMap<>();
    private final AtomicLong signatures = new AtomicLong();

    public PaperTradingVenue(BigDecimal initialBaseBalance) {
        BigInteger lamports = initialBaseBalance.movePointRight(JupiterClient.BASE_DECIMALS).toBigInteger();
        balances.put(JupiterClient.WRAPPED_SOL_MINT, new Balance(lamports, JupiterClient.BASE_DECIMALS));
    }

    @Override
    public synchronized SubmissionResult submit(SwapTransaction transaction) {
        SwapQuote quote = transaction.quote();
        Balance input = balances.get(quote.inputMint());
        if (input == null || input.raw().compareTo(quote.inAmount()) < 0) {
            log.warn("paper swap {} -> {} rejected: insufficient balance", quote.inputMint(), quote.outputMint());
            return SubmissionResult.failed("insufficient balance");
        }
        balances.put(quote.inputMint(), new Balance(input.raw().subtract(quote.inAmount()), input.decimals()));
        Balance output = balances.getOrDefault(quote.outputMint(), new Balance(BigInteger.ZERO, quote.outputDecimals()));
        balances.put(quote.outputMint(), new Balance(output.raw().add(quote.outAmount()), output.decimals()));

        String signature = "paper-" + signatures.incrementAndGet();
        log.info("paper swap {} {} -> {} {} ({})",
                quote.inAmountUi().toPlainString(), quote.inputMint(), quote.outAmountUi().toPlainString(), quote.outputMint(), signature);
        return SubmissionResult.submitted(signature);
    }

    @Override
    public String publicKey() {
        return PAPER_WALLET;
    }

    @Override
    public synchronized BigDecimal baseBalance() {
        return balances.get(JupiterClient.WRAPPED_SOL_MINT).ui();
    }

    @Override
    public synchronized Optional<TokenHolding> tokenHolding(String mint) {
        Balance balance = balances.get(mint);
        return balance == null
                ? Optional.empty()
                : Optional.of(new TokenHolding(mint, balance.raw(), balance.decimals()));
    }

    private record Balance(BigInteger raw, int decimals) {
        BigDecimal ui() {
            return new BigDecimal(raw).movePointLeft(decimals);
        }
    }
}
