package com.swapbot.trader.wallet;

import com.swapbot.solana.TokenHolding;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Read access to the trading wallet. Key custody and signing live elsewhere.
 */
public interface WalletGateway {

    String publicKey();

    /**
     * Base currency (SOL) balance in whole units.
     */
    BigDecimal baseBalance();

    /**
     * Current holding of {@code mint}; empty when the wallet has never held it.
     */
    Optional<TokenHolding> tokenHolding(String mint);
}
