package com.swapbot.trader.wallet;

import com.swapbot.jupiter.JupiterClient;
import com.swapbot.jupiter.TokenDecimals;
import com.swapbot.solana.SolanaRpcClient;
import com.swapbot.solana.TokenHolding;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Wallet balances read over Solana JSON-RPC. Token decimals seen here are fed back into {@link TokenDecimals}.
 */
@RequiredArgsConstructor
public class SolanaRpcWalletGateway implements WalletGateway {

    private final @NonNull SolanaRpcClient rpc;
    private final @NonNull String publicKey;
    private final @NonNull TokenDecimals decimals;

    @Override
    public String publicKey() {
        return publicKey;
    }

    @Override
    public BigDecimal baseBalance() {
        return new BigDecimal(rpc.getBalance(publicKey)).movePointLeft(JupiterClient.BASE_DECIMALS);
    }

    @Override
    public Optional<TokenHolding> tokenHolding(String mint) {
        Optional<TokenHolding> holding = rpc.getTokenHolding(publicKey, mint);
        holding.ifPresent(h -> decimals.register(mint, h.decimals()));
        return holding;
    }
}
