package com.swapbot.trader.wallet;

import com.swapbot.jupiter.TokenDecimals;
import com.swapbot.solana.SolanaRpcClient;
import com.swapbot.solana.TokenHolding;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolanaRpcWalletGatewayTest {

    private static final String OWNER = "Wallet1111111111111111111111111111111111111";

    @Mock
    private SolanaRpcClient rpc;

    private final TokenDecimals decimals = new TokenDecimals(9, Map.of());

    @Test
    void baseBalanceIsConvertedFromLamports() {
        when(rpc.getBalance(OWNER)).thenReturn(BigInteger.valueOf(1_500_000_000L));

        assertThat(new SolanaRpcWalletGateway(rpc, OWNER, decimals).baseBalance()).isEqualByComparingTo("1.5");
    }

    @Test
    void holdingDecimalsAreLearned() {
        when(rpc.getTokenHolding(OWNER, "WifMint")).thenReturn(Optional.of(new TokenHolding("WifMint", BigInteger.valueOf(2_500_000L), 6)));

        Optional<TokenHolding> holding = new SolanaRpcWalletGateway(rpc, OWNER, decimals).tokenHolding("WifMint");

        assertThat(holding).get().satisfies(h -> assertThat(h.uiAmount()).isEqualByComparingTo("2.5"));
        assertThat(decimals.known("WifMint")).hasValue(6);
    }

    @Test
    void missingAccountIsEmpty() {
        when(rpc.getTokenHolding(OWNER, "WifMint")).thenReturn(Optional.empty());

        assertThat(new SolanaRpcWalletGateway(rpc, OWNER, decimals).tokenHolding("WifMint")).isEmpty();
        assertThat(decimals.known("WifMint")).isEmpty();
    }
}
