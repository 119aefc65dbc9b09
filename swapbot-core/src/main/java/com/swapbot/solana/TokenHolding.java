package com.swapbot.solana;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Balance of one mint across all token accounts of an owner.
 */
public record TokenHolding(String mint, BigInteger rawAmount, int decimals) {

  public static TokenHolding empty(String mint, int decimals) {
    return new TokenHolding(mint, BigInteger.ZERO, decimals);
  }

  public BigDecimal uiAmount() {
    return new BigDecimal(rawAmount).movePointLeft(decimals);
  }
}
