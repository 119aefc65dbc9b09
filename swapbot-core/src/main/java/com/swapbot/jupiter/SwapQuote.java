package com.swapbot.jupiter;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * Executable quote. Amounts are in smallest units; {@code raw} is the untouched quote payload that has to be
 * echoed back to {@code /swap}.
 */
public record SwapQuote(
    String inputMint,
    String outputMint,
    BigInteger inAmount,
    BigInteger outAmount,
    int inputDecimals,
    int outputDecimals,
    int slippageBps,
    JsonNode raw
) {

  public BigDecimal inAmountUi() {
    return new BigDecimal(inAmount).movePointLeft(inputDecimals);
  }

  public BigDecimal outAmountUi() {
    return new BigDecimal(outAmount).movePointLeft(outputDecimals);
  }

  /**
   * Input units paid per output unit. For a buy with the base currency as input this is the entry price.
   */
  public BigDecimal inputPerOutputUnit() {
    return inAmountUi().divide(outAmountUi(), MathContext.DECIMAL64);
  }

  /**
   * Output units received per input unit.
   */
  public BigDecimal outputPerInputUnit() {
    return outAmountUi().divide(inAmountUi(), MathContext.DECIMAL64);
  }
}
