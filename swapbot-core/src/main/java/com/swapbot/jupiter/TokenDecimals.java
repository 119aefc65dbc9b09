package com.swapbot.jupiter;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Decimal precision per mint.
 *
 * Lookup order: configured overrides, values learned at runtime (wallet holdings, signal sources), then the
 * configured default. Falling back to the default is logged once per mint since the resulting amounts
 * are off by orders of magnitude when the guess is wrong.
 */
@Slf4j
public final class TokenDecimals {

  private final int defaultDecimals;
  private final Map<String, Integer> overrides;
  private final Map<String, Integer> learned = new ConcurrentHashMap<>();
  private final Set<String> defaultedMints = ConcurrentHashMap.newKeySet();

  public TokenDecimals(int defaultDecimals, Map<String, Integer> overrides) {
    if (defaultDecimals < 0) {
      throw new IllegalArgumentException("defaultDecimals must be >= 0");
    }
    this.defaultDecimals = defaultDecimals;
    this.overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
  }

  public int defaultDecimals() {
    return defaultDecimals;
  }

  public int decimalsOf(String mint) {
    if (JupiterClient.WRAPPED_SOL_MINT.equals(mint)) {
      return JupiterClient.BASE_DECIMALS;
    }
    OptionalInt known = known(mint);
    if (known.isPresent()) {
      return known.getAsInt();
    }
    if (mint != null && defaultedMints.add(mint)) {
      log.warn("decimals unknown for mint {}, assuming {}", mint, defaultDecimals);
    }
    return defaultDecimals;
  }

  public OptionalInt known(String mint) {
    if (mint == null) {
      return OptionalInt.empty();
    }
    Integer override = overrides.get(mint);
    if (override != null) {
      return OptionalInt.of(override);
    }
    Integer value = learned.get(mint);
    return value == null ? OptionalInt.empty() : OptionalInt.of(value);
  }

  /**
   * Records precision reported by an authoritative source. Configured overrides always win.
   */
  public void register(String mint, int decimals) {
    if (mint == null || mint.isBlank() || decimals < 0) {
      return;
    }
    Integer previous = learned.put(mint, decimals);
    if (previous == null || previous != decimals) {
      log.debug("decimals for {} = {}", mint, decimals);
    }
  }

  public boolean usedDefault(String mint) {
    return mint != null && defaultedMints.contains(mint) && known(mint).isEmpty();
  }
}
