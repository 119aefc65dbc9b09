package com.swapbot.http;

import java.time.Duration;

/**
 * Constant-delay retry policy for {@link ErrorCategory#TRANSIENT_NETWORK} failures.
 *
 * @param maxAttempts total invocations allowed, including the first one
 * @param baseDelayMillis wait between two attempts
 * @param defaultThrottleWaitMillis wait used when a throttled response carries no explicit duration
 */
public record RetryPolicy(
    boolean enabled,
    int maxAttempts,
    long baseDelayMillis,
    long defaultThrottleWaitMillis
) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (baseDelayMillis < 0 || defaultThrottleWaitMillis < 0) {
      throw new IllegalArgumentException("delays must be >= 0");
    }
  }

  public static RetryPolicy of(int maxAttempts, Duration baseDelay) {
    return new RetryPolicy(true, maxAttempts, baseDelay.toMillis(), 60_000L);
  }

  public static RetryPolicy disabled() {
    return new RetryPolicy(false, 1, 0, 60_000L);
  }

  public int effectiveMaxAttempts() {
    return enabled ? maxAttempts : 1;
  }

  public Duration baseDelay() {
    return Duration.ofMillis(baseDelayMillis);
  }

  public Duration defaultThrottleWait() {
    return Duration.ofMillis(defaultThrottleWaitMillis);
  }
}
