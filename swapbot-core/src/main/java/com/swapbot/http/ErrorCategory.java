package com.swapbot.http;

/**
 * How a failed outbound call is handled by {@link ResilientExecutor}.
 */
public enum ErrorCategory {
  /**
   * Timeouts, disconnects, 5xx. Retried under the {@link RetryPolicy}.
   */
  TRANSIENT_NETWORK(true),
  /**
   * Server asked us to slow down and said for how long. Always retried after that wait,
   * without consuming an attempt.
   */
  THROTTLE(true),
  /**
   * Credentials rejected. Never retried.
   */
  FATAL_AUTHORIZATION(false),
  /**
   * Malformed request or unusable response. Never retried.
   */
  DOMAIN_VALIDATION(false);

  private final boolean retryable;

  ErrorCategory(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean retryable() {
    return retryable;
  }
}
