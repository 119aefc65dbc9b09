package com.swapbot.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Failure of a call to an external service, tagged with the category that decides whether it is retried.
 */
public class ExternalCallException extends RuntimeException {

  private final ErrorCategory category;
  private final int status;
  private final Duration retryAfter;

  public ExternalCallException(ErrorCategory category, String message, int status, Duration retryAfter, Throwable cause) {
    super(message, cause);
    this.category = Objects.requireNonNull(category, "category");
    this.status = status;
    this.retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
  }

  public static ExternalCallException transientNetwork(String message, Throwable cause) {
    return new ExternalCallException(ErrorCategory.TRANSIENT_NETWORK, message, 0, null, cause);
  }

  public static ExternalCallException throttled(String message, Duration retryAfter) {
    return new ExternalCallException(ErrorCategory.THROTTLE, message, 429, retryAfter, null);
  }

  public static ExternalCallException unauthorized(String message) {
    return new ExternalCallException(ErrorCategory.FATAL_AUTHORIZATION, message, 0, null, null);
  }

  public static ExternalCallException validation(String message) {
    return new ExternalCallException(ErrorCategory.DOMAIN_VALIDATION, message, 0, null, null);
  }

  public static ExternalCallException validation(String message, Throwable cause) {
    return new ExternalCallException(ErrorCategory.DOMAIN_VALIDATION, message, 0, null, cause);
  }

  public ErrorCategory category() {
    return category;
  }

  /**
   * HTTP status of the failed response, or 0 when the call failed before a response.
   */
  public int status() {
    return status;
  }

  /**
   * Wait required by the server before the next attempt. Zero unless {@link ErrorCategory#THROTTLE}.
   */
  public Duration retryAfter() {
    return retryAfter;
  }
}
