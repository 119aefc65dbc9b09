package com.swapbot.http;

import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * Maps HTTP statuses and client-side exceptions onto {@link ErrorCategory}.
 */
public final class ErrorClassifier {

  private static final int MAX_BODY_CHARS = 300;

  private final Duration defaultThrottleWait;
  private final Clock clock;

  public ErrorClassifier(Duration defaultThrottleWait, Clock clock) {
    this.defaultThrottleWait = Objects.requireNonNull(defaultThrottleWait, "defaultThrottleWait");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public ErrorClassifier(Duration defaultThrottleWait) {
    this(defaultThrottleWait, Clock.systemUTC());
  }

  public ErrorCategory classify(Throwable error) {
    return toException("call", error).category();
  }

  public ErrorCategory classifyStatus(int status) {
    if (status == 429) {
      return ErrorCategory.THROTTLE;
    }
    if (status == 401 || status == 403) {
      return ErrorCategory.FATAL_AUTHORIZATION;
    }
    if (status == 408 || status == 425 || status >= 500) {
      return ErrorCategory.TRANSIENT_NETWORK;
    }
    return ErrorCategory.DOMAIN_VALIDATION;
  }

  /**
   * Builds the failure for a non-2xx response. The body is kept as diagnostic text only.
   */
  public ExternalCallException fromResponse(String operation, int status, String retryAfterHeader, String body) {
    ErrorCategory category = classifyStatus(status);
    String message = "%s failed: HTTP %d %s".formatted(operation, status, abbreviate(body));
    Duration retryAfter = category == ErrorCategory.THROTTLE ? parseRetryAfter(retryAfterHeader) : Duration.ZERO;
    return new ExternalCallException(category, message, status, retryAfter, null);
  }

  /**
   * Wraps any exception thrown by an outbound call. {@link ExternalCallException}s pass through untouched.
   */
  public ExternalCallException toException(String operation, Throwable error) {
    if (error instanceof ExternalCallException e) {
      return e;
    }
    if (error instanceof HttpTimeoutException || error instanceof TimeoutException) {
      return ExternalCallException.transientNetwork(operation + " timed out", error);
    }
    if (error instanceof JsonProcessingException) {
      return ExternalCallException.validation(operation + " returned an unreadable body", error);
    }
    if (error instanceof IOException || error instanceof UncheckedIOException) {
      return ExternalCallException.transientNetwork(operation + " failed: " + error, error);
    }
    return ExternalCallException.validation(operation + " failed: " + error, error);
  }

  Duration parseRetryAfter(String header) {
    if (header == null || header.isBlank()) {
      return defaultThrottleWait;
    }
    String value = header.trim();
    try {
      long seconds = Long.parseLong(value);
      return Duration.ofSeconds(Math.max(0, seconds));
    } catch (NumberFormatException ignored) {
      // not delta-seconds, try HTTP-date
    }
    try {
      Instant until = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
      Duration wait = Duration.between(clock.instant(), until);
      return wait.isNegative() ? Duration.ZERO : wait;
    } catch (DateTimeParseException e) {
      return defaultThrottleWait;
    }
  }

  private static String abbreviate(String body) {
    if (body == null || body.isBlank()) {
      return "";
    }
    String trimmed = body.strip();
    return trimmed.length() <= MAX_BODY_CHARS ? trimmed : trimmed.substring(0, MAX_BODY_CHARS) + "...";
  }
}
