package com.swapbot.http;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

/**
 * Runs outbound calls behind a rate limiter and a retry policy.
 *
 * <ul>
 *   <li>every attempt takes a permit from the limiter first</li>
 *   <li>{@link ErrorCategory#THROTTLE}: sleep the server-provided wait and retry; does not count as an attempt</li>
 *   <li>{@link ErrorCategory#TRANSIENT_NETWORK}: sleep the base delay and retry until attempts are exhausted</li>
 *   <li>anything else is rethrown immediately</li>
 * </ul>
 */
@Slf4j
public class ResilientExecutor {

  private final String name;
  private final RequestRateLimiter rateLimiter;
  private final RetryPolicy retryPolicy;
  private final ErrorClassifier classifier;
  private final Sleeper sleeper;

  private final Counter retriesCounter;
  private final Counter throttledCounter;

  public ResilientExecutor(
      String name,
      RequestRateLimiter rateLimiter,
      RetryPolicy retryPolicy,
      ErrorClassifier classifier,
      Sleeper sleeper,
      MeterRegistry meterRegistry
  ) {
    this.name = Objects.requireNonNull(name, "name");
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");

    MeterRegistry registry = meterRegistry == null ? new SimpleMeterRegistry() : meterRegistry;
    this.retriesCounter = Counter.builder("swapbot.http.retries")
        .description("Outbound calls retried after a transient failure")
        .tag("client", name)
        .register(registry);
    this.throttledCounter = Counter.builder("swapbot.http.throttled")
        .description("Outbound calls delayed by a server throttle")
        .tag("client", name)
        .register(registry);
  }

  public ResilientExecutor(String name, RequestRateLimiter rateLimiter, RetryPolicy retryPolicy, ErrorClassifier classifier) {
    this(name, rateLimiter, retryPolicy, classifier, Sleeper.system(), null);
  }

  public String name() {
    return name;
  }

  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  public ErrorClassifier classifier() {
    return classifier;
  }

  /**
   * @throws ExternalCallException when the call fails with a non-retryable error or attempts run out
   * @throws CancellationException when the calling thread is interrupted while waiting
   */
  public <T> T execute(String operation, Callable<T> call) {
    int maxAttempts = retryPolicy.effectiveMaxAttempts();
    int failedAttempts = 0;

    while (true) {
      rateLimiter.acquire();
      ExternalCallException failure;
      try {
        return call.call();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancellationException(name + " " + operation + " interrupted");
      } catch (Exception e) {
        failure = classifier.toException(operation, e);
      }

      switch (failure.category()) {
        case THROTTLE -> {
          throttledCounter.increment();
          Duration wait = failure.retryAfter();
          log.warn("{} {} throttled, waiting {} ms before retrying", name, operation, wait.toMillis());
          pause(wait, operation);
        }
        case TRANSIENT_NETWORK -> {
          failedAttempts++;
          if (failedAttempts >= maxAttempts) {
            log.warn("{} {} failed after {} attempt(s): {}", name, operation, failedAttempts, failure.getMessage());
            throw failure;
          }
          retriesCounter.increment();
          log.warn("{} {} attempt {}/{} failed, retrying in {} ms: {}",
              name, operation, failedAttempts, maxAttempts, retryPolicy.baseDelayMillis(), failure.getMessage());
          pause(retryPolicy.baseDelay(), operation);
        }
        default -> throw failure;
      }
    }
  }

  /**
   * Variant for calls without a result.
   */
  public void run(String operation, CheckedRunnable call) {
    execute(operation, () -> {
      call.run();
      return null;
    });
  }

  private void pause(Duration wait, String operation) {
    try {
      sleeper.sleep(wait);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CancellationException(name + " " + operation + " interrupted while backing off");
    }
  }

  @FunctionalInterface
  public interface CheckedRunnable {
    void run() throws Exception;
  }
}
