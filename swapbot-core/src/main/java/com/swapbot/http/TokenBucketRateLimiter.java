package com.swapbot.http;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token bucket with continuous refill.
 *
 * The refill-and-take step runs under a lock; a caller that has to wait releases the lock while sleeping
 * and competes again after waking.
 */
@Slf4j
public final class TokenBucketRateLimiter implements RequestRateLimiter {

  private final double capacity;
  private final double refillPerSecond;
  private final Clock clock;
  private final Sleeper sleeper;
  private final ReentrantLock lock = new ReentrantLock();

  private double tokens;
  private Instant lastRefill;

  public TokenBucketRateLimiter(double requestsPerSecond, int burst, Clock clock) {
    this(requestsPerSecond, burst, clock, Sleeper.system());
  }

  public TokenBucketRateLimiter(double requestsPerSecond, int burst, Clock clock, Sleeper sleeper) {
    if (!(requestsPerSecond > 0)) {
      throw new IllegalArgumentException("requestsPerSecond must be > 0");
    }
    if (burst < 1) {
      throw new IllegalArgumentException("burst must be >= 1");
    }
    this.capacity = burst;
    this.refillPerSecond = requestsPerSecond;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.tokens = burst;
    this.lastRefill = clock.instant();
  }

  /**
   * {@code rateLimit} requests per {@code per}, starting with a full bucket of {@code rateLimit} permits.
   */
  public static TokenBucketRateLimiter perWindow(int rateLimit, Duration per, Clock clock, Sleeper sleeper) {
    double seconds = per.toNanos() / 1_000_000_000.0;
    return new TokenBucketRateLimiter(rateLimit / seconds, rateLimit, clock, sleeper);
  }

  @Override
  public void acquire() {
    while (true) {
      Duration wait;
      lock.lock();
      try {
        refill();
        if (tokens >= 1.0) {
          tokens -= 1.0;
          return;
        }
        wait = timeUntilOneToken();
      } finally {
        lock.unlock();
      }

      log.debug("rate limit reached, waiting {} ms", wait.toMillis());
      try {
        sleeper.sleep(wait);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancellationException("interrupted while waiting for a rate limit permit");
      }
    }
  }

  public double availableTokens() {
    lock.lock();
    try {
      refill();
      return tokens;
    } finally {
      lock.unlock();
    }
  }

  public double capacity() {
    return capacity;
  }

  private void refill() {
    Instant now = clock.instant();
    long elapsedNanos = Duration.between(lastRefill, now).toNanos();
    if (elapsedNanos > 0) {
      tokens = Math.min(capacity, tokens + (elapsedNanos / 1_000_000_000.0) * refillPerSecond);
      lastRefill = now;
    }
  }

  private Duration timeUntilOneToken() {
    double seconds = (1.0 - tokens) / refillPerSecond;
    return Duration.ofNanos((long) Math.ceil(seconds * 1_000_000_000.0));
  }
}
