package com.swapbot.http;

public interface RequestRateLimiter {

  /**
   * Blocks until a permit is available and consumes it.
   *
   * @throws java.util.concurrent.CancellationException if the waiting thread is interrupted
   */
  void acquire();

  static RequestRateLimiter noop() {
    return () -> {
    };
  }
}
