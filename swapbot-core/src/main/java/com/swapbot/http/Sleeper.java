package com.swapbot.http;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper system() {
    return duration -> {
      if (duration == null || duration.isZero() || duration.isNegative()) {
        return;
      }
      TimeUnit.NANOSECONDS.sleep(duration.toNanos());
    };
  }
}
