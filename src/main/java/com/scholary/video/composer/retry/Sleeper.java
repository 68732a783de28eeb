package com.scholary.video.composer.retry;

import java.time.Duration;

/** Waits between attempts. Swapped out in tests to observe delays without waiting for them. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;

  static Sleeper threadSleep() {
    return duration -> Thread.sleep(duration.toMillis());
  }
}
