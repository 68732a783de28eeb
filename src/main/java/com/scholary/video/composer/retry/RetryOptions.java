package com.scholary.video.composer.retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retry policy for one {@link RetryController#run} call.
 *
 * @param operationName label used in log lines
 * @param maxRetries retries after the first attempt
 * @param initialDelay delay before the first retry
 * @param multiplier growth factor between consecutive delays
 * @param maxDelay upper bound for any single delay
 * @param retryable decides whether a failure is worth another attempt
 * @param progress receives the operation's progress, reset to 0 before each retry
 */
public record RetryOptions(
    String operationName,
    int maxRetries,
    Duration initialDelay,
    double multiplier,
    Duration maxDelay,
    Predicate<Throwable> retryable,
    ProgressListener progress) {

  public static final int DEFAULT_MAX_RETRIES = 3;
  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
  public static final double DEFAULT_MULTIPLIER = 2.0;
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(10);

  public RetryOptions {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must not be negative: " + maxRetries);
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be at least 1: " + multiplier);
    }
    if (operationName == null) {
      operationName = "operation";
    }
    if (retryable == null) {
      retryable = new TransientFailureClassifier();
    }
    if (progress == null) {
      progress = ProgressListener.NONE;
    }
  }

  /** 3 retries, 1s initial delay doubling up to 10s, transient failures only. */
  public static RetryOptions defaults(String operationName) {
    return new RetryOptions(
        operationName,
        DEFAULT_MAX_RETRIES,
        DEFAULT_INITIAL_DELAY,
        DEFAULT_MULTIPLIER,
        DEFAULT_MAX_DELAY,
        new TransientFailureClassifier(),
        ProgressListener.NONE);
  }

  public RetryOptions withRetryable(Predicate<Throwable> predicate) {
    return new RetryOptions(
        operationName, maxRetries, initialDelay, multiplier, maxDelay, predicate, progress);
  }

  public RetryOptions withProgress(ProgressListener listener) {
    return new RetryOptions(
        operationName, maxRetries, initialDelay, multiplier, maxDelay, retryable, listener);
  }

  /**
   * Delay before retry {@code retry} (1-based): {@code min(initialDelay * multiplier^(retry-1),
   * maxDelay)}.
   */
  public Duration delayBeforeRetry(int retry) {
    double millis = initialDelay.toMillis() * Math.pow(multiplier, retry - 1);
    long capped = (long) Math.min(millis, maxDelay.toMillis());
    return Duration.ofMillis(capped);
  }
}
