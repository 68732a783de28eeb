package com.scholary.video.composer.retry;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Default retryable predicate.
 *
 * <p>A failure is transient if anything in its cause chain is a {@link TransientInfraException},
 * a connect or timeout exception, or carries a message mentioning one of the known transient
 * signals. Everything else is fatal.
 */
public class TransientFailureClassifier implements Predicate<Throwable> {

  static final List<String> TRANSIENT_SIGNALS =
      List.of(
          "network",
          "fetch",
          "timeout",
          "timed out",
          "cors",
          "connection",
          "out of memory",
          "resource temporarily unavailable",
          "busy");

  // Bounds the walk for pathological self-referencing chains.
  private static final int MAX_CAUSE_DEPTH = 16;

  @Override
  public boolean test(Throwable failure) {
    Throwable current = failure;
    for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
      if (isTransientType(current) || hasTransientMessage(current)) {
        return true;
      }
      if (current.getCause() == current) {
        break;
      }
      current = current.getCause();
    }
    return false;
  }

  private static boolean isTransientType(Throwable failure) {
    return failure instanceof TransientInfraException
        || failure instanceof ConnectException
        || failure instanceof SocketTimeoutException
        || failure instanceof HttpTimeoutException
        || failure instanceof TimeoutException
        || failure instanceof OutOfMemoryError;
  }

  private static boolean hasTransientMessage(Throwable failure) {
    String message = failure.getMessage();
    if (message == null) {
      return false;
    }
    String normalized = message.toLowerCase(Locale.ROOT);
    return TRANSIENT_SIGNALS.stream().anyMatch(normalized::contains);
  }
}
