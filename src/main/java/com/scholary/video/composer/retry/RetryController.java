package com.scholary.video.composer.retry;

import com.scholary.video.composer.logging.StructuredLogger;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs an operation with exponential backoff.
 *
 * <p>Only failures the options' predicate calls retryable are attempted again. Before every retry
 * the progress listener is reset to 0 so observers see a fresh attempt. When the budget is spent,
 * or the failure is fatal, the last exception is rethrown as is.
 *
 * <p>{@link Error}s go through the same predicate, so an {@link OutOfMemoryError} from a
 * memory-heavy attempt can be retried once the attempt's buffers are released. Any other error is
 * rethrown on the spot by the default predicate.
 */
@Component
public class RetryController {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetryController.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  private final Sleeper sleeper;

  public RetryController(Sleeper sleeper) {
    this.sleeper = sleeper;
  }

  /**
   * Run {@code operation} under {@code options}.
   *
   * @return the first successful result
   * @throws Exception the last failure, unchanged
   */
  public <T> T run(RetryableOperation<T> operation, RetryOptions options) throws Exception {
    int retry = 0;
    while (true) {
      try {
        return operation.execute(options.progress());
      } catch (Exception | Error e) {
        if (!options.retryable().test(e)) {
          LOGGER.warn(
              "{} failed with a non-retryable error after {} attempt(s): {}",
              options.operationName(),
              retry + 1,
              e.getMessage());
          throw e;
        }
        if (retry >= options.maxRetries()) {
          LOGGER.warn(
              "{} failed after {} attempt(s), giving up: {}",
              options.operationName(),
              retry + 1,
              e.getMessage());
          throw e;
        }

        retry++;
        Duration delay = options.delayBeforeRetry(retry);
        STRUCTURED_LOGGER.logRetry(
            options.operationName(),
            retry,
            options.maxRetries(),
            delay.toMillis(),
            e.getClass().getSimpleName(),
            e.getMessage());

        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          e.addSuppressed(ie);
          throw e;
        }
        options.progress().onProgress(0);
      }
    }
  }
}
