package com.scholary.video.composer.retry;

/**
 * Exception for failures expected to clear up on their own: network drops, timeouts, busy or
 * exhausted resources. Always retryable.
 */
public class TransientInfraException extends RuntimeException {

  public TransientInfraException(String message) {
    super(message);
  }

  public TransientInfraException(String message, Throwable cause) {
    super(message, cause);
  }
}
