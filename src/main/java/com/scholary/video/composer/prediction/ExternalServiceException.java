package com.scholary.video.composer.prediction;

/**
 * Exception thrown when the prediction service cannot accept or report on a prediction.
 *
 * <p>The message is meant for end users and ends up as the job's error.
 */
public class ExternalServiceException extends RuntimeException {

  private final int statusCode;

  public ExternalServiceException(String message) {
    this(message, -1, null);
  }

  public ExternalServiceException(String message, Throwable cause) {
    this(message, -1, cause);
  }

  public ExternalServiceException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status returned by the service, or -1 when no response was received. */
  public int getStatusCode() {
    return statusCode;
  }
}
