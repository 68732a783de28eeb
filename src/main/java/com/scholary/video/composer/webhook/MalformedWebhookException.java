package com.scholary.video.composer.webhook;

/** Thrown when a correctly signed webhook body is not a prediction document. */
public class MalformedWebhookException extends RuntimeException {

  public MalformedWebhookException(String message) {
    super(message);
  }

  public MalformedWebhookException(String message, Throwable cause) {
    super(message, cause);
  }
}
