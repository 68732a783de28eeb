package com.scholary.video.composer.webhook;

/** Thrown when a webhook delivery cannot be proven to come from the prediction service. */
public class SignatureVerificationException extends RuntimeException {

  public SignatureVerificationException(String message) {
    super(message);
  }

  public SignatureVerificationException(String message, Throwable cause) {
    super(message, cause);
  }
}
