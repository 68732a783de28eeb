package com.scholary.video.composer.compositing;

/**
 * Exception thrown when scene media cannot be composited into a video.
 *
 * <p>Whether it is retried depends on its message and cause, see the retry classifier.
 */
public class CompositingException extends RuntimeException {

  public CompositingException(String message) {
    super(message);
  }

  public CompositingException(String message, Throwable cause) {
    super(message, cause);
  }
}
