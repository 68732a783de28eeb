package com.scholary.video.composer.job;

/** Thrown when a job is submitted with scene definitions that can never be composited. */
public class InvalidSceneConfigException extends RuntimeException {

  public InvalidSceneConfigException(String message) {
    super(message);
  }

  public InvalidSceneConfigException(String message, Throwable cause) {
    super(message, cause);
  }
}
