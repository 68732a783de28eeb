package com.scholary.video.composer.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>The S3 SDK has already retried transient errors by the time this surfaces.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
