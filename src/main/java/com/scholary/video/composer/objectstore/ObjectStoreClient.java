package com.scholary.video.composer.objectstore;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Abstraction for the durable storage that finished videos are published to.
 *
 * <p>Keeps the compositor independent of S3 specifics and easy to mock.
 */
public interface ObjectStoreClient {

  /**
   * Upload a local file.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param file the file to upload
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putFile(String bucket, String key, Path file, String contentType);

  /**
   * Generate a presigned URL for temporary access to an object.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param ttl how long the URL stays valid
   * @return a presigned URL
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String bucket, String key, Duration ttl);

  /**
   * Get object metadata without downloading the content.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  ObjectMetadata getObjectMetadata(String bucket, String key);

  /** Object metadata returned by getObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
