package com.scholary.video.composer.retry;

/**
 * A unit of work that may be attempted more than once.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface RetryableOperation<T> {

  T execute(ProgressListener progress) throws Exception;
}
