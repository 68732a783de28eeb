package com.scholary.video.composer.retry;

/** Receives 0-100 progress updates from a long running operation. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = percent -> {};

  void onProgress(int percent);
}
