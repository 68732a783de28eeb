package com.scholary.video.composer.compositing;

import com.scholary.video.composer.retry.ProgressListener;
import java.io.IOException;
import java.util.List;

/**
 * Merges the media of two or more scenes into one published video.
 *
 * <p>Scenes are joined by {@code order}, never by list position, and each call is a complete
 * attempt: fetch, trim, transition, concatenate, encode, publish.
 */
public interface Compositor {

  /**
   * Composite the scenes of a job.
   *
   * @param jobId owning job, used for the storage key
   * @param scenes at least two scenes, any order
   * @param progress receives 0-100 progress for this attempt
   * @return the published artifact
   * @throws IOException if media cannot be fetched or written
   * @throws InterruptedException if the calling thread is interrupted
   * @throws CompositingException if the media cannot be composited
   */
  CompositionResult compose(String jobId, List<SceneMedia> scenes, ProgressListener progress)
      throws IOException, InterruptedException;
}
