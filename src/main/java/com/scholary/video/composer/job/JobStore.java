package com.scholary.video.composer.job;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Store of video jobs.
 *
 * <p>All state changes after creation go through {@link #compareAndUpdate}, which is the single
 * serialization point for racing observers of the same prediction.
 */
public interface JobStore {

  void save(VideoJob job);

  /** Returns a snapshot of the job. Mutating it has no effect on the stored record. */
  Optional<VideoJob> findById(String jobId);

  /**
   * Atomically apply {@code mutation} if {@code precondition} holds for the current record.
   *
   * <p>The mutation runs against a private copy that replaces the stored record only when it
   * returns normally. Both functions must be fast and must not call remote services.
   *
   * @return the updated snapshot, or empty if the job is unknown or the precondition failed
   */
  Optional<VideoJob> compareAndUpdate(
      String jobId, Predicate<VideoJob> precondition, Consumer<VideoJob> mutation);

  /** Jobs in {@code running} with an outstanding prediction, oldest first, up to {@code limit}. */
  List<VideoJob> findAwaitingPrediction(int limit);

  /** Jobs in {@code running} with no outstanding prediction, untouched since {@code cutoff}. */
  List<VideoJob> findStalledRunning(Instant cutoff, int limit);

  /** Jobs in {@code queued}, oldest first, at most {@code limit}. */
  List<VideoJob> findQueued(int limit);

  /** Resolve the job whose outstanding prediction has this id. */
  Optional<VideoJob> findByActivePredictionHandle(String predictionId);
}
