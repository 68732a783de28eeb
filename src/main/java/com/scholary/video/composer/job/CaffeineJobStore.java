package com.scholary.video.composer.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Stream;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory job store backed by a Caffeine cache.
 *
 * <p>Size and age bounds keep memory in check; finished jobs simply expire. Guarded updates use
 * {@code asMap().computeIfPresent}, which locks only the affected entry, so observers of different
 * jobs never contend.
 */
@Repository
public class CaffeineJobStore implements JobStore {

  private final Cache<String, VideoJob> cache;

  public CaffeineJobStore(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterHours}") int expireAfterHours) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofHours(expireAfterHours))
            .build();
  }

  @Override
  public void save(VideoJob job) {
    cache.put(job.getJobId(), job.copy());
  }

  @Override
  public Optional<VideoJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId)).map(VideoJob::copy);
  }

  @Override
  public Optional<VideoJob> compareAndUpdate(
      String jobId, Predicate<VideoJob> precondition, Consumer<VideoJob> mutation) {
    AtomicReference<VideoJob> applied = new AtomicReference<>();
    cache
        .asMap()
        .computeIfPresent(
            jobId,
            (id, current) -> {
              if (!precondition.test(current)) {
                return current;
              }
              VideoJob next = current.copy();
              mutation.accept(next);
              applied.set(next.copy());
              return next;
            });
    return Optional.ofNullable(applied.get());
  }

  @Override
  public List<VideoJob> findAwaitingPrediction(int limit) {
    return snapshot(
        job -> job.getStatus() == JobStatus.RUNNING && job.getActivePredictionHandle() != null,
        Comparator.comparing(VideoJob::getPredictionSubmittedAt),
        limit);
  }

  @Override
  public List<VideoJob> findStalledRunning(Instant cutoff, int limit) {
    return snapshot(
        job ->
            job.getStatus() == JobStatus.RUNNING
                && job.getActivePredictionHandle() == null
                && job.getUpdatedAt().isBefore(cutoff),
        Comparator.comparing(VideoJob::getUpdatedAt),
        limit);
  }

  @Override
  public List<VideoJob> findQueued(int limit) {
    return snapshot(
        job -> job.getStatus() == JobStatus.QUEUED,
        Comparator.comparing(VideoJob::getCreatedAt),
        limit);
  }

  @Override
  public Optional<VideoJob> findByActivePredictionHandle(String predictionId) {
    if (predictionId == null) {
      return Optional.empty();
    }
    return cache.asMap().values().stream()
        .filter(job -> predictionId.equals(job.getActivePredictionHandle()))
        .findFirst()
        .map(VideoJob::copy);
  }

  private List<VideoJob> snapshot(
      Predicate<VideoJob> filter, Comparator<VideoJob> order, int limit) {
    Stream<VideoJob> jobs =
        cache.asMap().values().stream().filter(Objects::nonNull).filter(filter);
    return jobs.sorted(order).limit(limit).map(VideoJob::copy).toList();
  }
}
