package com.scholary.video.composer.sequencer;

import com.scholary.video.composer.compositing.CompositionResult;
import com.scholary.video.composer.compositing.Compositor;
import com.scholary.video.composer.compositing.CompositorProperties;
import com.scholary.video.composer.compositing.SceneMedia;
import com.scholary.video.composer.job.FailureKind;
import com.scholary.video.composer.job.JobAlreadyTerminalException;
import com.scholary.video.composer.job.JobNotFoundException;
import com.scholary.video.composer.job.JobProgress;
import com.scholary.video.composer.job.JobStatus;
import com.scholary.video.composer.job.JobStore;
import com.scholary.video.composer.job.SceneOutput;
import com.scholary.video.composer.job.SceneSpec;
import com.scholary.video.composer.job.VideoJob;
import com.scholary.video.composer.logging.StructuredLogger;
import com.scholary.video.composer.prediction.ExternalServiceException;
import com.scholary.video.composer.prediction.PredictionGateway;
import com.scholary.video.composer.prediction.PredictionHandle;
import com.scholary.video.composer.prediction.SceneGenerationRequest;
import com.scholary.video.composer.retry.RetryController;
import com.scholary.video.composer.retry.RetryOptions;
import com.scholary.video.composer.retry.TransientFailureClassifier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * The job state machine.
 *
 * <p>Drives a job from {@code queued} through one prediction per scene, in order, to either a
 * single-scene completion or compositing, and finally to {@code completed} or {@code failed}.
 *
 * <p>The poller and the webhook both report prediction results here and may do so for the same
 * prediction at the same time. Every transition is therefore a guarded update on the
 * {@link JobStore}: it states what the job must look like (status, outstanding prediction, number
 * of scene outputs) and the store applies it atomically or not at all. The loser of a race gets
 * {@link TransitionOutcome#NOOP} and does nothing else. Remote calls always happen outside the
 * guarded update.
 */
@Service
public class SceneSequencer {

  private static final Logger LOGGER = LoggerFactory.getLogger(SceneSequencer.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  static final int GENERATION_START_PERCENT = 10;
  static final int GENERATION_END_PERCENT = 80;

  private final JobStore jobStore;
  private final PredictionGateway predictionGateway;
  private final Compositor compositor;
  private final RetryController retryController;
  private final SequencerProperties properties;
  private final CompositorProperties compositorProperties;
  private final Executor compositingExecutor;
  private final Clock clock;

  public SceneSequencer(
      JobStore jobStore,
      PredictionGateway predictionGateway,
      Compositor compositor,
      RetryController retryController,
      SequencerProperties properties,
      CompositorProperties compositorProperties,
      @Qualifier("compositingExecutor") Executor compositingExecutor,
      Clock clock) {
    this.jobStore = jobStore;
    this.predictionGateway = predictionGateway;
    this.compositor = compositor;
    this.retryController = retryController;
    this.properties = properties;
    this.compositorProperties = compositorProperties;
    this.compositingExecutor = compositingExecutor;
    this.clock = clock;
  }

  /**
   * Move a queued job to {@code running} and submit its first scene.
   *
   * @throws JobNotFoundException if the job does not exist
   */
  public TransitionOutcome start(String jobId) {
    Optional<VideoJob> started =
        guardedUpdate(
            jobId,
            job -> job.getStatus() == JobStatus.QUEUED,
            job -> {
              job.transitionTo(JobStatus.RUNNING, now());
              job.setProgress(generationProgress(job));
            });

    if (started.isEmpty()) {
      requireJob(jobId);
      LOGGER.debug("Job {} was already started", jobId);
      return TransitionOutcome.NOOP;
    }

    LOGGER.info("Starting job {} with {} scene(s)", jobId, started.get().sceneCount());
    dispatchScene(started.get(), 0);
    return TransitionOutcome.APPLIED;
  }

  /**
   * Record a scene's media and advance the job.
   *
   * <p>Applies only while the job is {@code running}, {@code predictionId} is its outstanding
   * prediction and a scene is still missing output. Then, depending on what is left: the next
   * scene is submitted, a single-scene job completes with that media as its artifact, or the job
   * moves to {@code encoding} and compositing is scheduled.
   */
  public TransitionOutcome onPredictionSucceeded(
      String jobId, String predictionId, String mediaUrl, NotificationSource source) {
    Instant at = now();
    Optional<VideoJob> updated =
        guardedUpdate(
            jobId,
            job -> awaits(job, predictionId) && job.nextSceneOrder() < job.sceneCount(),
            job -> {
              int order = job.nextSceneOrder();
              job.appendSceneOutput(new SceneOutput(order, mediaUrl, predictionId, at));
              job.clearActivePrediction();
              job.touch(at);
              if (!job.allScenesGenerated()) {
                job.setProgress(generationProgress(job));
              } else if (job.sceneCount() == 1) {
                job.recordArtifact(mediaUrl);
                job.transitionTo(JobStatus.COMPLETED, at);
                job.setProgress(JobProgress.of(JobStatus.COMPLETED, 100, "Video ready"));
              } else {
                job.transitionTo(JobStatus.ENCODING, at);
                job.setProgress(
                    JobProgress.of(
                        JobStatus.ENCODING,
                        0,
                        String.format("Compositing %d scenes", job.sceneCount())));
              }
            });

    if (updated.isEmpty()) {
      STRUCTURED_LOGGER.logTransitionSkipped(
          jobId, predictionId, "prediction_succeeded", source.toString());
      return TransitionOutcome.NOOP;
    }

    VideoJob job = updated.get();
    STRUCTURED_LOGGER.logSceneCompleted(
        jobId, job.nextSceneOrder() - 1, job.sceneCount(), predictionId, source.toString());

    switch (job.getStatus()) {
      case RUNNING -> dispatchScene(job, job.nextSceneOrder());
      case ENCODING -> scheduleCompositing(job);
      case COMPLETED -> STRUCTURED_LOGGER.logJobFinished(jobId, "completed", null, null);
      default ->
          LOGGER.warn("Job {} in unexpected state {} after scene output", jobId, job.getStatus());
    }
    return TransitionOutcome.APPLIED;
  }

  /** Fail the job because its outstanding prediction failed. Scene generation is never retried. */
  public TransitionOutcome onPredictionFailed(
      String jobId, String predictionId, String reason, NotificationSource source) {
    return failAwaiting(
        jobId,
        predictionId,
        FailureKind.SCENE_GENERATION_FAILED,
        job ->
            String.format(
                "Scene %d of %d failed: %s",
                job.nextSceneOrder() + 1,
                job.sceneCount(),
                reason == null || reason.isBlank() ? "unknown error" : reason),
        source);
  }

  /** Fail the job because its outstanding prediction exceeded the scene wait budget. */
  public TransitionOutcome timeOut(String jobId, String predictionId) {
    return failAwaiting(
        jobId,
        predictionId,
        FailureKind.TIMED_OUT,
        job ->
            String.format(
                "Scene %d of %d did not finish within %d minutes",
                job.nextSceneOrder() + 1,
                job.sceneCount(),
                properties.maxSceneWaitMinutes()),
        NotificationSource.POLLER);
  }

  /**
   * Count a failed status query. The job fails once the configured number of consecutive failures
   * is reached.
   */
  public TransitionOutcome onPollFailed(String jobId, String predictionId, String reason) {
    Instant at = now();
    Optional<VideoJob> updated =
        guardedUpdate(
            jobId,
            job -> awaits(job, predictionId),
            job -> {
              int failures = job.incrementPollFailures();
              if (failures >= properties.maxConsecutivePollFailures()) {
                job.fail(
                    FailureKind.EXTERNAL_SERVICE_ERROR,
                    String.format(
                        "Could not get the status of scene %d of %d: %s",
                        job.nextSceneOrder() + 1, job.sceneCount(), reason),
                    at);
              }
            });

    if (updated.isEmpty()) {
      STRUCTURED_LOGGER.logTransitionSkipped(jobId, predictionId, "poll_failed", "poller");
      return TransitionOutcome.NOOP;
    }
    VideoJob job = updated.get();
    if (job.getStatus() == JobStatus.FAILED) {
      STRUCTURED_LOGGER.logJobFinished(
          jobId, "failed", job.getFailureKind().name(), job.getError());
    } else {
      LOGGER.warn(
          "Poll failed for job {} ({}/{}): {}",
          jobId,
          job.getConsecutivePollFailures(),
          properties.maxConsecutivePollFailures(),
          reason);
    }
    return TransitionOutcome.APPLIED;
  }

  /**
   * Fail a running job that has had no outstanding prediction since {@code cutoff}, which happens
   * when the process stopped between claiming the job and submitting a scene.
   */
  public TransitionOutcome failStalled(String jobId, Instant cutoff) {
    return fail(
        jobId,
        job ->
            job.getStatus() == JobStatus.RUNNING
                && job.getActivePredictionHandle() == null
                && job.getUpdatedAt().isBefore(cutoff),
        FailureKind.TIMED_OUT,
        job ->
            String.format(
                "Scene %d of %d was never submitted", job.nextSceneOrder() + 1, job.sceneCount()));
  }

  /**
   * Cancel a job. Predictions already running at the service are left to finish and ignored.
   *
   * @return the cancelled job
   * @throws JobNotFoundException if the job does not exist
   * @throws JobAlreadyTerminalException if the job already completed or failed
   */
  public VideoJob cancel(String jobId, String reason) {
    requireJob(jobId);
    String message = reason == null || reason.isBlank() ? "Cancelled by user" : reason;
    Optional<VideoJob> cancelled =
        guardedUpdate(
            jobId,
            job -> !job.getStatus().isTerminal(),
            job -> job.fail(FailureKind.CANCELLED, message, now()));

    if (cancelled.isEmpty()) {
      VideoJob current = requireJob(jobId);
      throw new JobAlreadyTerminalException(jobId, current.getStatus());
    }
    STRUCTURED_LOGGER.logJobFinished(jobId, "failed", FailureKind.CANCELLED.name(), message);
    return cancelled.get();
  }

  void dispatchScene(VideoJob job, int order) {
    String jobId = job.getJobId();
    SceneSpec scene = job.sceneAt(order);

    PredictionHandle handle;
    try {
      handle =
          predictionGateway.submit(new SceneGenerationRequest(jobId, scene, job.getParameters()));
    } catch (ExternalServiceException e) {
      fail(
          jobId,
          current -> awaitsSubmission(current, order),
          FailureKind.EXTERNAL_SERVICE_ERROR,
          current ->
              String.format(
                  "Could not start scene %d of %d: %s",
                  order + 1, current.sceneCount(), e.getMessage()));
      return;
    }

    Instant at = now();
    Optional<VideoJob> recorded =
        guardedUpdate(
            jobId,
            current -> awaitsSubmission(current, order),
            current -> {
              current.setActivePredictionHandle(handle.id(), at);
              current.touch(at);
              current.setProgress(generationProgress(current));
            });

    if (recorded.isEmpty()) {
      LOGGER.warn(
          "Job {} moved on while scene {} was being submitted, prediction {} will be ignored",
          jobId,
          order,
          handle.id());
      return;
    }
    STRUCTURED_LOGGER.logSceneDispatched(jobId, order, job.sceneCount(), handle.id());
  }

  private void scheduleCompositing(VideoJob job) {
    try {
      compositingExecutor.execute(() -> runCompositing(job));
    } catch (RejectedExecutionException e) {
      LOGGER.error("Compositing queue full, failing job {}", job.getJobId());
      failCompositing(job.getJobId(), "Compositing capacity exhausted, try again later");
    }
  }

  void runCompositing(VideoJob job) {
    String jobId = job.getJobId();
    StructuredLogger.setJobContext(jobId);
    try {
      List<SceneMedia> media =
          job.getSceneOutputs().stream()
              .map(output -> new SceneMedia(job.sceneAt(output.order()), output.mediaUrl()))
              .toList();

      RetryOptions options =
          new RetryOptions(
              "compositing job " + jobId,
              compositorProperties.maxRetries(),
              Duration.ofMillis(compositorProperties.initialDelayMs()),
              RetryOptions.DEFAULT_MULTIPLIER,
              Duration.ofMillis(compositorProperties.maxDelayMs()),
              new TransientFailureClassifier(),
              percent -> reportCompositingProgress(jobId, percent));

      CompositionResult result =
          retryController.run(progress -> compositor.compose(jobId, media, progress), options);

      Optional<VideoJob> completed =
          guardedUpdate(
              jobId,
              current -> current.getStatus() == JobStatus.ENCODING,
              current -> {
                current.recordArtifact(result.artifactUrl());
                current.clearActivePrediction();
                current.transitionTo(JobStatus.COMPLETED, now());
                current.setProgress(JobProgress.of(JobStatus.COMPLETED, 100, "Video ready"));
              });

      if (completed.isPresent()) {
        STRUCTURED_LOGGER.logJobFinished(jobId, "completed", null, null);
      } else {
        LOGGER.info(
            "Job {} left encoding while compositing ran, discarding {}",
            jobId,
            result.objectKey());
      }

    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      failCompositing(jobId, "Compositing was interrupted");
    } catch (Exception e) {
      LOGGER.error("Compositing failed for job {}", jobId, e);
      failCompositing(jobId, "Compositing failed: " + e.getMessage());
    } catch (Error e) {
      // The job must not stay in encoding; nothing sweeps that state.
      LOGGER.error("Compositing aborted for job {}", jobId, e);
      failCompositing(jobId, "Compositing aborted: " + e);
      throw e;
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private void reportCompositingProgress(String jobId, int percent) {
    Optional<VideoJob> updated =
        guardedUpdate(
            jobId,
            job -> job.getStatus() == JobStatus.ENCODING,
            job ->
                job.setProgress(
                    JobProgress.of(
                        JobStatus.ENCODING,
                        percent,
                        String.format("Compositing %d scenes", job.sceneCount()))));
    updated.ifPresent(
        job ->
            STRUCTURED_LOGGER.logJobProgress(
                jobId, "encoding", percent, job.getProgress().message()));
  }

  private void failCompositing(String jobId, String message) {
    fail(
        jobId,
        job -> job.getStatus() == JobStatus.ENCODING,
        FailureKind.COMPOSITING_FAILED,
        job -> message);
  }

  private TransitionOutcome failAwaiting(
      String jobId,
      String predictionId,
      FailureKind kind,
      Function<VideoJob, String> message,
      NotificationSource source) {
    TransitionOutcome outcome = fail(jobId, job -> awaits(job, predictionId), kind, message);
    if (!outcome.applied()) {
      String event = "prediction_" + kind.name().toLowerCase(Locale.ROOT);
      STRUCTURED_LOGGER.logTransitionSkipped(jobId, predictionId, event, source.toString());
    }
    return outcome;
  }

  private TransitionOutcome fail(
      String jobId,
      Predicate<VideoJob> precondition,
      FailureKind kind,
      Function<VideoJob, String> message) {
    Optional<VideoJob> failed =
        guardedUpdate(jobId, precondition, job -> job.fail(kind, message.apply(job), now()));
    if (failed.isEmpty()) {
      return TransitionOutcome.NOOP;
    }
    STRUCTURED_LOGGER.logJobFinished(jobId, "failed", kind.name(), failed.get().getError());
    return TransitionOutcome.APPLIED;
  }

  private Optional<VideoJob> guardedUpdate(
      String jobId, Predicate<VideoJob> precondition, Consumer<VideoJob> mutation) {
    return jobStore.compareAndUpdate(jobId, precondition, mutation);
  }

  private VideoJob requireJob(String jobId) {
    return jobStore.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  private static boolean awaits(VideoJob job, String predictionId) {
    return job.getStatus() == JobStatus.RUNNING
        && predictionId != null
        && predictionId.equals(job.getActivePredictionHandle());
  }

  private static boolean awaitsSubmission(VideoJob job, int order) {
    return job.getStatus() == JobStatus.RUNNING
        && job.getActivePredictionHandle() == null
        && job.nextSceneOrder() == order;
  }

  /**
   * Progress while scenes are generated: 10% at start, rising to 80% as scenes finish, with an
   * ETA from the remaining scene count.
   */
  JobProgress generationProgress(VideoJob job) {
    int done = job.nextSceneOrder();
    int total = job.sceneCount();
    int percent =
        GENERATION_START_PERCENT
            + (GENERATION_END_PERCENT - GENERATION_START_PERCENT) * done / total;
    long eta = (long) (total - done) * properties.estimatedSceneSeconds();
    String message = String.format("Generating scene %d of %d", Math.min(done + 1, total), total);
    return new JobProgress(JobStatus.RUNNING, percent, message, eta);
  }

  private Instant now() {
    return clock.instant();
  }
}
