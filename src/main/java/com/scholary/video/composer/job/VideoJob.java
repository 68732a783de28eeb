package com.scholary.video.composer.job;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A multi-scene video generation job.
 *
 * <p>Tracks the ordered scene list, the media produced for each scene so far, the single
 * outstanding prediction and the final artifact. Instances handed out by a {@link JobStore} are
 * private snapshots; mutations only become visible through {@link JobStore#compareAndUpdate}.
 */
public class VideoJob {

  private final String jobId;
  private final List<SceneSpec> scenes;
  private final GenerationParameters parameters;
  private final Instant createdAt;

  private JobStatus status;
  private JobProgress progress;
  private final List<SceneOutput> sceneOutputs;
  private final List<String> outputs;
  private String activePredictionHandle;
  private Instant predictionSubmittedAt;
  private int consecutivePollFailures;
  private String error;
  private FailureKind failureKind;
  private Instant startedAt;
  private Instant completedAt;
  private Instant updatedAt;

  public VideoJob(
      String jobId, List<SceneSpec> scenes, GenerationParameters parameters, Instant createdAt) {
    if (scenes == null || scenes.isEmpty()) {
      throw new IllegalArgumentException("A job needs at least one scene");
    }
    this.jobId = jobId;
    this.scenes =
        scenes.stream().sorted(Comparator.comparingInt(SceneSpec::order)).toList();
    this.parameters = parameters == null ? GenerationParameters.none() : parameters;
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
    this.status = JobStatus.QUEUED;
    this.progress = JobProgress.of(JobStatus.QUEUED, 0, "Waiting in queue");
    this.sceneOutputs = new ArrayList<>();
    this.outputs = new ArrayList<>();
  }

  private VideoJob(VideoJob other) {
    this.jobId = other.jobId;
    this.scenes = other.scenes;
    this.parameters = other.parameters;
    this.createdAt = other.createdAt;
    this.status = other.status;
    this.progress = other.progress;
    this.sceneOutputs = new ArrayList<>(other.sceneOutputs);
    this.outputs = new ArrayList<>(other.outputs);
    this.activePredictionHandle = other.activePredictionHandle;
    this.predictionSubmittedAt = other.predictionSubmittedAt;
    this.consecutivePollFailures = other.consecutivePollFailures;
    this.error = other.error;
    this.failureKind = other.failureKind;
    this.startedAt = other.startedAt;
    this.completedAt = other.completedAt;
    this.updatedAt = other.updatedAt;
  }

  /** Deep enough copy that mutating the result never affects this instance. */
  public VideoJob copy() {
    return new VideoJob(this);
  }

  /**
   * Move the job to a new lifecycle state.
   *
   * @throws IllegalStateException if the transition would break monotonicity
   */
  public void transitionTo(JobStatus next, Instant at) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          String.format("Illegal transition for job %s: %s -> %s", jobId, status, next));
    }
    if (next == JobStatus.RUNNING && startedAt == null) {
      startedAt = at;
    }
    if (next.isTerminal()) {
      completedAt = at;
    }
    status = next;
    updatedAt = at;
  }

  /** Terminate the job with a human readable error. Produced scene media is kept. */
  public void fail(FailureKind kind, String message, Instant at) {
    transitionTo(JobStatus.FAILED, at);
    this.failureKind = kind;
    this.error = message;
    this.activePredictionHandle = null;
    this.progress = new JobProgress(JobStatus.FAILED, progress.percent(), message, null);
  }

  /**
   * Record generated media for the next scene in order.
   *
   * @throws IllegalStateException if the output does not belong to the next pending scene
   */
  public void appendSceneOutput(SceneOutput output) {
    if (sceneOutputs.size() >= scenes.size()) {
      throw new IllegalStateException("All scenes of job " + jobId + " already have output");
    }
    if (output.order() != sceneOutputs.size()) {
      throw new IllegalStateException(
          String.format(
              "Job %s expected output for scene %d but got scene %d",
              jobId, sceneOutputs.size(), output.order()));
    }
    sceneOutputs.add(output);
  }

  /**
   * Record the single deliverable artifact.
   *
   * @throws IllegalStateException if an artifact was already recorded
   */
  public void recordArtifact(String artifactUrl) {
    if (!outputs.isEmpty()) {
      throw new IllegalStateException("Job " + jobId + " already has a final artifact");
    }
    outputs.add(artifactUrl);
  }

  public boolean allScenesGenerated() {
    return sceneOutputs.size() == scenes.size();
  }

  public int nextSceneOrder() {
    return sceneOutputs.size();
  }

  public SceneSpec sceneAt(int order) {
    return scenes.get(order);
  }

  public int sceneCount() {
    return scenes.size();
  }

  public String getJobId() {
    return jobId;
  }

  public List<SceneSpec> getScenes() {
    return scenes;
  }

  public GenerationParameters getParameters() {
    return parameters;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public JobStatus getStatus() {
    return status;
  }

  public JobProgress getProgress() {
    return progress;
  }

  public void setProgress(JobProgress progress) {
    this.progress = progress;
  }

  public List<SceneOutput> getSceneOutputs() {
    return List.copyOf(sceneOutputs);
  }

  public List<String> getOutputs() {
    return List.copyOf(outputs);
  }

  public String getActivePredictionHandle() {
    return activePredictionHandle;
  }

  public void setActivePredictionHandle(String activePredictionHandle, Instant submittedAt) {
    this.activePredictionHandle = activePredictionHandle;
    this.predictionSubmittedAt = submittedAt;
    this.consecutivePollFailures = 0;
  }

  public void clearActivePrediction() {
    this.activePredictionHandle = null;
    this.predictionSubmittedAt = null;
    this.consecutivePollFailures = 0;
  }

  public Instant getPredictionSubmittedAt() {
    return predictionSubmittedAt;
  }

  public int getConsecutivePollFailures() {
    return consecutivePollFailures;
  }

  public int incrementPollFailures() {
    return ++consecutivePollFailures;
  }

  public String getError() {
    return error;
  }

  public FailureKind getFailureKind() {
    return failureKind;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void touch(Instant at) {
    this.updatedAt = at;
  }
}
