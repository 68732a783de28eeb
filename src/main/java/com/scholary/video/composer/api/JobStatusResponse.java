package com.scholary.video.composer.api;

import com.scholary.video.composer.job.FailureKind;
import com.scholary.video.composer.job.JobProgress;
import com.scholary.video.composer.job.JobStatus;
import com.scholary.video.composer.job.VideoJob;
import java.time.Instant;
import java.util.List;

/**
 * Response for job status query.
 *
 * <p>{@code outputs} holds the final video URL once the job is completed. Scene media produced
 * before a failure is still counted in {@code scenesCompleted}.
 */
public record JobStatusResponse(
    String jobId,
    JobStatus status,
    JobProgress progress,
    int sceneCount,
    int scenesCompleted,
    List<String> outputs,
    String error,
    FailureKind failureKind,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt) {

  public static JobStatusResponse from(VideoJob job) {
    return new JobStatusResponse(
        job.getJobId(),
        job.getStatus(),
        job.getProgress(),
        job.sceneCount(),
        job.getSceneOutputs().size(),
        job.getOutputs(),
        job.getError(),
        job.getFailureKind(),
        job.getCreatedAt(),
        job.getStartedAt(),
        job.getCompletedAt());
  }
}
