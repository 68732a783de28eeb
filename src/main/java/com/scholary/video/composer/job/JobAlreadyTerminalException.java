package com.scholary.video.composer.job;

/** Thrown when an operation needs a live job but the job already completed or failed. */
public class JobAlreadyTerminalException extends RuntimeException {

  private final JobStatus status;

  public JobAlreadyTerminalException(String jobId, JobStatus status) {
    super(String.format("Job %s is already %s", jobId, status.wireName()));
    this.status = status;
  }

  public JobStatus getStatus() {
    return status;
  }
}
