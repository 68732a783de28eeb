package com.scholary.video.composer.job;

/** Thrown when a job id does not resolve, either because it never existed or it expired. */
public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
  }
}
