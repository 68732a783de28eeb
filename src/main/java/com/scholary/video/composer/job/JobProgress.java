package com.scholary.video.composer.job;

/**
 * Progress read model consumed by clients.
 *
 * @param stage lifecycle stage the percentage refers to
 * @param percent 0-100
 * @param message human readable description of the current step
 * @param etaSeconds estimated seconds until the job finishes, or null when unknown
 */
public record JobProgress(JobStatus stage, int percent, String message, Long etaSeconds) {

  public JobProgress {
    if (percent < 0 || percent > 100) {
      throw new IllegalArgumentException("Progress percent must be between 0 and 100: " + percent);
    }
  }

  public static JobProgress of(JobStatus stage, int percent, String message) {
    return new JobProgress(stage, percent, message, null);
  }
}
