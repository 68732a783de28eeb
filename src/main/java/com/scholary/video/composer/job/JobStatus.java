package com.scholary.video.composer.job;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle states of a video job.
 *
 * <p>States are ordered. A job only ever moves forward through this list, except that any
 * non-terminal state may jump straight to {@link #FAILED}. {@link #COMPLETED} and {@link #FAILED}
 * are terminal.
 */
public enum JobStatus {
  QUEUED,
  RUNNING,
  UPSCALING,
  ENCODING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /**
   * Check whether a transition from this state to {@code next} is legal.
   *
   * @param next the proposed next state
   * @return true if the transition keeps the lifecycle monotonic
   */
  public boolean canTransitionTo(JobStatus next) {
    if (isTerminal()) {
      return false;
    }
    if (next == FAILED) {
      return true;
    }
    return next.ordinal() >= ordinal();
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
