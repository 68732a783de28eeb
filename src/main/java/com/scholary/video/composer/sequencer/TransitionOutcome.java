package com.scholary.video.composer.sequencer;

/** Whether an event changed the job or was already accounted for. */
public enum TransitionOutcome {
  APPLIED,
  /** The job's state no longer matched the event, nothing was changed. */
  NOOP;

  public boolean applied() {
    return this == APPLIED;
  }
}
