package com.scholary.video.composer.job;

/** Why a job ended in {@link JobStatus#FAILED}. */
public enum FailureKind {
  SCENE_GENERATION_FAILED,
  COMPOSITING_FAILED,
  EXTERNAL_SERVICE_ERROR,
  TIMED_OUT,
  CANCELLED
}
