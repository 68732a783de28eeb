package com.scholary.video.composer.job;

/**
 * One scene of a multi-scene job.
 *
 * <p>{@code order} is the only ordering authority for compositing. Trim points are in seconds
 * relative to the start of the generated clip.
 */
public record SceneSpec(
    String id,
    int order,
    String prompt,
    double durationSeconds,
    double trimStart,
    double trimEnd,
    TransitionType transitionType,
    double transitionDuration) {

  /** Clip lengths the generation model renders, in seconds. */
  public static final int SHORT_CLIP_SECONDS = 5;

  public static final int LONG_CLIP_SECONDS = 8;

  public SceneSpec {
    if (transitionType == null) {
      transitionType = TransitionType.NONE;
    }
  }

  public double trimmedDuration() {
    return trimEnd - trimStart;
  }

  /** Length of the clip the model actually renders for this scene. */
  public int generatedClipSeconds() {
    return durationSeconds > SHORT_CLIP_SECONDS ? LONG_CLIP_SECONDS : SHORT_CLIP_SECONDS;
  }

  public boolean hasTransition() {
    return transitionType != TransitionType.NONE;
  }
}
