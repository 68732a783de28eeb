package com.scholary.video.composer.api;

import com.scholary.video.composer.job.SceneSpec;
import com.scholary.video.composer.job.TransitionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * One scene of a job submission.
 *
 * <p>Trim points default to the whole clip and the transition to none. The transition joins this
 * scene to the next one.
 */
public record SceneRequest(
    String id,
    @NotNull Integer order,
    @NotBlank String prompt,
    @Positive double durationSeconds,
    Double trimStart,
    Double trimEnd,
    TransitionType transitionType,
    Double transitionDuration) {

  public SceneSpec toSceneSpec() {
    return new SceneSpec(
        id == null || id.isBlank() ? "scene-" + order : id,
        order,
        prompt,
        durationSeconds,
        trimStart == null ? 0.0 : trimStart,
        trimEnd == null ? durationSeconds : trimEnd,
        transitionType,
        transitionDuration == null ? 0.0 : transitionDuration);
  }
}
