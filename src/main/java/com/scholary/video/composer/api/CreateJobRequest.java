package com.scholary.video.composer.api;

import com.scholary.video.composer.job.GenerationParameters;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * Request to generate a multi-scene video.
 *
 * <p>The generation parameters are optional and apply to every scene.
 */
public record CreateJobRequest(
    @NotEmpty @Valid List<SceneRequest> scenes,
    String negativePrompt,
    String aspectRatio,
    Long seed) {

  public GenerationParameters generationParameters() {
    return new GenerationParameters(negativePrompt, aspectRatio, seed);
  }
}
