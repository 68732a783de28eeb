package com.scholary.video.composer.prediction;

import com.scholary.video.composer.job.GenerationParameters;
import com.scholary.video.composer.job.SceneSpec;

/** Everything the prediction service needs to render one scene. */
public record SceneGenerationRequest(
    String jobId, SceneSpec scene, GenerationParameters parameters) {}
