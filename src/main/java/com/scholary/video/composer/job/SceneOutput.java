package com.scholary.video.composer.job;

import java.time.Instant;

/** Media produced by the prediction service for the scene with the given order. */
public record SceneOutput(int order, String mediaUrl, String predictionId, Instant completedAt) {}
