package com.scholary.video.composer.compositing;

/**
 * The published video.
 *
 * @param artifactUrl time-limited download URL
 * @param objectKey storage key of the video
 * @param durationSeconds expected running time of the composited video
 */
public record CompositionResult(String artifactUrl, String objectKey, double durationSeconds) {}
