package com.scholary.video.composer.compositing;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for compositing.
 *
 * <p>Output geometry, encoder settings, process limits and the retry budget for a whole compositing
 * run.
 */
@ConfigurationProperties(prefix = "compositor")
@Validated
public record CompositorProperties(
    @NotBlank String ffmpegBinary,
    @NotBlank String tempDir,
    @Positive int width,
    @Positive int height,
    @Positive int fps,
    @NotBlank String preset,
    @Min(0) @Max(51) int crf,
    @Positive int commandTimeoutMinutes,
    @Positive int connectTimeoutSeconds,
    @Positive int downloadTimeoutSeconds,
    @Positive int artifactTtlDays,
    @Min(0) int maxRetries,
    @Positive long initialDelayMs,
    @Positive long maxDelayMs) {}
