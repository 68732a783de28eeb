package com.scholary.video.composer.sequencer;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for scene sequencing, polling and dispatch.
 *
 * @param pollIntervalMs delay between status poller sweeps
 * @param pollBatchSize max jobs polled per sweep
 * @param dispatchIntervalMs delay between queue dispatcher sweeps
 * @param dispatchBatchSize max queued jobs started per sweep
 * @param maxSceneWaitMinutes how long one scene may stay outstanding before its job times out
 * @param maxConsecutivePollFailures failed polls in a row that fail the job
 * @param estimatedSceneSeconds typical scene generation time, used for the ETA
 * @param pollerThreads poll task pool size
 * @param pollerQueueSize poll task queue capacity
 * @param compositingThreads compositing pool size
 * @param compositingQueueSize compositing queue capacity
 */
@ConfigurationProperties(prefix = "sequencer")
@Validated
public record SequencerProperties(
    @Positive long pollIntervalMs,
    @Positive int pollBatchSize,
    @Positive long dispatchIntervalMs,
    @Positive int dispatchBatchSize,
    @Positive int maxSceneWaitMinutes,
    @Min(1) int maxConsecutivePollFailures,
    @Positive int estimatedSceneSeconds,
    @Positive int pollerThreads,
    @Positive int pollerQueueSize,
    @Positive int compositingThreads,
    @Positive int compositingQueueSize) {}
