package com.scholary.video.composer.api;

/** Optional body of a cancellation. */
public record CancelJobRequest(String reason) {}
