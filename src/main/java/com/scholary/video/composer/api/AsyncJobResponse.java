package com.scholary.video.composer.api;

import com.scholary.video.composer.job.JobStatus;

/** Response for an accepted job. Poll {@code GET /api/jobs/{jobId}} for progress. */
public record AsyncJobResponse(String jobId, JobStatus status) {}
