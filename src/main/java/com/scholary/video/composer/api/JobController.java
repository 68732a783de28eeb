package com.scholary.video.composer.api;

import com.scholary.video.composer.job.JobNotFoundException;
import com.scholary.video.composer.job.JobStore;
import com.scholary.video.composer.job.SceneSpec;
import com.scholary.video.composer.job.SceneSpecValidator;
import com.scholary.video.composer.job.VideoJob;
import com.scholary.video.composer.sequencer.SceneSequencer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Clock;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for video jobs.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting a multi-scene job (returns the job ID immediately)
 *   <li>Job status polling
 *   <li>Cancellation
 * </ul>
 *
 * <p>Submitted jobs wait in {@code queued} until the queue dispatcher starts them.
 */
@RestController
@RequestMapping("/api/jobs")
@Tag(name = "Jobs", description = "Multi-scene video generation jobs")
public class JobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobController.class);

  private final JobStore jobStore;
  private final SceneSpecValidator validator;
  private final SceneSequencer sequencer;
  private final Clock clock;

  public JobController(
      JobStore jobStore, SceneSpecValidator validator, SceneSequencer sequencer, Clock clock) {
    this.jobStore = jobStore;
    this.validator = validator;
    this.sequencer = sequencer;
    this.clock = clock;
  }

  @PostMapping
  @Operation(
      summary = "Create job",
      description = "Queue a multi-scene video job and return its ID for status polling")
  public ResponseEntity<AsyncJobResponse> createJob(@Valid @RequestBody CreateJobRequest request) {
    List<SceneSpec> scenes = request.scenes().stream().map(SceneRequest::toSceneSpec).toList();
    validator.validate(scenes);

    String jobId = UUID.randomUUID().toString();
    VideoJob job = new VideoJob(jobId, scenes, request.generationParameters(), clock.instant());
    jobStore.save(job);

    LOGGER.info("Created job {} with {} scene(s)", jobId, scenes.size());
    return ResponseEntity.accepted().body(new AsyncJobResponse(jobId, job.getStatus()));
  }

  @GetMapping("/{id}")
  @Operation(summary = "Get job status", description = "Current state, progress and outputs")
  public JobStatusResponse getJob(@PathVariable String id) {
    return jobStore
        .findById(id)
        .map(JobStatusResponse::from)
        .orElseThrow(() -> new JobNotFoundException(id));
  }

  @PostMapping("/{id}/cancel")
  @Operation(
      summary = "Cancel job",
      description =
          "Fail a job that has not finished yet. Running predictions are left to finish and"
              + " ignored")
  public JobStatusResponse cancelJob(
      @PathVariable String id, @RequestBody(required = false) CancelJobRequest request) {
    String reason = request == null ? null : request.reason();
    return JobStatusResponse.from(sequencer.cancel(id, reason));
  }
}
