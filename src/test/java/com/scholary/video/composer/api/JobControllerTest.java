package com.scholary.video.composer.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.video.composer.job.FailureKind;
import com.scholary.video.composer.job.GenerationParameters;
import com.scholary.video.composer.job.JobAlreadyTerminalException;
import com.scholary.video.composer.job.JobStatus;
import com.scholary.video.composer.job.JobStore;
import com.scholary.video.composer.job.SceneSpec;
import com.scholary.video.composer.job.SceneSpecValidator;
import com.scholary.video.composer.job.TransitionType;
import com.scholary.video.composer.job.VideoJob;
import com.scholary.video.composer.sequencer.SceneSequencer;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(JobController.class)
@Import({SceneSpecValidator.class, JobControllerTest.FixedClockConfig.class})
class JobControllerTest {

  private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private JobStore jobStore;

  @MockitoBean private SceneSequencer sequencer;

  @Test
  void createJob_shouldQueueJobAndApplySceneDefaults() throws Exception {
    String body =
        """
        {
          "scenes": [
            {"order": 1, "prompt": "city at night", "durationSeconds": 5},
            {"order": 0, "prompt": "sunrise", "durationSeconds": 8, "trimStart": 1,
             "trimEnd": 7, "transitionType": "dissolve", "transitionDuration": 1.5}
          ],
          "negativePrompt": "blurry",
          "seed": 42
        }
        """;

    mockMvc
        .perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").isNotEmpty())
        .andExpect(jsonPath("$.status").value("queued"));

    ArgumentCaptor<VideoJob> saved = ArgumentCaptor.forClass(VideoJob.class);
    verify(jobStore).save(saved.capture());
    VideoJob job = saved.getValue();
    assertThat(job.getCreatedAt()).isEqualTo(NOW);
    assertThat(job.getParameters().negativePrompt()).isEqualTo("blurry");
    assertThat(job.getParameters().seed()).isEqualTo(42L);
    assertThat(job.getScenes())
        .containsExactly(
            new SceneSpec("scene-0", 0, "sunrise", 8, 1, 7, TransitionType.DISSOLVE, 1.5),
            new SceneSpec("scene-1", 1, "city at night", 5, 0, 5, TransitionType.NONE, 0));
  }

  @Test
  void createJob_shouldRejectImpossibleTrim() throws Exception {
    String body =
        """
        {"scenes": [{"order": 0, "prompt": "sunrise", "durationSeconds": 5, "trimEnd": 6}]}
        """;

    mockMvc
        .perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_scene_config"));

    verify(jobStore, never()).save(any());
  }

  @Test
  void createJob_shouldRejectSceneLongerThanGeneratedClip() throws Exception {
    String body =
        """
        {"scenes": [
          {"order": 0, "prompt": "sunrise", "durationSeconds": 10,
           "transitionType": "dissolve", "transitionDuration": 1.0},
          {"order": 1, "prompt": "city", "durationSeconds": 10}
        ]}
        """;

    mockMvc
        .perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_scene_config"))
        .andExpect(
            jsonPath("$.message").value(containsString("exceeds the longest generated clip")));

    verify(jobStore, never()).save(any());
  }

  @Test
  void createJob_shouldRejectMissingPrompt() throws Exception {
    String body = "{\"scenes\": [{\"order\": 0, \"durationSeconds\": 5}]}";

    mockMvc
        .perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("validation_failed"));
  }

  @Test
  void createJob_shouldRejectUnreadableBody() throws Exception {
    mockMvc
        .perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("{scenes:"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("malformed_request"));
  }

  @Test
  void getJob_shouldReturnStatusAndProgress() throws Exception {
    when(jobStore.findById("job-1")).thenReturn(Optional.of(job()));

    mockMvc
        .perform(get("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.jobId").value("job-1"))
        .andExpect(jsonPath("$.status").value("queued"))
        .andExpect(jsonPath("$.progress.percent").value(0))
        .andExpect(jsonPath("$.progress.message").value("Waiting in queue"))
        .andExpect(jsonPath("$.sceneCount").value(2))
        .andExpect(jsonPath("$.scenesCompleted").value(0))
        .andExpect(jsonPath("$.outputs").isEmpty());
  }

  @Test
  void getJob_shouldReturnNotFoundForUnknownJob() throws Exception {
    when(jobStore.findById("nope")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/jobs/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("job_not_found"))
        .andExpect(jsonPath("$.message").value("Job not found: nope"));
  }

  @Test
  void cancelJob_shouldReturnFailedJob() throws Exception {
    VideoJob cancelled = job();
    cancelled.fail(FailureKind.CANCELLED, "Cancelled by user", NOW);
    when(sequencer.cancel(eq("job-1"), isNull())).thenReturn(cancelled);

    mockMvc
        .perform(post("/api/jobs/job-1/cancel"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("failed"))
        .andExpect(jsonPath("$.failureKind").value("CANCELLED"))
        .andExpect(jsonPath("$.error").value("Cancelled by user"));
  }

  @Test
  void cancelJob_shouldConflictWhenAlreadyFinished() throws Exception {
    when(sequencer.cancel("job-1", "changed my mind"))
        .thenThrow(new JobAlreadyTerminalException("job-1", JobStatus.COMPLETED));

    mockMvc
        .perform(
            post("/api/jobs/job-1/cancel")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\": \"changed my mind\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.error").value("job_already_terminal"));
  }

  private static VideoJob job() {
    return new VideoJob(
        "job-1",
        List.of(
            new SceneSpec("a", 0, "sunrise", 5, 0, 5, TransitionType.NONE, 0),
            new SceneSpec("b", 1, "sunset", 5, 0, 5, TransitionType.NONE, 0)),
        GenerationParameters.none(),
        NOW);
  }

  @TestConfiguration
  static class FixedClockConfig {

    @Bean
    Clock clock() {
      return Clock.fixed(NOW, ZoneOffset.UTC);
    }
  }
}
