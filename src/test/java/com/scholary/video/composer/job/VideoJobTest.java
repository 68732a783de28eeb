package com.scholary.video.composer.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class VideoJobTest {

  private static final Instant NOW = Instant.parse("2025-01-01T10:00:00Z");

  @Test
  void constructor_shouldSortScenesByOrder() {
    VideoJob job =
        new VideoJob(
            "job-1", List.of(scene(2), scene(0), scene(1)), GenerationParameters.none(), NOW);

    assertThat(job.getScenes()).extracting(SceneSpec::order).containsExactly(0, 1, 2);
    assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(job.getProgress().percent()).isZero();
  }

  @Test
  void appendSceneOutput_shouldRejectOutOfOrderScene() {
    VideoJob job = new VideoJob("job-1", List.of(scene(0), scene(1)), null, NOW);

    assertThatThrownBy(() -> job.appendSceneOutput(new SceneOutput(1, "url", "p", NOW)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("expected output for scene 0");
  }

  @Test
  void appendSceneOutput_shouldNeverExceedSceneCount() {
    VideoJob job = new VideoJob("job-1", List.of(scene(0)), null, NOW);
    job.appendSceneOutput(new SceneOutput(0, "url", "p", NOW));

    assertThat(job.allScenesGenerated()).isTrue();
    assertThatThrownBy(() -> job.appendSceneOutput(new SceneOutput(1, "url", "p", NOW)))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void recordArtifact_shouldAcceptExactlyOne() {
    VideoJob job = new VideoJob("job-1", List.of(scene(0)), null, NOW);
    job.recordArtifact("https://cdn/final.mp4");

    assertThatThrownBy(() -> job.recordArtifact("https://cdn/other.mp4"))
        .isInstanceOf(IllegalStateException.class);
    assertThat(job.getOutputs()).containsExactly("https://cdn/final.mp4");
  }

  @Test
  void transitionTo_shouldRefuseLeavingTerminalState() {
    VideoJob job = new VideoJob("job-1", List.of(scene(0)), null, NOW);
    job.fail(FailureKind.CANCELLED, "stop", NOW);

    assertThatThrownBy(() -> job.transitionTo(JobStatus.RUNNING, NOW))
        .isInstanceOf(IllegalStateException.class);
    assertThat(job.getError()).isEqualTo("stop");
    assertThat(job.getCompletedAt()).isEqualTo(NOW);
  }

  @Test
  void copy_shouldBeIndependentOfOriginal() {
    VideoJob job = new VideoJob("job-1", List.of(scene(0), scene(1)), null, NOW);
    VideoJob copy = job.copy();

    copy.transitionTo(JobStatus.RUNNING, NOW);
    copy.appendSceneOutput(new SceneOutput(0, "url", "p", NOW));
    copy.setActivePredictionHandle("p-2", NOW);

    assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
    assertThat(job.getSceneOutputs()).isEmpty();
    assertThat(job.getActivePredictionHandle()).isNull();
  }

  private static SceneSpec scene(int order) {
    return new SceneSpec("s" + order, order, "prompt " + order, 5, 0, 5, TransitionType.NONE, 0);
  }
}
