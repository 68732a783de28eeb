package com.scholary.video.composer.compositing;

import static com.scholary.video.composer.compositing.CompositingFixtures.media;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.scholary.video.composer.compositing.CompositionPlan.TransitionStage;
import com.scholary.video.composer.compositing.CompositionPlan.TrimStage;
import com.scholary.video.composer.job.TransitionType;
import java.util.List;
import org.junit.jupiter.api.Test;

class CompositionPlannerTest {

  private final CompositionPlanner planner =
      new CompositionPlanner(CompositingFixtures.properties("/tmp"));

  @Test
  void plan_shouldOrderTrimsBySceneOrder() {
    CompositionPlan plan =
        planner.plan(
            List.of(
                media(2, 0, 5, TransitionType.NONE, 0),
                media(0, 0.5, 4.5, TransitionType.NONE, 0),
                media(1, 1, 3, TransitionType.NONE, 0)));

    assertThat(plan.trims())
        .containsExactly(
            new TrimStage(0, 0, 0.5, 4.5), new TrimStage(1, 1, 1, 3), new TrimStage(2, 2, 0, 5));
    assertThat(plan.concatenate().segmentCount()).isEqualTo(3);
    assertThat(plan.encode().codec()).isEqualTo("libx264");
    assertThat(plan.encode().pixelFormat()).isEqualTo("yuv420p");
    assertThat(plan.encode().width()).isEqualTo(1280);
  }

  @Test
  void plan_shouldIgnoreTransitionOnLastScene() {
    CompositionPlan plan =
        planner.plan(
            List.of(
                media(0, 0, 5, TransitionType.DISSOLVE, 1),
                media(1, 0, 5, TransitionType.WIPE, 1)));

    assertThat(plan.transitions())
        .containsExactly(new TransitionStage(0, TransitionType.DISSOLVE, 1));
    assertThat(plan.transitionAfter(1)).isEmpty();
    assertThat(plan.transitionBefore(1)).isPresent();
  }

  @Test
  void totalDuration_shouldSubtractOnlyOverlappingTransitions() {
    CompositionPlan plan =
        planner.plan(
            List.of(
                media(0, 0, 5, TransitionType.DISSOLVE, 1),
                media(1, 0, 4, TransitionType.FADE, 0.5),
                media(2, 1, 5, TransitionType.NONE, 0)));

    assertThat(plan.totalDurationSeconds()).isCloseTo(12.0, within(1e-9));
  }

  @Test
  void plan_shouldRequireAtLeastTwoScenes() {
    assertThatThrownBy(() -> planner.plan(List.of(media(0, 0, 5, TransitionType.NONE, 0))))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
