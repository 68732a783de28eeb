package com.scholary.video.composer.compositing;

import com.scholary.video.composer.compositing.CompositionPlan.ConcatenateStage;
import com.scholary.video.composer.compositing.CompositionPlan.EncodeStage;
import com.scholary.video.composer.compositing.CompositionPlan.TransitionStage;
import com.scholary.video.composer.compositing.CompositionPlan.TrimStage;
import com.scholary.video.composer.job.SceneSpec;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/** Turns scene media into a {@link CompositionPlan}, ordered by scene order. */
@Component
public class CompositionPlanner {

  static final String CODEC = "libx264";
  static final String PIXEL_FORMAT = "yuv420p";

  private final CompositorProperties properties;

  public CompositionPlanner(CompositorProperties properties) {
    this.properties = properties;
  }

  public CompositionPlan plan(List<SceneMedia> scenes) {
    if (scenes.size() < 2) {
      throw new IllegalArgumentException("Compositing needs at least two scenes: " + scenes.size());
    }

    List<SceneSpec> ordered =
        scenes.stream()
            .map(SceneMedia::scene)
            .sorted(Comparator.comparingInt(SceneSpec::order))
            .toList();

    List<TrimStage> trims = new ArrayList<>();
    List<TransitionStage> transitions = new ArrayList<>();
    for (int i = 0; i < ordered.size(); i++) {
      SceneSpec scene = ordered.get(i);
      trims.add(new TrimStage(i, scene.order(), scene.trimStart(), scene.trimEnd()));
      boolean last = i == ordered.size() - 1;
      if (!last && scene.hasTransition() && scene.transitionDuration() > 0) {
        transitions.add(
            new TransitionStage(i, scene.transitionType(), scene.transitionDuration()));
      }
    }

    EncodeStage encode =
        new EncodeStage(
            properties.width(),
            properties.height(),
            properties.fps(),
            CODEC,
            properties.preset(),
            properties.crf(),
            PIXEL_FORMAT);

    return new CompositionPlan(trims, transitions, new ConcatenateStage(trims.size()), encode);
  }
}
