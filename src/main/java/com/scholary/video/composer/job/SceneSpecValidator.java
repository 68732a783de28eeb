package com.scholary.video.composer.job;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Rejects scene lists that could never be composited.
 *
 * <p>Runs once at job creation. Anything that passes here is safe to trim and join, so the
 * compositor does not re-check these constraints. Scenes are capped at the longest clip the model
 * renders, which keeps every trim point inside the generated clip.
 */
@Component
public class SceneSpecValidator {

  /**
   * Validate a scene list.
   *
   * @param scenes scenes in any order
   * @throws InvalidSceneConfigException listing every violation found
   */
  public void validate(List<SceneSpec> scenes) {
    if (scenes == null || scenes.isEmpty()) {
      throw new InvalidSceneConfigException("A job needs at least one scene");
    }

    List<String> violations = new ArrayList<>();
    Set<Integer> orders = new HashSet<>();

    for (SceneSpec scene : scenes) {
      String label = "Scene " + scene.order();
      if (!orders.add(scene.order())) {
        violations.add(label + ": duplicate order");
      }
      if (scene.prompt() == null || scene.prompt().isBlank()) {
        violations.add(label + ": prompt is required");
      }
      if (scene.durationSeconds() <= 0) {
        violations.add(label + ": durationSeconds must be positive");
      } else if (scene.durationSeconds() > SceneSpec.LONG_CLIP_SECONDS) {
        violations.add(
            String.format(
                "%s: durationSeconds (%.2f) exceeds the longest generated clip (%ds)",
                label, scene.durationSeconds(), SceneSpec.LONG_CLIP_SECONDS));
      }
      if (scene.trimStart() < 0) {
        violations.add(label + ": trimStart must not be negative");
      }
      if (scene.trimEnd() <= scene.trimStart()) {
        violations.add(
            String.format(
                "%s: trimEnd (%.2f) must be greater than trimStart (%.2f)",
                label, scene.trimEnd(), scene.trimStart()));
      }
      if (scene.trimEnd() > scene.durationSeconds()) {
        violations.add(
            String.format(
                "%s: trimEnd (%.2f) exceeds durationSeconds (%.2f)",
                label, scene.trimEnd(), scene.durationSeconds()));
      }
      if (scene.transitionDuration() < 0) {
        violations.add(label + ": transitionDuration must not be negative");
      }
    }

    for (int expected = 0; expected < scenes.size(); expected++) {
      if (!orders.contains(expected)) {
        violations.add("Scene orders must be contiguous from 0, missing order " + expected);
        break;
      }
    }

    if (violations.isEmpty()) {
      validateTransitions(
          scenes.stream().sorted(Comparator.comparingInt(SceneSpec::order)).toList(), violations);
    }

    if (!violations.isEmpty()) {
      throw new InvalidSceneConfigException(String.join("; ", violations));
    }
  }

  // The last scene has no successor, so its transition is never applied.
  private void validateTransitions(List<SceneSpec> ordered, List<String> violations) {
    for (int i = 0; i < ordered.size() - 1; i++) {
      SceneSpec current = ordered.get(i);
      if (!current.hasTransition()) {
        continue;
      }
      SceneSpec next = ordered.get(i + 1);
      double limit = Math.min(current.trimmedDuration(), next.trimmedDuration());
      if (current.transitionDuration() <= 0) {
        violations.add(
            String.format(
                "Scene %d: %s transition needs a positive transitionDuration",
                current.order(), current.transitionType().wireName()));
      } else if (current.transitionDuration() > limit) {
        violations.add(
            String.format(
                "Scene %d: transitionDuration (%.2f) exceeds the shorter adjacent trimmed scene"
                    + " (%.2f)",
                current.order(), current.transitionDuration(), limit));
      }
    }
  }
}
