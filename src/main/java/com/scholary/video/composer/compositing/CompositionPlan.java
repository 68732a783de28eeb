package com.scholary.video.composer.compositing;

import com.scholary.video.composer.job.TransitionType;
import java.util.List;
import java.util.Optional;

/**
 * Backend-neutral description of a compositing run.
 *
 * <p>Inputs are numbered by their position in {@link #trims()}, which is already sorted by scene
 * order. A {@link TransitionStage} sits between input {@code i} and input {@code i + 1}.
 */
public record CompositionPlan(
    List<TrimStage> trims,
    List<TransitionStage> transitions,
    ConcatenateStage concatenate,
    EncodeStage encode) {

  public CompositionPlan {
    trims = List.copyOf(trims);
    transitions = List.copyOf(transitions);
  }

  /** Transition applied after input {@code input}, if any. */
  public Optional<TransitionStage> transitionAfter(int input) {
    return transitions.stream().filter(t -> t.fromInput() == input).findFirst();
  }

  /** Transition applied before input {@code input}, if any. */
  public Optional<TransitionStage> transitionBefore(int input) {
    return transitionAfter(input - 1);
  }

  /** Running time of the output. Overlapping transitions shorten it, fades do not. */
  public double totalDurationSeconds() {
    double total = trims.stream().mapToDouble(TrimStage::duration).sum();
    for (TransitionStage transition : transitions) {
      if (transition.overlaps()) {
        total -= transition.duration();
      }
    }
    return total;
  }

  /** Cut input {@code input} (scene {@code sceneOrder}) to {@code [start, end)} seconds. */
  public record TrimStage(int input, int sceneOrder, double start, double end) {

    public double duration() {
      return end - start;
    }
  }

  /** Blend input {@code fromInput} into the next input over {@code duration} seconds. */
  public record TransitionStage(int fromInput, TransitionType type, double duration) {

    /** Whether both clips play at the same time during the transition. */
    public boolean overlaps() {
      return type == TransitionType.DISSOLVE || type == TransitionType.WIPE;
    }
  }

  /** Join all segments, in input order, into one video-only stream. */
  public record ConcatenateStage(int segmentCount) {}

  /** Final encoding parameters. */
  public record EncodeStage(
      int width, int height, int fps, String codec, String preset, int crf, String pixelFormat) {}
}
