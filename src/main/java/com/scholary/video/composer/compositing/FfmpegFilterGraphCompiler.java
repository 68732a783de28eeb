package com.scholary.video.composer.compositing;

import com.scholary.video.composer.compositing.CompositionPlan.EncodeStage;
import com.scholary.video.composer.compositing.CompositionPlan.TransitionStage;
import com.scholary.video.composer.compositing.CompositionPlan.TrimStage;
import com.scholary.video.composer.job.TransitionType;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Compiles a {@link CompositionPlan} into an ffmpeg command line.
 *
 * <p>Every input is trimmed, retimed and normalised to the target frame rate, size and pixel
 * format, so clips from different predictions can be joined. The normalised clips are then folded
 * left to right: overlapping transitions become an {@code xfade}, everything else a two-way
 * {@code concat}. Fades are applied to the clips themselves before the join.
 *
 * <p>The output is video only.
 */
@Component
public class FfmpegFilterGraphCompiler {

  static final String OUTPUT_LABEL = "[out]";

  /**
   * Build the full ffmpeg command.
   *
   * @param plan the plan to compile
   * @param ffmpegBinary executable to run
   * @param inputs one local file per trim stage, in plan order
   * @param output file to write
   */
  public List<String> compile(
      CompositionPlan plan, String ffmpegBinary, List<Path> inputs, Path output) {
    if (inputs.size() != plan.trims().size()) {
      throw new IllegalArgumentException(
          String.format(
              "Plan has %d inputs but %d files were given", plan.trims().size(), inputs.size()));
    }

    EncodeStage encode = plan.encode();
    List<String> command = new ArrayList<>();
    command.add(ffmpegBinary);
    command.add("-y");
    command.add("-hide_banner");
    command.add("-nostats");
    command.add("-progress");
    command.add("pipe:1");
    for (Path input : inputs) {
      command.add("-i");
      command.add(input.toString());
    }
    command.add("-filter_complex");
    command.add(buildFilterGraph(plan));
    command.add("-map");
    command.add(OUTPUT_LABEL);
    command.add("-an");
    command.add("-c:v");
    command.add(encode.codec());
    command.add("-preset");
    command.add(encode.preset());
    command.add("-crf");
    command.add(String.valueOf(encode.crf()));
    command.add("-pix_fmt");
    command.add(encode.pixelFormat());
    command.add("-r");
    command.add(String.valueOf(encode.fps()));
    command.add("-movflags");
    command.add("+faststart");
    command.add(output.toString());
    return command;
  }

  String buildFilterGraph(CompositionPlan plan) {
    List<String> chains = new ArrayList<>();
    for (TrimStage trim : plan.trims()) {
      chains.add(buildClipChain(plan, trim));
    }

    String current = clipLabel(0);
    double accumulated = plan.trims().get(0).duration();
    int last = plan.trims().size() - 1;

    for (int index = 1; index <= last; index++) {
      TrimStage trim = plan.trims().get(index);
      Optional<TransitionStage> transition = plan.transitionBefore(index);
      String next = index == last ? OUTPUT_LABEL : "[j" + index + "]";

      if (transition.isPresent() && transition.get().overlaps()) {
        double duration = transition.get().duration();
        double offset = Math.max(accumulated - duration, 0.0);
        chains.add(
            current
                + clipLabel(index)
                + "xfade=transition="
                + xfadeName(transition.get().type())
                + ":duration="
                + formatSeconds(duration)
                + ":offset="
                + formatSeconds(offset)
                + next);
        accumulated = accumulated + trim.duration() - duration;
      } else {
        chains.add(current + clipLabel(index) + "concat=n=2:v=1:a=0" + next);
        accumulated = accumulated + trim.duration();
      }
      current = next;
    }

    return String.join(";", chains);
  }

  private String buildClipChain(CompositionPlan plan, TrimStage trim) {
    EncodeStage encode = plan.encode();
    StringBuilder chain = new StringBuilder();
    chain
        .append("[")
        .append(trim.input())
        .append(":v]")
        .append("trim=start=")
        .append(formatSeconds(trim.start()))
        .append(":end=")
        .append(formatSeconds(trim.end()))
        .append(",setpts=PTS-STARTPTS")
        .append(",fps=")
        .append(encode.fps())
        .append(",scale=")
        .append(encode.width())
        .append(":")
        .append(encode.height())
        .append(":force_original_aspect_ratio=decrease")
        .append(",pad=")
        .append(encode.width())
        .append(":")
        .append(encode.height())
        .append(":(ow-iw)/2:(oh-ih)/2")
        .append(",setsar=1")
        .append(",format=")
        .append(encode.pixelFormat());

    plan.transitionBefore(trim.input())
        .filter(t -> t.type() == TransitionType.FADE)
        .ifPresent(
            fade ->
                chain.append(",fade=t=in:st=0:d=").append(formatSeconds(fade.duration())));

    plan.transitionAfter(trim.input())
        .filter(t -> t.type() == TransitionType.FADE)
        .ifPresent(
            fade ->
                chain
                    .append(",fade=t=out:st=")
                    .append(formatSeconds(Math.max(trim.duration() - fade.duration(), 0.0)))
                    .append(":d=")
                    .append(formatSeconds(fade.duration())));

    chain.append(clipLabel(trim.input()));
    return chain.toString();
  }

  private static String xfadeName(TransitionType type) {
    return switch (type) {
      // xfade "fade" is the linear alpha mix.
      case DISSOLVE -> "fade";
      case WIPE -> "wipeleft";
      default -> throw new IllegalArgumentException("Not an overlapping transition: " + type);
    };
  }

  private static String clipLabel(int input) {
    return "[v" + input + "]";
  }

  static String formatSeconds(double seconds) {
    return String.format(Locale.ROOT, "%.3f", seconds);
  }
}
