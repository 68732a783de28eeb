package com.scholary.video.composer.compositing;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/** Runs an external command to completion. */
public interface CommandRunner {

  /**
   * Run {@code command}, forwarding each line of combined stdout and stderr to {@code lines}.
   *
   * @throws IOException if the process cannot be started or exceeds {@code timeout}
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  CommandResult run(List<String> command, Duration timeout, Consumer<String> lines)
      throws IOException, InterruptedException;

  /**
   * Outcome of a finished command.
   *
   * @param exitCode process exit code
   * @param outputTail last lines of combined output, for error reports
   */
  record CommandResult(int exitCode, String outputTail) {

    public boolean succeeded() {
      return exitCode == 0;
    }
  }
}
