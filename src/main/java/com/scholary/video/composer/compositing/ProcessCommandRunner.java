package com.scholary.video.composer.compositing;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Output is read on a separate thread so the timeout holds even when the process stops
 * writing. A process still running at the deadline is killed.
 */
@Component
public class ProcessCommandRunner implements CommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);

  static final int TAIL_LINES = 40;

  @Override
  public CommandResult run(List<String> command, Duration timeout, Consumer<String> lines)
      throws IOException, InterruptedException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process = new ProcessBuilder(command).redirectErrorStream(true).start();
    Deque<String> tail = new ArrayDeque<>();

    Thread reader =
        new Thread(
            () -> {
              try (BufferedReader output =
                  new BufferedReader(
                      new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = output.readLine()) != null) {
                  lines.accept(line);
                  synchronized (tail) {
                    tail.addLast(line);
                    if (tail.size() > TAIL_LINES) {
                      tail.removeFirst();
                    }
                  }
                }
              } catch (IOException e) {
                LOGGER.debug("Output stream closed: {}", e.getMessage());
              }
            },
            "command-output");
    reader.setDaemon(true);
    reader.start();

    boolean finished;
    try {
      finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (InterruptedException e) {
      process.destroyForcibly();
      throw e;
    }
    if (!finished) {
      process.destroyForcibly();
      throw new IOException(
          String.format("Command timed out after %ds: %s", timeout.toSeconds(), command.get(0)));
    }
    reader.join(TimeUnit.SECONDS.toMillis(5));

    synchronized (tail) {
      return new CommandResult(process.exitValue(), String.join(System.lineSeparator(), tail));
    }
  }
}
