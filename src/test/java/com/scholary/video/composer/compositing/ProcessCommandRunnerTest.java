package com.scholary.video.composer.compositing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;

@DisabledOnOs(OS.WINDOWS)
class ProcessCommandRunnerTest {

  private final ProcessCommandRunner runner = new ProcessCommandRunner();

  @Test
  void run_shouldStreamLinesAndReportExitCode() throws Exception {
    List<String> lines = new CopyOnWriteArrayList<>();

    CommandRunner.CommandResult result =
        runner.run(
            List.of("sh", "-c", "echo out_time_us=1000; echo oops 1>&2; exit 3"),
            Duration.ofSeconds(10),
            lines::add);

    assertThat(result.exitCode()).isEqualTo(3);
    assertThat(result.succeeded()).isFalse();
    assertThat(lines).containsExactlyInAnyOrder("out_time_us=1000", "oops");
    assertThat(result.outputTail()).contains("oops");
  }

  @Test
  void run_shouldKeepOnlyTheTailOfLongOutput() throws Exception {
    CommandRunner.CommandResult result =
        runner.run(
            List.of("sh", "-c", "i=0; while [ $i -lt 100 ]; do echo line$i; i=$((i+1)); done"),
            Duration.ofSeconds(10),
            line -> {});

    assertThat(result.succeeded()).isTrue();
    assertThat(result.outputTail().split(System.lineSeparator()))
        .hasSize(ProcessCommandRunner.TAIL_LINES)
        .endsWith("line99")
        .doesNotContain("line59");
  }

  @Test
  void run_shouldKillCommandsThatExceedTimeout() {
    assertThatThrownBy(
            () -> runner.run(List.of("sleep", "30"), Duration.ofMillis(200), line -> {}))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("timed out");
  }
}
