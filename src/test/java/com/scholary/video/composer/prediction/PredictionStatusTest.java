package com.scholary.video.composer.prediction;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class PredictionStatusTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @ParameterizedTest
  @CsvSource({
    "starting, PENDING",
    "processing, PENDING",
    "succeeded, SUCCEEDED",
    "failed, FAILED",
    "canceled, FAILED",
    "Cancelled, FAILED",
    "something-new, PENDING"
  })
  void fromWire_shouldMapServiceStatuses(String wire, PredictionState expected) {
    assertThat(PredictionState.fromWire(wire)).isEqualTo(expected);
  }

  @Test
  void fromPayload_shouldTakeFirstUrlOfArrayOutput() throws Exception {
    PredictionStatus status =
        PredictionStatus.fromPayload(
            "succeeded", objectMapper.readTree("[\"\", \"https://cdn/a.mp4\", \"b\"]"), null);

    assertThat(status).isEqualTo(PredictionStatus.succeeded("https://cdn/a.mp4"));
  }

  @Test
  void fromPayload_shouldTreatSuccessWithoutOutputAsFailure() {
    PredictionStatus status = PredictionStatus.fromPayload("succeeded", null, null);

    assertThat(status.state()).isEqualTo(PredictionState.FAILED);
    assertThat(status.error()).isEqualTo("Prediction succeeded without an output");
  }

  @Test
  void fromPayload_shouldDescribeFailureWithoutError() {
    assertThat(PredictionStatus.fromPayload("canceled", null, " ").error())
        .isEqualTo("Prediction canceled");
    assertThat(PredictionStatus.fromPayload("failed", null, "GPU out of memory").error())
        .isEqualTo("GPU out of memory");
  }

  @Test
  void fromPayload_shouldKeepPendingStatusesPending() {
    assertThat(PredictionStatus.fromPayload("processing", new TextNode("partial"), null))
        .isEqualTo(PredictionStatus.pending());
  }
}
