package com.scholary.video.composer.prediction;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of polling a prediction.
 *
 * @param state coarse state
 * @param outputUrl media location, only when succeeded
 * @param error failure description from the service, only when failed
 */
public record PredictionStatus(PredictionState state, String outputUrl, String error) {

  public static PredictionStatus pending() {
    return new PredictionStatus(PredictionState.PENDING, null, null);
  }

  public static PredictionStatus succeeded(String outputUrl) {
    return new PredictionStatus(PredictionState.SUCCEEDED, outputUrl, null);
  }

  public static PredictionStatus failed(String error) {
    return new PredictionStatus(PredictionState.FAILED, null, error);
  }

  /**
   * Build a status from the fields of a prediction document.
   *
   * <p>Used for both poll responses and webhook deliveries. A succeeded prediction without a
   * usable output is reported as failed.
   */
  public static PredictionStatus fromPayload(String status, JsonNode output, String error) {
    PredictionState state = PredictionState.fromWire(status);
    switch (state) {
      case SUCCEEDED -> {
        String url = extractOutputUrl(output);
        if (url == null) {
          return failed("Prediction succeeded without an output");
        }
        return succeeded(url);
      }
      case FAILED -> {
        String reason = error;
        if (reason == null || reason.isBlank()) {
          reason = "Prediction " + status;
        }
        return failed(reason);
      }
      default -> {
        return pending();
      }
    }
  }

  /** Output is either a single URL or an array of URLs, of which the first is used. */
  static String extractOutputUrl(JsonNode output) {
    if (output == null || output.isNull()) {
      return null;
    }
    if (output.isTextual()) {
      return output.asText().isBlank() ? null : output.asText();
    }
    if (output.isArray()) {
      for (JsonNode element : output) {
        if (element.isTextual() && !element.asText().isBlank()) {
          return element.asText();
        }
      }
    }
    return null;
  }
}
