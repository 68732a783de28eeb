package com.scholary.video.composer.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Prediction document pushed by the service when a prediction finishes.
 *
 * <p>{@code output} is a URL or a list of URLs. {@code error} is usually a string but is kept as a
 * node since some models report structured errors.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PredictionWebhookPayload(String id, String status, JsonNode output, JsonNode error) {

  public String errorText() {
    if (error == null || error.isNull()) {
      return null;
    }
    return error.isTextual() ? error.asText() : error.toString();
  }
}
