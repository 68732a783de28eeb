package com.scholary.video.composer.prediction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.video.composer.job.GenerationParameters;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for a Replicate-style prediction API.
 *
 * <p>Submissions ask the service to call our webhook on completion when one is configured. Polling
 * still works without it.
 *
 * <p>No retries happen here: a scene that cannot be submitted or polled fails its job.
 */
@Component
public class HttpPredictionClient implements PredictionGateway {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpPredictionClient.class);

  private final HttpClient httpClient;
  private final PredictionProperties properties;
  private final ObjectMapper objectMapper;

  public HttpPredictionClient(PredictionProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized prediction client: baseUrl={}, model={}, webhook={}",
        properties.baseUrl(),
        properties.model(),
        properties.webhookEnabled());
  }

  @Override
  public PredictionHandle submit(SceneGenerationRequest request) {
    LOGGER.info(
        "Submitting scene: jobId={}, order={}, duration={}s",
        request.jobId(),
        request.scene().order(),
        request.scene().durationSeconds());

    try {
      String body = objectMapper.writeValueAsString(buildSubmission(request));
      HttpRequest httpRequest =
          authorized(URI.create(properties.baseUrl() + "/v1/predictions"))
              .header("Content-Type", "application/json")
              .POST(BodyPublishers.ofString(body))
              .build();

      HttpResponse<String> response =
          httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      ensureSuccess(response, "submit");

      JsonNode prediction = objectMapper.readTree(response.body());
      String id = prediction.path("id").asText(null);
      if (id == null || id.isBlank()) {
        throw new ExternalServiceException(
            "Prediction service returned no prediction id", response.statusCode(), null);
      }

      LOGGER.info(
          "Scene submitted: jobId={}, order={}, predictionId={}",
          request.jobId(),
          request.scene().order(),
          id);
      return new PredictionHandle(id);

    } catch (IOException e) {
      throw new ExternalServiceException(
          "Failed to reach prediction service: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExternalServiceException("Prediction submission interrupted", e);
    }
  }

  @Override
  public PredictionStatus poll(PredictionHandle handle) {
    LOGGER.debug("Polling prediction: id={}", handle.id());

    try {
      HttpRequest httpRequest =
          authorized(URI.create(properties.baseUrl() + "/v1/predictions/" + handle.id()))
              .GET()
              .build();

      HttpResponse<String> response =
          httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
      ensureSuccess(response, "poll");

      JsonNode prediction = objectMapper.readTree(response.body());
      PredictionStatus status =
          PredictionStatus.fromPayload(
              prediction.path("status").asText(null),
              prediction.get("output"),
              errorText(prediction.get("error")));

      LOGGER.debug("Prediction {} is {}", handle.id(), status.state());
      return status;

    } catch (IOException e) {
      throw new ExternalServiceException(
          "Failed to reach prediction service: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExternalServiceException("Prediction poll interrupted", e);
    }
  }

  ObjectNode buildSubmission(SceneGenerationRequest request) {
    ObjectNode root = objectMapper.createObjectNode();
    root.put("model", properties.model());

    ObjectNode input = root.putObject("input");
    input.put("prompt", request.scene().prompt());
    input.put("duration", request.scene().generatedClipSeconds());

    GenerationParameters parameters = request.parameters();
    if (parameters != null) {
      if (parameters.negativePrompt() != null && !parameters.negativePrompt().isBlank()) {
        input.put("negative_prompt", parameters.negativePrompt());
      }
      if (parameters.seed() != null) {
        input.put("seed", parameters.seed());
      }
      if (parameters.aspectRatio() != null && !parameters.aspectRatio().isBlank()) {
        input.put("aspect_ratio", parameters.aspectRatio());
      }
    }

    if (properties.webhookEnabled()) {
      root.put("webhook", properties.webhookUrl());
      root.putArray("webhook_events_filter").add("completed");
    }
    return root;
  }

  private HttpRequest.Builder authorized(URI uri) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("Accept", "application/json");
    if (properties.apiToken() != null && !properties.apiToken().isBlank()) {
      builder.header("Authorization", "Bearer " + properties.apiToken());
    }
    return builder;
  }

  private void ensureSuccess(HttpResponse<String> response, String operation) {
    int status = response.statusCode();
    if (status >= 200 && status < 300) {
      return;
    }
    LOGGER.warn(
        "Prediction service {} failed: status={}, body={}", operation, status, response.body());
    String message =
        switch (status) {
          case 402 -> "Insufficient prediction credits. Add credits to the prediction account";
          case 429 -> "Rate limit exceeded at the prediction service. Try again later";
          default ->
              String.format("Prediction service returned status %d on %s", status, operation);
        };
    throw new ExternalServiceException(message, status, null);
  }

  private static String errorText(JsonNode error) {
    if (error == null || error.isNull()) {
      return null;
    }
    return error.isTextual() ? error.asText() : error.toString();
  }
}
