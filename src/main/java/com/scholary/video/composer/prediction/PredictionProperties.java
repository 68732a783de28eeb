package com.scholary.video.composer.prediction;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the prediction service client.
 *
 * @param baseUrl service root, without the {@code /v1} path
 * @param apiToken bearer token
 * @param model model identifier submitted with every scene
 * @param connectTimeout connect timeout in seconds
 * @param readTimeout per-request timeout in seconds
 * @param webhookUrl public URL of our webhook endpoint, or blank to rely on polling only
 */
@ConfigurationProperties(prefix = "prediction")
@Validated
public record PredictionProperties(
    @NotBlank String baseUrl,
    String apiToken,
    @NotBlank String model,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    String webhookUrl) {

  public boolean webhookEnabled() {
    return webhookUrl != null && !webhookUrl.isBlank();
  }
}
