package com.scholary.video.composer.webhook;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for inbound prediction webhooks.
 *
 * @param secret shared HMAC secret. When blank every delivery is rejected
 * @param signatureHeader request header carrying {@code sha256=<hex>}
 */
@ConfigurationProperties(prefix = "webhook")
@Validated
public record WebhookProperties(String secret, @NotBlank String signatureHeader) {

  public boolean hasSecret() {
    return secret != null && !secret.isBlank();
  }
}
