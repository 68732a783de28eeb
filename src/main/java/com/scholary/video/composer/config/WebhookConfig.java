package com.scholary.video.composer.config;

import com.scholary.video.composer.webhook.WebhookProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for inbound webhooks.
 *
 * <p>A missing secret is allowed so the service can run on polling alone, but it is logged
 * because every webhook will then be rejected.
 */
@Configuration
@EnableConfigurationProperties(WebhookProperties.class)
public class WebhookConfig {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookConfig.class);

  public WebhookConfig(WebhookProperties properties) {
    if (!properties.hasSecret()) {
      LOGGER.warn("webhook.secret is not set, all webhook deliveries will be rejected");
    }
  }
}
