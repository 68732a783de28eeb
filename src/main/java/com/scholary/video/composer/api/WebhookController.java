package com.scholary.video.composer.api;

import com.scholary.video.composer.webhook.WebhookOutcome;
import com.scholary.video.composer.webhook.WebhookProperties;
import com.scholary.video.composer.webhook.WebhookReceiver;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoint the prediction service calls when a prediction finishes.
 *
 * <p>The body is taken as raw bytes because the signature covers the exact bytes sent.
 */
@RestController
@Tag(name = "Webhooks", description = "Prediction completion callbacks")
public class WebhookController {

  private final WebhookReceiver receiver;
  private final WebhookProperties properties;

  public WebhookController(WebhookReceiver receiver, WebhookProperties properties) {
    this.receiver = receiver;
    this.properties = properties;
  }

  @PostMapping("/api/webhooks/predictions")
  @Operation(
      summary = "Prediction webhook",
      description = "Signed prediction completion notification")
  public WebhookAck receivePrediction(@RequestBody byte[] body, HttpServletRequest request) {
    String signature = request.getHeader(properties.signatureHeader());
    return new WebhookAck(receiver.receive(body, signature));
  }

  /** Acknowledgement body. */
  public record WebhookAck(WebhookOutcome result) {}
}
