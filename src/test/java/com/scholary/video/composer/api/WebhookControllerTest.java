package com.scholary.video.composer.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.video.composer.config.WebhookConfig;
import com.scholary.video.composer.webhook.MalformedWebhookException;
import com.scholary.video.composer.webhook.SignatureVerificationException;
import com.scholary.video.composer.webhook.WebhookOutcome;
import com.scholary.video.composer.webhook.WebhookReceiver;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(WebhookController.class)
@Import(WebhookConfig.class)
class WebhookControllerTest {

  private static final String BODY = "{\"id\":\"pred-1\",\"status\":\"succeeded\"}";

  @Autowired private MockMvc mockMvc;

  @MockitoBean private WebhookReceiver receiver;

  @Test
  void receivePrediction_shouldPassRawBodyAndConfiguredHeader() throws Exception {
    when(receiver.receive(BODY.getBytes(StandardCharsets.UTF_8), "sha256=abc"))
        .thenReturn(WebhookOutcome.APPLIED);

    mockMvc
        .perform(
            post("/api/webhooks/predictions")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Webhook-Signature", "sha256=abc")
                .content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.result").value("applied"));
  }

  @Test
  void receivePrediction_shouldAcknowledgeDuplicates() throws Exception {
    when(receiver.receive(any(), eq("sha256=abc"))).thenReturn(WebhookOutcome.DUPLICATE);

    mockMvc
        .perform(
            post("/api/webhooks/predictions")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Webhook-Signature", "sha256=abc")
                .content(BODY))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.result").value("duplicate"));
  }

  @Test
  void receivePrediction_shouldRejectBadSignature() throws Exception {
    when(receiver.receive(any(), any()))
        .thenThrow(new SignatureVerificationException("Missing webhook signature"));

    mockMvc
        .perform(
            post("/api/webhooks/predictions").contentType(MediaType.APPLICATION_JSON).content(BODY))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("invalid_signature"));
  }

  @Test
  void receivePrediction_shouldRejectMalformedBody() throws Exception {
    when(receiver.receive(any(), any()))
        .thenThrow(new MalformedWebhookException("Webhook body has no prediction id"));

    mockMvc
        .perform(
            post("/api/webhooks/predictions")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Webhook-Signature", "sha256=abc")
                .content("{}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("malformed_webhook"))
        .andExpect(jsonPath("$.message").value("Webhook body has no prediction id"));
  }
}
