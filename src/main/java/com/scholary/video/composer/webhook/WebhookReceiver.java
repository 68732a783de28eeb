package com.scholary.video.composer.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.video.composer.job.JobStore;
import com.scholary.video.composer.job.VideoJob;
import com.scholary.video.composer.logging.StructuredLogger;
import com.scholary.video.composer.prediction.PredictionStatus;
import com.scholary.video.composer.sequencer.NotificationSource;
import com.scholary.video.composer.sequencer.SceneSequencer;
import com.scholary.video.composer.sequencer.TransitionOutcome;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Handles prediction completion pushes.
 *
 * <p>The body is authenticated before it is parsed. Deliveries carry no job id, so the job is
 * found through its outstanding prediction. The result then goes through the same
 * {@link SceneSequencer} transitions as the poller, and whichever of the two arrives second is
 * reported as {@link WebhookOutcome#DUPLICATE}.
 */
@Service
public class WebhookReceiver {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookReceiver.class);

  private final WebhookSignatureVerifier verifier;
  private final JobStore jobStore;
  private final SceneSequencer sequencer;
  private final ObjectMapper objectMapper;

  public WebhookReceiver(
      WebhookSignatureVerifier verifier,
      JobStore jobStore,
      SceneSequencer sequencer,
      ObjectMapper objectMapper) {
    this.verifier = verifier;
    this.jobStore = jobStore;
    this.sequencer = sequencer;
    this.objectMapper = objectMapper;
  }

  /**
   * Process one delivery.
   *
   * @param rawBody request body exactly as received
   * @param signature value of the signature header, may be null
   * @throws SignatureVerificationException if the delivery is not authentic; no state is touched
   * @throws MalformedWebhookException if the authentic body is not a prediction document
   */
  public WebhookOutcome receive(byte[] rawBody, String signature) {
    verifier.verify(rawBody, signature);

    PredictionWebhookPayload payload = parse(rawBody);
    PredictionStatus status =
        PredictionStatus.fromPayload(payload.status(), payload.output(), payload.errorText());

    if (!status.state().isTerminal()) {
      LOGGER.debug(
          "Ignoring webhook for prediction {} in status {}", payload.id(), payload.status());
      return WebhookOutcome.IGNORED_NOT_TERMINAL;
    }

    Optional<VideoJob> owner = jobStore.findByActivePredictionHandle(payload.id());
    if (owner.isEmpty()) {
      LOGGER.info("No job is waiting on prediction {}, ignoring webhook", payload.id());
      return WebhookOutcome.IGNORED_UNKNOWN_PREDICTION;
    }

    String jobId = owner.get().getJobId();
    StructuredLogger.setJobContext(jobId);
    try {
      TransitionOutcome outcome =
          switch (status.state()) {
            case SUCCEEDED ->
                sequencer.onPredictionSucceeded(
                    jobId, payload.id(), status.outputUrl(), NotificationSource.WEBHOOK);
            case FAILED ->
                sequencer.onPredictionFailed(
                    jobId, payload.id(), status.error(), NotificationSource.WEBHOOK);
            case PENDING -> TransitionOutcome.NOOP;
          };
      return outcome.applied() ? WebhookOutcome.APPLIED : WebhookOutcome.DUPLICATE;
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private PredictionWebhookPayload parse(byte[] rawBody) {
    PredictionWebhookPayload payload;
    try {
      payload = objectMapper.readValue(rawBody, PredictionWebhookPayload.class);
    } catch (IOException e) {
      throw new MalformedWebhookException("Webhook body is not valid JSON", e);
    }
    if (payload == null || payload.id() == null || payload.id().isBlank()) {
      throw new MalformedWebhookException("Webhook body has no prediction id");
    }
    return payload;
  }
}
