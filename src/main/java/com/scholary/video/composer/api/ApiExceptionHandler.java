package com.scholary.video.composer.api;

import com.scholary.video.composer.job.InvalidSceneConfigException;
import com.scholary.video.composer.job.JobAlreadyTerminalException;
import com.scholary.video.composer.job.JobNotFoundException;
import com.scholary.video.composer.webhook.MalformedWebhookException;
import com.scholary.video.composer.webhook.SignatureVerificationException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps exceptions to {@link ErrorResponse} bodies. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidSceneConfigException.class)
  public ResponseEntity<ErrorResponse> handleInvalidScenes(InvalidSceneConfigException ex) {
    return respond(HttpStatus.BAD_REQUEST, "invalid_scene_config", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
    return respond(HttpStatus.BAD_REQUEST, "validation_failed", message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return respond(HttpStatus.BAD_REQUEST, "malformed_request", "Request body could not be read");
  }

  @ExceptionHandler(MalformedWebhookException.class)
  public ResponseEntity<ErrorResponse> handleMalformedWebhook(MalformedWebhookException ex) {
    return respond(HttpStatus.BAD_REQUEST, "malformed_webhook", ex.getMessage());
  }

  @ExceptionHandler(SignatureVerificationException.class)
  public ResponseEntity<ErrorResponse> handleSignature(SignatureVerificationException ex) {
    LOGGER.warn("Rejected webhook: {}", ex.getMessage());
    return respond(HttpStatus.UNAUTHORIZED, "invalid_signature", "Webhook signature rejected");
  }

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(JobNotFoundException ex) {
    return respond(HttpStatus.NOT_FOUND, "job_not_found", ex.getMessage());
  }

  @ExceptionHandler(JobAlreadyTerminalException.class)
  public ResponseEntity<ErrorResponse> handleTerminal(JobAlreadyTerminalException ex) {
    return respond(HttpStatus.CONFLICT, "job_already_terminal", ex.getMessage());
  }

  private static ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String error, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(error, message));
  }
}
