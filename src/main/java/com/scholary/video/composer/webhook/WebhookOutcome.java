package com.scholary.video.composer.webhook;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** What a verified webhook delivery led to. All outcomes are acknowledged with 200. */
public enum WebhookOutcome {
  APPLIED,
  /** Prediction still running, nothing to do yet. */
  IGNORED_NOT_TERMINAL,
  /** No job is waiting on this prediction. */
  IGNORED_UNKNOWN_PREDICTION,
  /** The poller, or an earlier delivery, already handled this result. */
  DUPLICATE;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
