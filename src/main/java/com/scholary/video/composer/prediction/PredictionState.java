package com.scholary.video.composer.prediction;

import java.util.Locale;

/** Coarse prediction state as seen by the orchestrator. */
public enum PredictionState {
  PENDING,
  SUCCEEDED,
  FAILED;

  /**
   * Map the service's status string.
   *
   * <p>{@code starting}, {@code processing} and anything unrecognised are still pending. A
   * {@code canceled} prediction will never produce output, so it counts as failed.
   */
  public static PredictionState fromWire(String status) {
    if (status == null) {
      return PENDING;
    }
    return switch (status.trim().toLowerCase(Locale.ROOT)) {
      case "succeeded" -> SUCCEEDED;
      case "failed", "canceled", "cancelled" -> FAILED;
      default -> PENDING;
    };
  }

  public boolean isTerminal() {
    return this != PENDING;
  }
}
