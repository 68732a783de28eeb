package com.scholary.video.composer.prediction;

/** Opaque reference to a prediction running at the external service. */
public record PredictionHandle(String id) {

  public PredictionHandle {
    if (id == null || id.isBlank()) {
      throw new IllegalArgumentException("Prediction id must not be blank");
    }
  }
}
