package com.scholary.video.composer.prediction;

/**
 * Boundary to the external asynchronous prediction service.
 *
 * <p>Implementations do not retry. A failed submission or poll is terminal for the job, so
 * callers decide what to do with an {@link ExternalServiceException}.
 */
public interface PredictionGateway {

  /**
   * Start generating a scene.
   *
   * @throws ExternalServiceException if the service rejects the request or is unreachable
   */
  PredictionHandle submit(SceneGenerationRequest request);

  /**
   * Look up the current state of a prediction.
   *
   * @throws ExternalServiceException if the service cannot be queried
   */
  PredictionStatus poll(PredictionHandle handle);
}
