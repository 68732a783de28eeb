package com.scholary.video.composer.sequencer;

import com.scholary.video.composer.job.JobStore;
import com.scholary.video.composer.job.VideoJob;
import com.scholary.video.composer.logging.StructuredLogger;
import com.scholary.video.composer.prediction.ExternalServiceException;
import com.scholary.video.composer.prediction.PredictionGateway;
import com.scholary.video.composer.prediction.PredictionHandle;
import com.scholary.video.composer.prediction.PredictionStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic sweep over jobs waiting on a prediction.
 *
 * <p>This is the always-on completion path; webhooks only make it faster. Each tick reads the
 * awaiting jobs fresh from the store and polls each prediction on the poller pool. Results go to
 * the {@link SceneSequencer}, which ignores anything the webhook already handled.
 */
@Component
public class StatusPoller {

  private static final Logger LOGGER = LoggerFactory.getLogger(StatusPoller.class);

  private final JobStore jobStore;
  private final PredictionGateway predictionGateway;
  private final SceneSequencer sequencer;
  private final SequencerProperties properties;
  private final Executor pollerExecutor;
  private final Clock clock;

  // Jobs with a poll task queued or running, so slow polls are not stacked up across ticks.
  private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

  public StatusPoller(
      JobStore jobStore,
      PredictionGateway predictionGateway,
      SceneSequencer sequencer,
      SequencerProperties properties,
      @Qualifier("pollerExecutor") Executor pollerExecutor,
      Clock clock) {
    this.jobStore = jobStore;
    this.predictionGateway = predictionGateway;
    this.sequencer = sequencer;
    this.properties = properties;
    this.pollerExecutor = pollerExecutor;
    this.clock = clock;
  }

  @Scheduled(
      fixedDelayString = "${sequencer.pollIntervalMs}",
      initialDelayString = "${sequencer.pollIntervalMs}")
  public void sweep() {
    List<VideoJob> awaiting = jobStore.findAwaitingPrediction(properties.pollBatchSize());
    if (!awaiting.isEmpty()) {
      LOGGER.debug("Poll tick: {} job(s) awaiting a prediction", awaiting.size());
    }
    for (VideoJob job : awaiting) {
      submitPoll(job);
    }

    Instant cutoff = clock.instant().minus(maxSceneWait());
    for (VideoJob stalled : jobStore.findStalledRunning(cutoff, properties.pollBatchSize())) {
      sequencer.failStalled(stalled.getJobId(), cutoff);
    }
  }

  private void submitPoll(VideoJob job) {
    if (!inFlight.add(job.getJobId())) {
      return;
    }
    try {
      pollerExecutor.execute(
          () -> {
            try {
              pollJob(job);
            } finally {
              inFlight.remove(job.getJobId());
            }
          });
    } catch (RejectedExecutionException e) {
      inFlight.remove(job.getJobId());
      LOGGER.debug("Poller pool saturated, job {} waits for the next tick", job.getJobId());
    }
  }

  void pollJob(VideoJob job) {
    String jobId = job.getJobId();
    String predictionId = job.getActivePredictionHandle();
    StructuredLogger.setJobContext(jobId);
    try {
      PredictionStatus status = predictionGateway.poll(new PredictionHandle(predictionId));
      switch (status.state()) {
        case SUCCEEDED ->
            sequencer.onPredictionSucceeded(
                jobId, predictionId, status.outputUrl(), NotificationSource.POLLER);
        case FAILED ->
            sequencer.onPredictionFailed(
                jobId, predictionId, status.error(), NotificationSource.POLLER);
        case PENDING -> {
          if (exceededSceneWait(job)) {
            sequencer.timeOut(jobId, predictionId);
          }
        }
      }
    } catch (ExternalServiceException e) {
      sequencer.onPollFailed(jobId, predictionId, e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected error polling prediction {} of job {}", predictionId, jobId, e);
      sequencer.onPollFailed(jobId, predictionId, "Unexpected error: " + e.getMessage());
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  private boolean exceededSceneWait(VideoJob job) {
    Instant submittedAt = job.getPredictionSubmittedAt();
    return submittedAt != null && submittedAt.plus(maxSceneWait()).isBefore(clock.instant());
  }

  private Duration maxSceneWait() {
    return Duration.ofMinutes(properties.maxSceneWaitMinutes());
  }
}
