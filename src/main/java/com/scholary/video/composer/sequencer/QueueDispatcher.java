package com.scholary.video.composer.sequencer;

import com.scholary.video.composer.job.JobStore;
import com.scholary.video.composer.job.VideoJob;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Starts queued jobs, oldest first, a bounded batch per tick to stay within the prediction
 * service's rate limits.
 */
@Component
public class QueueDispatcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(QueueDispatcher.class);

  private final JobStore jobStore;
  private final SceneSequencer sequencer;
  private final SequencerProperties properties;

  public QueueDispatcher(
      JobStore jobStore, SceneSequencer sequencer, SequencerProperties properties) {
    this.jobStore = jobStore;
    this.sequencer = sequencer;
    this.properties = properties;
  }

  @Scheduled(fixedDelayString = "${sequencer.dispatchIntervalMs}")
  public void dispatchQueued() {
    List<VideoJob> queued = jobStore.findQueued(properties.dispatchBatchSize());
    if (queued.isEmpty()) {
      return;
    }

    LOGGER.info("Dispatching {} queued job(s)", queued.size());
    for (VideoJob job : queued) {
      try {
        sequencer.start(job.getJobId());
      } catch (RuntimeException e) {
        LOGGER.error("Failed to start job {}", job.getJobId(), e);
      }
    }
  }
}
