package com.scholary.video.composer.sequencer;

import static com.scholary.video.composer.sequencer.SequencerFixtures.job;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.video.composer.job.JobNotFoundException;
import com.scholary.video.composer.job.JobStore;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class QueueDispatcherTest {

  @Mock private JobStore jobStore;

  @Mock private SceneSequencer sequencer;

  private QueueDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    dispatcher =
        new QueueDispatcher(jobStore, sequencer, SequencerFixtures.sequencerProperties());
  }

  @Test
  void dispatchQueued_shouldStartOldestBatch() {
    when(jobStore.findQueued(1)).thenReturn(List.of(job("job-1", 2)));

    dispatcher.dispatchQueued();

    verify(sequencer).start("job-1");
  }

  @Test
  void dispatchQueued_shouldKeepGoingWhenOneJobFails() {
    when(jobStore.findQueued(1)).thenReturn(List.of(job("job-1", 2), job("job-2", 2)));
    when(sequencer.start("job-1")).thenThrow(new JobNotFoundException("job-1"));

    dispatcher.dispatchQueued();

    verify(sequencer).start("job-2");
  }

  @Test
  void dispatchQueued_shouldDoNothingWhenQueueIsEmpty() {
    when(jobStore.findQueued(1)).thenReturn(List.of());

    dispatcher.dispatchQueued();

    verify(sequencer, never()).start(anyString());
  }
}
