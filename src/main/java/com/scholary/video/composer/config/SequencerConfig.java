package com.scholary.video.composer.config;

import com.scholary.video.composer.compositing.CompositorProperties;
import com.scholary.video.composer.retry.Sleeper;
import com.scholary.video.composer.sequencer.SequencerProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for sequencing, compositing and their retry policy. */
@Configuration
@EnableConfigurationProperties({SequencerProperties.class, CompositorProperties.class})
public class SequencerConfig {

  @Bean
  public Sleeper retrySleeper() {
    return Sleeper.threadSleep();
  }
}
