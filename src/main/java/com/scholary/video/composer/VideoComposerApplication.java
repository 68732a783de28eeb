package com.scholary.video.composer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VideoComposerApplication {

  public static void main(String[] args) {
    SpringApplication.run(VideoComposerApplication.class, args);
  }
}
