package com.scholary.video.composer.job;

/**
 * Job-wide parameters forwarded with every scene submission.
 *
 * <p>All fields are optional.
 */
public record GenerationParameters(String negativePrompt, String aspectRatio, Long seed) {

  public static GenerationParameters none() {
    return new GenerationParameters(null, null, null);
  }
}
