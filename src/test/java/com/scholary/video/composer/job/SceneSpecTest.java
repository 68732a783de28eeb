package com.scholary.video.composer.job;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SceneSpecTest {

  @ParameterizedTest
  @CsvSource({"1, 5", "5, 5", "5.1, 8", "8, 8"})
  void generatedClipSeconds_shouldRoundUpToSupportedClipLength(double requested, int expected) {
    SceneSpec scene = new SceneSpec("a", 0, "p", requested, 0, requested, null, 0);

    assertThat(scene.generatedClipSeconds()).isEqualTo(expected);
  }
}
