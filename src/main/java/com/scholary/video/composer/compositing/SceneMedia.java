package com.scholary.video.composer.compositing;

import com.scholary.video.composer.job.SceneSpec;

/** A scene together with the location of its generated media. */
public record SceneMedia(SceneSpec scene, String mediaUrl) {

  public int order() {
    return scene.order();
  }
}
