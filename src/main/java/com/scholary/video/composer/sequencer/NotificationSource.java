package com.scholary.video.composer.sequencer;

import java.util.Locale;

/** Path a prediction result arrived by. */
public enum NotificationSource {
  POLLER,
  WEBHOOK;

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
