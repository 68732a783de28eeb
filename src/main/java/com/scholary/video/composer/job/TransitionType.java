package com.scholary.video.composer.job;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Visual transition applied at the boundary between a scene and the one after it. */
public enum TransitionType {
  NONE,
  /** Independent fade-out of the outgoing clip and fade-in of the incoming clip. */
  FADE,
  /** Alpha cross-blend of both clips over the transition window. */
  DISSOLVE,
  /** Directional reveal of the incoming clip over the outgoing one. */
  WIPE;

  @JsonCreator
  public static TransitionType fromWire(String value) {
    if (value == null || value.isBlank()) {
      return NONE;
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
