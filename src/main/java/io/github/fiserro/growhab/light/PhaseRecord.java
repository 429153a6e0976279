package io.github.fiserro.growhab.light;

import io.github.fiserro.growhab.LightState;
import java.time.Duration;
import java.time.Instant;

/** Closed light phase inside the current window. */
public record PhaseRecord(LightState phase, Instant start, Instant end) {

  public Duration duration() {
    return Duration.between(start, end);
  }
}
