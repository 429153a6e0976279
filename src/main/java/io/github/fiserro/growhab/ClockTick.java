package io.github.fiserro.growhab;

import java.time.Instant;
import java.util.Objects;

/**
 * Periodic time signal. Lets dwell timers and light windows progress while sensors are quiet.
 */
public record ClockTick(String growspaceId, Instant timestamp) implements GrowspaceEvent {

  public ClockTick {
    Objects.requireNonNull(growspaceId, "growspaceId");
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
