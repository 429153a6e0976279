package io.github.fiserro.growhab;

import java.time.Instant;
import java.util.Objects;

/** Raw light sensor state. Repeated states are allowed; only changes count as transitions. */
public record LightChange(String growspaceId, LightState state, Instant timestamp)
    implements GrowspaceEvent {

  public LightChange {
    Objects.requireNonNull(growspaceId, "growspaceId");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
