package io.github.fiserro.growhab;

import java.time.Instant;
import java.util.Objects;

/** New reading (or loss of reading) for one bound sensor. */
public record SensorUpdate(String growspaceId, SensorReading reading) implements GrowspaceEvent {

  public SensorUpdate {
    Objects.requireNonNull(growspaceId, "growspaceId");
    Objects.requireNonNull(reading, "reading");
  }

  public static SensorUpdate of(
      String growspaceId, SensorVariable variable, double value, Instant timestamp) {
    return new SensorUpdate(growspaceId, SensorReading.of(variable, value, timestamp));
  }

  public static SensorUpdate unavailable(
      String growspaceId, SensorVariable variable, Instant timestamp) {
    return new SensorUpdate(growspaceId, SensorReading.unavailable(variable, timestamp));
  }

  public SensorVariable variable() {
    return reading.variable();
  }

  @Override
  public Instant timestamp() {
    return reading.timestamp();
  }
}
