package io.github.fiserro.growhab;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Latest value of one variable. An unavailable reading is a distinct state, never a zero value:
 * the estimator treats it as missing evidence.
 *
 * <p>Switch variables are encoded as 1 (on) and 0 (off).
 */
public record SensorReading(SensorVariable variable, OptionalDouble value, Instant timestamp) {

  public SensorReading {
    Objects.requireNonNull(variable, "variable");
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(timestamp, "timestamp");
  }

  public static SensorReading of(SensorVariable variable, double value, Instant timestamp) {
    return new SensorReading(variable, OptionalDouble.of(value), timestamp);
  }

  public static SensorReading ofSwitch(SensorVariable variable, boolean on, Instant timestamp) {
    return of(variable, on ? 1 : 0, timestamp);
  }

  public static SensorReading unavailable(SensorVariable variable, Instant timestamp) {
    return new SensorReading(variable, OptionalDouble.empty(), timestamp);
  }

  public boolean isAvailable() {
    return value.isPresent();
  }

  /** Switch interpretation of the value; only meaningful when available. */
  public boolean isOn() {
    return value.isPresent() && value.getAsDouble() > 0;
  }
}
