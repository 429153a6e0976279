package io.github.fiserro.growhab;

import java.util.Arrays;
import java.util.Locale;

/** Environment variables the engine accepts readings for. */
public enum SensorVariable {
  TEMPERATURE(false),
  HUMIDITY(false),
  VPD(false),
  CO2(false),
  /** Circulation fan; a switch reading where 1 means running. */
  FAN_STATE(true);

  private final boolean switchType;

  SensorVariable(boolean switchType) {
    this.switchType = switchType;
  }

  /** True for on/off variables, whose readings are encoded as 1 (on) and 0 (off). */
  public boolean isSwitch() {
    return switchType;
  }

  /** Lower-case key used in verdict attributes, e.g. {@code "fan_state"}. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static SensorVariable fromKey(String key) {
    String normalized = key.trim().toUpperCase(Locale.ROOT);
    return Arrays.stream(values())
        .filter(variable -> variable.name().equals(normalized))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown sensor variable: " + key));
  }
}
