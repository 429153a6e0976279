package io.github.fiserro.growhab;

/** Lights-on (day) or lights-off (night) window of a growspace. */
public enum DayNightPhase {
  DAY,
  NIGHT;

  /**
   * Derives the phase from the current light state. Without a known light state (no light sensor
   * bound, or the sensor is unavailable) the growspace is assumed to be in its day phase.
   */
  public static DayNightPhase of(LightState light) {
    return light == LightState.OFF ? NIGHT : DAY;
  }
}
