package io.github.fiserro.growhab;

/** State reported by a growspace light or light switch. */
public enum LightState {
  ON,
  OFF,
  UNAVAILABLE;

  public boolean isKnown() {
    return this != UNAVAILABLE;
  }

  public static LightState of(boolean on) {
    return on ? ON : OFF;
  }
}
