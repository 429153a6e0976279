package io.github.fiserro.growhab;

/** Outcome of the light cycle verification. */
public enum LightScheduleStatus {
  CORRECT,
  INCORRECT,
  UNKNOWN
}
