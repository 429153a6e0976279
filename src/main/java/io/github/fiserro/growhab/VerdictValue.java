package io.github.fiserro.growhab;

/** Published value of a binary verdict; UNKNOWN when there is not enough data to decide. */
public enum VerdictValue {
  ON,
  OFF,
  UNKNOWN;

  public static VerdictValue of(boolean on) {
    return on ? ON : OFF;
  }
}
