package io.github.fiserro.growhab.gate;

/** Where a posterior falls relative to the gate thresholds. */
public enum Classification {
  /** At or above the turn-on threshold. */
  ON,
  /** At or below the turn-off threshold. */
  OFF,
  /** Strictly between the thresholds. */
  BAND,
  /** No posterior available. */
  NONE
}
