package io.github.fiserro.growhab.gate;

import io.github.fiserro.growhab.VerdictValue;
import java.time.Duration;
import java.time.Instant;

/**
 * Persisted state of one condition's gate.
 *
 * @param verdict current gated verdict
 * @param stale true while the verdict is held without fresh evidence
 * @param seeded true once any evidence arrived; unseeded gates publish UNKNOWN
 * @param changedAt time of the last verdict transition, null before the first one
 * @param classification classification of the latest posterior
 * @param classifiedSince start of the uninterrupted run of {@code classification}
 */
public record GateState(
    boolean verdict,
    boolean stale,
    boolean seeded,
    Instant changedAt,
    Classification classification,
    Instant classifiedSince) {

  public static GateState initial() {
    return new GateState(false, true, false, null, Classification.NONE, null);
  }

  public VerdictValue value() {
    return seeded ? VerdictValue.of(verdict) : VerdictValue.UNKNOWN;
  }

  /** How long the latest classification has held at {@code now}. */
  public Duration classifiedFor(Instant now) {
    if (classifiedSince == null || now.isBefore(classifiedSince)) {
      return Duration.ZERO;
    }
    return Duration.between(classifiedSince, now);
  }
}
