package io.github.fiserro.growhab.gate;

import io.github.fiserro.growhab.ConfigurationException;
import io.github.fiserro.growhab.VerdictValue;
import io.github.fiserro.growhab.config.ConditionSettings;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalDouble;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a posterior stream into a stable binary verdict.
 *
 * <p>Logic:
 *
 * <ul>
 *   <li>Posterior &gt;= turn-on threshold: turn ON, once that has held for the minimum dwell
 *   <li>Posterior &lt;= turn-off threshold: turn OFF, once that has held for the minimum dwell
 *   <li>Posterior in between: keep the current verdict and restart any pending dwell
 *   <li>No posterior: keep the current verdict, mark it stale
 * </ul>
 *
 * <p>The first posterior of an unseeded gate publishes its verdict right away; leaving UNKNOWN
 * counts as a change.
 *
 * <p>The gate holds no state of its own; callers pass the previous {@link GateState} and keep the
 * returned one.
 */
@Slf4j
@Getter
public class HysteresisGate {

  private final double turnOnThreshold;
  private final double turnOffThreshold;
  private final Duration minimumDwell;

  /**
   * @throws ConfigurationException if the thresholds are outside [0, 1], on is not above off, or
   *     the dwell is negative
   */
  public HysteresisGate(double turnOnThreshold, double turnOffThreshold, Duration minimumDwell) {
    if (!(turnOnThreshold >= 0 && turnOnThreshold <= 1)
        || !(turnOffThreshold >= 0 && turnOffThreshold <= 1)) {
      throw new ConfigurationException(
          String.format(
              "Gate thresholds must lie in [0, 1], got on=%s off=%s",
              turnOnThreshold, turnOffThreshold));
    }
    if (turnOnThreshold <= turnOffThreshold) {
      throw new ConfigurationException(
          String.format(
              "Turn-on threshold %s must be greater than turn-off threshold %s",
              turnOnThreshold, turnOffThreshold));
    }
    if (minimumDwell == null || minimumDwell.isNegative()) {
      throw new ConfigurationException("Minimum dwell must not be negative");
    }
    this.turnOnThreshold = turnOnThreshold;
    this.turnOffThreshold = turnOffThreshold;
    this.minimumDwell = minimumDwell;
  }

  public static HysteresisGate of(ConditionSettings settings) {
    return new HysteresisGate(
        settings.turnOnThreshold(), settings.turnOffThreshold(), settings.minimumDwell());
  }

  public Classification classify(double posterior) {
    if (posterior >= turnOnThreshold) {
      return Classification.ON;
    }
    if (posterior <= turnOffThreshold) {
      return Classification.OFF;
    }
    return Classification.BAND;
  }

  public GateResult update(GateState previous, OptionalDouble posterior, Instant now) {
    if (posterior.isEmpty()) {
      GateState held =
          new GateState(
              previous.verdict(),
              true,
              previous.seeded(),
              previous.changedAt(),
              Classification.NONE,
              null);
      if (!previous.stale()) {
        log.debug("Gate: no evidence, holding {} as stale", previous.value());
      }
      return new GateResult(held, false);
    }

    double p = posterior.getAsDouble();
    Classification classification = classify(p);
    Instant since =
        classification == previous.classification() && previous.classifiedSince() != null
            ? previous.classifiedSince()
            : now;

    boolean verdict = previous.verdict();
    Instant changedAt = previous.changedAt();
    boolean target =
        switch (classification) {
          case ON -> true;
          case OFF -> false;
          default -> verdict;
        };

    if (target != verdict) {
      Duration held = now.isBefore(since) ? Duration.ZERO : Duration.between(since, now);
      if (held.compareTo(minimumDwell) >= 0) {
        verdict = target;
        changedAt = now;
        log.debug(
            "Gate: {} -> {} at posterior {} (held {})",
            previous.verdict() ? "ON" : "OFF",
            verdict ? "ON" : "OFF",
            String.format("%.3f", p),
            held);
      } else {
        log.debug(
            "Gate: pending {} at posterior {}, held {} of {}",
            target ? "ON" : "OFF",
            String.format("%.3f", p),
            held,
            minimumDwell);
      }
    }

    boolean changed = VerdictValue.of(verdict) != previous.value();
    if (changed) {
      changedAt = now;
    }
    GateState next = new GateState(verdict, false, true, changedAt, classification, since);
    return new GateResult(next, changed);
  }
}
