package io.github.fiserro.growhab.bayes;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Evidence of one source.
 *
 * @param key variable key, or a context key such as {@code stage_age}
 * @param contextual true for evidence not backed by a sensor reading
 */
public record VariableEvidence(
    String key, double value, double likelihoodRatio, boolean contextual, String reason) {

  private static final double NEUTRAL_EPSILON = 1e-9;

  public boolean isNeutral() {
    return Math.abs(Math.log(likelihoodRatio)) < NEUTRAL_EPSILON;
  }

  /** Strength of the evidence regardless of direction. */
  public double influence() {
    return Math.abs(Math.log(likelihoodRatio));
  }

  public VariableEvidence withLikelihoodRatio(double ratio) {
    return new VariableEvidence(key, value, ratio, contextual, reason);
  }

  static String format(double value) {
    return BigDecimal.valueOf(value)
        .setScale(2, RoundingMode.HALF_UP)
        .stripTrailingZeros()
        .toPlainString();
  }
}
