package io.github.fiserro.growhab.profile;

import io.github.fiserro.growhab.ConfigurationException;

/**
 * Ideal band of a variable plus the tolerance that scales deviations outside of it. A reading one
 * tolerance above {@code high} has a normalized distance of 1.
 */
public record VariableRange(double low, double high, double tolerance) {

  public VariableRange {
    if (!(low <= high)) {
      throw new ConfigurationException(
          String.format("Range low %.2f must not exceed high %.2f", low, high));
    }
    if (!(tolerance > 0)) {
      throw new ConfigurationException(
          String.format("Range tolerance %.2f must be positive", tolerance));
    }
  }

  /** Band of {@code ideal +- halfWidth} with the half width as tolerance. */
  public static VariableRange around(double ideal, double halfWidth) {
    return new VariableRange(ideal - halfWidth, ideal + halfWidth, halfWidth);
  }

  public boolean contains(double value) {
    return value >= low && value <= high;
  }

  /** Normalized distance above the band, 0 inside or below it. */
  public double distanceAbove(double value) {
    return Math.max(0, value - high) / tolerance;
  }

  /** Normalized distance below the band, 0 inside or above it. */
  public double distanceBelow(double value) {
    return Math.max(0, low - value) / tolerance;
  }

  public double distance(double value) {
    return Math.max(distanceAbove(value), distanceBelow(value));
  }

  public double midpoint() {
    return (low + high) / 2;
  }
}
