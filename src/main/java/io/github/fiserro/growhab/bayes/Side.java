package io.github.fiserro.growhab.bayes;

import io.github.fiserro.growhab.profile.VariableRange;

/** Which deviations from the ideal band count as evidence. */
public enum Side {
  BOTH,
  ABOVE,
  BELOW;

  double distance(VariableRange range, double value) {
    return switch (this) {
      case ABOVE -> range.distanceAbove(value);
      case BELOW -> range.distanceBelow(value);
      case BOTH -> range.distance(value);
    };
  }
}
