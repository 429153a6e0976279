package io.github.fiserro.growhab.bayes;

import io.github.fiserro.growhab.ConfigurationException;

/**
 * Likelihood ratio P(obs | condition) / P(obs | not condition) as a function of severity. The
 * ratio moves geometrically from {@code idealRatio} (severity 0) to {@code extremeRatio} (severity
 * 1).
 *
 * <p>Adverse conditions use an ideal ratio of 1, so readings inside the band leave the prior
 * untouched. The favorable condition uses an ideal ratio above 1 and an extreme ratio below 1.
 */
public record LikelihoodMapping(double idealRatio, double extremeRatio) {

  public LikelihoodMapping {
    if (!(idealRatio > 0) || !(extremeRatio > 0)) {
      throw new ConfigurationException("Likelihood ratios must be positive");
    }
  }

  /** Mapping that is neutral at ideal and rises to {@code extremeRatio}. */
  public static LikelihoodMapping adverse(double extremeRatio) {
    return new LikelihoodMapping(1.0, extremeRatio);
  }

  public static LikelihoodMapping favorable(double idealRatio, double extremeRatio) {
    return new LikelihoodMapping(idealRatio, extremeRatio);
  }

  public double ratio(LikelihoodCurve curve, double distance) {
    double severity = curve.severity(distance);
    return idealRatio * Math.pow(extremeRatio / idealRatio, severity);
  }
}
