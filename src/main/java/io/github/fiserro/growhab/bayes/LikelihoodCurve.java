package io.github.fiserro.growhab.bayes;

/**
 * Maps a normalized distance from the ideal band (in tolerance units) to a severity in [0, 1]. Both
 * curves are monotonic and return 0 inside the band.
 */
public enum LikelihoodCurve {
  /** Grows linearly and saturates two tolerances outside the band. */
  LINEAR {
    @Override
    public double severity(double distance) {
      return Math.min(1.0, Math.max(0.0, distance) / 2.0);
    }
  },
  /** Smooth start, about 0.39 at one tolerance, 0.86 at two, saturating near three. */
  GAUSSIAN {
    @Override
    public double severity(double distance) {
      double d = Math.max(0.0, distance);
      return 1.0 - Math.exp(-0.5 * d * d);
    }
  };

  public abstract double severity(double distance);
}
