package io.github.fiserro.growhab.config;

import io.github.fiserro.growhab.bayes.LikelihoodCurve;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

/**
 * Shape and bounds of likelihood ratios.
 *
 * @param minRatio lower clamp of a single variable's likelihood ratio
 * @param maxRatio upper clamp of a single variable's likelihood ratio
 * @param curve how the deviation from ideal maps to severity
 * @param nightMoldWeight exponent applied to mold evidence during the night phase
 */
@Builder(toBuilder = true, builderClassName = "LikelihoodSettingsBuilder")
public record LikelihoodSettings(
    @DecimalMin(value = "0", inclusive = false) @DecimalMax("1") double minRatio,
    @DecimalMin("1") double maxRatio,
    @NotNull LikelihoodCurve curve,
    @DecimalMin("1") @DecimalMax("3") double nightMoldWeight) {

  public static LikelihoodSettings defaults() {
    return builder().build();
  }

  public double clamp(double ratio) {
    return Math.max(minRatio, Math.min(maxRatio, ratio));
  }

  public static class LikelihoodSettingsBuilder {

    public LikelihoodSettingsBuilder() {
      minRatio = 0.05;
      maxRatio = 20.0;
      curve = LikelihoodCurve.GAUSSIAN;
      nightMoldWeight = 1.5;
    }
  }
}
