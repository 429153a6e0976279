package io.github.fiserro.growhab.config;

import io.github.fiserro.growhab.Condition;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Builder;
import lombok.With;

/**
 * Prior and gate tuning of one condition.
 *
 * @param prior base-rate probability, strictly between 0 and 1
 * @param turnOnThreshold posterior at or above which the verdict turns on
 * @param turnOffThreshold posterior at or below which the verdict turns off
 * @param minimumDwell how long the posterior has to stay past a threshold before the verdict flips
 */
@Builder(toBuilder = true, builderClassName = "ConditionSettingsBuilder")
public record ConditionSettings(
    @DecimalMin(value = "0", inclusive = false) @DecimalMax(value = "1", inclusive = false)
        double prior,
    @With @DecimalMin("0") @DecimalMax("1") double turnOnThreshold,
    @With @DecimalMin("0") @DecimalMax("1") double turnOffThreshold,
    @With @NotNull Duration minimumDwell) {

  /** Width of the dead band when only the turn-on threshold is given. */
  public static final double DEFAULT_BAND = 0.15;

  public static ConditionSettings of(double prior, double turnOnThreshold) {
    return new ConditionSettings(
        prior, turnOnThreshold, turnOnThreshold - DEFAULT_BAND, Duration.ZERO);
  }

  public static ConditionSettings defaults(Condition condition) {
    return switch (condition) {
      case STRESS -> of(0.15, 0.70);
      case MOLD_RISK -> of(0.10, 0.75);
      case OPTIMAL -> of(0.40, 0.80);
    };
  }

  public static class ConditionSettingsBuilder {

    public ConditionSettingsBuilder() {
      prior = 0.5;
      turnOnThreshold = 0.75;
      turnOffThreshold = 0.75 - DEFAULT_BAND;
      minimumDwell = Duration.ZERO;
    }
  }
}
