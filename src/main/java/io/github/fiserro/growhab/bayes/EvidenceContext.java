package io.github.fiserro.growhab.bayes;

import io.github.fiserro.growhab.DayNightPhase;
import io.github.fiserro.growhab.GrowthStage;
import io.github.fiserro.growhab.SensorReading;
import io.github.fiserro.growhab.SensorVariable;
import io.github.fiserro.growhab.config.LikelihoodSettings;
import io.github.fiserro.growhab.profile.ThresholdProfile;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import lombok.Builder;

/**
 * Everything evidence sources may look at during one evaluation.
 *
 * @param daysInStage whole days since the stage started, empty when the start is unknown
 */
@Builder
public record EvidenceContext(
    GrowthStage stage,
    DayNightPhase phase,
    ThresholdProfile profile,
    Map<SensorVariable, SensorReading> readings,
    OptionalLong daysInStage,
    LikelihoodSettings likelihood) {

  /** Available, finite value of the variable. */
  public OptionalDouble value(SensorVariable variable) {
    SensorReading reading = readings.get(variable);
    if (reading == null || !reading.isAvailable()) {
      return OptionalDouble.empty();
    }
    double value = reading.value().getAsDouble();
    return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
  }

  public boolean isNight() {
    return phase == DayNightPhase.NIGHT;
  }
}
