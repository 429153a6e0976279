package io.github.fiserro.growhab.profile;

import io.github.fiserro.growhab.DayNightPhase;
import io.github.fiserro.growhab.GrowthStage;
import io.github.fiserro.growhab.SensorVariable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Ideal ranges of a stage and phase. Immutable. */
public record ThresholdProfile(
    GrowthStage stage, DayNightPhase phase, Map<SensorVariable, VariableRange> ranges) {

  /** Variables every profile has to define. */
  public static final Set<SensorVariable> REQUIRED_VARIABLES =
      Set.of(SensorVariable.TEMPERATURE, SensorVariable.HUMIDITY, SensorVariable.VPD);

  public ThresholdProfile {
    Map<SensorVariable, VariableRange> copy = new EnumMap<>(SensorVariable.class);
    copy.putAll(ranges);
    ranges = Collections.unmodifiableMap(copy);
  }

  public Optional<VariableRange> range(SensorVariable variable) {
    return Optional.ofNullable(ranges.get(variable));
  }
}
