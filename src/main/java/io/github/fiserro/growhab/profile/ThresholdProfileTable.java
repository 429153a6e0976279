package io.github.fiserro.growhab.profile;

import io.github.fiserro.growhab.ConfigurationException;
import io.github.fiserro.growhab.DayNightPhase;
import io.github.fiserro.growhab.GrowthStage;
import io.github.fiserro.growhab.SensorVariable;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Threshold profiles of all stages. Every stage has a day profile; the night profile is optional.
 * Built once at startup and never mutated afterwards.
 */
public final class ThresholdProfileTable {

  private final Map<GrowthStage, Map<DayNightPhase, ThresholdProfile>> profiles;

  private ThresholdProfileTable(Map<GrowthStage, Map<DayNightPhase, ThresholdProfile>> profiles) {
    this.profiles = profiles;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Optional<ThresholdProfile> find(GrowthStage stage, DayNightPhase phase) {
    Map<DayNightPhase, ThresholdProfile> byPhase = profiles.get(stage);
    return byPhase == null ? Optional.empty() : Optional.ofNullable(byPhase.get(phase));
  }

  public static final class Builder {

    private final Map<GrowthStage, Map<DayNightPhase, ThresholdProfile>> profiles =
        new EnumMap<>(GrowthStage.class);

    private Builder() {}

    public Builder profile(ThresholdProfile profile) {
      profiles
          .computeIfAbsent(profile.stage(), stage -> new EnumMap<>(DayNightPhase.class))
          .put(profile.phase(), profile);
      return this;
    }

    public Builder profile(
        GrowthStage stage, DayNightPhase phase, Map<SensorVariable, VariableRange> ranges) {
      return profile(new ThresholdProfile(stage, phase, ranges));
    }

    /**
     * @throws ConfigurationException if a stage lacks a day profile or a profile lacks a required
     *     variable
     */
    public ThresholdProfileTable build() {
      for (GrowthStage stage : GrowthStage.values()) {
        Map<DayNightPhase, ThresholdProfile> byPhase = profiles.get(stage);
        if (byPhase == null || !byPhase.containsKey(DayNightPhase.DAY)) {
          throw new ConfigurationException("Missing day profile for stage " + stage.key());
        }
        for (ThresholdProfile profile : byPhase.values()) {
          for (SensorVariable required : ThresholdProfile.REQUIRED_VARIABLES) {
            if (profile.range(required).isEmpty()) {
              throw new ConfigurationException(
                  String.format(
                      "Profile %s/%s lacks a %s range",
                      stage.key(), profile.phase().name().toLowerCase(), required.key()));
            }
          }
        }
      }
      Map<GrowthStage, Map<DayNightPhase, ThresholdProfile>> copy =
          new EnumMap<>(GrowthStage.class);
      profiles.forEach((stage, byPhase) -> copy.put(stage, new EnumMap<>(byPhase)));
      return new ThresholdProfileTable(copy);
    }
  }
}
