package io.github.fiserro.growhab.profile;

import io.github.fiserro.growhab.DayNightPhase;
import io.github.fiserro.growhab.GrowthStage;
import lombok.RequiredArgsConstructor;

/**
 * Selects the profile for a stage and phase. Total: a missing night profile falls back to the
 * stage's day profile, which the table guarantees to exist.
 */
@RequiredArgsConstructor
public class ThresholdProfileResolver {

  private final ThresholdProfileTable table;

  public static ThresholdProfileResolver withDefaultProfiles() {
    return new ThresholdProfileResolver(new ThresholdProfileLoader().loadDefault());
  }

  public ThresholdProfile resolve(GrowthStage stage, DayNightPhase phase) {
    return table
        .find(stage, phase)
        .or(() -> table.find(stage, DayNightPhase.DAY))
        .orElseThrow(() -> new IllegalStateException("No day profile for " + stage));
  }
}
