package io.github.fiserro.growhab.config;

import io.github.fiserro.growhab.GrowthStage;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;
import lombok.Builder;

/**
 * Light cycle verification settings.
 *
 * @param expectedOn expected lights-on time per 24 hour window, by stage
 * @param tolerance allowed difference between observed and expected lights-on time
 * @param rolloverTime local time at which windows close; null for windows anchored at the first
 *     observed transition
 * @param zone zone of {@code rolloverTime}
 * @param debounce how long a raw light state has to persist before it counts; zero disables
 */
@Builder(toBuilder = true, builderClassName = "LightScheduleSettingsBuilder")
public record LightScheduleSettings(
    @NotNull Map<GrowthStage, Duration> expectedOn,
    @NotNull Duration tolerance,
    LocalTime rolloverTime,
    @NotNull ZoneId zone,
    @NotNull Duration debounce) {

  public static final Duration VEG_DAY = Duration.ofHours(18);
  public static final Duration FLOWER_DAY = Duration.ofHours(12);

  public static LightScheduleSettings defaults() {
    return builder().build();
  }

  /** Expected lights-on time for the stage; zero for stages without a configured schedule. */
  public Duration expectedOn(GrowthStage stage) {
    return expectedOn.getOrDefault(stage, Duration.ZERO);
  }

  public static class LightScheduleSettingsBuilder {

    public LightScheduleSettingsBuilder() {
      expectedOn = new EnumMap<>(GrowthStage.class);
      expectedOn.put(GrowthStage.SEEDLING, VEG_DAY);
      expectedOn.put(GrowthStage.CLONE, VEG_DAY);
      expectedOn.put(GrowthStage.MOTHER, VEG_DAY);
      expectedOn.put(GrowthStage.VEG, VEG_DAY);
      expectedOn.put(GrowthStage.FLOWER, FLOWER_DAY);
      expectedOn.put(GrowthStage.DRY, Duration.ZERO);
      expectedOn.put(GrowthStage.CURE, Duration.ZERO);
      tolerance = Duration.ofMinutes(15);
      zone = ZoneId.systemDefault();
      debounce = Duration.ZERO;
    }

    /** Overrides the expected lights-on time of one stage. */
    public LightScheduleSettingsBuilder stageHours(GrowthStage stage, Duration hours) {
      Map<GrowthStage, Duration> copy = new EnumMap<>(GrowthStage.class);
      copy.putAll(expectedOn);
      copy.put(stage, hours);
      expectedOn = copy;
      return this;
    }
  }
}
