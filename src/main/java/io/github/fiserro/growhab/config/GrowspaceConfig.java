package io.github.fiserro.growhab.config;

import io.github.fiserro.growhab.Condition;
import io.github.fiserro.growhab.ConfigurationException;
import io.github.fiserro.growhab.GrowthStage;
import io.github.fiserro.growhab.SensorVariable;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import lombok.Builder;

/**
 * Setup of one growspace.
 *
 * @param growspaceId unique id, also the prefix of the growspace's openHAB items
 * @param enabledConditions conditions to evaluate and publish
 * @param boundSensors variables with a bound sensor; readings for others are dropped
 * @param lightSensorBound whether a light sensor or light switch is bound
 * @param initialStage stage assumed until the plant records push one
 * @param conditions prior and gate settings per condition
 * @param leafTemperatureOffset leaf minus air temperature used when VPD is derived
 */
@Builder(toBuilder = true, builderClassName = "GrowspaceConfigBuilder")
public record GrowspaceConfig(
    @NotNull String growspaceId,
    @NotNull Set<Condition> enabledConditions,
    @NotNull Set<SensorVariable> boundSensors,
    boolean lightSensorBound,
    @NotNull GrowthStage initialStage,
    @NotNull Map<Condition, ConditionSettings> conditions,
    @NotNull LightScheduleSettings lightSchedule,
    @NotNull LikelihoodSettings likelihood,
    @DecimalMin("-5") @DecimalMax("5") double leafTemperatureOffset) {

  private static final Duration FULL_DAY = Duration.ofHours(24);

  public ConditionSettings conditionSettings(Condition condition) {
    ConditionSettings settings = conditions.get(condition);
    return settings != null ? settings : ConditionSettings.defaults(condition);
  }

  public boolean isBound(SensorVariable variable) {
    return boundSensors.contains(variable);
  }

  /**
   * Checks annotated bounds and cross-field rules of this config and its nested settings.
   *
   * @return this config
   * @throws ConfigurationException on the first violation found
   */
  public GrowspaceConfig validate() {
    ConfigConstraints.check(this, growspaceId);
    if (growspaceId.isBlank()) {
      throw new ConfigurationException("Growspace id must not be blank");
    }
    for (Condition condition : enabledConditions) {
      ConditionSettings settings = conditionSettings(condition);
      ConfigConstraints.check(settings, growspaceId);
      if (settings.turnOnThreshold() <= settings.turnOffThreshold()) {
        throw new ConfigurationException(
            growspaceId,
            String.format(
                "%s: turn-on threshold %.2f must be greater than turn-off threshold %.2f",
                condition.key(), settings.turnOnThreshold(), settings.turnOffThreshold()));
      }
      if (settings.minimumDwell().isNegative()) {
        throw new ConfigurationException(
            growspaceId, condition.key() + ": minimum dwell must not be negative");
      }
    }

    ConfigConstraints.check(lightSchedule, growspaceId);
    if (lightSchedule.tolerance().isNegative()) {
      throw new ConfigurationException(
          growspaceId, "Light schedule tolerance must not be negative");
    }
    if (lightSchedule.debounce().isNegative()) {
      throw new ConfigurationException(growspaceId, "Light debounce must not be negative");
    }
    lightSchedule.expectedOn().forEach((stage, hours) -> {
      if (hours.isNegative() || hours.compareTo(FULL_DAY) > 0) {
        throw new ConfigurationException(
            growspaceId, "Expected lights-on time for " + stage.key() + " must be within 0..24h");
      }
    });

    ConfigConstraints.check(likelihood, growspaceId);
    if (likelihood.minRatio() >= likelihood.maxRatio()) {
      throw new ConfigurationException(
          growspaceId, "Likelihood ratio bounds must satisfy minRatio < maxRatio");
    }
    return this;
  }

  public static class GrowspaceConfigBuilder {

    public GrowspaceConfigBuilder() {
      enabledConditions = EnumSet.allOf(Condition.class);
      boundSensors =
          EnumSet.of(SensorVariable.TEMPERATURE, SensorVariable.HUMIDITY, SensorVariable.VPD);
      lightSensorBound = false;
      initialStage = GrowthStage.VEG;
      conditions = new EnumMap<>(Condition.class);
      for (Condition condition : Condition.values()) {
        conditions.put(condition, ConditionSettings.defaults(condition));
      }
      lightSchedule = LightScheduleSettings.defaults();
      likelihood = LikelihoodSettings.defaults();
      leafTemperatureOffset = -2.0;
    }

    /** Replaces the settings of one condition, keeping the others. */
    public GrowspaceConfigBuilder condition(Condition condition, ConditionSettings settings) {
      Map<Condition, ConditionSettings> copy = new EnumMap<>(Condition.class);
      copy.putAll(conditions);
      copy.put(condition, settings);
      conditions = copy;
      return this;
    }
  }
}
