package io.github.fiserro.growhab.bayes;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.fiserro.growhab.Condition;
import io.github.fiserro.growhab.ConfigurationException;
import io.github.fiserro.growhab.DayNightPhase;
import io.github.fiserro.growhab.GrowthStage;
import io.github.fiserro.growhab.SensorReading;
import io.github.fiserro.growhab.SensorVariable;
import io.github.fiserro.growhab.config.LikelihoodSettings;
import io.github.fiserro.growhab.profile.ThresholdProfile;
import io.github.fiserro.growhab.profile.ThresholdProfileResolver;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BayesianEstimatorTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final ThresholdProfileResolver PROFILES =
      ThresholdProfileResolver.withDefaultProfiles();

  private final BayesianEstimator estimator = new BayesianEstimator();

  private static Map<SensorVariable, SensorReading> readings(Object... pairs) {
    Map<SensorVariable, SensorReading> readings = new EnumMap<>(SensorVariable.class);
    for (int i = 0; i < pairs.length; i += 2) {
      SensorVariable variable = (SensorVariable) pairs[i];
      readings.put(variable, SensorReading.of(variable, ((Number) pairs[i + 1]).doubleValue(), NOW));
    }
    return readings;
  }

  private static EvidenceContext context(
      GrowthStage stage, DayNightPhase phase, Map<SensorVariable, SensorReading> readings) {
    return context(stage, phase, readings, LikelihoodSettings.defaults(), OptionalLong.empty());
  }

  private static EvidenceContext context(
      GrowthStage stage,
      DayNightPhase phase,
      Map<SensorVariable, SensorReading> readings,
      LikelihoodSettings likelihood,
      OptionalLong daysInStage) {
    ThresholdProfile profile = PROFILES.resolve(stage, phase);
    return EvidenceContext.builder()
        .stage(stage)
        .phase(phase)
        .profile(profile)
        .readings(readings)
        .daysInStage(daysInStage)
        .likelihood(likelihood)
        .build();
  }

  @Nested
  @DisplayName("insufficient evidence")
  class Insufficient {

    @Test
    void noReadingsGiveNoPosterior() {
      PosteriorEstimate estimate =
          estimator.estimate(
              ConditionModels.STRESS, 0.15, context(GrowthStage.VEG, DayNightPhase.DAY, Map.of()));

      assertTrue(estimate.isInsufficient());
      assertTrue(estimate.probability().isEmpty());
      assertEquals(List.of(PosteriorEstimate.INSUFFICIENT_DATA), estimate.reasons());
      assertTrue(estimate.contributingVariables().isEmpty());
    }

    @Test
    void unavailableReadingIsMissingEvidenceNotZero() {
      Map<SensorVariable, SensorReading> readings = new EnumMap<>(SensorVariable.class);
      readings.put(
          SensorVariable.TEMPERATURE, SensorReading.unavailable(SensorVariable.TEMPERATURE, NOW));

      PosteriorEstimate estimate =
          estimator.estimate(
              ConditionModels.STRESS, 0.15, context(GrowthStage.VEG, DayNightPhase.DAY, readings));

      assertTrue(estimate.isInsufficient());
    }

    @Test
    void stageAgeAloneIsNotEnough() {
      PosteriorEstimate estimate =
          estimator.estimate(
              ConditionModels.MOLD_RISK,
              0.10,
              context(
                  GrowthStage.FLOWER,
                  DayNightPhase.DAY,
                  Map.of(),
                  LikelihoodSettings.defaults(),
                  OptionalLong.of(50)));

      assertTrue(estimate.isInsufficient());
    }
  }

  @Nested
  @DisplayName("posterior")
  class Posterior {

    @Test
    void idealReadingsLeaveAdversePriorUnchanged() {
      EvidenceContext ideal =
          context(
              GrowthStage.VEG,
              DayNightPhase.DAY,
              readings(SensorVariable.TEMPERATURE, 24, SensorVariable.HUMIDITY, 60, SensorVariable.VPD, 1.0));

      assertEquals(0.15, estimator.estimate(ConditionModels.STRESS, 0.15, ideal).probability().getAsDouble(), 1e-9);
      assertEquals(0.10, estimator.estimate(ConditionModels.MOLD_RISK, 0.10, ideal).probability().getAsDouble(), 1e-9);
    }

    @Test
    void idealReadingsMakeConditionsOptimal() {
      EvidenceContext ideal =
          context(
              GrowthStage.VEG,
              DayNightPhase.DAY,
              readings(SensorVariable.TEMPERATURE, 24, SensorVariable.HUMIDITY, 60, SensorVariable.VPD, 1.0));

      double p = estimator.estimate(ConditionModels.OPTIMAL, 0.40, ideal).probability().getAsDouble();

      // prior odds 2/3 times 3 * 2 * 3
      assertEquals(12.0 / 13.0, p, 1e-9);
    }

    @Test
    void highTemperatureRaisesStressAndIsTheOnlyContributor() {
      EvidenceContext hot =
          context(
              GrowthStage.VEG,
              DayNightPhase.DAY,
              readings(SensorVariable.TEMPERATURE, 30, SensorVariable.HUMIDITY, 60));

      PosteriorEstimate estimate = estimator.estimate(ConditionModels.STRESS, 0.15, hot);

      assertTrue(estimate.probability().getAsDouble() > 0.5, "posterior " + estimate.probability());
      assertEquals(List.of("temperature"), estimate.contributingVariables());
      assertEquals(List.of("temperature", "humidity"), estimate.observedVariables());
      assertTrue(estimate.reasons().get(0).startsWith("temperature 30 above ideal 22-26"));
      assertFalse(estimate.isLowConfidence());
    }

    @Test
    void posteriorGrowsWithDeviation() {
      double previous = 0;
      for (double temperature = 26; temperature <= 34; temperature += 1) {
        double p =
            estimator
                .estimate(
                    ConditionModels.STRESS,
                    0.15,
                    context(GrowthStage.VEG, DayNightPhase.DAY, readings(SensorVariable.TEMPERATURE, temperature)))
                .probability()
                .getAsDouble();
        assertTrue(p >= previous, "not monotonic at " + temperature);
        previous = p;
      }
    }

    @Test
    void singleVariableIsLowConfidence() {
      PosteriorEstimate estimate =
          estimator.estimate(
              ConditionModels.STRESS,
              0.15,
              context(GrowthStage.VEG, DayNightPhase.DAY, readings(SensorVariable.TEMPERATURE, 24)));

      assertTrue(estimate.isLowConfidence());
    }

    @Test
    void likelihoodIsClampedPerVariable() {
      LikelihoodSettings tight = LikelihoodSettings.builder().maxRatio(2.0).build();
      EvidenceContext extreme =
          context(
              GrowthStage.VEG,
              DayNightPhase.DAY,
              readings(SensorVariable.TEMPERATURE, 45),
              tight,
              OptionalLong.empty());

      PosteriorEstimate estimate = estimator.estimate(ConditionModels.STRESS, 0.15, extreme);

      assertEquals(2.0, estimate.evidence().get(0).likelihoodRatio(), 1e-9);
      double odds = 0.15 / 0.85 * 2.0;
      assertEquals(odds / (1 + odds), estimate.probability().getAsDouble(), 1e-9);
    }

    @Test
    void posteriorNeverReachesCertainty() {
      EvidenceContext awful =
          context(
              GrowthStage.VEG,
              DayNightPhase.DAY,
              readings(
                  SensorVariable.TEMPERATURE, 45,
                  SensorVariable.HUMIDITY, 99,
                  SensorVariable.VPD, 0.0,
                  SensorVariable.CO2, 5000));

      double p = estimator.estimate(ConditionModels.STRESS, 0.15, awful).probability().getAsDouble();

      assertTrue(p > 0.99 && p < 1.0, "posterior " + p);
    }
  }

  @Nested
  @DisplayName("mold risk")
  class MoldRisk {

    @Test
    void stoppedFanRaisesMoldRisk() {
      Map<SensorVariable, SensorReading> readings = readings(SensorVariable.HUMIDITY, 50);
      readings.put(SensorVariable.FAN_STATE, SensorReading.ofSwitch(SensorVariable.FAN_STATE, false, NOW));

      PosteriorEstimate estimate =
          estimator.estimate(ConditionModels.MOLD_RISK, 0.10, context(GrowthStage.FLOWER, DayNightPhase.DAY, readings));

      double odds = 0.10 / 0.90 * 5.0;
      assertEquals(odds / (1 + odds), estimate.probability().getAsDouble(), 1e-9);
      assertEquals(List.of("fan_state"), estimate.contributingVariables());
    }

    @Test
    void humidityWeighsMoreAtNight() {
      Map<SensorVariable, SensorReading> damp = readings(SensorVariable.HUMIDITY, 70);

      double day =
          estimator.estimate(ConditionModels.MOLD_RISK, 0.10, context(GrowthStage.FLOWER, DayNightPhase.DAY, damp))
              .probability().getAsDouble();
      double night =
          estimator.estimate(ConditionModels.MOLD_RISK, 0.10, context(GrowthStage.FLOWER, DayNightPhase.NIGHT, damp))
              .probability().getAsDouble();

      assertTrue(night > day, "night " + night + " vs day " + day);
    }

    @Test
    void lowHumidityIsNoMoldEvidence() {
      PosteriorEstimate estimate =
          estimator.estimate(
              ConditionModels.MOLD_RISK,
              0.10,
              context(GrowthStage.FLOWER, DayNightPhase.DAY, readings(SensorVariable.HUMIDITY, 30)));

      assertEquals(0.10, estimate.probability().getAsDouble(), 1e-9);
    }

    @Test
    void lateFlowerRaisesMoldRisk() {
      Map<SensorVariable, SensorReading> readings = readings(SensorVariable.HUMIDITY, 50);

      PosteriorEstimate early =
          estimator.estimate(
              ConditionModels.MOLD_RISK, 0.10,
              context(GrowthStage.FLOWER, DayNightPhase.DAY, readings, LikelihoodSettings.defaults(), OptionalLong.of(20)));
      PosteriorEstimate late =
          estimator.estimate(
              ConditionModels.MOLD_RISK, 0.10,
              context(GrowthStage.FLOWER, DayNightPhase.DAY, readings, LikelihoodSettings.defaults(), OptionalLong.of(40)));

      assertEquals(0.10, early.probability().getAsDouble(), 1e-9);
      assertTrue(late.probability().getAsDouble() > 0.25);
      assertTrue(late.reasons().contains("flower day 40 (late flower)"), late.reasons().toString());
      assertTrue(late.contributingVariables().isEmpty());
    }
  }

  @Nested
  @DisplayName("prior validation")
  class PriorValidation {

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 1.0, -0.2, 1.5, Double.NaN})
    void invalidPriorIsRejected(double prior) {
      assertThrows(
          ConfigurationException.class,
          () -> estimator.combine(Condition.STRESS, prior, List.of(), LikelihoodSettings.defaults()));
    }
  }
}
