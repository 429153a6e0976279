package io.github.fiserro.growhab.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.fiserro.growhab.Condition;
import io.github.fiserro.growhab.ConfigurationException;
import io.github.fiserro.growhab.GrowthStage;
import java.time.Duration;
import java.util.EnumSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GrowspaceConfigTest {

  private static GrowspaceConfig.GrowspaceConfigBuilder tent() {
    return GrowspaceConfig.builder().growspaceId("tent1");
  }

  @Nested
  @DisplayName("defaults")
  class Defaults {

    @Test
    void defaultConfigIsValid() {
      assertDoesNotThrow(() -> tent().build().validate());
    }

    @Test
    void conditionDefaults() {
      GrowspaceConfig config = tent().build();

      assertEquals(0.15, config.conditionSettings(Condition.STRESS).prior());
      assertEquals(0.70, config.conditionSettings(Condition.STRESS).turnOnThreshold());
      assertEquals(0.55, config.conditionSettings(Condition.STRESS).turnOffThreshold(), 1e-9);
      assertEquals(0.10, config.conditionSettings(Condition.MOLD_RISK).prior());
      assertEquals(0.75, config.conditionSettings(Condition.MOLD_RISK).turnOnThreshold());
      assertEquals(0.40, config.conditionSettings(Condition.OPTIMAL).prior());
      assertEquals(0.80, config.conditionSettings(Condition.OPTIMAL).turnOnThreshold());
      assertEquals(Duration.ZERO, config.conditionSettings(Condition.OPTIMAL).minimumDwell());
    }

    @Test
    void lightScheduleDefaults() {
      LightScheduleSettings light = tent().build().lightSchedule();

      assertEquals(Duration.ofHours(18), light.expectedOn(GrowthStage.VEG));
      assertEquals(Duration.ofHours(18), light.expectedOn(GrowthStage.SEEDLING));
      assertEquals(Duration.ofHours(12), light.expectedOn(GrowthStage.FLOWER));
      assertEquals(Duration.ZERO, light.expectedOn(GrowthStage.DRY));
      assertEquals(Duration.ofMinutes(15), light.tolerance());
      assertTrue(light.debounce().isZero());
    }

    @Test
    void stageHoursOverride() {
      LightScheduleSettings light =
          LightScheduleSettings.builder().stageHours(GrowthStage.VEG, Duration.ofHours(20)).build();

      assertEquals(Duration.ofHours(20), light.expectedOn(GrowthStage.VEG));
      assertEquals(Duration.ofHours(12), light.expectedOn(GrowthStage.FLOWER));
    }
  }

  @Nested
  @DisplayName("validation")
  class Validation {

    @Test
    void priorOfOneIsRejected() {
      GrowspaceConfig config =
          tent().condition(Condition.STRESS, new ConditionSettings(1.0, 0.7, 0.5, Duration.ZERO))
              .build();

      ConfigurationException e = assertThrows(ConfigurationException.class, config::validate);
      assertEquals("tent1", e.getGrowspaceId());
      assertTrue(e.getMessage().contains("prior"), e.getMessage());
    }

    @Test
    void priorOfZeroIsRejected() {
      GrowspaceConfig config =
          tent().condition(Condition.OPTIMAL, new ConditionSettings(0.0, 0.7, 0.5, Duration.ZERO))
              .build();

      assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    void turnOnMustBeAboveTurnOff() {
      GrowspaceConfig config =
          tent().condition(Condition.STRESS, new ConditionSettings(0.2, 0.5, 0.5, Duration.ZERO))
              .build();

      ConfigurationException e = assertThrows(ConfigurationException.class, config::validate);
      assertTrue(e.getMessage().contains("turn-on threshold"), e.getMessage());
    }

    @Test
    void thresholdAboveOneIsRejected() {
      GrowspaceConfig config =
          tent().condition(Condition.STRESS, new ConditionSettings(0.2, 1.2, 0.5, Duration.ZERO))
              .build();

      assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    void negativeDwellIsRejected() {
      GrowspaceConfig config =
          tent().condition(
                  Condition.MOLD_RISK,
                  ConditionSettings.of(0.1, 0.75).withMinimumDwell(Duration.ofMinutes(-1)))
              .build();

      assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    void disabledConditionIsNotValidated() {
      GrowspaceConfig config =
          tent().enabledConditions(EnumSet.of(Condition.OPTIMAL))
              .condition(Condition.STRESS, new ConditionSettings(0.2, 0.5, 0.6, Duration.ZERO))
              .build();

      assertDoesNotThrow(config::validate);
    }

    @Test
    void likelihoodBoundsMustBeOrdered() {
      GrowspaceConfig config =
          tent().likelihood(LikelihoodSettings.builder().minRatio(0.5).maxRatio(1.0).build())
              .build();
      assertDoesNotThrow(config::validate);

      GrowspaceConfig broken =
          tent().likelihood(LikelihoodSettings.builder().minRatio(0.0).build()).build();
      assertThrows(ConfigurationException.class, broken::validate);
    }

    @Test
    void negativeToleranceIsRejected() {
      GrowspaceConfig config =
          tent().lightSchedule(
                  LightScheduleSettings.builder().tolerance(Duration.ofMinutes(-5)).build())
              .build();

      assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    void expectedHoursBeyondADayAreRejected() {
      GrowspaceConfig config =
          tent().lightSchedule(
                  LightScheduleSettings.builder()
                      .stageHours(GrowthStage.VEG, Duration.ofHours(25))
                      .build())
              .build();

      assertThrows(ConfigurationException.class, config::validate);
    }

    @Test
    void missingIdIsRejected() {
      GrowspaceConfig config = GrowspaceConfig.builder().build();

      assertThrows(ConfigurationException.class, config::validate);
    }
  }
}
