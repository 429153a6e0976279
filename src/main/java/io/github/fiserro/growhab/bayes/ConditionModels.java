package io.github.fiserro.growhab.bayes;

import static io.github.fiserro.growhab.bayes.LikelihoodMapping.adverse;
import static io.github.fiserro.growhab.bayes.LikelihoodMapping.favorable;

import io.github.fiserro.growhab.Condition;
import io.github.fiserro.growhab.GrowthStage;
import io.github.fiserro.growhab.SensorVariable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.experimental.UtilityClass;

/** Built-in evidence models of the three conditions. */
@UtilityClass
public class ConditionModels {

  /** Days into flower after which dense buds make mold noticeably more likely. */
  public static final long LATE_FLOWER_DAYS = 35;

  /** Plant stress: any variable too far from ideal, in either direction. */
  public static final ConditionModel STRESS =
      new ConditionModel(
          Condition.STRESS,
          List.of(
              RangeEvidenceSource.of(SensorVariable.TEMPERATURE, Side.BOTH, adverse(12.0)),
              RangeEvidenceSource.of(SensorVariable.HUMIDITY, Side.BOTH, adverse(6.0)),
              RangeEvidenceSource.of(SensorVariable.VPD, Side.BOTH, adverse(6.0)),
              RangeEvidenceSource.of(SensorVariable.CO2, Side.BOTH, adverse(4.0))));

  /**
   * Mold risk: damp, still air. Humidity above and VPD below ideal, a stopped fan, and late flower.
   * Sensor evidence weighs more at night.
   */
  public static final ConditionModel MOLD_RISK =
      new ConditionModel(
          Condition.MOLD_RISK,
          List.of(
              new RangeEvidenceSource(SensorVariable.HUMIDITY, Side.ABOVE, adverse(8.0), true),
              new RangeEvidenceSource(SensorVariable.VPD, Side.BELOW, adverse(6.0), true),
              new SwitchEvidenceSource(SensorVariable.FAN_STATE, 1.0, 5.0, true),
              new StageAgeEvidenceSource(GrowthStage.FLOWER, LATE_FLOWER_DAYS, 4.0)));

  /** Optimal conditions: every variable inside its ideal band. */
  public static final ConditionModel OPTIMAL =
      new ConditionModel(
          Condition.OPTIMAL,
          List.of(
              RangeEvidenceSource.of(SensorVariable.TEMPERATURE, Side.BOTH, favorable(3.0, 0.2)),
              RangeEvidenceSource.of(SensorVariable.HUMIDITY, Side.BOTH, favorable(2.0, 0.3)),
              RangeEvidenceSource.of(SensorVariable.VPD, Side.BOTH, favorable(3.0, 0.25)),
              RangeEvidenceSource.of(SensorVariable.CO2, Side.BOTH, favorable(1.5, 0.5))));

  public Map<Condition, ConditionModel> defaults() {
    Map<Condition, ConditionModel> models = new EnumMap<>(Condition.class);
    models.put(Condition.STRESS, STRESS);
    models.put(Condition.MOLD_RISK, MOLD_RISK);
    models.put(Condition.OPTIMAL, OPTIMAL);
    return Collections.unmodifiableMap(models);
  }
}
