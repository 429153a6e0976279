package io.github.fiserro.growhab.bayes;

import io.github.fiserro.growhab.SensorVariable;
import io.github.fiserro.growhab.profile.VariableRange;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Evidence from the distance of a numeric reading to the profile's ideal band.
 *
 * @param nightWeighted whether the ratio is raised to the night weight during the night phase
 */
public record RangeEvidenceSource(
    SensorVariable variable, Side side, LikelihoodMapping mapping, boolean nightWeighted)
    implements EvidenceSource {

  public static RangeEvidenceSource of(
      SensorVariable variable, Side side, LikelihoodMapping mapping) {
    return new RangeEvidenceSource(variable, side, mapping, false);
  }

  @Override
  public String key() {
    return variable.key();
  }

  @Override
  public Optional<VariableEvidence> evaluate(EvidenceContext context) {
    OptionalDouble reading = context.value(variable);
    Optional<VariableRange> range = context.profile().range(variable);
    if (reading.isEmpty() || range.isEmpty()) {
      return Optional.empty();
    }
    double value = reading.getAsDouble();
    VariableRange band = range.get();

    double ratio = mapping.ratio(context.likelihood().curve(), side.distance(band, value));
    if (nightWeighted && context.isNight()) {
      ratio = Math.pow(ratio, context.likelihood().nightMoldWeight());
    }
    return Optional.of(new VariableEvidence(key(), value, ratio, false, describe(value, band)));
  }

  private String describe(double value, VariableRange band) {
    String position;
    if (value > band.high()) {
      position = "above";
    } else if (value < band.low()) {
      position = "below";
    } else {
      position = "within";
    }
    return String.format(
        "%s %s %s ideal %s-%s",
        key(),
        VariableEvidence.format(value),
        position,
        VariableEvidence.format(band.low()),
        VariableEvidence.format(band.high()));
  }
}
