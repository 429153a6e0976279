package io.github.fiserro.growhab.bayes;

import io.github.fiserro.growhab.SensorVariable;
import java.util.Optional;
import java.util.OptionalDouble;

/** Evidence from an on/off reading such as the circulation fan. */
public record SwitchEvidenceSource(
    SensorVariable variable, double ratioWhenOn, double ratioWhenOff, boolean nightWeighted)
    implements EvidenceSource {

  @Override
  public String key() {
    return variable.key();
  }

  @Override
  public Optional<VariableEvidence> evaluate(EvidenceContext context) {
    OptionalDouble reading = context.value(variable);
    if (reading.isEmpty()) {
      return Optional.empty();
    }
    boolean on = reading.getAsDouble() > 0;
    double ratio = on ? ratioWhenOn : ratioWhenOff;
    if (nightWeighted && context.isNight()) {
      ratio = Math.pow(ratio, context.likelihood().nightMoldWeight());
    }
    return Optional.of(
        new VariableEvidence(
            key(), reading.getAsDouble(), ratio, false, key() + (on ? " on" : " off")));
  }
}
