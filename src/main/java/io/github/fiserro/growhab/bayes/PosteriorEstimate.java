package io.github.fiserro.growhab.bayes;

import io.github.fiserro.growhab.Condition;
import java.util.Comparator;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Result of combining a prior with the evidence of one evaluation.
 *
 * @param probability posterior in (0, 1); empty when no sensor-backed evidence was available
 * @param evidence clamped evidence of every source that had data
 */
public record PosteriorEstimate(
    Condition condition,
    double prior,
    OptionalDouble probability,
    List<VariableEvidence> evidence) {

  public static final String INSUFFICIENT_DATA = "insufficient data";

  public PosteriorEstimate {
    evidence = List.copyOf(evidence);
  }

  public static PosteriorEstimate insufficient(Condition condition, double prior) {
    return new PosteriorEstimate(condition, prior, OptionalDouble.empty(), List.of());
  }

  public boolean isInsufficient() {
    return probability.isEmpty();
  }

  /** Sensor variables with an available reading. */
  public List<String> observedVariables() {
    return evidence.stream().filter(e -> !e.contextual()).map(VariableEvidence::key).toList();
  }

  /** Sensor variables whose readings actually moved the posterior. */
  public List<String> contributingVariables() {
    return evidence.stream()
        .filter(e -> !e.contextual() && !e.isNeutral())
        .map(VariableEvidence::key)
        .toList();
  }

  /** A posterior resting on a single variable. */
  public boolean isLowConfidence() {
    return observedVariables().size() == 1;
  }

  /** Explanations of the non-neutral evidence, strongest first. */
  public List<String> reasons() {
    if (isInsufficient()) {
      return List.of(INSUFFICIENT_DATA);
    }
    return evidence.stream()
        .filter(e -> !e.isNeutral())
        .sorted(Comparator.comparingDouble(VariableEvidence::influence).reversed())
        .map(VariableEvidence::reason)
        .toList();
  }
}
