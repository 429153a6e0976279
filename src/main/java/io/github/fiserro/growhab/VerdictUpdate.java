package io.github.fiserro.growhab;

import java.time.Instant;
import java.util.List;
import java.util.OptionalDouble;
import lombok.Builder;

/**
 * Published outcome of one condition evaluation.
 *
 * @param value gated verdict; UNKNOWN before the first evidence or when the condition does not
 *     apply to the current stage
 * @param stale true while the verdict is held without fresh evidence
 * @param probability posterior, empty when evidence was insufficient
 * @param contributingVariables keys of the sensor variables whose readings moved the posterior
 * @param reasons human-readable explanation, strongest influence first
 * @param lowConfidence true when the posterior rests on a single variable
 * @param changed true when this evaluation changed the published value
 * @param changedAt time of the last verdict transition, null before the first one
 */
@Builder
public record VerdictUpdate(
    String growspaceId,
    Condition condition,
    VerdictValue value,
    boolean stale,
    OptionalDouble probability,
    List<String> contributingVariables,
    List<String> reasons,
    boolean lowConfidence,
    boolean changed,
    Instant changedAt,
    Instant evaluatedAt) {

  public VerdictUpdate {
    probability = probability == null ? OptionalDouble.empty() : probability;
    contributingVariables =
        contributingVariables == null ? List.of() : List.copyOf(contributingVariables);
    reasons = reasons == null ? List.of() : List.copyOf(reasons);
  }
}
