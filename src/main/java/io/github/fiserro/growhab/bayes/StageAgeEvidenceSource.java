package io.github.fiserro.growhab.bayes;

import io.github.fiserro.growhab.GrowthStage;
import java.util.Optional;

/** Raises a condition once a stage has lasted at least {@code minDays}, e.g. late flower. */
public record StageAgeEvidenceSource(GrowthStage stage, long minDays, double ratio)
    implements EvidenceSource {

  public static final String KEY = "stage_age";

  @Override
  public String key() {
    return KEY;
  }

  @Override
  public boolean contextual() {
    return true;
  }

  @Override
  public Optional<VariableEvidence> evaluate(EvidenceContext context) {
    if (context.stage() != stage || context.daysInStage().isEmpty()) {
      return Optional.empty();
    }
    long days = context.daysInStage().getAsLong();
    if (days < minDays) {
      return Optional.empty();
    }
    String reason = String.format("%s day %d (late %s)", stage.key(), days, stage.key());
    return Optional.of(new VariableEvidence(KEY, days, ratio, true, reason));
  }
}
