package io.github.fiserro.growhab.bayes;

import java.util.Optional;

/** Produces one likelihood ratio for a condition from the current context. */
public interface EvidenceSource {

  String key();

  /**
   * Contextual sources (stage age) only refine an estimate; on their own they never make the
   * evidence sufficient.
   */
  default boolean contextual() {
    return false;
  }

  /** Empty when the reading is unavailable or the profile has no range for the variable. */
  Optional<VariableEvidence> evaluate(EvidenceContext context);
}
