package io.github.fiserro.growhab.bayes;

import io.github.fiserro.growhab.Condition;
import java.util.List;

/** Evidence sources combined for one condition. */
public record ConditionModel(Condition condition, List<EvidenceSource> sources) {

  public ConditionModel {
    sources = List.copyOf(sources);
  }
}
