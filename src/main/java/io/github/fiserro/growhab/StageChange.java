package io.github.fiserro.growhab;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Stage metadata pushed by the plant records. {@code stageStart} may be null when the records do
 * not track when the stage began; stage-age evidence is then skipped.
 */
public record StageChange(
    String growspaceId, GrowthStage stage, LocalDate stageStart, Instant timestamp)
    implements GrowspaceEvent {

  public StageChange {
    Objects.requireNonNull(growspaceId, "growspaceId");
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
