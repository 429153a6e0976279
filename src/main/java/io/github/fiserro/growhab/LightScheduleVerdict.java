package io.github.fiserro.growhab;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Published light schedule verification.
 *
 * @param observedOnDuration lights-on time of the last closed window, empty before one closed
 * @param windowClosedAt end of the last closed window, null before one closed
 */
public record LightScheduleVerdict(
    String growspaceId,
    LightScheduleStatus status,
    Optional<Duration> observedOnDuration,
    Duration expectedOnDuration,
    Instant windowClosedAt) {

  public static LightScheduleVerdict unknown(String growspaceId, Duration expectedOnDuration) {
    return new LightScheduleVerdict(
        growspaceId, LightScheduleStatus.UNKNOWN, Optional.empty(), expectedOnDuration, null);
  }
}
