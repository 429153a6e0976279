package io.github.fiserro.growhab.light;

import io.github.fiserro.growhab.GrowthStage;
import io.github.fiserro.growhab.LightScheduleStatus;
import io.github.fiserro.growhab.LightState;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.With;

/**
 * Light cycle log of one growspace.
 *
 * @param stage stage whose schedule the log is verified against
 * @param phase current debounced light state, UNAVAILABLE while unknown
 * @param phaseStart when {@code phase} began, or the last stage change if later; null while
 *     unknown
 * @param windowStart start of the open observation window, null until the first transition
 * @param anchored whether the open window is a full 24 hour window; a window cut short by a
 *     rollover time is not judged
 * @param phases phases closed inside the open window
 * @param status verdict of the last closed window, sticky until the next closure; INCORRECT
 *     also when the running phase outlasts the schedule
 * @param lastObservedOn lights-on time of the last judged window
 * @param lastWindowClosedAt end of the last judged window
 */
public record LightCycleState(
    GrowthStage stage,
    @With LightState phase,
    @With Instant phaseStart,
    @With Instant windowStart,
    @With boolean anchored,
    @With List<PhaseRecord> phases,
    @With LightScheduleStatus status,
    Duration lastObservedOn,
    Instant lastWindowClosedAt) {

  public LightCycleState {
    phases = List.copyOf(phases);
  }

  public static LightCycleState initial(GrowthStage stage) {
    return new LightCycleState(
        stage, LightState.UNAVAILABLE, null, null, false, List.of(),
        LightScheduleStatus.UNKNOWN, null, null);
  }

  /** Same light state, log cleared for a new stage. */
  public LightCycleState restart(GrowthStage newStage) {
    return new LightCycleState(
        newStage, phase, phaseStart, null, false, List.of(),
        LightScheduleStatus.UNKNOWN, null, null);
  }

  LightCycleState judged(LightScheduleStatus verdict, Duration observedOn, Instant closedAt) {
    return new LightCycleState(
        stage, phase, phaseStart, closedAt, true, List.of(), verdict, observedOn, closedAt);
  }
}
