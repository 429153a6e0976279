package io.github.fiserro.growhab.light;

import io.github.fiserro.growhab.GrowthStage;
import io.github.fiserro.growhab.LightScheduleStatus;
import io.github.fiserro.growhab.LightScheduleVerdict;
import io.github.fiserro.growhab.LightState;
import io.github.fiserro.growhab.config.LightScheduleSettings;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies that lights stay on for the stage's expected time in every 24 hour window.
 *
 * <p>The first window opens at the first observed transition, since the length of the phase seen
 * before it is unknown. A window closes 24 hours later, or at the configured rollover time. Its
 * lights-on total is compared with the expected duration; the result holds until the next window
 * closes. A stage change clears the log and restarts verification.
 *
 * <p>A light that never switches opens no window. It is judged INCORRECT as soon as the current
 * phase outlasts the schedule by more than the tolerance: an ON phase longer than the expected on
 * time, or an OFF phase longer than the rest of the day. The phase is counted from the later of
 * its start and the last stage change.
 *
 * <p>Works on explicit {@link LightCycleState} values and keeps no state itself.
 */
@Slf4j
@RequiredArgsConstructor
public class LightCycleVerifier {

  private static final Duration FULL_WINDOW = Duration.ofHours(24);

  private final LightScheduleSettings settings;

  public LightCycleState initial(GrowthStage stage) {
    return LightCycleState.initial(stage);
  }

  /** Records a debounced light state observed at {@code at}. */
  public LightCycleState record(LightCycleState state, LightState light, Instant at) {
    if (!light.isKnown()) {
      if (state.phase().isKnown()) {
        log.info("Light sensor unavailable, light cycle log cleared");
      }
      return LightCycleState.initial(state.stage());
    }

    LightCycleState current = advance(state, at);
    if (current.phase() == light) {
      return current;
    }
    if (!current.phase().isKnown()) {
      log.debug("Light state known: {}", light);
      return current.withPhase(light).withPhaseStart(at);
    }

    Instant transition = latest(at, current.phaseStart(), current.windowStart());
    if (current.windowStart() == null) {
      log.debug("Light cycle window opened at {}", transition);
      return current
          .withWindowStart(transition)
          .withAnchored(settings.rolloverTime() == null)
          .withPhase(light)
          .withPhaseStart(transition);
    }

    List<PhaseRecord> phases = new ArrayList<>(current.phases());
    phases.add(
        new PhaseRecord(
            current.phase(), latest(current.phaseStart(), current.windowStart()), transition));
    return current.withPhases(phases).withPhase(light).withPhaseStart(transition);
  }

  /** Closes every window that ended at or before {@code now}. */
  public LightCycleState advance(LightCycleState state, Instant now) {
    LightCycleState current = state;
    while (current.windowStart() != null) {
      Instant end = windowEnd(current.windowStart());
      if (now.isBefore(end)) {
        break;
      }
      current = close(current, end);
    }
    return checkPhaseLength(current, now);
  }

  /** Clears the log for {@code stage}; a running phase is counted again from {@code at}. */
  public LightCycleState reset(LightCycleState state, GrowthStage stage, Instant at) {
    log.info(
        "Light cycle verification restarted for stage {} (expected {}h on)",
        stage.key(),
        settings.expectedOn(stage).toMinutes() / 60.0);
    LightCycleState restarted = state.restart(stage);
    return restarted.phase().isKnown()
        ? restarted.withPhaseStart(latest(state.phaseStart(), at))
        : restarted;
  }

  /**
   * Longest a phase may last in the stage's schedule, empty when the phase may last all day (lights
   * off while drying, or always on).
   */
  Optional<Duration> allowedPhaseLength(LightState phase, GrowthStage stage) {
    Duration on = settings.expectedOn(stage);
    Duration allowed = phase == LightState.ON ? on : FULL_WINDOW.minus(on);
    return allowed.compareTo(FULL_WINDOW) >= 0 ? Optional.empty() : Optional.of(allowed);
  }

  public LightScheduleVerdict verdict(String growspaceId, LightCycleState state) {
    return new LightScheduleVerdict(
        growspaceId,
        state.status(),
        Optional.ofNullable(state.lastObservedOn()),
        settings.expectedOn(state.stage()),
        state.lastWindowClosedAt());
  }

  Instant windowEnd(Instant windowStart) {
    if (settings.rolloverTime() == null) {
      return windowStart.plus(FULL_WINDOW);
    }
    ZonedDateTime start = windowStart.atZone(settings.zone());
    ZonedDateTime rollover =
        start.toLocalDate().atTime(settings.rolloverTime()).atZone(settings.zone());
    if (!rollover.toInstant().isAfter(windowStart)) {
      rollover = rollover.plusDays(1);
    }
    return rollover.toInstant();
  }

  private LightCycleState checkPhaseLength(LightCycleState state, Instant now) {
    if (!state.phase().isKnown()
        || state.phaseStart() == null
        || state.status() == LightScheduleStatus.INCORRECT) {
      return state;
    }
    Optional<Duration> allowed = allowedPhaseLength(state.phase(), state.stage());
    if (allowed.isEmpty()) {
      return state;
    }
    Duration running = Duration.between(state.phaseStart(), now);
    if (running.compareTo(allowed.get().plus(settings.tolerance())) <= 0) {
      return state;
    }
    log.info(
        "Light schedule INCORRECT: light {} for {}, expected at most {}",
        state.phase(),
        running,
        allowed.get());
    return state.withStatus(LightScheduleStatus.INCORRECT);
  }

  private LightCycleState close(LightCycleState state, Instant end) {
    Duration onTime = Duration.ZERO;
    for (PhaseRecord phase : state.phases()) {
      if (phase.phase() == LightState.ON) {
        onTime = onTime.plus(phase.duration());
      }
    }
    if (state.phase() == LightState.ON) {
      Instant from = latest(state.phaseStart(), state.windowStart());
      if (from.isBefore(end)) {
        onTime = onTime.plus(Duration.between(from, end));
      }
    }

    if (!state.anchored()) {
      log.debug("Partial light window closed at {} with {} on, not judged", end, onTime);
      return state.withWindowStart(end).withAnchored(true).withPhases(List.of());
    }

    Duration expected = settings.expectedOn(state.stage());
    boolean correct = onTime.minus(expected).abs().compareTo(settings.tolerance()) <= 0;
    LightScheduleStatus status =
        correct ? LightScheduleStatus.CORRECT : LightScheduleStatus.INCORRECT;
    if (status != state.status()) {
      log.info("Light schedule {}: observed {} on, expected {}", status, onTime, expected);
    } else {
      log.debug("Light schedule {}: observed {} on, expected {}", status, onTime, expected);
    }
    return state.judged(status, onTime, end);
  }

  private static Instant latest(Instant... instants) {
    Instant latest = null;
    for (Instant instant : instants) {
      if (instant != null && (latest == null || instant.isAfter(latest))) {
        latest = instant;
      }
    }
    return latest;
  }
}
