package io.github.fiserro.growhab.light;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.fiserro.growhab.GrowthStage;
import io.github.fiserro.growhab.LightScheduleStatus;
import io.github.fiserro.growhab.LightScheduleVerdict;
import io.github.fiserro.growhab.LightState;
import io.github.fiserro.growhab.config.LightScheduleSettings;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LightCycleVerifierTest {

  private static final Instant T0 = Instant.parse("2026-03-01T00:00:00Z");

  private static Instant at(long hours, long minutes) {
    return T0.plus(Duration.ofHours(hours).plusMinutes(minutes));
  }

  private static Instant at(long hours) {
    return at(hours, 0);
  }

  private final LightCycleVerifier verifier =
      new LightCycleVerifier(LightScheduleSettings.builder().zone(ZoneOffset.UTC).build());

  /** Lights on at 0h (first seen), off at 12h (window opens), on at 24h, off at 36h. */
  private LightCycleState twelveTwelve(GrowthStage stage) {
    LightCycleState state = verifier.initial(stage);
    state = verifier.record(state, LightState.ON, at(0));
    state = verifier.record(state, LightState.OFF, at(12));
    state = verifier.record(state, LightState.ON, at(24));
    return verifier.record(state, LightState.OFF, at(36));
  }

  @Nested
  @DisplayName("window verdicts")
  class Windows {

    @Test
    void exactTwelveHoursInFlowerIsCorrect() {
      LightCycleState state = twelveTwelve(GrowthStage.FLOWER);

      assertEquals(LightScheduleStatus.CORRECT, state.status());
      assertEquals(Duration.ofHours(12), state.lastObservedOn());
      assertEquals(at(36), state.lastWindowClosedAt());
    }

    @Test
    void elevenHoursFortyWithFifteenMinuteToleranceIsIncorrect() {
      LightCycleState state = verifier.initial(GrowthStage.FLOWER);
      state = verifier.record(state, LightState.ON, at(0));
      state = verifier.record(state, LightState.OFF, at(12));
      state = verifier.record(state, LightState.ON, at(24));
      state = verifier.record(state, LightState.OFF, at(35, 40));
      state = verifier.advance(state, at(36));

      assertEquals(LightScheduleStatus.INCORRECT, state.status());
      assertEquals(Duration.ofHours(11).plusMinutes(40), state.lastObservedOn());
    }

    @Test
    void twelveTwelveInVegIsIncorrect() {
      assertEquals(LightScheduleStatus.INCORRECT, twelveTwelve(GrowthStage.VEG).status());
    }

    @Test
    void darkPostHarvestStageIsCorrect() {
      LightCycleState state = verifier.initial(GrowthStage.DRY);
      state = verifier.record(state, LightState.ON, at(0));
      state = verifier.record(state, LightState.OFF, at(0, 5));
      state = verifier.advance(state, at(24, 5));

      assertEquals(LightScheduleStatus.CORRECT, state.status());
      assertEquals(Duration.ZERO, state.lastObservedOn());
    }

    @Test
    void fragmentedOnPhasesAreSummed() {
      LightCycleState state = verifier.initial(GrowthStage.FLOWER);
      state = verifier.record(state, LightState.OFF, at(0));
      state = verifier.record(state, LightState.ON, at(1));
      state = verifier.record(state, LightState.OFF, at(7));
      state = verifier.record(state, LightState.ON, at(8));
      state = verifier.record(state, LightState.OFF, at(14));
      state = verifier.advance(state, at(25));

      assertEquals(Duration.ofHours(12), state.lastObservedOn());
      assertEquals(LightScheduleStatus.CORRECT, state.status());
    }

    @Test
    void onPhaseSpanningClosureIsSplit() {
      LightCycleState state = verifier.initial(GrowthStage.FLOWER);
      state = verifier.record(state, LightState.OFF, at(0));
      state = verifier.record(state, LightState.ON, at(2));
      state = verifier.record(state, LightState.OFF, at(8));
      state = verifier.record(state, LightState.ON, at(20));
      state = verifier.advance(state, at(26));

      // 2h-8h and 20h-26h
      assertEquals(Duration.ofHours(12), state.lastObservedOn());

      state = verifier.record(state, LightState.OFF, at(32));
      state = verifier.advance(state, at(50));
      // 26h-32h only
      assertEquals(Duration.ofHours(6), state.lastObservedOn());
      assertEquals(LightScheduleStatus.INCORRECT, state.status());
    }

    @Test
    void quietDaysCloseEveryWindow() {
      LightCycleState state = verifier.initial(GrowthStage.FLOWER);
      state = verifier.record(state, LightState.ON, at(0));
      state = verifier.record(state, LightState.OFF, at(12));
      state = verifier.advance(state, at(12 + 72));

      assertEquals(LightScheduleStatus.INCORRECT, state.status());
      assertEquals(Duration.ZERO, state.lastObservedOn());
      assertEquals(at(12 + 72), state.windowStart());
    }
  }

  @Nested
  @DisplayName("unknown verdicts")
  class Unknown {

    @Test
    void unknownBeforeFirstFullWindow() {
      LightCycleState state = verifier.initial(GrowthStage.FLOWER);
      state = verifier.record(state, LightState.ON, at(0));
      state = verifier.record(state, LightState.OFF, at(12));
      state = verifier.advance(state, at(24, 10));

      assertEquals(LightScheduleStatus.UNKNOWN, state.status());
      assertEquals(at(12), state.windowStart());
    }

    @Test
    void steadyLightWithinScheduleStaysUnknown() {
      LightCycleState state = verifier.initial(GrowthStage.FLOWER);
      state = verifier.record(state, LightState.ON, at(0));
      state = verifier.record(state, LightState.ON, at(10));
      state = verifier.advance(state, at(12, 15));

      assertEquals(LightScheduleStatus.UNKNOWN, state.status());
      assertNull(state.windowStart());
    }

    @Test
    void unavailableLightClearsTheLog() {
      LightCycleState state = twelveTwelve(GrowthStage.FLOWER);

      state = verifier.record(state, LightState.UNAVAILABLE, at(40));

      assertEquals(LightScheduleStatus.UNKNOWN, state.status());
      assertEquals(LightState.UNAVAILABLE, state.phase());
      assertNull(state.windowStart());
    }
  }

  @Nested
  @DisplayName("light that never switches")
  class PhaseLength {

    @Test
    void lightStuckOnIsIncorrect() {
      LightCycleState state = verifier.initial(GrowthStage.FLOWER);
      state = verifier.record(state, LightState.ON, at(0));
      state = verifier.advance(state, at(12, 16));

      assertEquals(LightScheduleStatus.INCORRECT, state.status());
      assertNull(state.windowStart());
      assertNull(state.lastObservedOn());
    }

    @Test
    void lightStuckOffIsIncorrect() {
      LightCycleState state = verifier.initial(GrowthStage.VEG);
      state = verifier.record(state, LightState.OFF, at(0));
      state = verifier.advance(state, at(6, 15));
      assertEquals(LightScheduleStatus.UNKNOWN, state.status());

      state = verifier.advance(state, at(6, 16));
      assertEquals(LightScheduleStatus.INCORRECT, state.status());
    }

    @Test
    void stuckLightStaysIncorrectForDays() {
      LightCycleState state = verifier.initial(GrowthStage.FLOWER);
      state = verifier.record(state, LightState.ON, at(0));
      for (int hour = 1; hour <= 96; hour++) {
        state = verifier.advance(state, at(hour));
      }

      assertEquals(LightScheduleStatus.INCORRECT, state.status());
    }

    @Test
    void darkDryingRoomIsNeverFlagged() {
      LightCycleState state = verifier.initial(GrowthStage.DRY);
      state = verifier.record(state, LightState.OFF, at(0));
      state = verifier.advance(state, at(96));

      assertEquals(LightScheduleStatus.UNKNOWN, state.status());
    }

    @Test
    void lightsLeftOnWhileDryingAreFlagged() {
      LightCycleState state = verifier.initial(GrowthStage.DRY);
      state = verifier.record(state, LightState.ON, at(0));
      state = verifier.advance(state, at(0, 16));

      assertEquals(LightScheduleStatus.INCORRECT, state.status());
    }

    @Test
    void stageChangeRestartsThePhaseClock() {
      LightCycleState state = verifier.initial(GrowthStage.VEG);
      state = verifier.record(state, LightState.ON, at(0));
      state = verifier.advance(state, at(16));

      state = verifier.reset(state, GrowthStage.FLOWER, at(16));
      assertEquals(at(16), state.phaseStart());
      state = verifier.advance(state, at(28));
      assertEquals(LightScheduleStatus.UNKNOWN, state.status(), "12h since the stage change");

      state = verifier.advance(state, at(29));
      assertEquals(LightScheduleStatus.INCORRECT, state.status());
    }

    @Test
    void allowedPhaseLengthFollowsStageSchedule() {
      assertEquals(
          Duration.ofHours(12), verifier.allowedPhaseLength(LightState.ON, GrowthStage.FLOWER).get());
      assertEquals(
          Duration.ofHours(6), verifier.allowedPhaseLength(LightState.OFF, GrowthStage.VEG).get());
      assertEquals(Duration.ZERO, verifier.allowedPhaseLength(LightState.ON, GrowthStage.CURE).get());
      assertTrue(verifier.allowedPhaseLength(LightState.OFF, GrowthStage.CURE).isEmpty());
    }
  }

  @Nested
  @DisplayName("stickiness and stage changes")
  class Sticky {

    @Test
    void verdictHoldsUntilNextClosure() {
      LightCycleState state = twelveTwelve(GrowthStage.FLOWER);
      state = verifier.record(state, LightState.ON, at(48));
      state = verifier.record(state, LightState.OFF, at(58));
      state = verifier.advance(state, at(59));

      assertEquals(LightScheduleStatus.CORRECT, state.status());

      state = verifier.advance(state, at(60));
      assertEquals(LightScheduleStatus.INCORRECT, state.status());
      assertEquals(Duration.ofHours(10), state.lastObservedOn());
    }

    @Test
    void stageChangeResetsToUnknown() {
      LightCycleState state = twelveTwelve(GrowthStage.FLOWER);

      state = verifier.reset(state, GrowthStage.VEG, at(37));

      assertEquals(LightScheduleStatus.UNKNOWN, state.status());
      assertEquals(GrowthStage.VEG, state.stage());
      assertNull(state.windowStart());
      assertTrue(state.phases().isEmpty());
      assertEquals(LightState.OFF, state.phase());
      assertEquals(at(37), state.phaseStart());

      LightScheduleVerdict verdict = verifier.verdict("tent1", state);
      assertEquals(Duration.ofHours(18), verdict.expectedOnDuration());
      assertTrue(verdict.observedOnDuration().isEmpty());
    }

    @Test
    void newWindowAfterStageChangeStartsAtNextTransition() {
      LightCycleState state = verifier.reset(twelveTwelve(GrowthStage.FLOWER), GrowthStage.VEG, at(37));
      state = verifier.record(state, LightState.ON, at(42));
      state = verifier.record(state, LightState.OFF, at(60));
      state = verifier.advance(state, at(66));

      assertEquals(LightScheduleStatus.CORRECT, state.status());
      assertEquals(Duration.ofHours(18), state.lastObservedOn());
    }
  }

  @Nested
  @DisplayName("rollover time")
  class Rollover {

    private LightCycleVerifier rolloverVerifier;

    @BeforeEach
    void setUp() {
      rolloverVerifier =
          new LightCycleVerifier(
              LightScheduleSettings.builder()
                  .zone(ZoneOffset.UTC)
                  .rolloverTime(LocalTime.of(6, 0))
                  .build());
    }

    @Test
    void partialFirstWindowIsNotJudged() {
      LightCycleState state = rolloverVerifier.initial(GrowthStage.FLOWER);
      state = rolloverVerifier.record(state, LightState.ON, at(6));
      state = rolloverVerifier.record(state, LightState.OFF, at(18));
      state = rolloverVerifier.advance(state, at(30));

      assertEquals(LightScheduleStatus.UNKNOWN, state.status());
      assertEquals(at(30), state.windowStart());
      assertTrue(state.anchored());
    }

    @Test
    void windowsCloseAtRolloverTime() {
      LightCycleState state = rolloverVerifier.initial(GrowthStage.FLOWER);
      state = rolloverVerifier.record(state, LightState.ON, at(6));
      state = rolloverVerifier.record(state, LightState.OFF, at(18));
      state = rolloverVerifier.record(state, LightState.ON, at(30));
      state = rolloverVerifier.record(state, LightState.OFF, at(42));
      state = rolloverVerifier.advance(state, at(54));

      assertEquals(LightScheduleStatus.CORRECT, state.status());
      assertEquals(Duration.ofHours(12), state.lastObservedOn());
      assertEquals(at(54), state.lastWindowClosedAt());
    }
  }
}
