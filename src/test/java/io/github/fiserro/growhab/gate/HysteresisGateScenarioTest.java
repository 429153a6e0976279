package io.github.fiserro.growhab.gate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalDouble;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvFileSource;

/**
 * Single-step scenarios of {@link HysteresisGate} with turn-on 0.70, turn-off 0.55 and no dwell.
 */
class HysteresisGateScenarioTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final HysteresisGate gate = new HysteresisGate(0.70, 0.55, Duration.ZERO);

  @ParameterizedTest(name = "{0}")
  @CsvFileSource(resources = "/hysteresis-gate-scenarios.csv", numLinesToSkip = 1, delimiter = ';')
  @DisplayName("HysteresisGate scenario")
  void testScenario(
      String scenario,
      boolean previousVerdict,
      boolean seeded,
      double posterior,
      boolean expectedVerdict,
      boolean expectedChanged) {

    GateState previous =
        new GateState(previousVerdict, !seeded, seeded, null, Classification.NONE, null);

    GateResult result = gate.update(previous, OptionalDouble.of(posterior), NOW);

    assertEquals(expectedVerdict, result.verdict(), "verdict mismatch for scenario: " + scenario);
    assertEquals(expectedChanged, result.changed(), "changed mismatch for scenario: " + scenario);
    assertFalse(result.state().stale(), "fresh evidence must clear staleness: " + scenario);
  }
}
