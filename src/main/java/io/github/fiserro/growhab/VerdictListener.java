package io.github.fiserro.growhab;

/**
 * Receives verdicts produced by the engine. Called on the growspace's serial lane, so
 * implementations must not block for long.
 */
public interface VerdictListener {

  void onVerdict(VerdictUpdate update);

  default void onLightSchedule(LightScheduleVerdict verdict) {}
}
