package io.github.fiserro.growhab;

import java.time.Instant;

/**
 * Input delivered to the engine for one growspace. Events for a growspace are applied strictly in
 * submission order.
 */
public sealed interface GrowspaceEvent
    permits SensorUpdate, StageChange, LightChange, ClockTick {

  String growspaceId();

  Instant timestamp();
}
