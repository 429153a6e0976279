package io.github.fiserro.growhab.openhab;

import io.github.fiserro.growhab.LightState;
import io.github.fiserro.growhab.SensorReading;
import io.github.fiserro.growhab.SensorVariable;
import java.time.Instant;
import java.util.OptionalDouble;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.openhab.core.library.types.OnOffType;
import org.openhab.core.types.State;
import org.openhab.core.types.UnDefType;

/**
 * Converts openHAB item states to engine values. NULL and UNDEF become unavailable readings, never
 * zero.
 */
@Slf4j
@UtilityClass
public class ItemStateConverter {

  /** Numeric value of a state: numbers and quantities as is, ON/OFF as 1/0. */
  public OptionalDouble toNumber(State state) {
    if (state == null || state instanceof UnDefType) {
      return OptionalDouble.empty();
    }
    if (state instanceof OnOffType onOff) {
      return OptionalDouble.of(onOff == OnOffType.ON ? 1 : 0);
    }
    if (state instanceof Number number) {
      return finite(number.doubleValue());
    }
    String text = state.toString().trim();
    if ("ON".equalsIgnoreCase(text) || "OFF".equalsIgnoreCase(text)) {
      return OptionalDouble.of("ON".equalsIgnoreCase(text) ? 1 : 0);
    }
    try {
      return finite(Double.parseDouble(text));
    } catch (NumberFormatException e) {
      log.warn(
          "Cannot convert state '{}' ({}) to a number", text, state.getClass().getSimpleName());
      return OptionalDouble.empty();
    }
  }

  public SensorReading toReading(SensorVariable variable, State state, Instant timestamp) {
    return new SensorReading(variable, toNumber(state), timestamp);
  }

  /** Light from a switch (ON/OFF) or a numeric light level, where any level above zero is on. */
  public LightState toLightState(State state) {
    OptionalDouble value = toNumber(state);
    if (value.isEmpty()) {
      return LightState.UNAVAILABLE;
    }
    return LightState.of(value.getAsDouble() > 0);
  }

  private OptionalDouble finite(double value) {
    return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
  }
}
