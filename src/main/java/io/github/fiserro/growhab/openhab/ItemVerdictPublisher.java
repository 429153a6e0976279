package io.github.fiserro.growhab.openhab;

import io.github.fiserro.growhab.Condition;
import io.github.fiserro.growhab.LightScheduleVerdict;
import io.github.fiserro.growhab.VerdictListener;
import io.github.fiserro.growhab.VerdictUpdate;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openhab.core.automation.module.script.defaultscope.ScriptBusEvent;

/**
 * Writes verdicts to openHAB items:
 *
 * <ul>
 *   <li>{@code <growspace>_<condition>}: ON, OFF or UNDEF
 *   <li>{@code <growspace>_<condition>_probability}: posterior or UNDEF
 *   <li>{@code <growspace>_light_schedule}: ON when correct, OFF when incorrect, UNDEF when unknown
 *   <li>{@code <growspace>_light_on_hours}: lights-on hours of the last judged window
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class ItemVerdictPublisher implements VerdictListener {

  static final String UNDEF = "UNDEF";

  private final ScriptBusEvent events;

  public static String verdictItem(String growspaceId, Condition condition) {
    return growspaceId + "_" + condition.key();
  }

  public static String probabilityItem(String growspaceId, Condition condition) {
    return verdictItem(growspaceId, condition) + "_probability";
  }

  public static String lightScheduleItem(String growspaceId) {
    return growspaceId + "_light_schedule";
  }

  public static String lightOnHoursItem(String growspaceId) {
    return growspaceId + "_light_on_hours";
  }

  @Override
  public void onVerdict(VerdictUpdate update) {
    String verdict =
        switch (update.value()) {
          case ON -> "ON";
          case OFF -> "OFF";
          case UNKNOWN -> UNDEF;
        };
    String probability =
        update.probability().isPresent()
            ? String.format(Locale.ROOT, "%.3f", update.probability().getAsDouble())
            : UNDEF;

    if (update.changed()) {
      log.info(
          "{} -> {} ({})",
          verdictItem(update.growspaceId(), update.condition()),
          verdict,
          String.join("; ", update.reasons()));
    }
    events.postUpdate(verdictItem(update.growspaceId(), update.condition()), verdict);
    events.postUpdate(probabilityItem(update.growspaceId(), update.condition()), probability);
  }

  @Override
  public void onLightSchedule(LightScheduleVerdict verdict) {
    String status =
        switch (verdict.status()) {
          case CORRECT -> "ON";
          case INCORRECT -> "OFF";
          case UNKNOWN -> UNDEF;
        };
    String hours =
        verdict
            .observedOnDuration()
            .map(d -> String.format(Locale.ROOT, "%.2f", d.toMinutes() / 60.0))
            .orElse(UNDEF);
    log.debug("{} -> {} ({}h on)", lightScheduleItem(verdict.growspaceId()), status, hours);
    events.postUpdate(lightScheduleItem(verdict.growspaceId()), status);
    events.postUpdate(lightOnHoursItem(verdict.growspaceId()), hours);
  }
}
