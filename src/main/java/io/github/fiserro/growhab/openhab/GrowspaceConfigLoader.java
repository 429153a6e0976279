package io.github.fiserro.growhab.openhab;

import io.github.fiserro.growhab.Condition;
import io.github.fiserro.growhab.config.ConditionSettings;
import io.github.fiserro.growhab.config.GrowspaceConfig;
import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openhab.core.automation.module.script.defaultscope.ScriptBusEvent;
import org.openhab.core.items.Item;
import org.openhab.core.items.ItemNotFoundException;
import org.openhab.core.items.ItemRegistry;
import org.openhab.core.types.State;
import org.openhab.core.types.UnDefType;

/**
 * Loads growspace tuning from openHAB items named {@code <growspace>Config<Property>} in camel
 * case, e.g. {@code tent1ConfigStressPrior} or {@code tent1ConfigMoldRiskMinimumDwellMinutes}.
 * Missing items keep the default; NULL/UNDEF items are initialized with it.
 */
@Slf4j
@RequiredArgsConstructor
public class GrowspaceConfigLoader {

  private static final String CONFIG_INFIX = "Config";

  private final ItemRegistry itemRegistry;
  private final ScriptBusEvent events;

  /**
   * @param base config providing the growspace id and the defaults
   * @return config with values from openHAB items; validated when the engine registers it
   */
  public GrowspaceConfig load(GrowspaceConfig base) {
    String prefix = base.growspaceId() + CONFIG_INFIX;
    GrowspaceConfig.GrowspaceConfigBuilder builder = base.toBuilder();

    for (Condition condition : Condition.values()) {
      ConditionSettings defaults = base.conditionSettings(condition);
      String conditionPrefix = prefix + camelCase(condition.key());
      double dwellMinutes =
          loadValue(
              conditionPrefix + "MinimumDwellMinutes", defaults.minimumDwell().toSeconds() / 60.0);
      builder.condition(
          condition,
          new ConditionSettings(
              loadValue(conditionPrefix + "Prior", defaults.prior()),
              loadValue(conditionPrefix + "TurnOnThreshold", defaults.turnOnThreshold()),
              loadValue(conditionPrefix + "TurnOffThreshold", defaults.turnOffThreshold()),
              Duration.ofSeconds(Math.round(dwellMinutes * 60))));
    }

    double toleranceMinutes =
        loadValue(
            prefix + "LightToleranceMinutes",
            base.lightSchedule().tolerance().toSeconds() / 60.0);
    builder.lightSchedule(
        base.lightSchedule().toBuilder()
            .tolerance(Duration.ofSeconds(Math.round(toleranceMinutes * 60)))
            .build());

    GrowspaceConfig config = builder.build();
    log.info("Loaded configuration of growspace '{}'", config.growspaceId());
    return config;
  }

  private double loadValue(String itemName, double defaultValue) {
    Item item;
    try {
      item = itemRegistry.getItem(itemName);
    } catch (ItemNotFoundException e) {
      log.debug("Config item '{}' not found, using default {}", itemName, defaultValue);
      return defaultValue;
    }
    State state = item.getState();
    if (state instanceof UnDefType) {
      log.info("Initializing config item '{}' with default value: {}", itemName, defaultValue);
      initializeItem(itemName, defaultValue);
      return defaultValue;
    }
    OptionalDouble value = ItemStateConverter.toNumber(state);
    if (value.isEmpty()) {
      log.warn("Config item '{}' has no numeric state ({}), using default", itemName, state);
      return defaultValue;
    }
    log.debug("Loaded config '{}' = {}", itemName, value.getAsDouble());
    return value.getAsDouble();
  }

  private void initializeItem(String itemName, double value) {
    try {
      events.postUpdate(itemName, String.valueOf(value));
    } catch (RuntimeException e) {
      log.warn("Failed to initialize item '{}' with value {}: {}", itemName, value, e.getMessage());
    }
  }

  /** {@code mold_risk -> MoldRisk}. */
  static String camelCase(String key) {
    return Arrays.stream(key.split("_"))
        .filter(part -> !part.isEmpty())
        .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1))
        .collect(Collectors.joining());
  }
}
