package io.github.fiserro.growhab.openhab;

import io.github.fiserro.growhab.GrowthStage;
import io.github.fiserro.growhab.LightChange;
import io.github.fiserro.growhab.SensorUpdate;
import io.github.fiserro.growhab.StageChange;
import io.github.fiserro.growhab.config.GrowspaceConfig;
import io.github.fiserro.growhab.engine.InferenceEngine;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.openhab.core.automation.module.script.defaultscope.ScriptBusEvent;
import org.openhab.core.items.ItemRegistry;
import org.openhab.core.types.State;

/**
 * openHAB rule wiring growspace items to the inference engine. Item state changes become sensor
 * and light events; a cron trigger calls {@link #tick()}.
 */
@Slf4j
public class GrowspaceRule {

  private final InferenceEngine engine;
  private final GrowspaceItemBindings bindings;
  private final GrowspaceConfigLoader configLoader;
  private final Clock clock;

  @Builder(builderClassName = "GrowspaceRuleBuilder")
  public GrowspaceRule(
      InferenceEngine engine,
      GrowspaceItemBindings bindings,
      GrowspaceConfigLoader configLoader,
      Clock clock) {
    this.engine = engine;
    this.bindings = bindings;
    this.configLoader = configLoader;
    this.clock = clock != null ? clock : Clock.systemUTC();
  }

  /** Engine publishing to openHAB items with config read from openHAB items. */
  public static GrowspaceRule create(
      ItemRegistry itemRegistry, ScriptBusEvent events, GrowspaceItemBindings bindings) {
    return builder()
        .engine(InferenceEngine.withDefaults(new ItemVerdictPublisher(events)))
        .bindings(bindings)
        .configLoader(new GrowspaceConfigLoader(itemRegistry, events))
        .build();
  }

  /**
   * Registers a growspace with its bound sensors taken from the item bindings and its tuning from
   * the config items.
   */
  public void addGrowspace(GrowspaceConfig base) {
    GrowspaceConfig config = bindings.applyTo(base);
    if (configLoader != null) {
      config = configLoader.load(config);
    }
    engine.register(config);
  }

  /** Called when any bound item changes. */
  public void onItemStateChanged(String itemName, State state) {
    if (!bindings.isBound(itemName)) {
      log.debug("Item {} is not bound to any growspace", itemName);
      return;
    }
    Instant now = clock.instant();
    bindings
        .sensorBindings(itemName)
        .forEach(
            binding ->
                engine.submit(
                    new SensorUpdate(
                        binding.growspaceId(),
                        ItemStateConverter.toReading(binding.variable(), state, now))));
    bindings
        .lightBindings(itemName)
        .forEach(
            growspaceId ->
                engine.submit(
                    new LightChange(growspaceId, ItemStateConverter.toLightState(state), now)));
  }

  /**
   * Called when the plant records change a growspace's stage.
   *
   * @param stageStart ISO date the stage began, or null
   */
  public void onStageChanged(String growspaceId, String stageKey, String stageStart) {
    GrowthStage stage;
    try {
      stage = GrowthStage.fromKey(stageKey);
    } catch (IllegalArgumentException e) {
      log.warn("Ignoring stage change of '{}': {}", growspaceId, e.getMessage());
      return;
    }
    LocalDate start = null;
    if (stageStart != null && !stageStart.isBlank()) {
      try {
        start = LocalDate.parse(stageStart.trim());
      } catch (DateTimeParseException e) {
        log.warn("Invalid stage start '{}' for '{}', stage age unknown", stageStart, growspaceId);
      }
    }
    engine.submit(new StageChange(growspaceId, stage, start, clock.instant()));
  }

  /** Periodic trigger; lets dwell timers and light windows progress. */
  public void tick() {
    engine.tick();
  }

  public void shutdown() {
    engine.shutdown();
  }
}
