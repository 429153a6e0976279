package io.github.fiserro.growhab.engine;

import io.github.fiserro.growhab.ClockTick;
import io.github.fiserro.growhab.Condition;
import io.github.fiserro.growhab.DayNightPhase;
import io.github.fiserro.growhab.GrowspaceEvent;
import io.github.fiserro.growhab.GrowthStage;
import io.github.fiserro.growhab.LightChange;
import io.github.fiserro.growhab.LightScheduleVerdict;
import io.github.fiserro.growhab.LightState;
import io.github.fiserro.growhab.SensorReading;
import io.github.fiserro.growhab.SensorUpdate;
import io.github.fiserro.growhab.SensorVariable;
import io.github.fiserro.growhab.StageChange;
import io.github.fiserro.growhab.VerdictListener;
import io.github.fiserro.growhab.VerdictUpdate;
import io.github.fiserro.growhab.VerdictValue;
import io.github.fiserro.growhab.bayes.BayesianEstimator;
import io.github.fiserro.growhab.bayes.ConditionModel;
import io.github.fiserro.growhab.bayes.EvidenceContext;
import io.github.fiserro.growhab.bayes.PosteriorEstimate;
import io.github.fiserro.growhab.bayes.VpdCalculator;
import io.github.fiserro.growhab.config.GrowspaceConfig;
import io.github.fiserro.growhab.gate.Classification;
import io.github.fiserro.growhab.gate.GateResult;
import io.github.fiserro.growhab.gate.GateState;
import io.github.fiserro.growhab.gate.HysteresisGate;
import io.github.fiserro.growhab.light.LightCycleState;
import io.github.fiserro.growhab.light.LightCycleVerifier;
import io.github.fiserro.growhab.light.LightDebouncer;
import io.github.fiserro.growhab.profile.ThresholdProfile;
import io.github.fiserro.growhab.profile.ThresholdProfileResolver;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns the state of one growspace: latest readings, stage, light log and gate states. Applies
 * events one at a time; every applied event that affects inference re-evaluates all enabled
 * conditions and publishes the verdicts.
 */
@Slf4j
public class GrowspaceOrchestrator {

  @Getter private final GrowspaceConfig config;
  private final ThresholdProfileResolver resolver;
  private final BayesianEstimator estimator;
  private final Map<Condition, ConditionModel> models;
  private final Map<Condition, HysteresisGate> gates = new EnumMap<>(Condition.class);
  private final VerdictListener listener;
  private final LightCycleVerifier verifier;
  private final LightDebouncer debouncer;

  private final Map<SensorVariable, SensorReading> readings = new EnumMap<>(SensorVariable.class);
  private final Map<Condition, GateState> gateStates = new EnumMap<>(Condition.class);
  private final Map<Condition, VerdictValue> published = new EnumMap<>(Condition.class);
  private GrowthStage stage;
  private LocalDate stageStart;
  private LightState light = LightState.UNAVAILABLE;
  private LightDebouncer.State debounceState = LightDebouncer.State.initial();
  private LightCycleState lightCycle;
  private LightScheduleVerdict lightVerdict;

  public GrowspaceOrchestrator(
      GrowspaceConfig config,
      ThresholdProfileResolver resolver,
      BayesianEstimator estimator,
      Map<Condition, ConditionModel> models,
      VerdictListener listener) {
    this.config = config.validate();
    this.resolver = resolver;
    this.estimator = estimator;
    this.models = models;
    this.listener = listener;
    this.verifier = new LightCycleVerifier(config.lightSchedule());
    this.debouncer = new LightDebouncer(config.lightSchedule().debounce());

    for (Condition condition : config.enabledConditions()) {
      gates.put(condition, HysteresisGate.of(config.conditionSettings(condition)));
      gateStates.put(condition, GateState.initial());
      published.put(condition, VerdictValue.UNKNOWN);
    }
    this.stage = config.initialStage();
    this.lightCycle = verifier.initial(stage);
    this.lightVerdict = verifier.verdict(config.growspaceId(), lightCycle);
  }

  public String growspaceId() {
    return config.growspaceId();
  }

  /** Publishes the initial UNKNOWN verdicts so consumers see every output before any data. */
  public synchronized void publishInitial(Instant now) {
    for (Condition condition : enabledConditions()) {
      GateState state = gateStates.get(condition);
      publish(
          VerdictUpdate.builder()
              .growspaceId(growspaceId())
              .condition(condition)
              .value(state.value())
              .stale(true)
              .reasons(List.of(PosteriorEstimate.INSUFFICIENT_DATA))
              .evaluatedAt(now)
              .build());
    }
    publishLight(lightVerdict);
  }

  public synchronized void apply(GrowspaceEvent event) {
    if (!growspaceId().equals(event.growspaceId())) {
      log.warn("[{}] Dropped event for growspace '{}'", growspaceId(), event.growspaceId());
      return;
    }
    if (event instanceof SensorUpdate update) {
      onSensorUpdate(update);
    } else if (event instanceof StageChange change) {
      onStageChange(change);
    } else if (event instanceof LightChange change) {
      onLightChange(change);
    } else if (event instanceof ClockTick tick) {
      onClockTick(tick);
    }
  }

  private void onSensorUpdate(SensorUpdate update) {
    if (!config.isBound(update.variable())) {
      log.warn(
          "[{}] Dropped reading of unbound sensor {}", growspaceId(), update.variable().key());
      return;
    }
    SensorReading current = readings.get(update.variable());
    if (current != null && update.timestamp().isBefore(current.timestamp())) {
      log.warn(
          "[{}] Dropped out-of-order {} reading from {}, latest is from {}",
          growspaceId(),
          update.variable().key(),
          update.timestamp(),
          current.timestamp());
      return;
    }
    SensorReading previous = readings.put(update.variable(), update.reading());
    if (previous != null && previous.isAvailable() && !update.reading().isAvailable()) {
      log.info("[{}] Sensor {} became unavailable", growspaceId(), update.variable().key());
    }
    evaluate(update.timestamp());
  }

  private void onStageChange(StageChange change) {
    if (change.stage() == stage && Objects.equals(change.stageStart(), stageStart)) {
      log.debug("[{}] Stage {} unchanged", growspaceId(), stage.key());
      return;
    }
    log.info(
        "[{}] Stage {} -> {} (started {})",
        growspaceId(),
        stage.key(),
        change.stage().key(),
        change.stageStart());
    stage = change.stage();
    stageStart = change.stageStart();
    lightCycle = verifier.reset(lightCycle, stage, change.timestamp());
    publishLightIfChanged();
    evaluate(change.timestamp());
  }

  private void onLightChange(LightChange change) {
    if (!config.lightSensorBound()) {
      log.warn("[{}] Dropped light state, no light sensor bound", growspaceId());
      return;
    }
    Instant at = change.timestamp();
    applyLight(debouncer.offer(debounceState, change.state(), at), at);
    evaluate(at);
  }

  private void onClockTick(ClockTick tick) {
    if (config.lightSensorBound()) {
      applyLight(debouncer.poll(debounceState, tick.timestamp()), tick.timestamp());
    }
    evaluate(tick.timestamp());
  }

  private void applyLight(LightDebouncer.Result result, Instant now) {
    debounceState = result.state();
    result
        .transition()
        .ifPresent(
            transition -> {
              if (transition.light() != light) {
                log.debug("[{}] Light {} -> {}", growspaceId(), light, transition.light());
              }
              light = transition.light();
              lightCycle = verifier.record(lightCycle, transition.light(), transition.at());
            });
    lightCycle = verifier.advance(lightCycle, now);
    publishLightIfChanged();
  }

  private void evaluate(Instant now) {
    DayNightPhase phase = DayNightPhase.of(light);
    ThresholdProfile profile = resolver.resolve(stage, phase);
    EvidenceContext context =
        EvidenceContext.builder()
            .stage(stage)
            .phase(phase)
            .profile(profile)
            .readings(effectiveReadings())
            .daysInStage(daysInStage(now))
            .likelihood(config.likelihood())
            .build();

    for (Condition condition : enabledConditions()) {
      if (!condition.appliesTo(stage)) {
        publishNotApplicable(condition, now);
        continue;
      }
      PosteriorEstimate estimate =
          estimator.estimate(
              models.get(condition), config.conditionSettings(condition).prior(), context);
      GateState previous = gateStates.get(condition);
      GateResult result = gates.get(condition).update(previous, estimate.probability(), now);
      gateStates.put(condition, result.state());
      published.put(condition, result.value());

      if (result.changed()) {
        log.info(
            "[{}] {} {} -> {} (p={}, {})",
            growspaceId(),
            condition.key(),
            previous.value(),
            result.value(),
            estimate.probability().isPresent()
                ? String.format("%.3f", estimate.probability().getAsDouble())
                : "n/a",
            String.join("; ", estimate.reasons()));
      }
      publish(
          VerdictUpdate.builder()
              .growspaceId(growspaceId())
              .condition(condition)
              .value(result.value())
              .stale(result.state().stale())
              .probability(estimate.probability())
              .contributingVariables(estimate.contributingVariables())
              .reasons(estimate.reasons())
              .lowConfidence(estimate.isLowConfidence())
              .changed(result.changed())
              .changedAt(result.state().changedAt())
              .evaluatedAt(now)
              .build());
    }
  }

  private void publishNotApplicable(Condition condition, Instant now) {
    VerdictValue previous = published.put(condition, VerdictValue.UNKNOWN);
    boolean changed = previous != VerdictValue.UNKNOWN;
    Instant changedAt = changed ? now : gateStates.get(condition).changedAt();
    gateStates.put(
        condition, new GateState(false, true, false, changedAt, Classification.NONE, null));
    publish(
        VerdictUpdate.builder()
            .growspaceId(growspaceId())
            .condition(condition)
            .value(VerdictValue.UNKNOWN)
            .stale(true)
            .probability(OptionalDouble.empty())
            .reasons(List.of("not applicable to " + stage.key() + " stage"))
            .changed(changed)
            .changedAt(changedAt)
            .evaluatedAt(now)
            .build());
  }

  /** Readings with VPD derived from temperature and humidity when no VPD sensor is bound. */
  Map<SensorVariable, SensorReading> effectiveReadings() {
    Map<SensorVariable, SensorReading> effective = new EnumMap<>(SensorVariable.class);
    effective.putAll(readings);
    if (!config.isBound(SensorVariable.VPD)) {
      SensorReading temperature = readings.get(SensorVariable.TEMPERATURE);
      SensorReading humidity = readings.get(SensorVariable.HUMIDITY);
      if (temperature != null
          && humidity != null
          && temperature.isAvailable()
          && humidity.isAvailable()) {
        double vpd =
            VpdCalculator.vpd(
                temperature.value().getAsDouble(),
                humidity.value().getAsDouble(),
                config.leafTemperatureOffset());
        Instant at =
            temperature.timestamp().isAfter(humidity.timestamp())
                ? temperature.timestamp()
                : humidity.timestamp();
        effective.put(SensorVariable.VPD, SensorReading.of(SensorVariable.VPD, vpd, at));
      }
    }
    return effective;
  }

  OptionalLong daysInStage(Instant now) {
    if (stageStart == null) {
      return OptionalLong.empty();
    }
    LocalDate today = now.atZone(config.lightSchedule().zone()).toLocalDate();
    return OptionalLong.of(Math.max(0, ChronoUnit.DAYS.between(stageStart, today)));
  }

  private List<Condition> enabledConditions() {
    return List.copyOf(gates.keySet());
  }

  private void publishLightIfChanged() {
    LightScheduleVerdict verdict = verifier.verdict(growspaceId(), lightCycle);
    if (!verdict.equals(lightVerdict)) {
      if (verdict.status() != lightVerdict.status()) {
        log.info("[{}] Light schedule {}", growspaceId(), verdict.status());
      }
      lightVerdict = verdict;
      publishLight(verdict);
    }
  }

  private void publish(VerdictUpdate update) {
    try {
      listener.onVerdict(update);
    } catch (RuntimeException e) {
      log.error(
          "[{}] Verdict listener failed for {}", growspaceId(), update.condition().key(), e);
    }
  }

  private void publishLight(LightScheduleVerdict verdict) {
    try {
      listener.onLightSchedule(verdict);
    } catch (RuntimeException e) {
      log.error("[{}] Light schedule listener failed", growspaceId(), e);
    }
  }

  public synchronized GateState gateState(Condition condition) {
    return gateStates.get(condition);
  }

  public synchronized LightCycleState lightCycleState() {
    return lightCycle;
  }

  public synchronized LightScheduleVerdict lightScheduleVerdict() {
    return lightVerdict;
  }

  public synchronized GrowthStage stage() {
    return stage;
  }

  public synchronized LightState light() {
    return light;
  }

  public synchronized Map<SensorVariable, SensorReading> readings() {
    return Collections.unmodifiableMap(new EnumMap<>(readings));
  }
}
