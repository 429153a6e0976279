package io.github.fiserro.growhab.engine;

import io.github.fiserro.growhab.ClockTick;
import io.github.fiserro.growhab.Condition;
import io.github.fiserro.growhab.ConfigurationException;
import io.github.fiserro.growhab.GrowspaceEvent;
import io.github.fiserro.growhab.VerdictListener;
import io.github.fiserro.growhab.bayes.BayesianEstimator;
import io.github.fiserro.growhab.bayes.ConditionModel;
import io.github.fiserro.growhab.bayes.ConditionModels;
import io.github.fiserro.growhab.config.GrowspaceConfig;
import io.github.fiserro.growhab.profile.ThresholdProfileResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the inference engine. Keeps one {@link GrowspaceOrchestrator} per registered
 * growspace and routes events to it through a {@link SerialEventLane}, so each growspace sees its
 * events in order while growspaces are processed in parallel on a shared executor.
 */
@Slf4j
public class InferenceEngine implements AutoCloseable {

  private final ThresholdProfileResolver resolver;
  private final BayesianEstimator estimator = new BayesianEstimator();
  private final Map<Condition, ConditionModel> models;
  private final VerdictListener listener;
  private final ExecutorService executorService;
  private final Clock clock;
  private final Map<String, Registration> growspaces = new ConcurrentHashMap<>();

  private record Registration(GrowspaceOrchestrator orchestrator, SerialEventLane lane) {}

  public InferenceEngine(
      ThresholdProfileResolver resolver,
      VerdictListener listener,
      ExecutorService executorService,
      Clock clock) {
    this.resolver = resolver;
    this.models = ConditionModels.defaults();
    this.listener = listener;
    this.executorService = executorService;
    this.clock = clock;
  }

  /** Engine with the bundled threshold profiles and a small worker pool. */
  public static InferenceEngine withDefaults(VerdictListener listener) {
    int workers = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
    return new InferenceEngine(
        ThresholdProfileResolver.withDefaultProfiles(),
        listener,
        Executors.newFixedThreadPool(workers),
        Clock.systemUTC());
  }

  /**
   * Registers a growspace, replacing an earlier registration with the same id, and publishes its
   * initial UNKNOWN verdicts.
   *
   * @throws ConfigurationException if the config is invalid; nothing is registered then
   */
  public synchronized GrowspaceOrchestrator register(GrowspaceConfig config) {
    GrowspaceOrchestrator orchestrator =
        new GrowspaceOrchestrator(config, resolver, estimator, models, listener);
    SerialEventLane lane =
        new SerialEventLane(config.growspaceId(), orchestrator::apply, executorService);
    Registration previous =
        growspaces.put(config.growspaceId(), new Registration(orchestrator, lane));
    if (previous != null) {
      previous.lane().discard();
      log.info("Growspace '{}' re-registered", config.growspaceId());
    } else {
      log.info(
          "Growspace '{}' registered: conditions={}, sensors={}, light={}",
          config.growspaceId(),
          config.enabledConditions(),
          config.boundSensors(),
          config.lightSensorBound());
    }
    orchestrator.publishInitial(clock.instant());
    return orchestrator;
  }

  /** Discards the growspace's state; its queued events are dropped unapplied. */
  public synchronized void unregister(String growspaceId) {
    Registration removed = growspaces.remove(growspaceId);
    if (removed != null) {
      removed.lane().discard();
      log.info("Growspace '{}' unregistered", growspaceId);
    }
  }

  public Set<String> growspaceIds() {
    return new TreeSet<>(growspaces.keySet());
  }

  public Optional<GrowspaceOrchestrator> orchestrator(String growspaceId) {
    return Optional.ofNullable(growspaces.get(growspaceId)).map(Registration::orchestrator);
  }

  /**
   * Queues an event for its growspace.
   *
   * @return false if the event was dropped
   */
  public boolean submit(GrowspaceEvent event) {
    Registration registration = growspaces.get(event.growspaceId());
    if (registration == null) {
      log.warn(
          "Dropped {} for unknown growspace '{}'",
          event.getClass().getSimpleName(),
          event.growspaceId());
      return false;
    }
    return registration.lane().submit(event);
  }

  /** Sends a clock tick to every registered growspace. */
  public void tick() {
    Instant now = clock.instant();
    growspaces.keySet().forEach(id -> submit(new ClockTick(id, now)));
  }

  /** Stops accepting events and waits up to 5 seconds for queued ones. */
  public void shutdown() {
    log.info("Shutting down inference engine executor service");
    growspaces.values().forEach(registration -> registration.lane().close());
    executorService.shutdown();
    try {
      if (!executorService.awaitTermination(5, TimeUnit.SECONDS)) {
        executorService.shutdownNow();
      }
    } catch (InterruptedException e) {
      executorService.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public void close() {
    shutdown();
  }
}
