package io.github.fiserro.growhab.engine;

import io.github.fiserro.growhab.GrowspaceEvent;
import io.github.fiserro.growhab.SensorUpdate;
import io.github.fiserro.growhab.SensorVariable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

/**
 * Serializes the events of one growspace on a shared executor. Events are handled one at a time in
 * submission order; different lanes run in parallel.
 *
 * <p>A sensor update drops a still queued update of the same variable and joins the queue at its
 * tail, so a burst of readings costs one evaluation and nothing is applied ahead of an event that
 * arrived earlier. Other events are never coalesced.
 */
@Slf4j
class SerialEventLane {

  private final String growspaceId;
  private final Consumer<GrowspaceEvent> handler;
  private final Executor executor;

  private final Deque<Slot> queue = new ArrayDeque<>();
  private final Map<SensorVariable, Slot> queuedSensorSlots = new EnumMap<>(SensorVariable.class);
  private boolean draining;
  private boolean closed;

  private static final class Slot {
    private final GrowspaceEvent event;

    private Slot(GrowspaceEvent event) {
      this.event = event;
    }
  }

  SerialEventLane(String growspaceId, Consumer<GrowspaceEvent> handler, Executor executor) {
    this.growspaceId = growspaceId;
    this.handler = handler;
    this.executor = executor;
  }

  /**
   * @return false if the lane is closed and the event was dropped
   */
  boolean submit(GrowspaceEvent event) {
    synchronized (this) {
      if (closed) {
        log.warn("[{}] Lane closed, dropped {}", growspaceId, event.getClass().getSimpleName());
        return false;
      }
      if (event instanceof SensorUpdate update) {
        Slot slot = new Slot(event);
        Slot replaced = queuedSensorSlots.put(update.variable(), slot);
        if (replaced != null) {
          log.debug("[{}] Coalesced queued {} reading", growspaceId, update.variable().key());
          queue.remove(replaced);
        }
        queue.add(slot);
      } else {
        queue.add(new Slot(event));
      }
      if (draining) {
        return true;
      }
      draining = true;
    }

    try {
      executor.execute(this::drain);
    } catch (RejectedExecutionException e) {
      synchronized (this) {
        draining = false;
      }
      log.warn("[{}] Executor rejected event processing: {}", growspaceId, e.getMessage());
      return false;
    }
    return true;
  }

  /** Stops accepting events; queued events are still handled. */
  synchronized void close() {
    closed = true;
  }

  /** Stops accepting events and drops the queued ones; an event being handled completes. */
  synchronized void discard() {
    closed = true;
    if (!queue.isEmpty()) {
      log.info("[{}] Discarded {} queued events", growspaceId, queue.size());
    }
    queue.clear();
    queuedSensorSlots.clear();
  }

  synchronized int queued() {
    return queue.size();
  }

  private void drain() {
    while (true) {
      GrowspaceEvent next;
      synchronized (this) {
        Slot slot = queue.poll();
        if (slot == null) {
          draining = false;
          return;
        }
        if (slot.event instanceof SensorUpdate update) {
          queuedSensorSlots.remove(update.variable(), slot);
        }
        next = slot.event;
      }
      try {
        handler.accept(next);
      } catch (RuntimeException e) {
        log.error(
            "[{}] Failed to apply {} at {}",
            growspaceId,
            next.getClass().getSimpleName(),
            next.timestamp(),
            e);
      } catch (Error e) {
        log.error(
            "[{}] {} while applying {}, queued events wait for the next submit",
            growspaceId,
            e.getClass().getSimpleName(),
            next.getClass().getSimpleName());
        synchronized (this) {
          draining = false;
        }
        throw e;
      }
    }
  }
}
