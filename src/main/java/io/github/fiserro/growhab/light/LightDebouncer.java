package io.github.fiserro.growhab.light;

import io.github.fiserro.growhab.LightState;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Filters light flapping: a new raw state counts only after it persisted for the debounce
 * duration, and then counts from the moment it was first seen. Unavailability and the first known
 * state pass through immediately. A zero duration disables filtering.
 */
@Slf4j
public class LightDebouncer {

  private final Duration debounce;

  public LightDebouncer(Duration debounce) {
    this.debounce = debounce == null ? Duration.ZERO : debounce;
  }

  /** Debounced state plus the candidate waiting to be confirmed. */
  public record State(LightState stable, LightState candidate, Instant candidateSince) {

    public static State initial() {
      return new State(LightState.UNAVAILABLE, null, null);
    }

    static State settled(LightState stable) {
      return new State(stable, null, null);
    }
  }

  /** Confirmed light state with the time it actually began. */
  public record Transition(LightState light, Instant at) {}

  public record Result(State state, Optional<Transition> transition) {}

  public Result offer(State state, LightState raw, Instant at) {
    if (debounce.isZero() || !raw.isKnown() || !state.stable().isKnown()) {
      Optional<Transition> transition =
          raw == state.stable() ? Optional.empty() : Optional.of(new Transition(raw, at));
      return new Result(State.settled(raw), transition);
    }
    if (raw == state.stable()) {
      if (state.candidate() != null) {
        log.debug(
            "Light flap to {} filtered after {}",
            state.candidate(),
            Duration.between(state.candidateSince(), at));
      }
      return new Result(State.settled(raw), Optional.empty());
    }
    State pending = raw == state.candidate() ? state : new State(state.stable(), raw, at);
    return poll(pending, at);
  }

  /** Confirms the pending candidate once it has persisted long enough. */
  public Result poll(State state, Instant now) {
    if (state.candidate() == null || now.isBefore(state.candidateSince().plus(debounce))) {
      return new Result(state, Optional.empty());
    }
    return new Result(
        State.settled(state.candidate()),
        Optional.of(new Transition(state.candidate(), state.candidateSince())));
  }
}
