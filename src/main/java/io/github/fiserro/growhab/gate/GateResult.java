package io.github.fiserro.growhab.gate;

import io.github.fiserro.growhab.VerdictValue;

/**
 * Output of one gate update.
 *
 * @param changed true when the published value changed, including the first evidence after
 *     UNKNOWN
 */
public record GateResult(GateState state, boolean changed) {

  public boolean verdict() {
    return state.verdict();
  }

  public VerdictValue value() {
    return state.value();
  }
}
