package com.github.declarativefsm;

import java.util.Optional;

/**
 * Externally observable state of a {@link StateMachineService} at a point in time. Snapshots are
 * immutable; a service replaces its snapshot on every transition instead of changing it.
 *
 * {@link #getActions()} holds the actions declared on the transition that produced this snapshot,
 * exactly as declared, and is empty for the initial snapshot and for transitions that declare
 * none. It never reflects entry or exit actions.
 */
public final class StateSnapshot {
  private final String value;
  private final Optional<Actions> actions;

  static StateSnapshot initial(final String value) {
    return new StateSnapshot(value, Optional.<Actions>empty());
  }

  static StateSnapshot of(final String value, final Actions actions) {
    return new StateSnapshot(value,
        actions == null || actions.isEmpty() ? Optional.<Actions>empty() : Optional.of(actions));
  }

  public String getValue() {
    return value;
  }

  public Optional<Actions> getActions() {
    return actions;
  }

  public boolean matches(final String stateKey) {
    return value.equals(stateKey);
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + value.hashCode();
    result = prime * result + actions.hashCode();
    return result;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (obj == null) {
      return false;
    }
    if (getClass() != obj.getClass()) {
      return false;
    }
    StateSnapshot other = (StateSnapshot) obj;
    return value.equals(other.value) && actions.equals(other.actions);
  }

  @Override
  public String toString() {
    return "StateSnapshot [value=" + value
        + (actions.isPresent() ? ", actions=" + actions.get() : "") + "]";
  }

  private StateSnapshot(final String value, final Optional<Actions> actions) {
    this.value = value;
    this.actions = actions;
  }

}
