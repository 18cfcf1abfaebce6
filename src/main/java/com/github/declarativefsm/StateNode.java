package com.github.declarativefsm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * This object represents immutable metadata about a state: its key, the actions to run on entering
 * and leaving it, and its outgoing transitions keyed by event type. An event type with no entry
 * here is ignored while the machine is in this state.
 */
public final class StateNode {
  private final String key;
  private final Actions entry;
  private final Actions exit;
  private final Map<String, Transition> on;

  public String getKey() {
    return key;
  }

  public Actions getEntry() {
    return entry;
  }

  public Actions getExit() {
    return exit;
  }

  /**
   * Transitions keyed by event type, in declaration order.
   */
  public Map<String, Transition> getOn() {
    return on;
  }

  @Override
  public int hashCode() {
    return key == null ? 0 : key.hashCode();
  }

  // keys are unique within a machine
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
    StateNode other = (StateNode) obj;
    if (key == null) {
      return other.key == null;
    }
    return key.equals(other.key);
  }

  @Override
  public String toString() {
    return "StateNode [key=" + key + ", entry=" + entry + ", exit=" + exit + ", on=" + on + "]";
  }

  public final static class StateNodeBuilder {
    private final String key;
    private Actions entry = Actions.none();
    private Actions exit = Actions.none();
    private final Map<String, Transition> on = new LinkedHashMap<>();

    public static StateNodeBuilder newBuilder(final String key) {
      return new StateNodeBuilder(key);
    }

    public StateNodeBuilder entry(final Actions entry) {
      this.entry = entry == null ? Actions.none() : entry;
      return this;
    }

    public StateNodeBuilder entry(final Action action) {
      return entry(Actions.of(action));
    }

    public StateNodeBuilder entry(final String actionName) {
      return entry(Actions.of(actionName));
    }

    public StateNodeBuilder exit(final Actions exit) {
      this.exit = exit == null ? Actions.none() : exit;
      return this;
    }

    public StateNodeBuilder exit(final Action action) {
      return exit(Actions.of(action));
    }

    public StateNodeBuilder exit(final String actionName) {
      return exit(Actions.of(actionName));
    }

    /**
     * Shorthand transition straight to target.
     */
    public StateNodeBuilder on(final String eventType, final String target) {
      return on(eventType, Transition.to(target));
    }

    public StateNodeBuilder on(final String eventType, final Transition transition) {
      on.put(eventType, transition);
      return this;
    }

    public StateNode build() {
      return new StateNode(key, entry, exit, on);
    }

    private StateNodeBuilder(final String key) {
      this.key = key;
    }
  }

  private StateNode(final String key, final Actions entry, final Actions exit,
      final Map<String, Transition> on) {
    this.key = key;
    this.entry = entry;
    this.exit = exit;
    this.on = Collections.unmodifiableMap(new LinkedHashMap<>(on));
  }

}
