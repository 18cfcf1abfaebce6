package com.github.declarativefsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * This class encapsulates the declarative definition of a StateMachine: the key of the initial
 * state and every {@link StateNode}. Use the {@code MachineConfigurationBuilder} to build it.
 *
 * Notes:<br>
 * 1. the whole table is checked for referential integrity when built; initial and every transition
 * target must name a declared state<br>
 * 2. all problems found are reported together in the message of a single
 * {@link StateMachineException.Code#INVALID_MACHINE_CONFIG} failure<br>
 * 3. once built, the configuration is never mutated, neither by users nor by the machine<br>
 */
public final class MachineConfiguration {
  private final String initial;
  private final Map<String, StateNode> states;

  public String getInitial() {
    return initial;
  }

  /**
   * States keyed by state key, in declaration order.
   */
  public Map<String, StateNode> getStates() {
    return states;
  }

  public final static class MachineConfigurationBuilder {
    private String initial;
    private final List<StateNode> states = new ArrayList<>();

    public static MachineConfigurationBuilder newBuilder() {
      return new MachineConfigurationBuilder();
    }

    public MachineConfigurationBuilder initial(final String initial) {
      this.initial = initial;
      return this;
    }

    public MachineConfigurationBuilder state(final StateNode state) {
      this.states.add(state);
      return this;
    }

    public MachineConfigurationBuilder states(final StateNode... states) {
      for (StateNode state : states) {
        this.states.add(state);
      }
      return this;
    }

    public MachineConfiguration build() throws StateMachineException {
      validate(initial, states);
      final Map<String, StateNode> statesByKey = new LinkedHashMap<>();
      for (final StateNode state : states) {
        statesByKey.put(state.getKey(), state);
      }
      return new MachineConfiguration(initial, statesByKey);
    }

    private MachineConfigurationBuilder() {}
  }

  private static void validate(final String initial, final List<StateNode> states)
      throws StateMachineException {
    StringBuilder messages = new StringBuilder();
    final List<String> declaredKeys = new ArrayList<>();
    for (final StateNode state : states) {
      if (state == null) {
        messages.append("State cannot be null. ");
        continue;
      }
      if (isBlank(state.getKey())) {
        messages.append("State key cannot be null or blank. ");
        continue;
      }
      if (declaredKeys.contains(state.getKey())) {
        messages.append("Duplicate state key: ").append(state.getKey()).append(". ");
        continue;
      }
      declaredKeys.add(state.getKey());
    }
    if (declaredKeys.isEmpty()) {
      messages.append("States cannot be empty. ");
    }
    if (isBlank(initial)) {
      messages.append("Initial state key cannot be null or blank. ");
    } else if (!declaredKeys.isEmpty() && !declaredKeys.contains(initial)) {
      messages.append("Initial state not found in states: ").append(initial).append(". ");
    }
    for (final StateNode state : states) {
      if (state == null || isBlank(state.getKey())) {
        continue;
      }
      for (final Map.Entry<String, Transition> entry : state.getOn().entrySet()) {
        final String eventType = entry.getKey();
        final Transition transition = entry.getValue();
        if (isBlank(eventType)) {
          messages.append("State ").append(state.getKey())
              .append(" has an event type that is null or blank. ");
          continue;
        }
        if (transition == null) {
          messages.append("State ").append(state.getKey()).append(" has a null transition on ")
              .append(eventType).append(". ");
          continue;
        }
        if (transition.getTarget().isPresent()
            && !declaredKeys.contains(transition.getTarget().get())) {
          messages.append("State ").append(state.getKey()).append(" transitions on ")
              .append(eventType).append(" to undeclared target: ")
              .append(transition.getTarget().get()).append(". ");
        }
      }
    }
    if (messages.length() > 0) {
      throw new StateMachineException(StateMachineException.Code.INVALID_MACHINE_CONFIG,
          messages.toString().trim());
    }
  }

  private static boolean isBlank(final String value) {
    return value == null || value.trim().isEmpty();
  }

  @Override
  public String toString() {
    return "MachineConfiguration [initial=" + initial + ", states=" + states.keySet() + "]";
  }

  private MachineConfiguration(final String initial, final Map<String, StateNode> states) {
    this.initial = initial;
    this.states = Collections.unmodifiableMap(states);
  }

}
