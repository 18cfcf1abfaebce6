package com.github.declarativefsm;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A simple declarative Finite State Machine. The machine is nothing but a normalized, immutable
 * transition table plus a pure function that resolves an event against it.
 *
 * Notes for users:<br>
 * 0a. correctness is the most important virtue of this fsm<br>
 * 0b. less boilerplate code is the next most important virtue<br>
 *
 * 1. this FSM instance is immutable and thus thread-safe<br>
 *
 * 2. it is designed to not be singleton within a process, so, if there's a desire to have many
 * state machines, just create as many as needed<br>
 *
 * 3. a machine holds no current state; that lives in a {@link StateMachineService}. There's no
 * need to make a new machine for every service, one machine may back any number of them.<br>
 *
 * 4. {@link #resolve(String, Event)} never executes actions. It only tells the caller which
 * actions are to run and where the machine goes next.<br>
 */
public interface StateMachine {

  /**
   * Resolve the transition for an event while in the given state. Returns empty if that state
   * declares no transition for the event's type, in which case the event is to be ignored.
   */
  Optional<TransitionResult> resolve(final String currentStateKey, final Event event)
      throws StateMachineException;

  /**
   * Key of the state every service of this machine starts in.
   */
  String getInitialStateKey();

  /**
   * Look up the state node for the given key.
   */
  StateNode getState(final String stateKey) throws StateMachineException;

  /**
   * All state keys in declaration order.
   */
  List<String> getStateKeys();

  /**
   * Event types the given state has a transition for.
   */
  Set<String> getEventTypes(final String stateKey) throws StateMachineException;

  /**
   * Reports the id of this StateMachine instance. You can have as many instances as you like.
   */
  String getId();

  /**
   * Returns the config that this fsm is wired with.
   */
  MachineConfiguration getConfiguration();

  /**
   * Shorthand for {@code StateMachineBuilder.newBuilder().config(config).build()}.
   */
  static StateMachine create(final MachineConfiguration config) throws StateMachineException {
    return StateMachineBuilder.newBuilder().config(config).build();
  }

  /**
   * A simple builder to let users use fluent APIs to build FSMs.
   */
  public final static class StateMachineBuilder {
    private MachineConfiguration config;

    public static StateMachineBuilder newBuilder() {
      return new StateMachineBuilder();
    }

    public StateMachineBuilder config(final MachineConfiguration config) {
      this.config = config;
      return this;
    }

    public StateMachine build() throws StateMachineException {
      return new StateMachineImpl(config);
    }

    private StateMachineBuilder() {}
  }

}
