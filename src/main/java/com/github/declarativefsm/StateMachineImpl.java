package com.github.declarativefsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.declarativefsm.StateMachineException.Code;

/**
 * A simple declarative Finite State Machine.
 *
 * The stateTransitionTable is hydrated once, at construction, from a validated
 * {@link MachineConfiguration} and never modified afterwards. Every lookup is a read of immutable
 * data, so a single instance can be shared by any number of services and threads without locking.
 */
final class StateMachineImpl implements StateMachine {
  private static final Logger logger = LogManager.getLogger(StateMachineImpl.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();

  private final MachineConfiguration config;

  // K=stateNode.key, V=stateNode. Shorthand transitions were already expanded by the builders.
  private final Map<String, StateNode> stateTransitionTable;

  private final List<String> stateKeys;

  StateMachineImpl(final MachineConfiguration config) throws StateMachineException {
    if (config == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_CONFIG,
          "Machine configuration cannot be null");
    }
    this.config = config;
    this.stateTransitionTable = config.getStates();
    this.stateKeys = Collections.unmodifiableList(new ArrayList<>(stateTransitionTable.keySet()));
    logInfo(machineId, "Successfully hydrated stateTransitionTable with states " + stateKeys
        + ", initial state " + config.getInitial());
  }

  @Override
  public Optional<TransitionResult> resolve(final String currentStateKey, final Event event)
      throws StateMachineException {
    if (event == null) {
      throw new StateMachineException(Code.INVALID_EVENT);
    }
    final StateNode source = lookupState(currentStateKey);
    final Transition transition = source.getOn().get(event.getType());
    if (transition == null) {
      logDebug(machineId, String.format("No transition from %s on %s", currentStateKey,
          event.getType()));
      return Optional.empty();
    }
    final TransitionResult result;
    if (transition.isInternal()) {
      result = TransitionResult.internal(source, event.getType(), transition);
    } else {
      // target integrity was checked when the configuration was built
      result = TransitionResult.external(source, event.getType(), transition,
          lookupState(transition.getTarget().get()));
    }
    logDebug(machineId, "Resolved " + result);
    return Optional.of(result);
  }

  @Override
  public String getInitialStateKey() {
    return config.getInitial();
  }

  @Override
  public StateNode getState(final String stateKey) throws StateMachineException {
    return lookupState(stateKey);
  }

  @Override
  public List<String> getStateKeys() {
    return stateKeys;
  }

  @Override
  public Set<String> getEventTypes(final String stateKey) throws StateMachineException {
    return lookupState(stateKey).getOn().keySet();
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public MachineConfiguration getConfiguration() {
    return config;
  }

  private StateNode lookupState(final String stateKey) throws StateMachineException {
    final StateNode state = stateKey == null ? null : stateTransitionTable.get(stateKey);
    if (state == null) {
      throw new StateMachineException(Code.INVALID_STATE,
          "State machine id:" + machineId + " does not declare state " + stateKey);
    }
    return state;
  }

  @Override
  public String toString() {
    return "StateMachine [id=" + machineId + ", initial=" + config.getInitial() + ", states="
        + stateKeys + "]";
  }

  private static void logInfo(final String machineId, final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String machineId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }

}
