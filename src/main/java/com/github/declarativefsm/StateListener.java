package com.github.declarativefsm;

/**
 * Callback notified by a {@link StateMachineService} after every event that matched a transition.
 */
@FunctionalInterface
public interface StateListener {

  void onTransition(final StateSnapshot snapshot) throws StateMachineException;

}
