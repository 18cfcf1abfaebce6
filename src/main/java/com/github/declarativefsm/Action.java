package com.github.declarativefsm;

/**
 * A side-effecting callback run by a {@link StateMachineService} on entry to a state, on exit from
 * a state or as part of a transition. Anything thrown here propagates to the caller of
 * {@link StateMachineService#start()} or {@link StateMachineService#send(Event)}.
 */
@FunctionalInterface
public interface Action {

  void execute() throws StateMachineException;

}
