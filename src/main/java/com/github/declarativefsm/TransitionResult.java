package com.github.declarativefsm;

import java.util.Optional;

/**
 * This object encapsulates what the StateMachine resolved for an event in some state: where to go
 * and which actions a service is to run on the way there. It is pure data; producing one runs no
 * action.
 *
 * External transitions carry a {@link #getTarget()}, the source state's exit actions and the
 * target state's entry actions. Internal transitions carry no target and empty exit/entry actions.
 * Both carry the transition's own {@link #getActions()}, in their declared shape.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class TransitionResult {
  private final String source;
  private final String eventType;
  private final Optional<String> target;
  private final Actions exitActions;
  private final Actions actions;
  private final Actions entryActions;

  static TransitionResult external(final StateNode source, final String eventType,
      final Transition transition, final StateNode target) {
    return new TransitionResult(source.getKey(), eventType, Optional.of(target.getKey()),
        source.getExit(), transition.getActions(), target.getEntry());
  }

  static TransitionResult internal(final StateNode source, final String eventType,
      final Transition transition) {
    return new TransitionResult(source.getKey(), eventType, Optional.<String>empty(),
        Actions.none(), transition.getActions(), Actions.none());
  }

  public String getSource() {
    return source;
  }

  public String getEventType() {
    return eventType;
  }

  public Optional<String> getTarget() {
    return target;
  }

  public boolean isInternal() {
    return !target.isPresent();
  }

  /**
   * The state value after this transition: the target, or the source for internal transitions.
   */
  public String getResultingStateKey() {
    return target.orElse(source);
  }

  public Actions getExitActions() {
    return exitActions;
  }

  public Actions getActions() {
    return actions;
  }

  public Actions getEntryActions() {
    return entryActions;
  }

  @Override
  public String toString() {
    return "TransitionResult [source=" + source + ", eventType=" + eventType + ", target="
        + target.orElse("<self>") + ", exitActions=" + exitActions + ", actions=" + actions
        + ", entryActions=" + entryActions + "]";
  }

  private TransitionResult(final String source, final String eventType,
      final Optional<String> target, final Actions exitActions, final Actions actions,
      final Actions entryActions) {
    this.source = source;
    this.eventType = eventType;
    this.target = target;
    this.exitActions = exitActions;
    this.actions = actions;
    this.entryActions = entryActions;
  }
}
