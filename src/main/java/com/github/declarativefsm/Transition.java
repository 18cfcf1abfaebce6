package com.github.declarativefsm;

import java.util.Optional;

/**
 * A transition hung off a {@link StateNode} under some event type. With a target, it is an
 * external transition: the machine leaves the source state (exit actions), runs this transition's
 * actions and enters the target (entry actions). Without a target, it is an internal or self
 * transition: only this transition's actions run and the state value stays put.
 *
 * Like the rest of the configuration, transitions are immutable and hold no runtime state, so the
 * same instance may be reused across states and machines.
 */
public final class Transition {
  private final Optional<String> target;
  private final Actions actions;

  /**
   * Shorthand form: go to target, no actions. Use {@link TransitionBuilder} without a target for an
   * internal transition.
   */
  public static Transition to(final String target) {
    if (target == null || target.trim().isEmpty()) {
      throw new IllegalArgumentException("Shorthand transition target cannot be null or blank");
    }
    return TransitionBuilder.newBuilder().target(target).build();
  }

  public Optional<String> getTarget() {
    return target;
  }

  public Actions getActions() {
    return actions;
  }

  public boolean isInternal() {
    return !target.isPresent();
  }

  @Override
  public String toString() {
    return "Transition [target=" + target.orElse("<self>") + ", actions=" + actions + "]";
  }

  public final static class TransitionBuilder {
    private String target;
    private Actions actions = Actions.none();

    public static TransitionBuilder newBuilder() {
      return new TransitionBuilder();
    }

    public TransitionBuilder target(final String target) {
      this.target = target;
      return this;
    }

    public TransitionBuilder actions(final Actions actions) {
      this.actions = actions == null ? Actions.none() : actions;
      return this;
    }

    public TransitionBuilder actions(final Action action) {
      return actions(Actions.of(action));
    }

    public TransitionBuilder actions(final String actionName) {
      return actions(Actions.of(actionName));
    }

    public Transition build() {
      return new Transition(Optional.ofNullable(target), actions);
    }

    private TransitionBuilder() {}
  }

  private Transition(final Optional<String> target, final Actions actions) {
    this.target = target;
    this.actions = actions;
  }

}
