package com.github.declarativefsm;

import java.util.Map;

import com.github.declarativefsm.StateMachineException.Code;

/**
 * Points at executable behavior: either an {@link Action} handed in directly or the name of an
 * action to be looked up in the {@link ServiceOptions} of the service executing it. Names are
 * resolved late, at execution time, never against any global table.
 */
public abstract class ActionReference {

  public static ActionReference to(final Action action) {
    return new Direct(action);
  }

  public static ActionReference named(final String name) {
    return new Named(name);
  }

  /**
   * Returns the action this reference stands for. Named references that are missing from
   * actionsByName fail with {@link Code#UNKNOWN_ACTION}.
   */
  abstract Action resolve(final Map<String, Action> actionsByName) throws StateMachineException;

  public abstract boolean isNamed();

  private ActionReference() {}

  static final class Direct extends ActionReference {
    private final Action action;

    private Direct(final Action action) {
      if (action == null) {
        throw new IllegalArgumentException("Action cannot be null");
      }
      this.action = action;
    }

    @Override
    Action resolve(final Map<String, Action> actionsByName) {
      return action;
    }

    @Override
    public boolean isNamed() {
      return false;
    }

    public Action getAction() {
      return action;
    }

    // identity of the wrapped action
    @Override
    public int hashCode() {
      return System.identityHashCode(action);
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Direct)) {
        return false;
      }
      return action == ((Direct) obj).action;
    }

    @Override
    public String toString() {
      return "ActionReference [action=" + action + "]";
    }
  }

  static final class Named extends ActionReference {
    private final String name;

    private Named(final String name) {
      if (name == null || name.trim().isEmpty()) {
        throw new IllegalArgumentException("Action name cannot be null or blank");
      }
      this.name = name;
    }

    @Override
    Action resolve(final Map<String, Action> actionsByName) throws StateMachineException {
      final Action action = actionsByName.get(name);
      if (action == null) {
        throw new StateMachineException(Code.UNKNOWN_ACTION,
            "Action not found in the action lookup table: " + name);
      }
      return action;
    }

    @Override
    public boolean isNamed() {
      return true;
    }

    public String getName() {
      return name;
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (this == obj) {
        return true;
      }
      if (!(obj instanceof Named)) {
        return false;
      }
      return name.equals(((Named) obj).name);
    }

    @Override
    public String toString() {
      return "ActionReference [name=" + name + "]";
    }
  }

}
