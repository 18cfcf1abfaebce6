package com.github.declarativefsm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered, immutable list of action references that remembers how it was declared: as a single
 * reference or as a list. Execution always walks {@link #getReferences()} left to right; the
 * declared shape only matters to whoever inspects a {@link StateSnapshot}.
 */
public final class Actions {
  private static final Actions none = new Actions(Collections.<ActionReference>emptyList(), false);

  private final List<ActionReference> references;
  private final boolean single;

  public static Actions none() {
    return none;
  }

  public static Actions of(final Action action) {
    return of(ActionReference.to(action));
  }

  public static Actions of(final String actionName) {
    return of(ActionReference.named(actionName));
  }

  public static Actions of(final ActionReference reference) {
    if (reference == null) {
      throw new IllegalArgumentException("Action reference cannot be null");
    }
    return new Actions(Collections.singletonList(reference), true);
  }

  public static Actions list(final ActionReference... references) {
    final List<ActionReference> copy = new ArrayList<>(references.length);
    for (final ActionReference reference : references) {
      if (reference == null) {
        throw new IllegalArgumentException("Action reference cannot be null");
      }
      copy.add(reference);
    }
    return new Actions(Collections.unmodifiableList(copy), false);
  }

  public static Actions list(final Action... actions) {
    final ActionReference[] references = new ActionReference[actions.length];
    for (int iter = 0; iter < actions.length; iter++) {
      references[iter] = ActionReference.to(actions[iter]);
    }
    return list(references);
  }

  public static Actions list(final String... actionNames) {
    final ActionReference[] references = new ActionReference[actionNames.length];
    for (int iter = 0; iter < actionNames.length; iter++) {
      references[iter] = ActionReference.named(actionNames[iter]);
    }
    return list(references);
  }

  public List<ActionReference> getReferences() {
    return references;
  }

  /**
   * True iff this was declared as one bare reference rather than a list (even a one-element list).
   */
  public boolean isSingle() {
    return single;
  }

  /**
   * The bare reference of a single-shaped declaration.
   */
  public ActionReference getSingle() {
    if (!single) {
      throw new IllegalStateException("Actions were declared as a list of " + references.size());
    }
    return references.get(0);
  }

  public boolean isEmpty() {
    return references.isEmpty();
  }

  public int size() {
    return references.size();
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + references.hashCode();
    result = prime * result + (single ? 1231 : 1237);
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
    Actions other = (Actions) obj;
    return single == other.single && references.equals(other.references);
  }

  @Override
  public String toString() {
    return single ? references.get(0).toString() : references.toString();
  }

  private Actions(final List<ActionReference> references, final boolean single) {
    this.references = references;
    this.single = single;
  }

}
