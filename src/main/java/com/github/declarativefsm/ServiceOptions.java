package com.github.declarativefsm;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * This class encapsulates the options a {@link StateMachineService} is created with. Use the
 * {@code ServiceOptionsBuilder} to build it.
 *
 * Notes:<br>
 * 1. actions registered here are what named {@link ActionReference}s resolve to. Lookup happens
 * when an action is about to run, so a machine may name actions that a given service never
 * needs<br>
 * 2. if lockAcquisitionMillis is not set, a default of 100 millis is used<br>
 */
public final class ServiceOptions {
  private static final long defaultLockAcquisitionMillis = 100L;

  private final Map<String, Action> actions;
  private final long lockAcquisitionMillis;

  public static ServiceOptions defaults() {
    return ServiceOptionsBuilder.newBuilder().build();
  }

  public Map<String, Action> getActions() {
    return actions;
  }

  public long getLockAcquisitionMillis() {
    return lockAcquisitionMillis;
  }

  public final static class ServiceOptionsBuilder {
    private final Map<String, Action> actions = new LinkedHashMap<>();
    private long lockAcquisitionMillis;

    public static ServiceOptionsBuilder newBuilder() {
      return new ServiceOptionsBuilder();
    }

    public ServiceOptionsBuilder action(final String name, final Action action) {
      if (name == null || name.trim().isEmpty() || action == null) {
        throw new IllegalArgumentException("Action name and action cannot be null or blank");
      }
      this.actions.put(name, action);
      return this;
    }

    public ServiceOptionsBuilder actions(final Map<String, Action> actions) {
      for (Map.Entry<String, Action> entry : actions.entrySet()) {
        action(entry.getKey(), entry.getValue());
      }
      return this;
    }

    public ServiceOptionsBuilder lockAcquisitionMillis(final long lockAcquisitionMillis) {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
      return this;
    }

    public ServiceOptions build() {
      return new ServiceOptions(actions, lockAcquisitionMillis);
    }

    private ServiceOptionsBuilder() {}
  }

  @Override
  public String toString() {
    return "ServiceOptions [actions=" + actions.keySet() + ", lockAcquisitionMillis="
        + lockAcquisitionMillis + "]";
  }

  private ServiceOptions(final Map<String, Action> actions, final long lockAcquisitionMillis) {
    this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    if (lockAcquisitionMillis <= 0L) {
      this.lockAcquisitionMillis = defaultLockAcquisitionMillis;
    } else {
      this.lockAcquisitionMillis = lockAcquisitionMillis;
    }
  }

}
