package com.github.declarativefsm;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Simple statistics holder for a service. Counters are only ever updated by the owning service.
 */
public final class ServiceStatistics {
  static final int maxRouteLength = 100;

  private final String serviceId;
  private final long createdMillis = System.currentTimeMillis();
  // written by the lock holder only, read by anyone
  volatile int starts;
  volatile int transitions;
  volatile int ignoredEvents;
  volatile int notifications;
  // bounded at maxRouteLength, oldest dropped first
  private final Deque<StateTimePair> boundedStateRoute = new ArrayDeque<>();

  ServiceStatistics(final String serviceId) {
    this.serviceId = serviceId;
  }

  public String getServiceId() {
    return serviceId;
  }

  public int getStarts() {
    return starts;
  }

  /**
   * Number of sent events that matched a transition, internal ones included.
   */
  public int getTransitions() {
    return transitions;
  }

  /**
   * Number of events sent to the running service that matched no transition.
   */
  public int getIgnoredEvents() {
    return ignoredEvents;
  }

  /**
   * Number of individual listener invocations.
   */
  public int getNotifications() {
    return notifications;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - createdMillis;
  }

  /**
   * The most recently entered states, oldest first.
   */
  public synchronized List<StateTimePair> getStateRoute() {
    final List<StateTimePair> route = new ArrayList<>(boundedStateRoute.size());
    for (final StateTimePair pair : boundedStateRoute) {
      route.add(pair.copy());
    }
    return route;
  }

  synchronized void stateEntered(final String stateKey) {
    final long now = System.currentTimeMillis();
    final StateTimePair previous = boundedStateRoute.peekLast();
    if (previous != null) {
      previous.elapsedMillis = now - previous.startMillis;
    }
    if (boundedStateRoute.size() == maxRouteLength) {
      boundedStateRoute.pollFirst();
    }
    final StateTimePair pair = new StateTimePair();
    pair.stateKey = stateKey;
    pair.startMillis = now;
    boundedStateRoute.addLast(pair);
  }

  @Override
  public String toString() {
    return "ServiceStatistics [serviceId=" + serviceId + ", starts=" + starts + ", transitions="
        + transitions + ", ignoredEvents=" + ignoredEvents + ", notifications=" + notifications
        + ", aliveTimeMillis=" + getAliveTimeMillis() + "]";
  }

  public final static class StateTimePair {
    public String stateKey;
    public long startMillis;
    // stays 0 while the state is still the current one
    public long elapsedMillis;

    private StateTimePair copy() {
      final StateTimePair copy = new StateTimePair();
      copy.stateKey = stateKey;
      copy.startMillis = startMillis;
      copy.elapsedMillis = elapsedMillis;
      return copy;
    }

    @Override
    public String toString() {
      return "StateTimePair [stateKey=" + stateKey + ", elapsedMillis=" + elapsedMillis + "]";
    }
  }

}
