package com.github.declarativefsm;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.declarativefsm.StateMachineException.Code;

/**
 * Default {@link StateMachineService}.
 *
 * Notes:<br>
 * 1. all mutators take the serviceLock. It is reentrant, so actions and listeners may call back
 * into {@link #send(Event)} on the same thread. Such a send is queued and returns false. Once the
 * running start or send has finished its transition and notified every listener, the queue is
 * drained in order, each deferred event getting its own transition and notification round. A
 * failure or a stop discards whatever is still queued<br>
 *
 * 2. the snapshot is volatile and read without locking. It is replaced, never modified<br>
 *
 * 3. listeners are kept in a copy-on-write list. A notification round iterates over the listeners
 * subscribed when it began, so subscribing or unsubscribing from inside a listener only takes
 * effect from the next round<br>
 *
 * 4. a transition that has started always runs to completion, even if an action stops the
 * service midway<br>
 */
final class StateMachineServiceImpl implements StateMachineService {
  private static final Logger logger =
      LogManager.getLogger(StateMachineServiceImpl.class.getSimpleName());

  private final String serviceId = UUID.randomUUID().toString();

  private final StateMachine machine;
  private final ServiceOptions options;
  private final long lockAcquisitionMillis;

  private final ReentrantLock serviceLock = new ReentrantLock(true);

  private volatile boolean running;
  private volatile StateSnapshot snapshot;

  private final List<ListenerSubscription> listeners = new CopyOnWriteArrayList<>();

  // both only touched by the lock holder
  private final Deque<Event> deferredEvents = new ArrayDeque<>();
  private boolean processing;

  private final ServiceStatistics serviceStats;

  StateMachineServiceImpl(final StateMachine machine, final ServiceOptions options)
      throws StateMachineException {
    if (machine == null) {
      throw new StateMachineException(Code.INVALID_MACHINE_CONFIG,
          "Service cannot be created without a state machine");
    }
    this.machine = machine;
    this.options = options == null ? ServiceOptions.defaults() : options;
    this.lockAcquisitionMillis = this.options.getLockAcquisitionMillis();
    this.serviceStats = new ServiceStatistics(serviceId);
    logInfo(machine.getId(), serviceId, "Created service with " + this.options);
  }

  @Override
  public boolean start() throws StateMachineException {
    acquireLock("start service");
    try {
      if (running) {
        logInfo(machine.getId(), serviceId, "Cannot start an already running service");
        return false;
      }
      final String initial = machine.getInitialStateKey();
      snapshot = StateSnapshot.initial(initial);
      running = true;
      serviceStats.starts++;
      serviceStats.stateEntered(initial);
      logInfo(machine.getId(), serviceId, "Started service in state " + initial);
      if (processing) {
        // restarted from inside an action, the outer call drains the queue
        executeActions(machine.getState(initial).getEntry(), "entry", initial);
        return true;
      }
      processing = true;
      try {
        executeActions(machine.getState(initial).getEntry(), "entry", initial);
        drainDeferredEvents();
      } finally {
        processing = false;
        deferredEvents.clear();
      }
      return true;
    } finally {
      serviceLock.unlock();
    }
  }

  @Override
  public boolean stop() throws StateMachineException {
    acquireLock("stop service");
    try {
      if (!running) {
        logInfo(machine.getId(), serviceId, "Service is already stopped");
        return false;
      }
      running = false;
      if (!deferredEvents.isEmpty()) {
        logDebug(machine.getId(), serviceId,
            String.format("Dropping %d deferred event(s)", deferredEvents.size()));
        deferredEvents.clear();
      }
      logInfo(machine.getId(), serviceId,
          "Stopped service in state " + snapshot.getValue() + " with " + serviceStats);
      return true;
    } finally {
      serviceLock.unlock();
    }
  }

  @Override
  public boolean send(final String eventType) throws StateMachineException {
    return send(Event.of(eventType));
  }

  @Override
  public boolean send(final Event event) throws StateMachineException {
    if (event == null) {
      throw new StateMachineException(Code.INVALID_EVENT);
    }
    acquireLock("send " + event.getType());
    try {
      if (!running) {
        logDebug(machine.getId(), serviceId,
            "Service is not running, ignoring event " + event.getType());
        return false;
      }
      if (processing) {
        deferredEvents.addLast(event);
        logDebug(machine.getId(), serviceId, String.format(
            "Deferred event %s until the current transition completes", event.getType()));
        return false;
      }
      processing = true;
      try {
        final boolean transitioned = process(event);
        drainDeferredEvents();
        return transitioned;
      } finally {
        processing = false;
        deferredEvents.clear();
      }
    } finally {
      serviceLock.unlock();
    }
  }

  private boolean process(final Event event) throws StateMachineException {
    final StateSnapshot current = snapshot;
    final Optional<TransitionResult> resolved = machine.resolve(current.getValue(), event);
    if (!resolved.isPresent()) {
      serviceStats.ignoredEvents++;
      logDebug(machine.getId(), serviceId,
          String.format("Ignoring event %s in state %s", event.getType(), current.getValue()));
      return false;
    }
    final TransitionResult result = resolved.get();

    // 1. leave the source, exit actions still see the old snapshot
    executeActions(result.getExitActions(), "exit", result.getSource());

    // 2. the transition's own actions
    executeActions(result.getActions(), "transition", result.getSource());

    // 3. swap the snapshot
    final String next = result.getResultingStateKey();
    final StateSnapshot updated = StateSnapshot.of(next, result.getActions());
    snapshot = updated;
    serviceStats.transitions++;
    if (!result.isInternal()) {
      serviceStats.stateEntered(next);
    }
    logDebug(machine.getId(), serviceId, String.format("Transitioned %s->%s on %s",
        result.getSource(), next, event.getType()));

    // 4. enter the target, entry actions see the new snapshot
    executeActions(result.getEntryActions(), "entry", next);

    // 5. tell everyone
    notifyListeners(updated);
    return true;
  }

  private void drainDeferredEvents() throws StateMachineException {
    Event deferred;
    while (running && (deferred = deferredEvents.pollFirst()) != null) {
      process(deferred);
    }
  }

  @Override
  public boolean can(final Event event) throws StateMachineException {
    final StateSnapshot current = snapshot;
    if (!running || current == null) {
      return false;
    }
    return machine.resolve(current.getValue(), event).isPresent();
  }

  @Override
  public Subscription subscribe(final StateListener listener) {
    if (listener == null) {
      throw new IllegalArgumentException("Listener cannot be null");
    }
    final ListenerSubscription subscription = new ListenerSubscription(listener);
    listeners.add(subscription);
    return subscription;
  }

  @Override
  public StateSnapshot getState() {
    return snapshot;
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  @Override
  public String getId() {
    return serviceId;
  }

  @Override
  public StateMachine getMachine() {
    return machine;
  }

  @Override
  public ServiceStatistics getStatistics() {
    return serviceStats;
  }

  private void executeActions(final Actions actions, final String phase, final String stateKey)
      throws StateMachineException {
    for (final ActionReference reference : actions.getReferences()) {
      final Action action;
      try {
        action = reference.resolve(options.getActions());
      } catch (StateMachineException unknownAction) {
        logError(machine.getId(), serviceId, String.format("Failed to resolve %s action %s in %s",
            phase, reference, stateKey));
        throw unknownAction;
      }
      action.execute();
    }
  }

  private void notifyListeners(final StateSnapshot current) throws StateMachineException {
    for (final ListenerSubscription subscription : listeners) {
      subscription.listener.onTransition(current);
      serviceStats.notifications++;
    }
  }

  private void acquireLock(final String operation) throws StateMachineException {
    try {
      if (!serviceLock.tryLock(lockAcquisitionMillis, TimeUnit.MILLISECONDS)) {
        throw new StateMachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE,
            "Timed out while trying to " + operation);
      }
    } catch (InterruptedException exception) {
      Thread.currentThread().interrupt();
      throw new StateMachineException(Code.OPERATION_LOCK_ACQUISITION_FAILURE, exception);
    }
  }

  @Override
  public String toString() {
    return "StateMachineService [id=" + serviceId + ", machineId=" + machine.getId()
        + ", running=" + running + ", state=" + snapshot + "]";
  }

  private final class ListenerSubscription implements Subscription {
    private final StateListener listener;

    private ListenerSubscription(final StateListener listener) {
      this.listener = listener;
    }

    @Override
    public void unsubscribe() {
      if (listeners.remove(this)) {
        logDebug(machine.getId(), serviceId, "Unsubscribed listener " + listener);
      }
    }
  }

  private static void logError(final String machineId, final String serviceId,
      final String message) {
    logger.error(new StringBuilder().append("[m:").append(machineId).append("][s:")
        .append(serviceId).append("] ").append(message).toString());
  }

  private static void logInfo(final String machineId, final String serviceId,
      final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("][s:")
        .append(serviceId).append("] ").append(message).toString());
  }

  private static void logDebug(final String machineId, final String serviceId,
      final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("][s:")
          .append(serviceId).append("] ").append(message).toString());
    }
  }

}
