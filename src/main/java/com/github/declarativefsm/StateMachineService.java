package com.github.declarativefsm;

/**
 * A running interpreter of a {@link StateMachine}. The service owns the current
 * {@link StateSnapshot}, runs entry, exit and transition actions around every transition and
 * notifies subscribed listeners afterwards.
 *
 * Notes for users:<br>
 * 1. every operation runs synchronously to completion on the caller's thread. Actions and
 * listeners may call {@link #send(Event)} again. Such an event is queued, and is processed once the
 * current transition has run all its actions and notified every listener. Queued events are
 * processed in the order they were sent, before the outermost call returns<br>
 *
 * 2. an action or listener that throws aborts the send it runs in and discards queued events.
 * Whatever the send had already done, including replacing the snapshot, is not rolled back<br>
 *
 * 3. the service is the only writer of its snapshot. Mutating operations are serialized through a
 * reentrant lock, so a service may be shared across threads, but there's little point in doing
 * so<br>
 */
public interface StateMachineService {

  /**
   * Enter the machine's initial state and run its entry actions. Listeners are not notified. Starting
   * an already running service does nothing; a stopped service starts over from the initial state.
   *
   * Returns true iff the service was started by this call.
   */
  boolean start() throws StateMachineException;

  /**
   * Stop the service. No exit actions run and the last snapshot stays readable. Stopping a stopped
   * service does nothing.
   *
   * Returns true iff the service was stopped by this call.
   */
  boolean stop() throws StateMachineException;

  /**
   * Feed an event to the machine. Does nothing unless the service is running.
   *
   * Returns true iff the event matched a transition, false if it was ignored. A send made from an
   * action or listener is queued and returns false; its outcome shows up in the notifications.
   */
  boolean send(final Event event) throws StateMachineException;

  /**
   * Shorthand for sending an event with the given type and no payload.
   */
  boolean send(final String eventType) throws StateMachineException;

  /**
   * Check if the event would match a transition from the current state, without sending it.
   */
  boolean can(final Event event) throws StateMachineException;

  /**
   * Register a listener to be notified, in subscription order, after every matched event.
   */
  Subscription subscribe(final StateListener listener);

  /**
   * Read the current snapshot. Null until the service is first started.
   */
  StateSnapshot getState();

  boolean isRunning();

  String getId();

  StateMachine getMachine();

  ServiceStatistics getStatistics();

  /**
   * A simple builder to let users use fluent APIs to build services.
   */
  public final static class StateMachineServiceBuilder {
    private StateMachine machine;
    private ServiceOptions options = ServiceOptions.defaults();

    public static StateMachineServiceBuilder newBuilder() {
      return new StateMachineServiceBuilder();
    }

    public StateMachineServiceBuilder machine(final StateMachine machine) {
      this.machine = machine;
      return this;
    }

    public StateMachineServiceBuilder options(final ServiceOptions options) {
      this.options = options == null ? ServiceOptions.defaults() : options;
      return this;
    }

    public StateMachineService build() throws StateMachineException {
      return new StateMachineServiceImpl(machine, options);
    }

    private StateMachineServiceBuilder() {}
  }

}
