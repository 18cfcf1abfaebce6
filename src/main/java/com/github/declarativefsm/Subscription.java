package com.github.declarativefsm;

/**
 * Handle to a {@link StateListener} registered with a service.
 */
public interface Subscription {

  /**
   * Stop notifying the listener. Calling this more than once is harmless. A notification already in
   * progress when this is called still completes as it started.
   */
  void unsubscribe();

}
