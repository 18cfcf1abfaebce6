package com.github.declarativefsm;

/**
 * Unified single exception that's thrown and handled by this FSM. The idea is to use the code enum
 * to encapsulate the various error conditions: a malformed machine definition, an action name that
 * the service's lookup table cannot resolve and so on. Stack traces, where available, are not
 * meant to be kept from users.
 */
public final class StateMachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public StateMachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public StateMachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public StateMachineException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_MACHINE_CONFIG("State machine configuration is invalid"),
    // 2.
    UNKNOWN_ACTION("Action name was not found in the service's action lookup table"),
    // 3.
    INVALID_STATE("State key is not declared by the state machine"),
    // 4.
    INVALID_EVENT("Event cannot be null and must carry a non-blank type"),
    // 5.
    OPERATION_LOCK_ACQUISITION_FAILURE(
        "Failed to acquire service lock to perform requested operation. This is retryable.");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
