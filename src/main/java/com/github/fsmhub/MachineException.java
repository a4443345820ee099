package com.github.fsmhub;

/**
 * Unified single exception that's thrown and handled by the machine runtime and the hub. The idea
 * is to use the code enum to encapsulate various error/exception conditions. Stack traces, where
 * available, are not meant to be kept from users.
 */
public final class MachineException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public MachineException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public MachineException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public MachineException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public MachineException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_EVENT("Event is not legal for the current state of the machine"),
    // 2.
    GUARD_FAILURE("One or more guards denied the requested transition"),
    // 3.
    INVARIANT_VIOLATION("Destination state invariants do not hold after the transition"),
    // 4.
    TRANSITION_IN_PROGRESS("Another transition is already executing for this machine instance"),
    // 5.
    ACTION_FAILURE("A transition action failed"),
    // 6.
    HOOK_FAILURE("A state entry or exit hook failed"),
    // 7.
    SERVICE_FAILURE("Invoked service failed"),
    // 8.
    SERVICE_TIMEOUT("Invoked service did not complete before the state timeout"),
    // 9.
    MACHINE_NOT_ALIVE("Machine instance is not running and cannot service requests"),
    // 10.
    OPERATION_LOCK_ACQUISITION_FAILURE(
        "Failed to acquire read or write lock to perform requested operation. This is retryable."),
    // 11.
    INVALID_MACHINE_DEFINITION("Machine definition is invalid"),
    // 12.
    INVALID_MACHINE_CONFIG("Machine or hub configuration is invalid"),
    // 13.
    UNKNOWN_INSTANCE("Hub failed to lookup instance with provided id"),
    // 14.
    DUPLICATE_INSTANCE("An instance is already registered with the provided id"),
    // 15.
    INTERRUPTED("Machine was interrupted"),
    // 16.
    UNKNOWN_FAILURE("Machine failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
