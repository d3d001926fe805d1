package com.github.pfc;

/**
 * Unified single exception that's thrown by chart construction, analysis and execution. The code
 * enum encapsulates the various error conditions; a caller that needs to tell structural mistakes
 * from execution protocol violations switches on {@link #getCode()}.
 */
public final class PfcException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public PfcException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public PfcException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public PfcException(final Code code, final Throwable throwable) {
    super(throwable);
    this.code = code;
  }

  public PfcException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    STRUCTURE_VIOLATION("Attempted structural change would corrupt the chart"),
    // 2.
    DUPLICATE_ELEMENT_ID("An element with the same id already exists in this chart"),
    // 3.
    DUPLICATE_ELEMENT_NAME("An element with the same name already exists in this chart"),
    // 4.
    FOREIGN_ELEMENT("Element belongs to a different chart"),
    // 5.
    INVALID_SYNCHRONIZATION(
        "Synchronization requires non-empty arrays whose members are all of the same kind"),
    // 6.
    STRUCTURE_LOCKED("Chart structure is locked while an execution engine is attached"),
    // 7.
    MALFORMED_CHART("Chart does not have the shape required by the requested operation"),
    // 8.
    PRIMARY_PATH_LOOP("Primary path contains a loop"),
    // 9.
    ILLEGAL_STATE_TRANSITION("Attempted state transition is not permitted"),
    // 10.
    STATE_MACHINE_REPLACEMENT("Attempt to replace an existing state machine"),
    // 11.
    MISSING_SUCCESSOR_TRANSITION("A step has no successor transition"),
    // 12.
    NOT_DETACHABLE("Operation must be invoked from within a detachable event"),
    // 13.
    ILLEGAL_EVENT_TIME("Events cannot be requested for a time earlier than now"),
    // 14.
    EXECUTIVE_RUNNING("Executive is already running"),
    // 15.
    UNRESOLVED_REFERENCE("A transition condition refers to an element that cannot be found"),
    // 16.
    INVALID_ENGINE_CONFIG("Execution engine configuration is invalid"),
    // 17.
    INTERRUPTED("Unit of work was interrupted while suspended"),
    // 18.
    UNKNOWN_FAILURE("Execution failed. Check exception stacktrace for more details of the failure");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
