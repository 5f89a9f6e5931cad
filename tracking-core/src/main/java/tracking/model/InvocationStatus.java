package tracking.model;

public enum InvocationStatus {
  PENDING(0),
  DONE(1),
  RETRY(2),
  DEAD(3);

  private final int code;

  InvocationStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** PENDING and RETRY invocations may still run; DONE and DEAD are terminal. */
  public boolean isRunnable() {
    return this == PENDING || this == RETRY;
  }

  public static InvocationStatus fromCode(int code) {
    for (InvocationStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown invocation status code: " + code);
  }
}
