package tracking.model;

public enum UnresolvedStatus {
  PENDING(0),
  RESOLVED(1),
  REVIEW(2);

  private final int code;

  UnresolvedStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static UnresolvedStatus fromCode(int code) {
    for (UnresolvedStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown unresolved status code: " + code);
  }
}
