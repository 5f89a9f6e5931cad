package tracking.model;

public enum ActionKind {
  NOTIFY,
  WEBHOOK
}
