package tracking.model;

public enum ArchiveKind {
  RAW_EVENT,
  TIMELINE_SNAPSHOT
}
