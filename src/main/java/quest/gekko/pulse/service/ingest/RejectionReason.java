package quest.gekko.pulse.service.ingest;

public enum RejectionReason {
    MALFORMED,
    EMPTY_TEXT,
    NO_TITLE_MATCH
}
