package in.spreadarb.domain.common;

/**
 * Event types emitted by the engine. Storage and formatting belong to the sink.
 */
public enum EventType {
    // Scanner
    OPPORTUNITY_DETECTED,

    // Position lifecycle
    POSITION_OPENED,
    POSITION_CLOSED,
    POSITION_CLOSE_FAILED,

    // Statistics
    DAILY_ROLLOVER,
    SESSION_SUMMARY
}
