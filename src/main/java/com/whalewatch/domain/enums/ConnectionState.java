package com.whalewatch.domain.enums;

/**
 * Lifecycle state of one connection pool slot.
 */
public enum ConnectionState {
    /** Transport is being opened and entities subscribed. */
    CONNECTING,

    /** Connected and receiving traffic within the warn staleness bound. */
    READY,

    /** Connected but quiet for longer than the warn threshold, or partially subscribed. */
    DEGRADED,

    /** Old transport discarded, a new one is being opened. */
    RECONNECTING,

    /** Permanently failed (authorization error or reconnect attempts exhausted). */
    FAILED
}
