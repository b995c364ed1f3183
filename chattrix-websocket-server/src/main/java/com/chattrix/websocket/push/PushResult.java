package com.chattrix.websocket.push;

/**
 * Outcome of one push delivery attempt.
 */
public enum PushResult {
    DELIVERED,
    /** The endpoint is gone for good; the subscription should be deleted. */
    EXPIRED,
    /** Anything else. Not retried. */
    TRANSIENT_ERROR
}
