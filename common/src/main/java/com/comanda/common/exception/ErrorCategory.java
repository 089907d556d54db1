package com.comanda.common.exception;

/**
 * Coarse failure buckets shared by every engine operation. The HTTP layer
 * maps each bucket to a status code; callers use it to decide whether a retry
 * makes sense.
 */
public enum ErrorCategory {
    VALIDATION,           // bad items, bad coupon; user-correctable
    AUTHORIZATION,        // role or ownership does not permit the action
    NOT_FOUND,
    STATE_CONFLICT,       // invalid transition or order closed
    CONCURRENCY_CONFLICT, // version mismatch; re-read and retry
    RESOURCE_UNAVAILABLE, // no courier available; retryable
    DEPENDENCY_FAILURE    // collaborator unreachable; retryable
}
