package com.prmanager.backend.global.error;

/**
 * Closed set of failure kinds the review engine reports to its callers.
 * The transport layer owns the mapping from kind to protocol status.
 */
public enum ErrorKind {
    BAD_REQUEST,
    NOT_FOUND,
    AUTHOR_INACTIVE,
    PR_MERGED,
    NOT_ASSIGNED,
    NO_CANDIDATE,
    STORAGE_FAILURE
}
