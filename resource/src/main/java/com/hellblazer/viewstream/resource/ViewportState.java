package com.hellblazer.viewstream.resource;

/**
 * Lifecycle of a pool slot: AVAILABLE -> IN_USE -> PENDING_CLEANUP -> AVAILABLE, and DISPOSED once removed
 */
public enum ViewportState {
    AVAILABLE,
    IN_USE,
    PENDING_CLEANUP,
    DISPOSED
}
