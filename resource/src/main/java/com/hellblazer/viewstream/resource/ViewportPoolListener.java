package com.hellblazer.viewstream.resource;

/**
 * Observer of pool lifecycle events. Callbacks run on the thread that caused the event and must be quick; exceptions
 * are logged and otherwise ignored.
 */
public interface ViewportPoolListener {

    default void onViewportAcquired(ViewportHandle viewport) {
    }

    default void onViewportReleased(ViewportHandle viewport) {
    }

    default void onViewportAvailable(ViewportHandle viewport) {
    }

    default void onViewportRemoved(ViewportHandle viewport) {
    }

    default void onGarbageCollection(ViewportPool.GarbageCollectionResult result) {
    }
}
