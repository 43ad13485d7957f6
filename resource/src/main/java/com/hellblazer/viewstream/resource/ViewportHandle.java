package com.hellblazer.viewstream.resource;

/**
 * Immutable view of a pool slot handed out to callers. The pool keeps ownership of the slot itself; a handle is only
 * a snapshot taken at the time of the call.
 *
 * @param poolId         pool-assigned identity, used to release the slot
 * @param viewportId     unique rendering viewport identity
 * @param type           content type the slot is tagged with
 * @param state          lifecycle state when the snapshot was taken
 * @param contentId      assigned content, null unless IN_USE
 * @param resourceHandle opaque rendering resource, may be null
 * @param createdAt      creation time in epoch millis
 * @param lastUsedAt     last acquisition time in epoch millis, 0 if never used
 * @param usageCount     number of acquisitions
 */
public record ViewportHandle(String poolId, String viewportId, ViewportType type, ViewportState state,
                             String contentId, Object resourceHandle, long createdAt, long lastUsedAt,
                             int usageCount) {
}
