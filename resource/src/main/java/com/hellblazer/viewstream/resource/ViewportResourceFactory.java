package com.hellblazer.viewstream.resource;

/**
 * Creates and tears down the opaque rendering resources behind pool slots. Implementations are called by the pool and
 * must not call back into it.
 */
public interface ViewportResourceFactory {

    /**
     * Factory that allocates nothing; slots carry no rendering resource.
     */
    ViewportResourceFactory NONE = new ViewportResourceFactory() {
        @Override
        public Object createResource(String poolId, ViewportType type) {
            return null;
        }

        @Override
        public void cleanResource(String poolId, Object resource) {
        }
    };

    /**
     * Allocate the rendering resource for a new or re-tagged slot.
     *
     * @return the resource handle, or null if the slot needs none
     */
    Object createResource(String poolId, ViewportType type);

    /**
     * Reset a resource after its content was released so the slot can be reused.
     */
    void cleanResource(String poolId, Object resource) throws Exception;

    /**
     * Release a resource for good when its slot is removed from the pool.
     */
    default void disposeResource(String poolId, Object resource) throws Exception {
        cleanResource(poolId, resource);
    }
}
