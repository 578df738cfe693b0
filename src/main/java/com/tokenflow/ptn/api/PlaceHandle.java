package com.tokenflow.ptn.api;

/**
 * Handle to a declared place. The place's offset in the state vector is equal to
 * {@link #index()}.
 */
public record PlaceHandle(long modelId, int index, String name) implements NodeHandle {

    @Override
    public NodeKind kind() {
        return NodeKind.PLACE;
    }

    /** Position of this place in every state and delta vector. */
    public int offset() {
        return index;
    }
}
