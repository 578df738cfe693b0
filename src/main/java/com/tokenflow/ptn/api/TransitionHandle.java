package com.tokenflow.ptn.api;

/**
 * Handle to a declared transition.
 */
public record TransitionHandle(long modelId, int index, String name) implements NodeHandle {

    @Override
    public NodeKind kind() {
        return NodeKind.TRANSITION;
    }
}
