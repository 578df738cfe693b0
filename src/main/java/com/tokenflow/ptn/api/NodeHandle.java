package com.tokenflow.ptn.api;

/**
 * A tagged reference to a node declared on a model.
 *
 * Handles are plain values: an arena index plus the identity of the model that
 * issued them. They never point into the model's storage, so arcs can be
 * recorded in any order relative to other declarations and a handle can never
 * alias a structure the compiler later rewrites.
 *
 * Key Responsibilities:
 *
 * 1. Kind tagging: the compiler classifies an arc purely from the kinds of its
 * two endpoints.
 *
 * 2. Ownership: {@link #modelId()} lets the model reject handles issued by a
 * different model.
 */
public interface NodeHandle {

    /** Identity of the model that issued this handle. */
    long modelId();

    /** Dense arena index within the node's kind. */
    int index();

    /** Identifier the node was declared under. */
    String name();

    NodeKind kind();

    default boolean isPlace() {
        return kind() == NodeKind.PLACE;
    }

    default boolean isTransition() {
        return kind() == NodeKind.TRANSITION;
    }
}
