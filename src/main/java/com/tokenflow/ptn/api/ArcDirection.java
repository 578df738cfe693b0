package com.tokenflow.ptn.api;

/**
 * Orientation of an arc between a place and a transition.
 */
public enum ArcDirection {
    /** Consumption: contributes a negative weight to the delta vector. */
    PLACE_TO_TRANSITION,
    /** Production: contributes a positive weight to the delta vector. */
    TRANSITION_TO_PLACE;

    /** Applies the orientation's sign to an unsigned weight. */
    public long signed(long weight) {
        return this == PLACE_TO_TRANSITION ? -weight : weight;
    }
}
