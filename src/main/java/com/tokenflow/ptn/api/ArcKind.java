package com.tokenflow.ptn.api;

/**
 * Arc flavours.
 *
 * NORMAL arcs move tokens and are folded into the transition's delta vector.
 * INHIBITOR arcs never move tokens; they compile to a guard on the target
 * transition and must run from a place to a transition.
 */
public enum ArcKind {
    NORMAL,
    INHIBITOR
}
