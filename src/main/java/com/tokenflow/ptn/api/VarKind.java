package com.tokenflow.ptn.api;

/**
 * Which field of the frozen net an overlay variable patches.
 */
public enum VarKind {
    /** Starting token count of a place. */
    INITIAL,
    /** Upper bound of a place; zero means unbounded. */
    CAPACITY,
    /** Weight of the arc between a place and a transition. */
    WEIGHT
}
