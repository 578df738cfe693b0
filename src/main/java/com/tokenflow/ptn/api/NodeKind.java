package com.tokenflow.ptn.api;

/**
 * The two kinds of node a net is made of.
 */
public enum NodeKind {
    PLACE,
    TRANSITION
}
