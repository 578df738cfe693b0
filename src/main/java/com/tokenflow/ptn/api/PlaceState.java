package com.tokenflow.ptn.api;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Exported state of one place.
 *
 * @param initial  Starting token count.
 * @param capacity Upper bound on the token count; zero means unbounded.
 * @param offset   Index of the place in every state and delta vector.
 */
@JsonPropertyOrder({ "initial", "capacity", "offset" })
public record PlaceState(long initial, long capacity, int offset) {

    public boolean unbounded() {
        return capacity == 0;
    }
}
