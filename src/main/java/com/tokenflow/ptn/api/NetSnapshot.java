package com.tokenflow.ptn.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Compiled, overlaid projection of a net, handed to an {@link Evaluator}.
 *
 * A snapshot is always the result of a freeze: every transition carries a delta
 * vector whose length equals {@link #placeCount()}. It holds no pending arcs or
 * variables and is deeply immutable, so it may be shared between threads and
 * evaluators without coordination.
 *
 * Map iteration order is part of the value: places iterate in offset order and
 * transitions in declaration order, which keeps the byte encoding stable across
 * export and import.
 */
@JsonPropertyOrder({ "schema", "places", "transitions" })
public record NetSnapshot(String schema, Map<String, PlaceState> places,
        Map<String, TransitionState> transitions) {

    public NetSnapshot {
        places = places == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(places));
        transitions = transitions == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
    }

    public int placeCount() {
        return places.size();
    }

    public PlaceState place(String id) {
        return places.get(id);
    }

    public TransitionState transition(String id) {
        return transitions.get(id);
    }

    /** Initial token counts indexed by place offset. */
    public long[] initialVector() {
        long[] out = new long[places.size()];
        for (PlaceState p : places.values())
            out[p.offset()] = p.initial();
        return out;
    }

    /** Capacities indexed by place offset; zero entries are unbounded. */
    public long[] capacityVector() {
        long[] out = new long[places.size()];
        for (PlaceState p : places.values())
            out[p.offset()] = p.capacity();
        return out;
    }
}
