package com.tokenflow.ptn.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Exported state of one transition.
 *
 * @param delta  Net token change per place for a single firing, indexed by place
 *               offset.
 * @param role   Role required to fire the transition.
 * @param guards Inhibitor thresholds by place identifier. Omitted from the wire
 *               form when empty.
 */
@JsonPropertyOrder({ "delta", "role", "guards" })
public record TransitionState(List<Long> delta, String role,
        @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Long> guards) {

    public TransitionState {
        delta = delta == null ? List.of() : List.copyOf(delta);
        guards = guards == null || guards.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(guards));
    }

    public static TransitionState of(long[] delta, String role, Map<String, Long> guards) {
        return new TransitionState(boxed(delta), role, guards);
    }

    /** Returns a copy of the delta as a primitive vector. */
    public long[] deltaVector() {
        long[] out = new long[delta.size()];
        for (int i = 0; i < out.length; i++)
            out[i] = delta.get(i);
        return out;
    }

    public RoleId roleId() {
        return new RoleId(role);
    }

    private static List<Long> boxed(long[] delta) {
        Long[] boxed = new Long[delta.length];
        for (int i = 0; i < delta.length; i++)
            boxed[i] = delta[i];
        return List.of(boxed);
    }
}
