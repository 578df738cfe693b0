package com.tokenflow.ptn.engine;

import com.tokenflow.ptn.api.PlaceHandle;
import com.tokenflow.ptn.api.RoleId;
import com.tokenflow.ptn.api.TransitionHandle;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Arena of declared places and transitions.
 *
 * Places and transitions live in dense lists; handles and arcs refer to them by
 * index. A place's index is its offset, assigned once in declaration order, so
 * offsets are always contiguous and zero-based. Re-declaring an identifier
 * rewrites the existing slot's values and keeps its index.
 */
final class NodeRegistry {
    private final long modelId;

    private final List<PlaceSlot> places = new ArrayList<>();
    private final Map<String, Integer> placeIndex = new HashMap<>();

    private final List<TransitionSlot> transitions = new ArrayList<>();
    private final Map<String, Integer> transitionIndex = new HashMap<>();

    NodeRegistry(long modelId) {
        this.modelId = modelId;
    }

    PlaceHandle declarePlace(String name, long initial, long capacity) {
        Integer existing = placeIndex.get(name);
        if (existing != null) {
            PlaceSlot slot = places.get(existing);
            slot.initial = initial;
            slot.capacity = capacity;
            return new PlaceHandle(modelId, existing, name);
        }
        int offset = places.size();
        places.add(new PlaceSlot(name, offset, initial, capacity));
        placeIndex.put(name, offset);
        return new PlaceHandle(modelId, offset, name);
    }

    TransitionHandle declareTransition(String name, RoleId role) {
        Integer existing = transitionIndex.get(name);
        if (existing != null) {
            transitions.get(existing).role = role;
            return new TransitionHandle(modelId, existing, name);
        }
        int idx = transitions.size();
        transitions.add(new TransitionSlot(name, role));
        transitionIndex.put(name, idx);
        return new TransitionHandle(modelId, idx, name);
    }

    int placeCount() {
        return places.size();
    }

    int transitionCount() {
        return transitions.size();
    }

    PlaceSlot place(int offset) {
        return places.get(offset);
    }

    TransitionSlot transition(int idx) {
        return transitions.get(idx);
    }

    /** Arena index of the named place, or -1. */
    int placeIndexOf(String name) {
        Integer idx = name == null ? null : placeIndex.get(name);
        return idx == null ? -1 : idx;
    }

    /** Arena index of the named transition, or -1. */
    int transitionIndexOf(String name) {
        Integer idx = name == null ? null : transitionIndex.get(name);
        return idx == null ? -1 : idx;
    }

    List<PlaceSlot> places() {
        return places;
    }

    List<TransitionSlot> transitions() {
        return transitions;
    }

    /** Mutable storage for one place. */
    static final class PlaceSlot {
        final String name;
        final int offset;
        long initial;
        long capacity;

        PlaceSlot(String name, int offset, long initial, long capacity) {
            this.name = name;
            this.offset = offset;
            this.initial = initial;
            this.capacity = capacity;
        }
    }

    /** Mutable storage for one transition. {@code delta} is null until freeze. */
    static final class TransitionSlot {
        final String name;
        RoleId role;
        long[] delta;
        // place offset -> inhibitor threshold, in arc order
        Map<Integer, Long> guards = new LinkedHashMap<>();

        TransitionSlot(String name, RoleId role) {
            this.name = name;
            this.role = role;
        }
    }
}
