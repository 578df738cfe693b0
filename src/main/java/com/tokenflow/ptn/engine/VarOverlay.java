package com.tokenflow.ptn.engine;

import com.tokenflow.ptn.api.ArcDirection;
import com.tokenflow.ptn.api.NetModelException;
import com.tokenflow.ptn.api.VarKind;

import java.util.ArrayList;
import java.util.List;

import lombok.extern.log4j.Log4j2;

/**
 * Applies overlay variables to a frozen registry.
 *
 * Resolution happens in two passes. The first pass resolves every variable in
 * declaration order: names are looked up and each supplier is called exactly
 * once. Only if every variable resolves does the second pass write the values,
 * again in declaration order, so a later WEIGHT patch on the same pair wins.
 * Overlays rewrite values only; they never add places, transitions or slots.
 */
@Log4j2
final class VarOverlay {

    private VarOverlay() {
    }

    static int apply(NodeRegistry registry, List<VarBinding> vars) {
        List<Patch> patches = new ArrayList<>(vars.size());
        for (VarBinding v : vars)
            patches.add(resolve(registry, v));

        for (Patch p : patches) {
            switch (p.kind()) {
                case CAPACITY -> registry.place(p.place()).capacity = p.value();
                case INITIAL -> registry.place(p.place()).initial = p.value();
                case WEIGHT -> registry.transition(p.transition()).delta[p.place()] = p.value();
            }
        }
        return patches.size();
    }

    static Patch resolve(NodeRegistry registry, VarBinding v) {
        if (v.kind() == null)
            throw NetModelException.unresolved("Variable has no target: " + v);
        if (!v.isBound())
            throw NetModelException.unbound("Unbound variable: " + v);

        return switch (v.kind()) {
            case CAPACITY, INITIAL -> {
                int place = requirePlace(registry, v.target(), v);
                yield new Patch(v.kind(), place, -1, value(v));
            }
            case WEIGHT -> resolveWeight(registry, v);
        };
    }

    private static Patch resolveWeight(NodeRegistry registry, VarBinding v) {
        ArcDirection direction = v.direction();
        int transition;
        int place;

        if (direction == null) {
            if ((transition = registry.transitionIndexOf(v.source())) >= 0) {
                direction = ArcDirection.TRANSITION_TO_PLACE;
                place = requirePlace(registry, v.target(), v);
            } else if ((transition = registry.transitionIndexOf(v.target())) >= 0) {
                direction = ArcDirection.PLACE_TO_TRANSITION;
                place = requirePlace(registry, v.source(), v);
            } else {
                throw NetModelException.unresolved("Neither endpoint is a known transition: " + v);
            }
        } else if (direction == ArcDirection.TRANSITION_TO_PLACE) {
            transition = requireTransition(registry, v.source(), v);
            place = requirePlace(registry, v.target(), v);
        } else {
            place = requirePlace(registry, v.source(), v);
            transition = requireTransition(registry, v.target(), v);
        }

        long weight = value(v);
        log.debug("{} resolved as {} weight {}", v, direction, weight);
        return new Patch(VarKind.WEIGHT, place, transition, direction.signed(weight));
    }

    private static long value(VarBinding v) {
        long value = v.supplier().getAsLong();
        if (value < 0)
            throw NetModelException.invalidValue(v + " produced negative value " + value);
        return value;
    }

    private static int requirePlace(NodeRegistry registry, String name, VarBinding v) {
        int idx = registry.placeIndexOf(name);
        if (idx < 0)
            throw NetModelException.unresolved("Unknown place '" + name + "' in " + v);
        return idx;
    }

    private static int requireTransition(NodeRegistry registry, String name, VarBinding v) {
        int idx = registry.transitionIndexOf(name);
        if (idx < 0)
            throw NetModelException.unresolved("Unknown transition '" + name + "' in " + v);
        return idx;
    }

    /** A resolved write: a place field, or one delta slot when kind is WEIGHT. */
    record Patch(VarKind kind, int place, int transition, long value) {
    }
}
