package com.tokenflow.ptn.engine;

import com.tokenflow.ptn.api.ArcKind;
import com.tokenflow.ptn.api.NetModelException;
import com.tokenflow.ptn.api.NodeHandle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Folds the arc ledger into per-transition delta vectors.
 *
 * Every transition gets a zero-filled vector with one slot per place. Each
 * normal arc then writes its signed weight into the slot of its place:
 * place to transition writes {@code -weight}, transition to place writes
 * {@code +weight}. A later arc on the same (place, transition) pair overwrites
 * the slot; contributions never accumulate.
 *
 * Inhibitor arcs write nothing to the delta. They become guards on the
 * transition, keyed by place offset.
 *
 * Vectors are built off to the side and installed only once every arc has been
 * classified, so a malformed arc leaves the registry untouched.
 */
@Log4j2
final class DeltaCompiler {

    private DeltaCompiler() {
    }

    static void compile(NodeRegistry registry, List<ArcLedger.Arc> arcs) {
        int placeCount = registry.placeCount();
        int transitionCount = registry.transitionCount();

        long[][] deltas = new long[transitionCount][placeCount];
        List<Map<Integer, Long>> guards = new ArrayList<>(transitionCount);
        for (int i = 0; i < transitionCount; i++)
            guards.add(new LinkedHashMap<>());

        for (ArcLedger.Arc arc : arcs) {
            NodeHandle src = arc.source();
            NodeHandle dst = arc.target();

            if (arc.kind() == ArcKind.INHIBITOR) {
                if (!src.isPlace() || !dst.isTransition())
                    throw NetModelException.malformedArc(describe(arc) + ": inhibitor must run place -> transition");
                guards.get(dst.index()).put(src.index(), arc.weight());
                log.debug("guard {} -> {} threshold {}", src.name(), dst.name(), arc.weight());
            } else if (src.isPlace() && dst.isTransition()) {
                deltas[dst.index()][src.index()] = -arc.weight();
            } else if (src.isTransition() && dst.isPlace()) {
                deltas[src.index()][dst.index()] = arc.weight();
            } else {
                throw NetModelException.malformedArc(describe(arc) + ": arc must join a place and a transition");
            }
        }

        for (int i = 0; i < transitionCount; i++) {
            NodeRegistry.TransitionSlot slot = registry.transition(i);
            slot.delta = deltas[i];
            slot.guards = guards.get(i);
        }
        log.debug("Compiled {} arcs into {} delta vectors of length {}", arcs.size(), transitionCount, placeCount);
    }

    private static String describe(ArcLedger.Arc arc) {
        return "bad arc " + arc.source().kind() + "(" + arc.source().name() + ") -> "
                + arc.target().kind() + "(" + arc.target().name() + ")";
    }
}
