package com.tokenflow.ptn.engine;

import com.tokenflow.ptn.api.ArcKind;
import com.tokenflow.ptn.api.NodeHandle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pending arc declarations in the order they were made.
 *
 * Orientation is not checked here; the compiler classifies every arc when the
 * model is frozen.
 */
final class ArcLedger {
    private final List<Arc> arcs = new ArrayList<>();

    void append(Arc arc) {
        arcs.add(arc);
    }

    List<Arc> arcs() {
        return Collections.unmodifiableList(arcs);
    }

    int size() {
        return arcs.size();
    }

    void clear() {
        arcs.clear();
    }

    /** A weighted connection between two node handles. */
    record Arc(NodeHandle source, NodeHandle target, long weight, ArcKind kind) {
    }
}
