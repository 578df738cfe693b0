package com.tokenflow.ptn.dsl;

import com.tokenflow.ptn.api.ArcKind;
import com.tokenflow.ptn.api.NetSnapshot;
import com.tokenflow.ptn.api.NodeHandle;
import com.tokenflow.ptn.api.PlaceHandle;
import com.tokenflow.ptn.api.RoleId;
import com.tokenflow.ptn.api.TransitionHandle;
import com.tokenflow.ptn.engine.NetModel;
import com.tokenflow.ptn.engine.VarBinding;

/**
 * Net Builder -- the user-facing API for declaring token-flow nets.
 *
 * Usage Pattern:
 * 1. Create a builder: NetBuilder net = NetBuilder.create("Counter");
 * 2. Declare roles, places and transitions: var p0 = net.place("p0", 0);
 * 3. Connect them: net.arc(p0, 1, dec0); net.arc(inc0, 1, p0);
 * 4. Optionally declare overlay variables: net.var().capacity("p0").bind(() -> 5);
 * 5. Build: NetSnapshot snapshot = net.build();
 *
 * Arc direction is taken from the kinds of the two handles, not from argument
 * order: the place end and the transition end are identified at freeze time.
 */
public final class NetBuilder {
    private final NetModel model;

    private NetBuilder(String schema) {
        this.model = NetModel.create(schema);
    }

    public static NetBuilder create(String schema) {
        return new NetBuilder(schema);
    }

    /** Creates a builder and runs {@code declaration} against it. */
    public static NetBuilder declare(String schema, NetDeclaration declaration) {
        NetBuilder net = create(schema);
        declaration.declare(net);
        return net;
    }

    // ── Nodes ────────────────────────────────────────────────────

    public RoleId role(String name) {
        return model.declareRole(name);
    }

    /** Declares an empty, unbounded place. */
    public PlaceHandle place(String name) {
        return place(name, 0, 0);
    }

    /** Declares an unbounded place. */
    public PlaceHandle place(String name, long initial) {
        return place(name, initial, 0);
    }

    /**
     * @param capacity Upper bound on the token count; zero means unbounded.
     */
    public PlaceHandle place(String name, long initial, long capacity) {
        return model.declarePlace(name, initial, capacity);
    }

    public TransitionHandle transition(String name, RoleId role) {
        return model.declareTransition(name, role);
    }

    // ── Arcs ─────────────────────────────────────────────────────

    /**
     * Connects {@code node} and {@code other} with a normal arc and returns
     * {@code node}, so a declaration can be chained:
     * {@code net.arc(net.place("p0", 0), 1, dec0)}.
     */
    public <N extends NodeHandle> N arc(N node, long weight, NodeHandle other) {
        model.addArc(node, other, weight, ArcKind.NORMAL);
        return node;
    }

    /**
     * Guards the transition end on the place end with an inhibitor arc. Only the
     * place to transition orientation is legal; anything else fails
     * immediately rather than at freeze.
     */
    public <N extends NodeHandle> N inhibitor(N node, long weight, NodeHandle other) {
        model.addArc(node, other, weight, ArcKind.INHIBITOR);
        return node;
    }

    // ── Variables ────────────────────────────────────────────────

    public VarBinding var() {
        return model.newVar();
    }

    // ── Build ────────────────────────────────────────────────────

    public NetModel freeze() {
        return model.freeze();
    }

    /**
     * Freezes the net, applies every pending variable and exports the result.
     */
    public NetSnapshot build() {
        return model.freeze().applyOverlay().export();
    }

    /** The model under construction. */
    public NetModel model() {
        return model;
    }
}
