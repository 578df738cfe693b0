package com.tokenflow.ptn.engine;

import com.tokenflow.ptn.api.ArcKind;
import com.tokenflow.ptn.api.NetModelException;
import com.tokenflow.ptn.api.NetSnapshot;
import com.tokenflow.ptn.api.NodeHandle;
import com.tokenflow.ptn.api.PlaceHandle;
import com.tokenflow.ptn.api.PlaceState;
import com.tokenflow.ptn.api.RoleId;
import com.tokenflow.ptn.api.TransitionHandle;
import com.tokenflow.ptn.api.TransitionState;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import lombok.extern.log4j.Log4j2;

/**
 * A place/transition net moving from declaration to compiled form.
 *
 * Lifecycle:
 * <ol>
 * <li>Declare places, transitions, roles and arcs in any order. Arcs are only
 * recorded.</li>
 * <li>{@link #freeze()} compiles the arcs into delta vectors and locks the
 * shape. Freezing is one-way and idempotent.</li>
 * <li>{@link #applyOverlay()} resolves the pending variables and patches
 * capacities, initial counts and delta slots.</li>
 * <li>{@link #export()} projects the result into an immutable
 * {@link NetSnapshot}.</li>
 * </ol>
 *
 * A model rebuilt from a snapshot with {@link #fromSnapshot} is frozen from the
 * start, carries no pending arcs or variables, and accepts no new variables.
 *
 * Thread Safety: none. A model is owned by one builder thread until it is
 * exported; the exported snapshot may then be shared freely.
 */
@Log4j2
public final class NetModel {
    private static final AtomicLong MODEL_IDS = new AtomicLong();

    private final long id = MODEL_IDS.incrementAndGet();
    private final String schema;
    private final NodeRegistry registry = new NodeRegistry(id);
    private final ArcLedger ledger = new ArcLedger();
    private final List<VarBinding> vars = new ArrayList<>();

    private boolean frozen;
    private final boolean imported;

    private NetModel(String schema, boolean imported) {
        if (schema == null)
            throw new IllegalArgumentException("schema must not be null");
        this.schema = schema;
        this.imported = imported;
    }

    /** Creates an empty, unfrozen model. */
    public static NetModel create(String schema) {
        return new NetModel(schema, false);
    }

    /**
     * Rebuilds a frozen model from an exported snapshot.
     *
     * @throws IllegalArgumentException if the snapshot's offsets are not
     *                                  contiguous or a delta has the wrong length.
     */
    public static NetModel fromSnapshot(NetSnapshot snapshot) {
        NetModel m = new NetModel(snapshot.schema(), true);
        int n = snapshot.placeCount();

        String[] byOffset = new String[n];
        for (Map.Entry<String, PlaceState> e : snapshot.places().entrySet()) {
            int offset = e.getValue().offset();
            if (offset < 0 || offset >= n || byOffset[offset] != null)
                throw new IllegalArgumentException("Snapshot place offsets are not contiguous at " + e.getKey());
            byOffset[offset] = e.getKey();
        }
        for (String name : byOffset) {
            PlaceState p = snapshot.place(name);
            m.registry.declarePlace(name, p.initial(), p.capacity());
        }

        for (Map.Entry<String, TransitionState> e : snapshot.transitions().entrySet()) {
            TransitionState t = e.getValue();
            if (t.delta().size() != n)
                throw new IllegalArgumentException("Delta of " + e.getKey() + " has length " + t.delta().size()
                        + ", expected " + n);
            TransitionHandle h = m.registry.declareTransition(e.getKey(), t.roleId());
            NodeRegistry.TransitionSlot slot = m.registry.transition(h.index());
            slot.delta = t.deltaVector();
            for (Map.Entry<String, Long> g : t.guards().entrySet()) {
                int place = m.registry.placeIndexOf(g.getKey());
                if (place < 0)
                    throw new IllegalArgumentException("Guard on " + e.getKey() + " names unknown place " + g.getKey());
                slot.guards.put(place, g.getValue());
            }
        }
        m.frozen = true;
        log.info("Loaded frozen net '{}' with {} places and {} transitions", m.schema, n,
                m.registry.transitionCount());
        return m;
    }

    // ── Declaration ──────────────────────────────────────────────

    public RoleId declareRole(String name) {
        checkNotFrozen();
        if (name == null)
            throw new IllegalArgumentException("role name must not be null");
        return new RoleId(name);
    }

    /**
     * Declares a place, or rewrites the values of an existing place of the same
     * name without changing its offset.
     *
     * @param capacity Upper bound on the token count; zero means unbounded.
     */
    public PlaceHandle declarePlace(String name, long initial, long capacity) {
        checkNotFrozen();
        if (name == null)
            throw new IllegalArgumentException("place name must not be null");
        requireUnsigned("initial of " + name, initial);
        requireUnsigned("capacity of " + name, capacity);
        return registry.declarePlace(name, initial, capacity);
    }

    /** Declares a transition, or rewrites the role of an existing one. */
    public TransitionHandle declareTransition(String name, RoleId role) {
        checkNotFrozen();
        if (name == null)
            throw new IllegalArgumentException("transition name must not be null");
        if (role == null)
            throw new IllegalArgumentException("transition " + name + " needs a role");
        return registry.declareTransition(name, role);
    }

    /**
     * Records an arc. Normal arcs are not classified until freeze; an inhibitor
     * must run from a place to a transition and is rejected here otherwise.
     */
    public void addArc(NodeHandle source, NodeHandle target, long weight, ArcKind kind) {
        checkNotFrozen();
        checkOwned(source);
        checkOwned(target);
        requireUnsigned("arc weight", weight);
        if (kind == ArcKind.INHIBITOR && (!source.isPlace() || !target.isTransition()))
            throw NetModelException.malformedArc("Inhibitor arcs must run from a place to a transition: "
                    + source.name() + " -> " + target.name());
        ledger.append(new ArcLedger.Arc(source, target, weight, kind == null ? ArcKind.NORMAL : kind));
    }

    /**
     * Declares an overlay variable. Variables may be declared before or after
     * freeze; they are resolved by {@link #applyOverlay()}.
     */
    public VarBinding newVar() {
        if (imported)
            throw NetModelException.alreadyFrozen("Model '" + schema + "' was loaded from a snapshot; overlay is unavailable");
        VarBinding v = new VarBinding(id);
        vars.add(v);
        return v;
    }

    // ── Compilation ──────────────────────────────────────────────

    /**
     * Compiles the arc ledger into delta vectors and locks the model's shape.
     * Calling it again on a frozen model does nothing.
     *
     * @throws NetModelException MALFORMED_ARC if an arc does not join a place and a
     *                           transition. The model then stays unfrozen and
     *                           unchanged, but the offending arc cannot be removed.
     */
    public NetModel freeze() {
        if (frozen) {
            log.debug("Net '{}' already frozen", schema);
            return this;
        }
        DeltaCompiler.compile(registry, ledger.arcs());
        ledger.clear();
        frozen = true;
        log.info("Froze net '{}': {} places, {} transitions", schema, registry.placeCount(),
                registry.transitionCount());
        return this;
    }

    /**
     * Resolves and applies every pending variable, in declaration order. Applied
     * variables are dropped, so a second call with nothing new is a no-op.
     *
     * @throws NetModelException NOT_FROZEN before freeze; UNRESOLVED_REFERENCE,
     *                           UNBOUND_VARIABLE or INVALID_VALUE if any variable
     *                           fails, in which case nothing is applied.
     */
    public NetModel applyOverlay() {
        checkFrozen("applyOverlay");
        if (vars.isEmpty())
            return this;
        int applied = VarOverlay.apply(registry, vars);
        vars.clear();
        log.info("Applied {} overlay variables to net '{}'", applied, schema);
        return this;
    }

    // ── Export ───────────────────────────────────────────────────

    /**
     * Projects the model into an immutable snapshot. Pending variables are not
     * applied; call {@link #applyOverlay()} first.
     */
    public NetSnapshot export() {
        checkFrozen("export");
        Map<String, PlaceState> places = new LinkedHashMap<>();
        for (NodeRegistry.PlaceSlot p : registry.places())
            places.put(p.name, new PlaceState(p.initial, p.capacity, p.offset));

        Map<String, TransitionState> transitions = new LinkedHashMap<>();
        for (NodeRegistry.TransitionSlot t : registry.transitions()) {
            Map<String, Long> guards = new LinkedHashMap<>();
            for (Map.Entry<Integer, Long> g : t.guards.entrySet())
                guards.put(registry.place(g.getKey()).name, g.getValue());
            transitions.put(t.name, TransitionState.of(t.delta, t.role.name(), guards));
        }
        return new NetSnapshot(schema, places, transitions);
    }

    // ── Queries ──────────────────────────────────────────────────

    public String schema() {
        return schema;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean isImported() {
        return imported;
    }

    public int placeCount() {
        return registry.placeCount();
    }

    public int transitionCount() {
        return registry.transitionCount();
    }

    public int pendingArcCount() {
        return ledger.size();
    }

    public List<VarBinding> pendingVars() {
        return Collections.unmodifiableList(vars);
    }

    /** Offset of the named place. */
    public int offsetOf(String place) {
        int idx = registry.placeIndexOf(place);
        if (idx < 0)
            throw NetModelException.unresolved("Unknown place: " + place);
        return idx;
    }

    /** Returns a copy of the named transition's delta vector. */
    public long[] delta(String transition) {
        checkFrozen("delta");
        int idx = registry.transitionIndexOf(transition);
        if (idx < 0)
            throw NetModelException.unresolved("Unknown transition: " + transition);
        return Arrays.copyOf(registry.transition(idx).delta, registry.placeCount());
    }

    private void checkNotFrozen() {
        if (frozen)
            throw NetModelException.alreadyFrozen("Net '" + schema + "' is frozen and cannot be altered");
    }

    private void checkFrozen(String operation) {
        if (!frozen)
            throw NetModelException.notFrozen(operation + " requires a frozen net: '" + schema + "'");
    }

    private void checkOwned(NodeHandle handle) {
        if (handle == null)
            throw new IllegalArgumentException("handle must not be null");
        if (handle.modelId() != id)
            throw new IllegalArgumentException("Handle " + handle.name() + " belongs to another model");
    }

    private static void requireUnsigned(String what, long value) {
        if (value < 0)
            throw NetModelException.invalidValue(what + " must not be negative: " + value);
    }
}
