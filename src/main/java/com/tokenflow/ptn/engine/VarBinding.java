package com.tokenflow.ptn.engine;

import com.tokenflow.ptn.api.ArcDirection;
import com.tokenflow.ptn.api.NodeHandle;
import com.tokenflow.ptn.api.PlaceHandle;
import com.tokenflow.ptn.api.TransitionHandle;
import com.tokenflow.ptn.api.VarKind;

import java.util.function.LongSupplier;

/**
 * A deferred patch on a frozen net, declared with a fluent builder.
 *
 * <pre>
 * model.newVar().capacity("p0").bind(() -&gt; 5);
 * model.newVar().weight(inc0, p0).bind(() -&gt; 2);
 * </pre>
 *
 * Nothing is looked up when the variable is declared. Names are resolved and
 * the supplier is called exactly once, when the model applies its overlay.
 * Calling {@link #capacity}, {@link #initial} or {@link #weight} again retargets
 * the variable.
 */
public final class VarBinding {
    private final long modelId;

    private VarKind kind;
    private String source;
    private String target;
    // null means the direction is inferred from which endpoint is a transition
    private ArcDirection direction;
    private LongSupplier value;

    VarBinding(long modelId) {
        this.modelId = modelId;
    }

    /** Patches the capacity of the named place. */
    public VarBinding capacity(String place) {
        return retarget(VarKind.CAPACITY, null, place, null);
    }

    public VarBinding capacity(PlaceHandle place) {
        return capacity(owned(place).name());
    }

    /** Patches the initial token count of the named place. */
    public VarBinding initial(String place) {
        return retarget(VarKind.INITIAL, null, place, null);
    }

    public VarBinding initial(PlaceHandle place) {
        return initial(owned(place).name());
    }

    /**
     * Patches the weight of the arc between two named nodes. Whichever endpoint
     * names a transition decides the orientation, the source being tried first.
     */
    public VarBinding weight(String source, String target) {
        return retarget(VarKind.WEIGHT, source, target, null);
    }

    /** Patches a consuming arc. */
    public VarBinding weight(PlaceHandle source, TransitionHandle target) {
        return retarget(VarKind.WEIGHT, owned(source).name(), owned(target).name(),
                ArcDirection.PLACE_TO_TRANSITION);
    }

    /** Patches a producing arc. */
    public VarBinding weight(TransitionHandle source, PlaceHandle target) {
        return retarget(VarKind.WEIGHT, owned(source).name(), owned(target).name(),
                ArcDirection.TRANSITION_TO_PLACE);
    }

    /**
     * Binds the value supplier. A variable can be bound only once.
     *
     * @throws IllegalStateException if a supplier is already bound.
     */
    public VarBinding bind(LongSupplier supplier) {
        if (supplier == null)
            throw new IllegalArgumentException("supplier must not be null");
        if (value != null)
            throw new IllegalStateException("variable already bound: " + this);
        this.value = supplier;
        return this;
    }

    /** Binds a value known at declaration time. */
    public VarBinding bind(long constant) {
        return bind(() -> constant);
    }

    public VarKind kind() {
        return kind;
    }

    public String source() {
        return source;
    }

    public String target() {
        return target;
    }

    public ArcDirection direction() {
        return direction;
    }

    public boolean isBound() {
        return value != null;
    }

    LongSupplier supplier() {
        return value;
    }

    private VarBinding retarget(VarKind kind, String source, String target, ArcDirection direction) {
        this.kind = kind;
        this.source = source;
        this.target = target;
        this.direction = direction;
        return this;
    }

    private <H extends NodeHandle> H owned(H handle) {
        if (handle == null)
            throw new IllegalArgumentException("handle must not be null");
        if (handle.modelId() != modelId)
            throw new IllegalArgumentException("Handle " + handle.name() + " belongs to another model");
        return handle;
    }

    @Override
    public String toString() {
        if (kind == null)
            return "var(?)";
        return switch (kind) {
            case CAPACITY, INITIAL -> "var(" + kind + " " + target + ")";
            case WEIGHT -> "var(" + kind + " " + source + " -> " + target + ")";
        };
    }
}
