package com.tokenflow.ptn.api;

/**
 * Raised when a net declaration, compilation or overlay cannot be completed.
 *
 * Every condition is a configuration defect rather than a transient failure, so
 * there is nothing to retry. The {@link Kind} tells the caller which rule was
 * broken; the model is left exactly as it was before the failing call.
 */
public class NetModelException extends RuntimeException {

    /** The rule that was violated. */
    public enum Kind {
        /** Arc endpoints are not one place and one transition, or an inhibitor is mis-oriented. */
        MALFORMED_ARC,
        /** An overlay variable names a place or transition the model does not have. */
        UNRESOLVED_REFERENCE,
        /** An overlay variable was never given a value supplier. */
        UNBOUND_VARIABLE,
        /** A structural declaration was attempted on a frozen model. */
        ALREADY_FROZEN,
        /** An operation that needs compiled delta vectors ran before freeze. */
        NOT_FROZEN,
        /** A weight, capacity or initial count is negative. */
        INVALID_VALUE
    }

    private final Kind kind;

    public NetModelException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static NetModelException malformedArc(String message) {
        return new NetModelException(Kind.MALFORMED_ARC, message);
    }

    public static NetModelException unresolved(String message) {
        return new NetModelException(Kind.UNRESOLVED_REFERENCE, message);
    }

    public static NetModelException unbound(String message) {
        return new NetModelException(Kind.UNBOUND_VARIABLE, message);
    }

    public static NetModelException alreadyFrozen(String message) {
        return new NetModelException(Kind.ALREADY_FROZEN, message);
    }

    public static NetModelException notFrozen(String message) {
        return new NetModelException(Kind.NOT_FROZEN, message);
    }

    public static NetModelException invalidValue(String message) {
        return new NetModelException(Kind.INVALID_VALUE, message);
    }
}
