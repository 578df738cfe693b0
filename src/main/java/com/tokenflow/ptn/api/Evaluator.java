package com.tokenflow.ptn.api;

/**
 * Execution engine that fires transitions against a state vector.
 *
 * Evaluators are built from an exported
 * {@link NetSnapshot}. This library never fires
 * transitions itself; it only guarantees that the snapshot has the shape an
 * evaluator expects:
 *
 * 1. Places carry contiguous zero-based offsets, which are the indices of the
 * state vector.
 *
 * 2. Every transition's delta vector has exactly one slot per place, in offset
 * order.
 *
 * 3. Capacity zero means the place is unbounded.
 *
 * A snapshot is immutable, so any number of evaluators may share one.
 */
public interface Evaluator {

    /** Returns a fresh copy of the initial state vector. */
    long[] initialState();

    /**
     * Applies {@code multiplier} firings of {@code action} to {@code state}.
     *
     * @param state      Current state vector, indexed by place offset.
     * @param action     Transition identifier.
     * @param multiplier Number of times the delta is applied.
     * @return The raw next state, the role the action requires, and the error if
     *         the result is not a legal state.
     */
    Transformation transform(long[] state, String action, long multiplier);

    /**
     * Result of one {@link #transform} call. {@code error} is null when the new
     * state is valid; the state is returned unclamped either way.
     */
    record Transformation(long[] state, RoleId role, String error) {

        public boolean ok() {
            return error == null;
        }
    }
}
