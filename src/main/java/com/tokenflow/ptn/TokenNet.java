package com.tokenflow.ptn;

import com.tokenflow.ptn.api.NetSnapshot;
import com.tokenflow.ptn.dsl.NetBuilder;
import com.tokenflow.ptn.dsl.NetDeclaration;
import com.tokenflow.ptn.engine.NetModel;
import com.tokenflow.ptn.io.JsonNetLoader;
import com.tokenflow.ptn.io.SnapshotCodec;

import java.io.IOException;
import java.nio.file.Path;

/**
 * TokenNet -- declarative place/transition nets compiled to delta vectors.
 *
 * <h2>Model</h2>
 * <ul>
 * <li><b>Places</b> hold a bounded token count and own one slot of the state
 * vector.</li>
 * <li><b>Transitions</b> carry a role and, once compiled, a signed delta vector
 * with one entry per place.</li>
 * <li><b>Arcs</b> join a place and a transition. They are only recorded while
 * the net is declared and are folded into delta vectors when it is
 * frozen.</li>
 * <li><b>Variables</b> patch capacities, initial counts or arc weights after
 * freeze, without touching the net's shape.</li>
 * </ul>
 *
 * The result is a {@link NetSnapshot}, the immutable input of an
 * {@link com.tokenflow.ptn.api.Evaluator}.
 */
public final class TokenNet {

    private TokenNet() {
        // Prevent instantiation of utility class
    }

    /** Entry point: create a new net builder. */
    public static NetBuilder builder(String schema) {
        return NetBuilder.create(schema);
    }

    /** Declares, compiles, overlays and exports a net in one step. */
    public static NetSnapshot compile(String schema, NetDeclaration declaration) {
        return NetBuilder.declare(schema, declaration).build();
    }

    /** Compiles the JSON net definition at {@code path}. */
    public static NetSnapshot load(Path path) throws IOException {
        return JsonNetLoader.load(path);
    }

    public static byte[] toBytes(NetSnapshot snapshot) {
        return SnapshotCodec.toBytes(snapshot);
    }

    /** Rebuilds a frozen model from {@link #toBytes} output. */
    public static NetModel fromBytes(byte[] payload) throws IOException {
        return SnapshotCodec.importModel(payload);
    }
}
