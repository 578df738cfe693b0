package com.tokenflow.ptn.io;

import com.tokenflow.ptn.api.NetSnapshot;
import com.tokenflow.ptn.engine.NetModel;

import java.io.IOException;
import java.io.UncheckedIOException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Byte encoding of compiled nets.
 *
 * The payload is UTF-8 JSON holding the schema, places and transitions only:
 * <pre>
 * {"schema":"Counter",
 *  "places":{"p0":{"initial":1,"capacity":5,"offset":0}, ...},
 *  "transitions":{"INC0":{"delta":[2,0],"role":"default"}, ...}}
 * </pre>
 * Pending arcs, variables and the frozen flag are never written. Map order is
 * preserved in both directions, so decoding and re-encoding yields identical
 * bytes.
 */
public final class SnapshotCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private SnapshotCodec() {
        // Utility class
    }

    public static byte[] toBytes(NetSnapshot snapshot) {
        try {
            return MAPPER.writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode net " + snapshot.schema(), e);
        }
    }

    /** Exports a frozen model and encodes it. */
    public static byte[] toBytes(NetModel model) {
        return toBytes(model.export());
    }

    public static NetSnapshot fromBytes(byte[] payload) throws IOException {
        return MAPPER.readValue(payload, NetSnapshot.class);
    }

    /** Decodes a payload into a frozen model with no pending state. */
    public static NetModel importModel(byte[] payload) throws IOException {
        return NetModel.fromSnapshot(fromBytes(payload));
    }
}
