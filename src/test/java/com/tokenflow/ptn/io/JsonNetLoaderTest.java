package com.tokenflow.ptn.io;

import com.tokenflow.ptn.api.NetModelException;
import com.tokenflow.ptn.api.NetSnapshot;
import com.tokenflow.ptn.dsl.NetBuilder;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import static org.junit.Assert.*;

public class JsonNetLoaderTest {

    private static final String COUNTER = """
            {
              "net": {
                "schema": "Counter",
                "roles": ["default"],
                "transitions": [
                  {"name": "DEC0", "role": "default"},
                  {"name": "INC0", "role": "default"}
                ],
                "places": [
                  {"name": "p0", "initial": 0},
                  {"name": "p1", "initial": 1, "capacity": 3}
                ],
                "arcs": [
                  {"source": "p0", "target": "DEC0"},
                  {"source": "INC0", "target": "p0", "weight": 1},
                  {"source": "p1", "target": "INC0", "inhibitor": true}
                ],
                "vars": [
                  {"kind": "capacity", "target": "p0", "value": 5},
                  {"kind": "weight", "source": "INC0", "target": "p0", "value": 2}
                ]
              }
            }
            """;

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test
    public void testParseAndBuild() throws Exception {
        NetSnapshot snap = JsonNetLoader.declare(JsonNetLoader.parse(COUNTER)).build();

        assertEquals("Counter", snap.schema());
        assertEquals(2, snap.placeCount());
        assertEquals(5, snap.place("p0").capacity());
        assertEquals(3, snap.place("p1").capacity());
        assertArrayEquals(new long[] { 0, 1 }, snap.initialVector());
        assertArrayEquals(new long[] { -1, 0 }, snap.transition("DEC0").deltaVector());
        assertArrayEquals(new long[] { 2, 0 }, snap.transition("INC0").deltaVector());
        assertEquals(Long.valueOf(1), snap.transition("INC0").guards().get("p1"));
        assertEquals("default", snap.transition("INC0").role());
    }

    @Test
    public void testLoadFromFile() throws Exception {
        File f = tmp.newFile("counter.json");
        Files.writeString(f.toPath(), COUNTER, StandardCharsets.UTF_8);

        NetSnapshot snap = JsonNetLoader.load(f.toPath());
        assertEquals(2, snap.transitions().size());
    }

    @Test
    public void testVarWithoutValueCanBeBoundInCode() throws Exception {
        String json = """
                {"net": {"schema": "s",
                  "places": [{"name": "p"}],
                  "vars": [{"kind": "initial", "target": "p"}]}}
                """;
        NetBuilder net = JsonNetLoader.declare(JsonNetLoader.parse(json));
        net.model().pendingVars().get(0).bind(() -> 8);

        assertEquals(8, net.build().place("p").initial());
    }

    @Test
    public void testVarWithoutValueIsUnbound() throws Exception {
        String json = """
                {"net": {"schema": "s",
                  "places": [{"name": "p"}],
                  "vars": [{"kind": "initial", "target": "p"}]}}
                """;
        try {
            JsonNetLoader.declare(JsonNetLoader.parse(json)).build();
            fail("Expected NetModelException");
        } catch (NetModelException e) {
            assertEquals(NetModelException.Kind.UNBOUND_VARIABLE, e.kind());
        }
    }

    @Test
    public void testArcToUnknownNode() throws Exception {
        String json = """
                {"net": {"schema": "s",
                  "places": [{"name": "p"}],
                  "arcs": [{"source": "p", "target": "ghost"}]}}
                """;
        try {
            JsonNetLoader.declare(JsonNetLoader.parse(json));
            fail("Expected NetModelException");
        } catch (NetModelException e) {
            assertEquals(NetModelException.Kind.UNRESOLVED_REFERENCE, e.kind());
        }
    }

    @Test
    public void testPlaceToPlaceArcFailsOnBuild() throws Exception {
        String json = """
                {"net": {"schema": "s",
                  "places": [{"name": "a"}, {"name": "b"}],
                  "arcs": [{"source": "a", "target": "b"}]}}
                """;
        NetBuilder net = JsonNetLoader.declare(JsonNetLoader.parse(json));
        try {
            net.build();
            fail("Expected NetModelException");
        } catch (NetModelException e) {
            assertEquals(NetModelException.Kind.MALFORMED_ARC, e.kind());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownVarKind() throws Exception {
        String json = """
                {"net": {"schema": "s",
                  "places": [{"name": "p"}],
                  "vars": [{"kind": "colour", "target": "p", "value": 1}]}}
                """;
        JsonNetLoader.declare(JsonNetLoader.parse(json));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingNetKey() throws Exception {
        JsonNetLoader.declare(JsonNetLoader.parse("{\"graph\": {}}"));
    }
}
