package com.tokenflow.ptn;

import com.tokenflow.ptn.api.Evaluator;
import com.tokenflow.ptn.api.NetSnapshot;
import com.tokenflow.ptn.api.PlaceHandle;
import com.tokenflow.ptn.api.ReferenceEvaluator;
import com.tokenflow.ptn.api.RoleId;
import com.tokenflow.ptn.api.TransitionHandle;
import com.tokenflow.ptn.dsl.NetBuilder;
import com.tokenflow.ptn.dsl.NetDeclaration;
import com.tokenflow.ptn.engine.NetModel;
import org.junit.Test;

import static org.junit.Assert.*;

public class TokenNetTest {

    // counter net: two places, each with an increment and a decrement
    private static final NetDeclaration COUNTER = net -> {
        RoleId user = net.role("default");

        TransitionHandle dec0 = net.transition("DEC0", user);
        TransitionHandle dec1 = net.transition("DEC1", user);

        PlaceHandle p0 = net.arc(net.place("p0", 0), 1, dec0);
        PlaceHandle p1 = net.arc(net.place("p1", 1), 1, dec1);

        net.arc(net.transition("INC0", user), 1, p0);
        net.arc(net.transition("INC1", user), 1, p1);
    };

    private static NetBuilder counterWithOverlay() {
        NetBuilder net = NetBuilder.declare("Counter", COUNTER);
        net.var().capacity("p0").bind(() -> 5);
        net.var().initial("p0").bind(() -> 1);
        net.var().weight("INC0", "p0").bind(() -> 2);
        return net;
    }

    @Test
    public void testCounterStructure() {
        NetSnapshot snap = counterWithOverlay().build();

        assertArrayEquals(new long[] { 1, 1 }, snap.initialVector());
        assertEquals(5, snap.place("p0").capacity());
        assertEquals(0, snap.place("p1").capacity());
        assertArrayEquals(new long[] { 2, 0 }, snap.transition("INC0").deltaVector());
        assertArrayEquals(new long[] { 0, 1 }, snap.transition("INC1").deltaVector());
        assertArrayEquals(new long[] { -1, 0 }, snap.transition("DEC0").deltaVector());
        assertArrayEquals(new long[] { 0, -1 }, snap.transition("DEC1").deltaVector());
        assertEquals("default", snap.transition("INC0").role());
    }

    @Test
    public void testCounterDrivesEvaluator() {
        Evaluator sm = new ReferenceEvaluator(counterWithOverlay().build());
        long[] initial = sm.initialState();
        assertArrayEquals(new long[] { 1, 1 }, initial);

        Evaluator.Transformation once = sm.transform(initial, "INC0", 1);
        assertTrue(once.ok());
        assertArrayEquals(new long[] { 3, 1 }, once.state());

        Evaluator.Transformation atCapacity = sm.transform(initial, "INC0", 2);
        assertTrue(atCapacity.ok());
        assertArrayEquals(new long[] { 5, 1 }, atCapacity.state());

        Evaluator.Transformation over = sm.transform(initial, "INC0", 3);
        assertEquals("overflow", over.error());
        assertEquals(new RoleId("default"), over.role());
        assertArrayEquals(new long[] { 7, 1 }, over.state());
    }

    @Test
    public void testBytesRoundTrip() throws Exception {
        byte[] first = TokenNet.toBytes(TokenNet.compile("Counter", COUNTER));
        NetModel imported = TokenNet.fromBytes(first);

        assertTrue(imported.isFrozen());
        assertArrayEquals(first, TokenNet.toBytes(imported.export()));
    }

    @Test
    public void testPlaceCountMatchesDistinctIdentifiers() {
        NetBuilder net = TokenNet.builder("distinct");
        net.place("a");
        net.place("b");
        net.place("a", 4);
        net.place("c");

        NetSnapshot snap = net.build();
        assertEquals(3, snap.placeCount());
        assertEquals(0, snap.place("a").offset());
        assertEquals(1, snap.place("b").offset());
        assertEquals(2, snap.place("c").offset());
    }
}
