package com.tokenflow.ptn.api;

import com.tokenflow.ptn.dsl.NetBuilder;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ReferenceEvaluatorTest {

    private Evaluator evaluator;

    @Before
    public void setUp() {
        NetBuilder net = NetBuilder.create("Mutex");
        RoleId user = net.role("user");
        PlaceHandle free = net.place("free", 1, 1);
        PlaceHandle held = net.place("held", 0, 1);
        PlaceHandle stop = net.place("stop");
        TransitionHandle acquire = net.transition("acquire", user);
        TransitionHandle release = net.transition("release", user);
        net.arc(free, 1, acquire);
        net.arc(acquire, 1, held);
        net.arc(held, 1, release);
        net.arc(release, 1, free);
        net.inhibitor(stop, 1, acquire);
        evaluator = new ReferenceEvaluator(net.build());
    }

    @Test
    public void testInitialStateIsCopy() {
        long[] s = evaluator.initialState();
        s[0] = 42;
        assertArrayEquals(new long[] { 1, 0, 0 }, evaluator.initialState());
    }

    @Test
    public void testFireAndUnderflow() {
        Evaluator.Transformation r = evaluator.transform(evaluator.initialState(), "acquire", 1);
        assertTrue(r.ok());
        assertArrayEquals(new long[] { 0, 1, 0 }, r.state());
        assertEquals(new RoleId("user"), r.role());

        Evaluator.Transformation again = evaluator.transform(r.state(), "acquire", 1);
        assertEquals("underflow", again.error());
        assertArrayEquals(new long[] { -1, 2, 0 }, again.state());
    }

    @Test
    public void testGuardBlocksFiring() {
        Evaluator.Transformation r = evaluator.transform(new long[] { 1, 0, 1 }, "acquire", 1);
        assertEquals("inhibited", r.error());
    }
}
