package com.tokenflow.ptn.dsl;

/**
 * A reusable net declaration, applied to a fresh builder.
 *
 * <pre>
 * NetDeclaration counter = net -&gt; {
 *     RoleId user = net.role("default");
 *     TransitionHandle dec0 = net.transition("DEC0", user);
 *     net.arc(net.place("p0", 0), 1, dec0);
 * };
 * NetSnapshot snapshot = NetBuilder.declare("Counter", counter).build();
 * </pre>
 */
@FunctionalInterface
public interface NetDeclaration {
    void declare(NetBuilder net);
}
