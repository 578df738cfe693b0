package com.tokenflow.ptn.io;

import com.tokenflow.ptn.api.NetModelException;
import com.tokenflow.ptn.api.NetSnapshot;
import com.tokenflow.ptn.api.NodeHandle;
import com.tokenflow.ptn.api.RoleId;
import com.tokenflow.ptn.api.VarKind;
import com.tokenflow.ptn.dsl.NetBuilder;
import com.tokenflow.ptn.engine.VarBinding;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.log4j.Log4j2;

/**
 * Declares a net from a JSON {@link NetDefinition}.
 *
 * Places and transitions are declared first, in file order, so arcs and
 * variables may name nodes that appear anywhere in the file. Transition roles
 * are declared on first use; the optional {@code roles} list only fixes their
 * declaration order.
 */
@Log4j2
public final class JsonNetLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonNetLoader() {
        // Utility class
    }

    /** Parses a JSON file into a NetDefinition. */
    public static NetDefinition parseFile(Path path) throws IOException {
        return MAPPER.readValue(Files.readAllBytes(path), NetDefinition.class);
    }

    /** Parses a JSON string into a NetDefinition. */
    public static NetDefinition parse(String json) throws IOException {
        return MAPPER.readValue(json, NetDefinition.class);
    }

    /** Reads, compiles, overlays and exports the net in {@code path}. */
    public static NetSnapshot load(Path path) throws IOException {
        NetSnapshot snapshot = declare(parseFile(path)).build();
        log.info("Loaded net '{}' from {}", snapshot.schema(), path);
        return snapshot;
    }

    /**
     * Declares the definition on a fresh builder without freezing it, so the
     * caller may add arcs or bind variables in code before building.
     */
    public static NetBuilder declare(NetDefinition def) {
        NetDefinition.NetInfo info = def.getNet();
        if (info == null)
            throw new IllegalArgumentException("Missing 'net' key");
        if (info.getSchema() == null)
            throw new IllegalArgumentException("Net definition has no schema");

        NetBuilder net = NetBuilder.create(info.getSchema());
        Map<String, RoleId> roles = new HashMap<>();
        Map<String, NodeHandle> nodes = new HashMap<>();

        for (String role : orEmpty(info.getRoles()))
            roles.computeIfAbsent(role, net::role);

        for (NetDefinition.PlaceDef p : orEmpty(info.getPlaces()))
            nodes.put(p.getName(), net.place(p.getName(), p.getInitial(), p.getCapacity()));

        for (NetDefinition.TransitionDef t : orEmpty(info.getTransitions())) {
            if (t.getRole() == null)
                throw new IllegalArgumentException("Transition " + t.getName() + " has no role");
            if (nodes.containsKey(t.getName()) && nodes.get(t.getName()).isPlace())
                throw new IllegalArgumentException("Name used for both a place and a transition: " + t.getName());
            RoleId role = roles.computeIfAbsent(t.getRole(), net::role);
            nodes.put(t.getName(), net.transition(t.getName(), role));
        }

        for (NetDefinition.ArcDef a : orEmpty(info.getArcs())) {
            NodeHandle source = requireNode(nodes, a.getSource());
            NodeHandle target = requireNode(nodes, a.getTarget());
            if (a.isInhibitor())
                net.inhibitor(source, a.getWeight(), target);
            else
                net.arc(source, a.getWeight(), target);
        }

        for (NetDefinition.VarDef v : orEmpty(info.getVars()))
            declareVar(net.var(), v);

        log.debug("Declared net '{}' from definition: {} nodes", info.getSchema(), nodes.size());
        return net;
    }

    private static void declareVar(VarBinding var, NetDefinition.VarDef v) {
        if (v.getKind() == null)
            throw new IllegalArgumentException("Variable without kind: " + v);
        VarKind kind;
        try {
            kind = VarKind.valueOf(v.getKind().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown variable kind: " + v.getKind(), e);
        }
        switch (kind) {
            case CAPACITY -> var.capacity(v.getTarget());
            case INITIAL -> var.initial(v.getTarget());
            case WEIGHT -> var.weight(v.getSource(), v.getTarget());
        }
        if (v.getValue() != null)
            var.bind(v.getValue());
    }

    private static NodeHandle requireNode(Map<String, NodeHandle> nodes, String name) {
        NodeHandle h = nodes.get(name);
        if (h == null)
            throw NetModelException.unresolved("Arc names unknown node: " + name);
        return h;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }
}
