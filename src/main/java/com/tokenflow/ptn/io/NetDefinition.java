package com.tokenflow.ptn.io;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a declarative net, as read from JSON.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NetDefinition {
    private NetInfo net;

    /** The net body. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NetInfo {
        private String schema;
        private List<String> roles;
        private List<PlaceDef> places;
        private List<TransitionDef> transitions;
        private List<ArcDef> arcs;
        private List<VarDef> vars;
    }

    /** A place; capacity 0 means unbounded. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PlaceDef {
        private String name;
        private long initial;
        private long capacity;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class TransitionDef {
        private String name, role;
    }

    /** An arc between two node names; orientation comes from the node kinds. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ArcDef {
        private String source, target;
        private long weight = 1;
        private boolean inhibitor;
    }

    /**
     * An overlay variable. {@code kind} is one of capacity, initial or weight;
     * capacity and initial use {@code target} only. A missing value leaves the
     * variable unbound.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class VarDef {
        private String kind, source, target;
        private Long value;
    }
}
