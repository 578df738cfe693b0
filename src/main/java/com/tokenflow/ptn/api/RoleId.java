package com.tokenflow.ptn.api;

import java.util.Objects;

/**
 * Authorization tag attached to a transition. Opaque to the compiler.
 */
public record RoleId(String name) {

    public RoleId {
        Objects.requireNonNull(name, "role name");
    }

    @Override
    public String toString() {
        return name;
    }
}
