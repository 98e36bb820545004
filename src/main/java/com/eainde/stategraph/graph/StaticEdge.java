package com.eainde.stategraph.graph;

import java.util.Objects;
import java.util.Set;

public record StaticEdge(String from, String to) implements Edge {

    public StaticEdge {
        Objects.requireNonNull(from, "edge source must not be null");
        Objects.requireNonNull(to, "edge target must not be null");
    }

    @Override
    public Set<String> targets() {
        return Set.of(to);
    }

    @Override
    public boolean isConditional() {
        return false;
    }
}
