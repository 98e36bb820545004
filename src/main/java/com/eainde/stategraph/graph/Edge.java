package com.eainde.stategraph.graph;

import java.util.Set;

/**
 * Outgoing transition of a node. A node has at most one.
 */
public interface Edge {

    String from();

    /**
     * @return every node id this edge can lead to, including END
     */
    Set<String> targets();

    boolean isConditional();
}
