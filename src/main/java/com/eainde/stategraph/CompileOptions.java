package com.eainde.stategraph;

import com.eainde.stategraph.listener.GraphListener;
import lombok.Builder;
import lombok.Singular;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;

import java.util.List;
import java.util.Optional;

/**
 * Graph-wide settings fixed at compile time.
 * <p>
 * {@code recursionLimit} is the number of node executions a run may perform before
 * it is aborted; {@link RunOptions#maxSteps()} may override it per run. The checkpoint
 * saver is handed to the graph runtime, which records a checkpoint after every node.
 *
 * <pre>
 * CompileOptions.builder()
 *         .recursionLimit(10)
 *         .listener(new LoggingGraphListener())
 *         .checkpointSaver(new InMemoryCheckpointSaver())
 *         .build();
 * </pre>
 */
public final class CompileOptions {

    public static final int DEFAULT_RECURSION_LIMIT = 25;

    private final int recursionLimit;
    private final List<GraphListener> listeners;
    private final BaseCheckpointSaver checkpointSaver;

    @Builder
    private CompileOptions(Integer recursionLimit,
                           @Singular List<GraphListener> listeners,
                           BaseCheckpointSaver checkpointSaver) {
        int limit = recursionLimit != null ? recursionLimit : DEFAULT_RECURSION_LIMIT;
        if (limit < 1) {
            throw new IllegalArgumentException("recursionLimit must be at least 1, got " + limit);
        }
        this.recursionLimit = limit;
        this.listeners = listeners;
        this.checkpointSaver = checkpointSaver;
    }

    public static CompileOptions defaults() {
        return builder().build();
    }

    public int getRecursionLimit() {
        return recursionLimit;
    }

    public List<GraphListener> getListeners() {
        return listeners;
    }

    public Optional<BaseCheckpointSaver> getCheckpointSaver() {
        return Optional.ofNullable(checkpointSaver);
    }

    CompileConfig toCompileConfig() {
        if (checkpointSaver == null) {
            return CompileConfig.builder().build();
        }
        return CompileConfig.builder().checkpointSaver(checkpointSaver).build();
    }

    @Override
    public String toString() {
        return "CompileOptions[recursionLimit=" + recursionLimit + ", listeners=" + listeners.size()
                + (checkpointSaver != null ? ", checkpointSaver=" + checkpointSaver.getClass().getSimpleName() : "")
                + "]";
    }
}
