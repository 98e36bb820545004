package com.eainde.stategraph;

import com.eainde.stategraph.execution.CancellationSignal;
import lombok.Builder;
import lombok.Singular;

import java.util.Map;
import java.util.Optional;

/**
 * Per-run settings passed to {@code Workflow.invoke(..)} and on to every
 * {@link com.eainde.stategraph.action.NodeActionWithOptions}.
 *
 * <ul>
 *   <li><b>threadId</b>: run id used for logging and as the runtime's checkpoint thread; generated when absent</li>
 *   <li><b>maxSteps</b>: overrides the graph's recursion limit for this run</li>
 *   <li><b>cancellationSignal</b>: polled before every node execution</li>
 *   <li><b>metadata</b>: collaborators and values injected into node actions</li>
 * </ul>
 *
 * <pre>
 * RunOptions.builder()
 *         .threadId("order-42")
 *         .maxSteps(10)
 *         .metadataEntry("pricingClient", pricingClient)
 *         .build();
 * </pre>
 */
public final class RunOptions {

    private static final RunOptions DEFAULTS = builder().build();

    private final String threadId;
    private final Integer maxSteps;
    private final CancellationSignal cancellationSignal;
    private final Map<String, Object> metadata;

    @Builder(toBuilder = true)
    private RunOptions(String threadId,
                       Integer maxSteps,
                       CancellationSignal cancellationSignal,
                       @Singular("metadataEntry") Map<String, Object> metadata) {
        if (maxSteps != null && maxSteps < 1) {
            throw new IllegalArgumentException("maxSteps must be at least 1, got " + maxSteps);
        }
        this.threadId = threadId;
        this.maxSteps = maxSteps;
        this.cancellationSignal = cancellationSignal != null ? cancellationSignal : CancellationSignal.NONE;
        this.metadata = metadata;
    }

    public static RunOptions defaults() {
        return DEFAULTS;
    }

    public Optional<String> threadId() {
        return Optional.ofNullable(threadId);
    }

    public Optional<Integer> maxSteps() {
        return Optional.ofNullable(maxSteps);
    }

    public CancellationSignal cancellationSignal() {
        return cancellationSignal;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public Optional<Object> metadata(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    public <T> Optional<T> metadata(String key, Class<T> type) {
        return metadata(key).filter(type::isInstance).map(type::cast);
    }

    public RunOptions withThreadId(String threadId) {
        return toBuilder().threadId(threadId).build();
    }

    @Override
    public String toString() {
        return "RunOptions[threadId=" + threadId + ", maxSteps=" + maxSteps
                + ", metadata=" + metadata.keySet() + "]";
    }
}
