package com.eainde.stategraph.checkpoint;

import lombok.extern.log4j.Log4j2;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps checkpoints on the heap, grouped by thread id (the run id). Lost on restart.
 * <p>
 * At most {@code maxRuns} runs are retained: storing the first checkpoint of a new run
 * beyond that evicts the run whose first checkpoint is oldest. Callers that need the
 * history of a run for longer copy it out, or {@link #release} runs they are done with.
 */
@Log4j2
public class InMemoryCheckpointSaver implements BaseCheckpointSaver {

    public static final int DEFAULT_MAX_RUNS = 1000;

    // thread id → checkpoints, newest first; insertion order of threads drives eviction
    private final Map<String, LinkedList<Checkpoint>> storage = new LinkedHashMap<>();
    private final int maxRuns;

    public InMemoryCheckpointSaver() {
        this(DEFAULT_MAX_RUNS);
    }

    public InMemoryCheckpointSaver(int maxRuns) {
        if (maxRuns < 1) {
            throw new IllegalArgumentException("maxRuns must be at least 1, got " + maxRuns);
        }
        this.maxRuns = maxRuns;
    }

    /**
     * @return the run's checkpoints, newest first; empty for an unknown run
     */
    @Override
    public synchronized Collection<Checkpoint> list(RunnableConfig config) {
        String threadId = config.threadId().orElse(null);
        LinkedList<Checkpoint> checkpoints = threadId == null ? null : storage.get(threadId);
        return checkpoints == null ? List.of() : List.copyOf(checkpoints);
    }

    /**
     * @return the checkpoint named by the config's checkpoint id, else the run's latest
     */
    @Override
    public synchronized Optional<Checkpoint> get(RunnableConfig config) {
        String threadId = config.threadId().orElse(null);
        LinkedList<Checkpoint> checkpoints = threadId == null ? null : storage.get(threadId);
        if (checkpoints == null || checkpoints.isEmpty()) {
            return Optional.empty();
        }
        return config.checkPointId()
                .flatMap(id -> checkpoints.stream().filter(c -> id.equals(c.getId())).findFirst())
                .or(() -> Optional.of(checkpoints.getFirst()));
    }

    /**
     * Stores {@code checkpoint} as the run's latest, or replaces the checkpoint named by
     * the config's checkpoint id.
     */
    @Override
    public synchronized RunnableConfig put(RunnableConfig config, Checkpoint checkpoint) {
        String threadId = config.threadId().orElseThrow(() ->
                new IllegalArgumentException("Thread ID is required")
        );

        LinkedList<Checkpoint> checkpoints = storage.get(threadId);
        if (checkpoints == null) {
            checkpoints = new LinkedList<>();
            storage.put(threadId, checkpoints);
            evictOldestRuns();
        }

        Optional<String> replaced = config.checkPointId();
        if (replaced.isPresent() && replace(checkpoints, replaced.get(), checkpoint)) {
            return config;
        }
        checkpoints.addFirst(checkpoint);

        return RunnableConfig.builder()
                .threadId(threadId)
                .checkPointId(checkpoint.getId())
                .build();
    }

    /**
     * Drops every checkpoint of the run.
     *
     * @return the dropped checkpoints, newest first
     */
    @Override
    public synchronized Tag release(RunnableConfig config) {
        String threadId = config.threadId().orElseThrow(() ->
                new IllegalArgumentException("Thread ID is required")
        );
        LinkedList<Checkpoint> removed = storage.remove(threadId);
        return new Tag(threadId, removed == null ? List.of() : List.copyOf(removed));
    }

    public synchronized int runCount() {
        return storage.size();
    }

    public int getMaxRuns() {
        return maxRuns;
    }

    private static boolean replace(LinkedList<Checkpoint> checkpoints, String id, Checkpoint checkpoint) {
        for (int i = 0; i < checkpoints.size(); i++) {
            if (id.equals(checkpoints.get(i).getId())) {
                checkpoints.set(i, checkpoint);
                return true;
            }
        }
        return false;
    }

    private void evictOldestRuns() {
        Iterator<String> threads = storage.keySet().iterator();
        while (storage.size() > maxRuns && threads.hasNext()) {
            String evicted = threads.next();
            threads.remove();
            log.debug("Evicted checkpoints of run {} (retaining at most {} runs)", evicted, maxRuns);
        }
    }
}
