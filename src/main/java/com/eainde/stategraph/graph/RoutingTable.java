package com.eainde.stategraph.graph;

import lombok.Builder;
import lombok.Singular;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Maps the routing keys a conditional edge's predicate may return to target node ids.
 * <p>
 * Keys are normalised (trimmed, lower-cased) on both sides, so {@code "FINISH"},
 * {@code " finish"} and {@code "finish"} are the same key. The declared keys are the
 * closed set of accepted values: anything else resolves to the default route when one
 * is declared and to nothing otherwise.
 * <p>
 * A table keeps its keys as declared. Keys that are blank or that collide once
 * normalised are not rejected here; {@link #problems()} lists them and graph
 * compilation reports them.
 *
 * <pre>
 * RoutingTable.builder()
 *         .route("high", "review")
 *         .otherwise("finalize")
 *         .build();
 *
 * // same table; the "default" key declares the fallback
 * RoutingTable.of(Map.of("high", "review", "default", "finalize"));
 * </pre>
 */
public final class RoutingTable {

    public static final String DEFAULT_KEY = "default";

    private final Map<String, String> declared;
    private final String otherwise;

    // derived from the declared keys, first declaration wins
    private final Map<String, String> routes = new LinkedHashMap<>();
    private final String defaultTarget;

    @Builder
    private RoutingTable(@Singular Map<String, String> routes, String otherwise) {
        this.declared = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
        this.otherwise = otherwise;

        String fallback = otherwise;
        for (Map.Entry<String, String> entry : declared.entrySet()) {
            String key = normalize(entry.getKey());
            if (key == null || key.isEmpty()) continue;
            if (DEFAULT_KEY.equals(key)) {
                if (fallback == null) fallback = entry.getValue();
            } else {
                this.routes.putIfAbsent(key, entry.getValue());
            }
        }
        this.defaultTarget = fallback;
    }

    public static RoutingTable of(Map<String, String> table) {
        Objects.requireNonNull(table, "routing table must not be null");
        return builder().routes(table).build();
    }

    public static String normalize(String key) {
        return key == null ? null : key.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * @param key routing key returned by a predicate, may be {@code null}
     * @return the mapped target, else the default target, else empty
     */
    public Optional<String> resolve(String key) {
        String target = key == null ? null : routes.get(normalize(key));
        return Optional.ofNullable(target != null ? target : defaultTarget);
    }

    /**
     * @return normalised key → target, without the default route
     */
    public Map<String, String> routes() {
        return Collections.unmodifiableMap(routes);
    }

    /**
     * @return the keys exactly as declared, including any {@code "default"} key
     */
    public Map<String, String> declaredRoutes() {
        return declared;
    }

    public Optional<String> defaultTarget() {
        return Optional.ofNullable(defaultTarget);
    }

    public Set<String> targets() {
        Set<String> targets = new LinkedHashSet<>(declared.values());
        if (otherwise != null) {
            targets.add(otherwise);
        }
        targets.remove(null);
        return Collections.unmodifiableSet(targets);
    }

    public boolean isEmpty() {
        return declared.isEmpty() && otherwise == null;
    }

    /**
     * @return blank keys, missing targets and keys that collide once normalised; empty for a well-formed table
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        Map<String, String> seen = new LinkedHashMap<>();
        if (otherwise != null) {
            seen.put(DEFAULT_KEY, "otherwise(..)");
        }
        declared.forEach((key, target) -> {
            String normalized = normalize(key);
            if (normalized == null || normalized.isEmpty()) {
                problems.add("routing key must not be blank");
                return;
            }
            if (target == null) {
                problems.add("routing key '" + key + "' has no target");
            }
            String previous = seen.putIfAbsent(normalized, "'" + key + "'");
            if (previous != null) {
                problems.add(DEFAULT_KEY.equals(normalized)
                        ? "default route declared more than once (" + previous + ", '" + key + "')"
                        : "routing key '" + key + "' collides with " + previous + " once normalised to '"
                        + normalized + "'");
            }
        });
        return problems;
    }

    @Override
    public String toString() {
        return "RoutingTable" + routes + (defaultTarget != null ? " otherwise " + defaultTarget : "");
    }
}
