package com.pharmagraph.normalization;

import java.util.*;

/**
 * Original node id to final node id, filled by canonicalization. Nodes removed by filtering
 * have no entry, so anything pointing at them fails to resolve.
 */
public final class IdentityMap {
    private final Map<String, String> finalIds = new LinkedHashMap<>();

    public void assign(String originalId, String finalId) {
        Objects.requireNonNull(originalId, "originalId");
        Objects.requireNonNull(finalId, "finalId");
        finalIds.put(originalId, finalId);
    }

    public Optional<String> resolve(String originalId) {
        if (originalId == null) return Optional.empty();
        return Optional.ofNullable(finalIds.get(originalId));
    }

    public boolean contains(String originalId) {
        return originalId != null && finalIds.containsKey(originalId);
    }

    public Set<String> originalsOf(String finalId) {
        Set<String> originals = new LinkedHashSet<>();
        finalIds.forEach((original, target) -> {
            if (target.equals(finalId)) originals.add(original);
        });
        return originals;
    }

    public int size() {
        return finalIds.size();
    }

    /** Originals folded into some other node's final id. */
    public int mergedCount() {
        return finalIds.size() - new HashSet<>(finalIds.values()).size();
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(finalIds);
    }
}
