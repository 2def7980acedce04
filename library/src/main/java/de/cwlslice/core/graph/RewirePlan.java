package de.cwlslice.core.graph;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Result of boundary rewriting: the ids to keep and the rewire table in insertion order.
 */
public record RewirePlan(Set<String> visited, Map<String, RewireEntry> rewire) {

    public RewirePlan {
        visited = Collections.unmodifiableSet(visited);
        rewire = Collections.unmodifiableMap(rewire);
    }

    public boolean keeps(final String id) {
        return visited.contains(id);
    }

    public Optional<String> replacementFor(final String id) {
        return Optional.ofNullable(rewire.get(id)).map(RewireEntry::id);
    }
}
