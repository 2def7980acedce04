package de.cwlslice.core.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Dependency graph of one workflow document, keyed by global node identifier.
 */
public class NodeRegistry {

    private final Map<String, Node> nodes = new LinkedHashMap<>();

    /**
     * Records the node if unknown, or fills in its kind if it is still {@link NodeKind#UNCLASSIFIED}.
     *
     * @return the registered node, new or existing
     */
    public Node declare(final String id, final NodeKind kind) {
        var node = nodes.computeIfAbsent(id, key -> new Node(key, kind));
        node.promote(kind);
        return node;
    }

    /**
     * Adds the edge {@code upstreamId -> downstreamId}; both ends must be declared.
     */
    public void connect(final String upstreamId, final String downstreamId) {
        get(upstreamId).addDownstream(downstreamId);
        get(downstreamId).addUpstream(upstreamId);
    }

    public Optional<Node> find(final String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public Node get(final String id) {
        var node = nodes.get(id);
        if (Objects.isNull(node)) {
            throw new IllegalStateException("Node '%s' is not declared".formatted(id));
        }
        return node;
    }

    public boolean contains(final String id) {
        return nodes.containsKey(id);
    }

    public NodeKind kindOf(final String id) {
        return get(id).getKind();
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(nodes.keySet());
    }

    public int size() {
        return nodes.size();
    }
}
