package de.cwlslice.core.graph;

import de.cwlslice.core.exception.UnknownRootException;
import lombok.RequiredArgsConstructor;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

@RequiredArgsConstructor
public class ReachabilityWalker {

    private final NodeRegistry registry;

    /**
     * Depth-first visit of everything reachable from {@code current}; nodes already in {@code visited} are skipped.
     */
    public void visit(final String current, final Set<String> visited, final Direction direction) {
        if (!visited.add(current)) {
            return;
        }
        var node = registry.get(current);
        var next = direction == Direction.UPSTREAM ? node.getUpstream() : node.getDownstream();
        for (String id : next) {
            visit(id, visited, direction);
        }
    }

    /**
     * Walks upstream from output roots (how is it computed) and downstream from any other root (what does it feed).
     */
    public Set<String> walkFromRoots(final Collection<String> roots) {
        Set<String> reached = new LinkedHashSet<>();
        for (String root : roots) {
            var node = registry.find(root).orElseThrow(() -> new UnknownRootException(root));
            visit(root, reached, directionFor(node));
        }
        return reached;
    }

    public static Direction directionFor(final Node root) {
        return root.getKind() == NodeKind.OUTPUT ? Direction.UPSTREAM : Direction.DOWNSTREAM;
    }

    public enum Direction {
        UPSTREAM,
        DOWNSTREAM
    }
}
