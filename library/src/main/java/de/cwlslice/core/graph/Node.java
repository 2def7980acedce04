package de.cwlslice.core.graph;

import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
@ToString
public class Node {

    private final String id;
    private final List<String> upstream = new ArrayList<>();
    private final List<String> downstream = new ArrayList<>();
    private NodeKind kind;

    Node(final String id, final NodeKind kind) {
        this.id = id;
        this.kind = kind;
    }

    public List<String> getUpstream() {
        return Collections.unmodifiableList(upstream);
    }

    public List<String> getDownstream() {
        return Collections.unmodifiableList(downstream);
    }

    // a concrete kind is never replaced
    void promote(final NodeKind newKind) {
        if (!kind.isConcrete()) {
            kind = newKind;
        }
    }

    void addUpstream(final String id) {
        upstream.add(id);
    }

    void addDownstream(final String id) {
        downstream.add(id);
    }
}
