package de.cwlslice.core.graph;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeRegistryTest {

    @Test
    void testDeclarePromotesUnclassifiedNode() {
        // given
        final NodeRegistry registry = new NodeRegistry();
        final Node first = registry.declare("wf#step", NodeKind.UNCLASSIFIED);

        // when
        final Node second = registry.declare("wf#step", NodeKind.STEP);

        // then
        assertThat(second).isSameAs(first);
        assertThat(registry.kindOf("wf#step")).isEqualTo(NodeKind.STEP);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void testDeclareNeverOverwritesConcreteKind() {
        // given
        final NodeRegistry registry = new NodeRegistry();
        registry.declare("wf#message", NodeKind.INPUT);

        // when
        registry.declare("wf#message", NodeKind.UNCLASSIFIED);
        registry.declare("wf#message", NodeKind.STEP);

        // then
        assertThat(registry.kindOf("wf#message")).isEqualTo(NodeKind.INPUT);
    }

    @Test
    void testConnectRecordsBothDirectionsInOrder() {
        // given
        final NodeRegistry registry = new NodeRegistry();
        registry.declare("wf#a", NodeKind.INPUT);
        registry.declare("wf#b", NodeKind.INPUT);
        registry.declare("wf#step", NodeKind.STEP);

        // when
        registry.connect("wf#b", "wf#step");
        registry.connect("wf#a", "wf#step");

        // then
        assertThat(registry.get("wf#step").getUpstream()).containsExactly("wf#b", "wf#a");
        assertThat(registry.get("wf#a").getDownstream()).containsExactly("wf#step");
        assertThat(registry.ids()).containsExactly("wf#a", "wf#b", "wf#step");
    }

    @Test
    void testConnectUnknownNodeFails() {
        // given
        final NodeRegistry registry = new NodeRegistry();
        registry.declare("wf#a", NodeKind.INPUT);

        // when & then
        assertThatThrownBy(() -> registry.connect("wf#a", "wf#missing"))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.find("wf#missing")).isEmpty();
        assertThat(registry.contains("wf#a")).isTrue();
    }
}
