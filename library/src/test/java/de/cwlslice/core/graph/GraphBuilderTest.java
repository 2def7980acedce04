package de.cwlslice.core.graph;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.cwlslice.core.model.Workflow;
import de.cwlslice.infrastructure.loading.YamlDocumentLoader;
import org.junit.jupiter.api.Test;

import static de.cwlslice.support.WorkflowFixtures.id;
import static de.cwlslice.support.WorkflowFixtures.workflow;
import static de.cwlslice.support.WorkflowFixtures.yaml;
import static org.assertj.core.api.Assertions.assertThat;

class GraphBuilderTest {

    @Test
    void testBuildLinearWorkflow() {
        // given
        final Workflow linear = workflow(new YamlDocumentLoader(), "linear.cwl");

        // when
        final NodeRegistry registry = GraphBuilder.build(linear.getTool());

        // then
        assertThat(registry.size()).isEqualTo(7);
        assertThat(registry.kindOf(id(linear, "message"))).isEqualTo(NodeKind.INPUT);
        assertThat(registry.kindOf(id(linear, "unused"))).isEqualTo(NodeKind.INPUT);
        assertThat(registry.kindOf(id(linear, "C"))).isEqualTo(NodeKind.OUTPUT);
        assertThat(registry.kindOf(id(linear, "A"))).isEqualTo(NodeKind.STEP);
        assertThat(registry.kindOf(id(linear, "A/out"))).isEqualTo(NodeKind.UNCLASSIFIED);

        assertThat(registry.get(id(linear, "A")).getUpstream()).containsExactly(id(linear, "message"));
        assertThat(registry.get(id(linear, "A")).getDownstream()).containsExactly(id(linear, "A/out"));
        assertThat(registry.get(id(linear, "B")).getUpstream()).containsExactly(id(linear, "A/out"));
        assertThat(registry.get(id(linear, "B/out")).getDownstream()).containsExactly(id(linear, "C"));
        assertThat(registry.get(id(linear, "C")).getUpstream()).containsExactly(id(linear, "B/out"));
        assertThat(registry.get(id(linear, "unused")).getDownstream()).isEmpty();
    }

    @Test
    void testBuildWithListSourcesAndPortsWithoutSource() {
        // given
        final ObjectNode document = yaml(
                "class: Workflow",
                "id: file:///wf.cwl",
                "inputs:",
                "  - id: file:///wf.cwl#x",
                "steps:",
                "  - id: file:///wf.cwl#s",
                "    run: tool.cwl",
                "    in:",
                "      - id: file:///wf.cwl#s/many",
                "        source: [file:///wf.cwl#x, file:///wf.cwl#other/out]",
                "      - id: file:///wf.cwl#s/fixed",
                "        default: 3",
                "    out:",
                "      - file:///wf.cwl#s/out",
                "      - id: file:///wf.cwl#s/log");

        // when
        final NodeRegistry registry = GraphBuilder.build(document);

        // then
        assertThat(registry.get("file:///wf.cwl#s").getUpstream())
                .containsExactly("file:///wf.cwl#x", "file:///wf.cwl#other/out");
        assertThat(registry.get("file:///wf.cwl#s").getDownstream())
                .containsExactly("file:///wf.cwl#s/out", "file:///wf.cwl#s/log");
        assertThat(registry.contains("file:///wf.cwl#s/fixed")).isFalse();
        assertThat(registry.kindOf("file:///wf.cwl#other/out")).isEqualTo(NodeKind.UNCLASSIFIED);
    }

    @Test
    void testBuildLeavesDocumentUntouched() {
        // given
        final Workflow fanin = workflow(new YamlDocumentLoader(), "fanin.cwl");
        final ObjectNode copy = fanin.getTool().deepCopy();

        // when
        GraphBuilder.build(fanin.getTool());

        // then
        assertThat(fanin.getTool()).isEqualTo(copy);
    }
}
