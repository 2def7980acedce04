package de.cwlslice.core.extraction;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.cwlslice.core.exception.InvalidProcessClassException;
import de.cwlslice.core.exception.UnknownRootException;
import de.cwlslice.core.model.Process;
import de.cwlslice.core.model.ProcessFactory;
import de.cwlslice.core.model.Workflow;
import de.cwlslice.infrastructure.loading.LoadingContext;
import de.cwlslice.infrastructure.loading.YamlDocumentLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static de.cwlslice.support.WorkflowFixtures.id;
import static de.cwlslice.support.WorkflowFixtures.ids;
import static de.cwlslice.support.WorkflowFixtures.record;
import static de.cwlslice.support.WorkflowFixtures.workflow;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SubgraphExtractorTest {

    private YamlDocumentLoader loader;
    private SubgraphExtractor extractor;

    @BeforeEach
    void setUp() {
        loader = new YamlDocumentLoader();
        extractor = new SubgraphExtractor(LoadingContext.of(loader));
    }

    @Test
    void testOutputRootKeepsEverythingUpstream() {
        // given
        final Workflow linear = workflow(loader, "linear.cwl");

        // when
        final ObjectNode extracted = extractor.extract(List.of(id(linear, "C")), linear);

        // then
        assertThat(ids(extracted.get("steps"))).containsExactly(id(linear, "A"), id(linear, "B"));
        assertThat(ids(extracted.get("inputs"))).containsExactly(id(linear, "message"));
        assertThat(ids(extracted.get("outputs"))).containsExactly(id(linear, "C"));
        assertThat(extracted.get("cwlVersion").asText()).isEqualTo("v1.2");
        assertThat(extracted.get("label").asText()).isEqualTo("linear pipeline");
        assertThat(extracted.get("id").asText()).isEqualTo(linear.getId());
    }

    @Test
    void testStepRootKeepsEverythingDownstream() {
        // given
        final Workflow linear = workflow(loader, "linear.cwl");

        // when
        final ObjectNode extracted = extractor.extract(List.of(id(linear, "A")), linear);

        // then
        assertThat(ids(extracted.get("steps"))).containsExactly(id(linear, "A"), id(linear, "B"));
        assertThat(ids(extracted.get("inputs"))).containsExactly(id(linear, "message"));
        assertThat(ids(extracted.get("outputs"))).containsExactly(id(linear, "C"));
    }

    @Test
    void testDanglingDependencyBecomesNewInput() {
        // given
        final Workflow linear = workflow(loader, "linear.cwl");

        // when
        final ObjectNode extracted = extractor.extract(List.of(id(linear, "B")), linear);

        // then
        assertThat(ids(extracted.get("steps"))).containsExactly(id(linear, "B"));
        assertThat(ids(extracted.get("inputs"))).containsExactly(id(linear, "A_out"));
        assertThat(record(extracted.get("inputs"), id(linear, "A_out")).get("type").asText()).isEqualTo("File");
        final ObjectNode stepB = record(extracted.get("steps"), id(linear, "B"));
        assertThat(stepB.get("in").get(0).get("source").asText()).isEqualTo(id(linear, "A_out"));
        assertThat(ids(extracted.get("outputs"))).containsExactly(id(linear, "C"));
    }

    @Test
    void testListSourceIsSubstitutedElementWise() {
        // given
        final Workflow fanin = workflow(loader, "fanin.cwl");

        // when
        final ObjectNode extracted = extractor.extract(List.of(id(fanin, "second")), fanin);

        // then
        assertThat(ids(extracted.get("steps"))).containsExactly(id(fanin, "second"), id(fanin, "join"));
        assertThat(ids(extracted.get("inputs")))
                .containsExactly(id(fanin, "right"), id(fanin, "label"), id(fanin, "first_out"));
        assertThat(record(extracted.get("inputs"), id(fanin, "first_out")).get("type").asText()).isEqualTo("File[]");

        final ObjectNode files = record(record(extracted.get("steps"), id(fanin, "join")).get("in"), id(fanin, "join/files"));
        assertThat(files.get("source").get(0).asText()).isEqualTo(id(fanin, "first_out"));
        assertThat(files.get("source").get(1).asText()).isEqualTo(id(fanin, "second/out"));
        assertThat(files.get("linkMerge").asText()).isEqualTo("merge_flattened");
        assertThat(extracted.has("requirements")).isTrue();
    }

    @Test
    void testMultipleRootsAreCombined() {
        // given
        final Workflow fanin = workflow(loader, "fanin.cwl");

        // when
        final ObjectNode extracted = extractor.extract(List.of(id(fanin, "first"), id(fanin, "second")), fanin);

        // then
        assertThat(ids(extracted.get("steps")))
                .containsExactly(id(fanin, "first"), id(fanin, "second"), id(fanin, "join"));
        assertThat(ids(extracted.get("inputs")))
                .containsExactly(id(fanin, "left"), id(fanin, "right"), id(fanin, "label"));
        assertThat(ids(extracted.get("outputs"))).containsExactly(id(fanin, "merged"));
    }

    @Test
    void testDanglingOutputSourceBecomesNewInput() {
        // given
        final Workflow branches = workflow(loader, "two-branches.cwl");

        // when
        final ObjectNode extracted = extractor.extract(List.of(id(branches, "a")), branches);

        // then
        assertThat(ids(extracted.get("steps"))).containsExactly(id(branches, "a"));
        assertThat(ids(extracted.get("inputs"))).containsExactly(id(branches, "x"), id(branches, "b_out"));
        assertThat(record(extracted.get("inputs"), id(branches, "b_out")).get("type").asText()).isEqualTo("File");
        final ObjectNode both = record(extracted.get("outputs"), id(branches, "both"));
        assertThat(both.get("outputSource").get(0).asText()).isEqualTo(id(branches, "a/out"));
        assertThat(both.get("outputSource").get(1).asText()).isEqualTo(id(branches, "b_out"));
    }

    @Test
    void testExtractionIsIdempotent() {
        // given
        final Workflow linear = workflow(loader, "linear.cwl");
        final Workflow fanin = workflow(loader, "fanin.cwl");
        final ObjectNode linearOnce = extractor.extract(List.of(id(linear, "B")), linear);
        final ObjectNode faninOnce = extractor.extract(List.of(id(fanin, "second")), fanin);

        // when
        final ObjectNode linearTwice = extractor.extract(List.of(id(linear, "B")),
                ProcessFactory.create(linearOnce, linear.getMetadata()));
        final ObjectNode faninTwice = extractor.extract(List.of(id(fanin, "second")),
                ProcessFactory.create(faninOnce, fanin.getMetadata()));

        // then
        assertThat(linearTwice).isEqualTo(linearOnce);
        assertThat(faninTwice).isEqualTo(faninOnce);
    }

    @Test
    void testSourceDocumentIsLeftUntouched() {
        // given
        final Workflow fanin = workflow(loader, "fanin.cwl");
        final ObjectNode copy = fanin.getTool().deepCopy();

        // when
        final ObjectNode extracted = extractor.extract(List.of(id(fanin, "second")), fanin);
        ((ObjectNode) extracted.get("steps").get(0)).put("label", "changed");

        // then
        assertThat(fanin.getTool()).isEqualTo(copy);
    }

    @Test
    void testNonWorkflowIsRejected() {
        // given
        final Process tool = loader.resolve("workflows/tools/echo.cwl");

        // when & then
        assertThatThrownBy(() -> extractor.extract(List.of(id(tool, "text")), tool))
                .isInstanceOf(InvalidProcessClassException.class)
                .hasMessage("Can only extract subgraph from workflow, got class 'CommandLineTool'");
    }

    @Test
    void testUnknownRootIsRejected() {
        // given
        final Workflow linear = workflow(loader, "linear.cwl");

        // when & then
        assertThatThrownBy(() -> extractor.extract(List.of(id(linear, "Z")), linear))
                .isInstanceOf(UnknownRootException.class);
    }
}
