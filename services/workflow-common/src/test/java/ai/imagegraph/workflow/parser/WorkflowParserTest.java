package ai.imagegraph.workflow.parser;

import ai.imagegraph.workflow.WorkflowFixtures;
import ai.imagegraph.workflow.exception.TemplateException;
import ai.imagegraph.workflow.model.EditorWorkflow;
import ai.imagegraph.workflow.model.ExecutionWorkflow;
import ai.imagegraph.workflow.model.NodeLink;
import ai.imagegraph.workflow.model.NodeSpec;
import ai.imagegraph.workflow.model.WorkflowDocument;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowParserTest {

    private final WorkflowParser parser = new WorkflowParser(new ObjectMapper());

    @Test
    void testParseExecutionFixture() throws Exception {
        WorkflowDocument document = parser.parse(Files.readString(WorkflowFixtures.path("txt2img_execution.json")));

        assertThat(document).isInstanceOf(ExecutionWorkflow.class);
        assertThat(document.representation()).isEqualTo(WorkflowDocument.Representation.EXECUTION);
        assertThat(document.nodeCount()).isEqualTo(7);

        NodeSpec output = ((ExecutionWorkflow) document).template().findNode("9").orElseThrow();
        assertThat(output.type()).isEqualTo("SaveImage");
        assertThat(output.title()).isEqualTo("Output");
        assertThat(output.input("filename_prefix")).isEqualTo("ComfyUI");
        assertThat(output.input("images")).isEqualTo(new NodeLink("8", 0));
    }

    @Test
    void testParseEditorFixture() throws Exception {
        WorkflowDocument document = parser.parse(Files.readString(WorkflowFixtures.path("txt2img_editor.json")));

        assertThat(document).isInstanceOf(EditorWorkflow.class);
        EditorWorkflow editor = (EditorWorkflow) document;
        assertThat(editor.representation()).isEqualTo(WorkflowDocument.Representation.EDITOR);
        assertThat(editor.nodes()).hasSize(8);
        assertThat(editor.links()).hasSize(9);
        assertThat(editor.nodes().get(3).title()).isEqualTo("Positive Prompt");
        assertThat(editor.links().get(7)).isEqualTo(new EditorWorkflow.Link(8, "4", 2, "8", 1));
    }

    @Test
    void testParseEditorObjectLinks() {
        String json = """
                {
                  "nodes": [
                    {"id": 1, "type": "EmptyLatentImage", "inputs": [], "widgets_values": [512, 768, 1]},
                    {"id": 2, "type": "KSampler", "inputs": [{"name": "latent_image", "link": 11}]}
                  ],
                  "links": [
                    {"id": 11, "origin_id": 1, "origin_slot": 0, "target_id": 2, "target_slot": 3, "type": "LATENT"}
                  ]
                }
                """;

        EditorWorkflow editor = (EditorWorkflow) parser.parse(json);

        assertThat(editor.links()).containsExactly(new EditorWorkflow.Link(11, "1", 0, "2", 3));
        assertThat(editor.nodes().get(1).inputs())
                .containsExactly(new EditorWorkflow.Input("latent_image", false, 11L));
    }

    @Test
    void testParseRejectsUnrecognizedShape() throws Exception {
        String json = Files.readString(WorkflowFixtures.path("not_a_workflow.json"));

        assertThatThrownBy(() -> parser.parse(json))
                .isInstanceOf(TemplateException.class)
                .extracting(e -> ((TemplateException) e).getReason())
                .isEqualTo(TemplateException.Reason.MALFORMED);
    }

    @Test
    void testParseRejectsInvalidJson() {
        assertThatThrownBy(() -> parser.parse("{\"3\": {\"class_type\": "))
                .isInstanceOf(TemplateException.class)
                .hasMessageContaining("not valid JSON")
                .extracting(e -> ((TemplateException) e).getReason())
                .isEqualTo(TemplateException.Reason.MALFORMED);
    }

    @Test
    void testParseRejectsDuplicateNodeKeys() {
        String json = """
                {
                  "1": {"class_type": "CLIPTextEncode", "inputs": {"text": "a"}},
                  "1": {"class_type": "SaveImage", "inputs": {}}
                }
                """;

        assertThatThrownBy(() -> parser.parse(json))
                .isInstanceOf(TemplateException.class)
                .extracting(e -> ((TemplateException) e).getReason())
                .isEqualTo(TemplateException.Reason.MALFORMED);
    }

    @Test
    void testParseRejectsTopLevelArray() {
        assertThatThrownBy(() -> parser.parse("[1, 2, 3]"))
                .isInstanceOf(TemplateException.class)
                .hasMessage("Workflow template must be a JSON object");
    }

    @Test
    void testParseRejectsMixedExecutionMembers() {
        String json = """
                {
                  "1": {"class_type": "CLIPTextEncode", "inputs": {"text": "a"}},
                  "version": 2
                }
                """;

        assertThatThrownBy(() -> parser.parse(json))
                .isInstanceOf(TemplateException.class)
                .extracting(e -> ((TemplateException) e).getReason())
                .isEqualTo(TemplateException.Reason.MALFORMED);
    }

    @Test
    void testTreatsLongArraysAsLiterals() {
        String json = """
                {"1": {"class_type": "LoraStack", "inputs": {"weights": [1, 2, 3], "pair": ["a", "b"]}}}
                """;

        ExecutionWorkflow execution = (ExecutionWorkflow) parser.parse(json);
        NodeSpec node = execution.template().findNode("1").orElseThrow();

        assertThat(node.input("weights")).isInstanceOf(List.class);
        assertThat(node.input("pair")).isInstanceOf(List.class);
        assertThat(node.linkCount()).isZero();
    }
}
