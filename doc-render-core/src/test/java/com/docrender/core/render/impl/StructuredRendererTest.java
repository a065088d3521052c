package com.docrender.core.render.impl;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.model.Document;
import com.docrender.core.model.Field;
import com.docrender.core.model.RawContent;
import com.docrender.core.model.Schema;
import com.docrender.core.model.SectionContent;
import com.docrender.core.model.TableContent;
import com.docrender.core.model.TextContent;
import com.docrender.core.operation.LimitOperation;
import com.docrender.core.pipeline.DocumentPipeline;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import static com.docrender.core.operation.OperationTestBase.row;
import static com.docrender.core.operation.OperationTestBase.sales;
import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link JsonRenderer} and {@link YamlRenderer}.
 */
class StructuredRendererTest {

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    @Test
    void json_rendersTableRowsWithRawValuesAndColumnOrder() throws IOException {
        Document document = new Document(List.of(sales().withOperations(new LimitOperation(2))),
            Map.of("title", "Report"));

        JsonNode root = JSON.readTree(new JsonRenderer().render(CancellationToken.create(), document));

        assertThat(root.path("metadata").path("title").asText()).isEqualTo("Report");
        JsonNode table = root.path("contents").get(0);
        assertThat(table.path("type").asText()).isEqualTo("table");
        assertThat(table.path("id").asText()).isEqualTo("sales");
        assertThat(table.path("columns")).extracting(JsonNode::asText).containsExactly("region", "product", "amount");
        assertThat(table.path("rows")).hasSize(2);
        assertThat(table.path("rows").get(1).path("amount").isInt()).isTrue();
        assertThat(table.path("rows").get(1).path("amount").asInt()).isEqualTo(20);
    }

    @Test
    void json_formatterOutputReplacesRawValue() throws IOException {
        Schema schema = new Schema(List.of(new Field("price", "number", value -> value + " EUR", false)));
        TableContent table = new TableContent("p", null, schema, List.of(row("price", 5)), List.of());

        JsonNode root = JSON.readTree(new JsonRenderer().render(CancellationToken.create(), Document.of(table)));

        assertThat(root.path("contents").get(0).path("rows").get(0).path("price").asText()).isEqualTo("5 EUR");
    }

    @Test
    void json_embedsMatchingRawContentAndSkipsOthers() throws IOException {
        Document document = Document.of(RawContent.of("json", "{\"k\": [1, 2]}"), RawContent.of("html", "<p/>"));

        JsonNode contents = JSON.readTree(new JsonRenderer().render(CancellationToken.create(), document)).path("contents");

        assertThat(contents).hasSize(1);
        assertThat(contents.get(0).path("data").path("k").get(1).asInt()).isEqualTo(2);
    }

    @Test
    void json_metadataWithNonJsonTypes_isRenderedAsText() throws IOException {
        Document transformed = new DocumentPipeline(Document.of(sales())).limit(1).execute(CancellationToken.create());

        JsonNode root = JSON.readTree(new JsonRenderer().render(CancellationToken.create(), transformed));

        assertThat(root.path("metadata").path(DocumentPipeline.STATS_METADATA_KEY).asText()).contains("TransformStats");
    }

    @Test
    void yaml_rendersNestedSections() throws IOException {
        Document document = Document.of(SectionContent.of("Intro", TextContent.of("hello")));

        JsonNode root = YAML.readTree(new YamlRenderer().render(CancellationToken.create(), document));

        JsonNode section = root.path("contents").get(0);
        assertThat(section.path("type").asText()).isEqualTo("section");
        assertThat(section.path("title").asText()).isEqualTo("Intro");
        assertThat(section.path("contents").get(0).path("text").asText()).isEqualTo("hello");
    }

    @Test
    void renderTo_writesSameBytesAsRender() throws IOException {
        JsonRenderer renderer = new JsonRenderer();
        Document document = Document.of(TextContent.of("x"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        renderer.renderTo(CancellationToken.create(), document, out);

        assertThat(out.toByteArray()).isEqualTo(renderer.render(CancellationToken.create(), document));
    }
}
