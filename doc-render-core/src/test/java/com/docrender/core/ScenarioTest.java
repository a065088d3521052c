package com.docrender.core;

import com.docrender.core.cancel.CancellationToken;
import com.docrender.core.error.ErrorComponent;
import com.docrender.core.error.MultiRenderException;
import com.docrender.core.error.WriterException;
import com.docrender.core.model.Document;
import com.docrender.core.model.TableContent;
import com.docrender.core.operation.Aggregates;
import com.docrender.core.operation.FilterOperation;
import com.docrender.core.operation.GroupByOperation;
import com.docrender.core.operation.LimitOperation;
import com.docrender.core.pipeline.TransformationPipeline;
import com.docrender.core.render.OutputFormat;
import com.docrender.core.render.OutputWriter;
import com.docrender.core.render.RenderOrchestrator;
import com.docrender.core.render.impl.JsonRenderer;
import com.docrender.core.render.impl.MarkdownRenderer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import static com.docrender.core.operation.OperationTestBase.row;
import static com.docrender.core.operation.OperationTestBase.sales;
import static com.docrender.core.operation.OperationTestBase.table;
import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end scenarios across operations, pipeline and rendering.
 */
class ScenarioTest {

    private final TransformationPipeline pipeline = new TransformationPipeline();

    @Test
    void filterThenLimit_keepsOneMatchingRowAndOriginalSchema() {
        // Given
        TableContent input = table("t", List.of("A", "B"),
            row("A", 1, "B", "x"),
            row("A", 2, "B", "y"),
            row("A", 3, "B", "z"))
            .withOperations(
                new FilterOperation(r -> ((Integer) r.get("A")) > 1),
                new LimitOperation(1));

        // When
        TableContent output = (TableContent) pipeline.applyTransformations(CancellationToken.create(), input);

        // Then
        assertThat(output.rows()).hasSize(1);
        assertThat((Integer) output.rows().get(0).get("A")).isGreaterThan(1);
        assertThat(output.schema().keyOrder()).containsExactly("A", "B");
        assertThat(input.rows()).hasSize(3);
    }

    @Test
    void failingWriter_isNamedWithItsFormats_whileOtherWriterReceivesOutput() {
        // Given
        Map<String, String> received = new ConcurrentHashMap<>();
        OutputWriter good = new OutputWriter() {
            @Override
            public String name() {
                return "memory";
            }

            @Override
            public void write(CancellationToken token, String format, byte[] data) {
                received.put(format, new String(data, StandardCharsets.UTF_8));
            }
        };
        OutputWriter broken = new OutputWriter() {
            @Override
            public String name() {
                return "broken";
            }

            @Override
            public void write(CancellationToken token, String format, byte[] data) {
                throw new IllegalStateException("write refused");
            }
        };
        Document document = Document.of(sales());
        RenderOrchestrator orchestrator = RenderOrchestrator.builder()
            .format(OutputFormat.of(new MarkdownRenderer()))
            .format(OutputFormat.of(new JsonRenderer()))
            .writer(good)
            .writer(broken)
            .build();

        // When / Then
        assertThatThrownBy(() -> orchestrator.render(CancellationToken.create(), document))
            .isInstanceOfSatisfying(MultiRenderException.class, error -> {
                assertThat(error.errorsFrom(ErrorComponent.WRITER)).hasSize(2)
                    .allSatisfy(failure -> assertThat(((WriterException) failure).writer()).isEqualTo("broken"));
                assertThat(error).hasMessageContaining("broken writer (format: markdown")
                    .hasMessageContaining("broken writer (format: json");
            });
        assertThat(received).containsOnlyKeys("markdown", "json");
        assertThat(received.get("markdown")).contains("| EU | a | 10 |");
        assertThat(received.get("json")).contains("\"region\"");
    }

    @Test
    void groupByRegion_countsRowsInFirstSeenOrder() {
        // Given
        TableContent input = table("orders", List.of("region", "amount"),
            row("region", "EU", "amount", 10),
            row("region", "US", "amount", 20),
            row("region", "EU", "amount", 30),
            row("region", "US", "amount", 40),
            row("region", "EU", "amount", 50))
            .withOperations(GroupByOperation.by("region").aggregate("count", Aggregates.count()));

        // When
        TableContent output = (TableContent) pipeline.applyTransformations(CancellationToken.create(), input);

        // Then
        assertThat(output.rows()).containsExactly(
            Map.of("region", "EU", "count", 3),
            Map.of("region", "US", "count", 2));
    }
}
