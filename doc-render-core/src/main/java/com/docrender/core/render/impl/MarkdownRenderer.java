package com.docrender.core.render.impl;

import com.docrender.core.model.ChartContent;
import com.docrender.core.model.CollapsibleSection;
import com.docrender.core.model.Content;
import com.docrender.core.model.DiagramContent;
import com.docrender.core.model.Document;
import com.docrender.core.model.Edge;
import com.docrender.core.model.Field;
import com.docrender.core.model.GraphContent;
import com.docrender.core.model.RawContent;
import com.docrender.core.model.SectionContent;
import com.docrender.core.model.TableContent;
import com.docrender.core.model.TextContent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * Renders documents as GitHub flavored Markdown.
 *
 * <p>Tables become pipe tables in schema key order, sections become headings one level below their
 * parent, collapsible sections become {@code <details>} blocks, and graphs, pie charts and mermaid
 * diagrams become {@code mermaid} code blocks. Raw content is emitted verbatim when its format is
 * {@code markdown}.
 */
public class MarkdownRenderer extends AbstractContentRenderer<StringBuilder> {

    private static final Logger log = LoggerFactory.getLogger(MarkdownRenderer.class);

    private static final String HEADING = "#";
    private static final String PIPE = "|";
    private static final String SEPARATOR = "---";
    private static final String NEWLINE = "\n";
    private static final String FENCE = "```";
    private static final String MERMAID = "mermaid";

    @Override
    public String format() {
        return "markdown";
    }

    @Override
    protected StringBuilder begin(Document document) {
        return new StringBuilder();
    }

    @Override
    protected void renderContent(StringBuilder out, Content content, RenderContext context) {
        renderContent(out, content, context, 1);
    }

    @Override
    protected byte[] finish(StringBuilder out, Document document) {
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    private void renderContent(StringBuilder out, Content content, RenderContext context, int depth) {
        if (content instanceof TableContent table) {
            renderTable(out, table, context, depth);
        } else if (content instanceof TextContent text) {
            if (text.header()) {
                heading(out, depth, text.text());
            } else {
                out.append(text.text()).append(NEWLINE).append(NEWLINE);
            }
        } else if (content instanceof RawContent raw) {
            if (raw.format().equalsIgnoreCase(format())) {
                out.append(new String(raw.data(), StandardCharsets.UTF_8)).append(NEWLINE);
            } else {
                log.debug("Skipping raw content '{}' for format {}", raw.id(), raw.format());
            }
        } else if (content instanceof SectionContent section) {
            int level = depth + section.level();
            heading(out, level, section.title());
            for (Content child : section.contents()) {
                renderContent(out, child, context, level + 1);
            }
        } else if (content instanceof CollapsibleSection section) {
            out.append(section.expanded() ? "<details open>" : "<details>").append(NEWLINE);
            out.append("<summary>").append(section.title()).append("</summary>").append(NEWLINE).append(NEWLINE);
            for (Content child : section.contents()) {
                renderContent(out, child, context, depth + 1);
            }
            out.append("</details>").append(NEWLINE).append(NEWLINE);
        } else if (content instanceof ChartContent chart) {
            renderChart(out, chart, depth);
        } else if (content instanceof GraphContent graph) {
            renderGraph(out, graph, depth);
        } else if (content instanceof DiagramContent diagram) {
            if (diagram.title() != null) {
                heading(out, depth, diagram.title());
            }
            out.append(FENCE).append(diagram.language()).append(NEWLINE)
                .append(diagram.source().strip()).append(NEWLINE)
                .append(FENCE).append(NEWLINE).append(NEWLINE);
        }
    }

    private void renderTable(StringBuilder out, TableContent table, RenderContext context, int depth) {
        if (table.title() != null) {
            heading(out, depth, table.title());
        }
        List<Field> visible = table.schema().fields().stream().filter(field -> !field.hidden()).toList();
        if (visible.isEmpty()) {
            return;
        }
        out.append(PIPE);
        visible.forEach(field -> out.append(' ').append(escape(field.name())).append(' ').append(PIPE));
        out.append(NEWLINE).append(PIPE);
        visible.forEach(field -> out.append(SEPARATOR).append(PIPE));
        out.append(NEWLINE);
        for (Map<String, Object> row : table.rows()) {
            out.append(PIPE);
            for (Field field : visible) {
                String cell = context.format(table.id(), field, row.get(field.name()));
                out.append(' ').append(escape(cell)).append(' ').append(PIPE);
            }
            out.append(NEWLINE);
        }
        out.append(NEWLINE);
    }

    private void renderChart(StringBuilder out, ChartContent chart, int depth) {
        if ("pie".equalsIgnoreCase(chart.chartType())) {
            out.append(FENCE).append(MERMAID).append(NEWLINE).append("pie");
            if (chart.title() != null) {
                out.append(" title ").append(chart.title());
            }
            out.append(NEWLINE);
            chart.data().forEach((label, value) ->
                out.append("    \"").append(label).append("\" : ").append(value).append(NEWLINE));
            out.append(FENCE).append(NEWLINE).append(NEWLINE);
            return;
        }
        if (chart.title() != null) {
            heading(out, depth, chart.title());
        }
        out.append("| Key | Value |").append(NEWLINE).append("|---|---|").append(NEWLINE);
        chart.data().forEach((key, value) ->
            out.append("| ").append(escape(key)).append(" | ").append(escape(String.valueOf(value))).append(" |").append(NEWLINE));
        out.append(NEWLINE);
    }

    private void renderGraph(StringBuilder out, GraphContent graph, int depth) {
        if (graph.title() != null) {
            heading(out, depth, graph.title());
        }
        out.append(FENCE).append(MERMAID).append(NEWLINE).append("graph TD").append(NEWLINE);
        for (Edge edge : graph.edges()) {
            out.append("    ").append(nodeId(edge.from()));
            if (edge.label() != null && !edge.label().isBlank()) {
                out.append(" -->|").append(edge.label()).append("| ");
            } else {
                out.append(" --> ");
            }
            out.append(nodeId(edge.to())).append(NEWLINE);
        }
        out.append(FENCE).append(NEWLINE).append(NEWLINE);
    }

    private static void heading(StringBuilder out, int level, String text) {
        out.append(HEADING.repeat(Math.min(level, 6))).append(' ').append(text).append(NEWLINE).append(NEWLINE);
    }

    private static String nodeId(String name) {
        return name.replaceAll("[^A-Za-z0-9_]", "_");
    }

    private static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("|", "\\|").replace("\n", " ");
    }
}
