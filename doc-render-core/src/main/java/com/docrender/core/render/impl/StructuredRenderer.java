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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a document as a tree of maps and lists serialized by a Jackson {@link ObjectMapper}.
 *
 * <p>Table cells keep their raw value unless the field has a formatter. Hidden fields are omitted.
 * Raw content is embedded when its format matches this renderer and skipped otherwise.
 */
public abstract class StructuredRenderer extends AbstractContentRenderer<List<Object>> {

    private static final Logger log = LoggerFactory.getLogger(StructuredRenderer.class);

    private final ObjectMapper mapper;

    protected StructuredRenderer(ObjectMapper mapper) {
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    protected List<Object> begin(Document document) {
        return new ArrayList<>();
    }

    @Override
    protected void renderContent(List<Object> state, Content content, RenderContext context) {
        Map<String, Object> node = toNode(content, context);
        if (node != null) {
            state.add(node);
        }
    }

    @Override
    protected byte[] finish(List<Object> state, Document document) {
        Map<String, Object> root = new LinkedHashMap<>();
        Map<String, Object> metadata = new LinkedHashMap<>();
        document.metadata().forEach((key, value) -> metadata.put(key, plain(value)));
        root.put("metadata", metadata);
        root.put("contents", state);
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize document as " + format(), e);
        }
    }

    private Map<String, Object> toNode(Content content, RenderContext context) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("id", content.id());
        node.put("type", content.type().displayName());

        if (content instanceof TableContent table) {
            node.put("title", table.title());
            node.put("columns", table.schema().keyOrder());
            List<Map<String, Object>> rows = new ArrayList<>(table.rows().size());
            for (Map<String, Object> row : table.rows()) {
                Map<String, Object> out = new LinkedHashMap<>();
                for (Field field : table.schema().fields()) {
                    if (field.hidden()) {
                        continue;
                    }
                    Object value = row.get(field.name());
                    out.put(field.name(), field.formatter() == null
                        ? plain(value)
                        : context.format(table.id(), field, value));
                }
                rows.add(out);
            }
            node.put("rows", rows);
        } else if (content instanceof TextContent text) {
            node.put("text", text.text());
            node.put("header", text.header());
        } else if (content instanceof RawContent raw) {
            if (!raw.format().equalsIgnoreCase(format())) {
                log.debug("Skipping raw content '{}' for format {}", raw.id(), raw.format());
                return null;
            }
            try {
                node.put("data", mapper.readTree(raw.data()));
            } catch (IOException e) {
                throw new UncheckedIOException("Raw content '" + raw.id() + "' is not valid " + format(), e);
            }
        } else if (content instanceof SectionContent section) {
            node.put("title", section.title());
            node.put("level", section.level());
            node.put("contents", children(section.contents(), context));
        } else if (content instanceof CollapsibleSection section) {
            node.put("title", section.title());
            node.put("expanded", section.expanded());
            node.put("contents", children(section.contents(), context));
        } else if (content instanceof ChartContent chart) {
            node.put("title", chart.title());
            node.put("chartType", chart.chartType());
            node.put("data", plain(chart.data()));
        } else if (content instanceof GraphContent graph) {
            node.put("title", graph.title());
            List<Map<String, Object>> edges = new ArrayList<>();
            for (Edge edge : graph.edges()) {
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("from", edge.from());
                out.put("to", edge.to());
                out.put("label", edge.label());
                edges.add(out);
            }
            node.put("edges", edges);
        } else if (content instanceof DiagramContent diagram) {
            node.put("title", diagram.title());
            node.put("language", diagram.language());
            node.put("source", diagram.source());
        }
        return node;
    }

    private List<Object> children(List<Content> contents, RenderContext context) {
        List<Object> nodes = new ArrayList<>();
        for (Content child : contents) {
            Map<String, Object> node = toNode(child, context);
            if (node != null) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    /**
     * Converts a value to something every Jackson backend can serialize without extra modules.
     */
    private static Object plain(Object value) {
        if (value == null || value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((key, item) -> out.put(String.valueOf(key), plain(item)));
            return out;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(StructuredRenderer::plain).toList();
        }
        return String.valueOf(value);
    }
}
