package com.docrender.core.io;

import com.docrender.core.error.ValidationException;
import com.docrender.core.model.ChartContent;
import com.docrender.core.model.CollapsibleSection;
import com.docrender.core.model.Content;
import com.docrender.core.model.DiagramContent;
import com.docrender.core.model.Document;
import com.docrender.core.model.Edge;
import com.docrender.core.model.GraphContent;
import com.docrender.core.model.RawContent;
import com.docrender.core.model.Schema;
import com.docrender.core.model.SectionContent;
import com.docrender.core.model.TableContent;
import com.docrender.core.model.TextContent;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads documents from YAML or JSON files.
 *
 * <p>JSON is a subset of YAML, so one YAML mapper reads both.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * metadata:
 *   title: "Quarterly report"
 * contents:
 *   - type: text
 *     text: "Sales"
 *     header: true
 *   - type: table
 *     id: sales
 *     title: "Sales by region"
 *     columns: [region, amount]
 *     rows:
 *       - {region: EU, amount: 120}
 *       - {region: US, amount: 80}
 * }</pre>
 *
 * <p>Supported {@code type} values: {@code table}, {@code text}, {@code raw}, {@code section},
 * {@code collapsible}, {@code chart}, {@code graph}, {@code diagram}. Table columns default to the
 * keys of the first row when {@code columns} is absent.
 */
public class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    /**
     * Loads a document file.
     *
     * @param path YAML or JSON file
     * @return document
     * @throws UncheckedIOException if the file cannot be read or parsed
     * @throws ValidationException if the file does not describe a valid document
     */
    public Document load(Path path) {
        JsonNode root;
        try {
            root = MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read document " + path, e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("document", path, "document must be a mapping with a 'contents' list");
        }
        Document document = parse(root);
        log.debug("Loaded document {} with {} contents", path, document.contents().size());
        return document;
    }

    /**
     * Parses a document tree.
     *
     * @param root document node
     * @return document
     */
    public Document parse(JsonNode root) {
        Map<String, Object> metadata = root.has("metadata")
            ? MAPPER.convertValue(root.get("metadata"), MAP_TYPE)
            : Map.of();
        return new Document(parseContents(root.path("contents"), "contents"), metadata);
    }

    private List<Content> parseContents(JsonNode node, String path) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ValidationException(path, node.getNodeType(), "must be a list");
        }
        List<Content> contents = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            contents.add(parseContent(node.get(i), path + "[" + i + "]"));
        }
        return contents;
    }

    private Content parseContent(JsonNode node, String path) {
        String type = node.path("type").asText("");
        String id = text(node, "id");
        String title = text(node, "title");
        return switch (type) {
            case "table" -> parseTable(node, path, id, title);
            case "text" -> new TextContent(id, required(node, "text", path), node.path("header").asBoolean(false));
            case "raw" -> new RawContent(id, required(node, "format", path),
                required(node, "data", path).getBytes(StandardCharsets.UTF_8));
            case "section" -> new SectionContent(id, required(node, "title", path), node.path("level").asInt(0),
                parseContents(node.path("contents"), path + ".contents"));
            case "collapsible" -> new CollapsibleSection(id, required(node, "title", path),
                parseContents(node.path("contents"), path + ".contents"), node.path("expanded").asBoolean(false));
            case "chart" -> new ChartContent(id, title, required(node, "chartType", path),
                node.has("data") ? MAPPER.convertValue(node.get("data"), MAP_TYPE) : Map.of());
            case "graph" -> new GraphContent(id, title, parseEdges(node.path("edges"), path + ".edges"));
            case "diagram" -> new DiagramContent(id, title, required(node, "language", path), required(node, "source", path));
            default -> throw new ValidationException(path + ".type", type, "unknown content type");
        };
    }

    private TableContent parseTable(JsonNode node, String path, String id, String title) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode row : node.path("rows")) {
            if (!row.isObject()) {
                throw new ValidationException(path + ".rows", row.getNodeType(), "rows must be mappings");
            }
            rows.add(new LinkedHashMap<>(MAPPER.convertValue(row, MAP_TYPE)));
        }
        List<String> columns = new ArrayList<>();
        if (node.has("columns")) {
            node.get("columns").forEach(column -> columns.add(column.asText()));
        } else if (!rows.isEmpty()) {
            columns.addAll(rows.get(0).keySet());
        }
        try {
            return new TableContent(id, title, Schema.ofKeys(columns), rows, List.of());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(path, columns, e.getMessage());
        }
    }

    private List<Edge> parseEdges(JsonNode node, String path) {
        List<Edge> edges = new ArrayList<>();
        for (JsonNode edge : node) {
            edges.add(new Edge(required(edge, "from", path), required(edge, "to", path), text(edge, "label")));
        }
        return edges;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String required(JsonNode node, String field, String path) {
        String value = text(node, field);
        if (value == null) {
            throw new ValidationException(path + "." + field, null, "required field missing");
        }
        return value;
    }
}
