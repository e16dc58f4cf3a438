package org.pragmatica.tscn.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.pragmatica.tscn.parser.ParseResult;
import org.pragmatica.tscn.parser.ParserConfig;
import org.pragmatica.tscn.parser.SceneParser;
import org.pragmatica.tscn.parser.SectionScanner;
import org.pragmatica.tscn.scene.SceneDocument;
import org.pragmatica.tscn.tree.AsciiTreeRenderer;
import org.pragmatica.tscn.tree.NodeIndex;
import org.pragmatica.tscn.tree.NodeTreeBuilder;
import org.pragmatica.tscn.tree.TreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * JSON boundary for tools that inspect scene files.
 *
 * <p>Every report is a JSON object. Failures are reported as {@code {"error": ..., "scenePath": ...}};
 * no exception crosses this boundary.
 */
public final class SceneTreeReporter {
    private static final Logger log = LoggerFactory.getLogger(SceneTreeReporter.class);

    private final ObjectMapper objectMapper;
    private final SceneParser parser;

    private SceneTreeReporter(ObjectMapper objectMapper, SceneParser parser) {
        this.objectMapper = objectMapper;
        this.parser = parser;
    }

    public static SceneTreeReporter create() {
        return create(new ObjectMapper(), ParserConfig.DEFAULT);
    }

    public static SceneTreeReporter create(ObjectMapper objectMapper, ParserConfig config) {
        return new SceneTreeReporter(Objects.requireNonNull(objectMapper, "objectMapper"),
                                     SectionScanner.create(config));
    }

    public ObjectNode treeReport(String scenePath, String text) {
        return treeReport(scenePath, text, NodeTreeBuilder.UNLIMITED_DEPTH);
    }

    /**
     * {@code {scenePath, nodeCount, tree, nodes, display}}: the nested tree, every declared node
     * with its properties, and the ASCII rendering.
     */
    public ObjectNode treeReport(String scenePath, String text, int maxDepth) {
        try {
            var parsed = parser.parse(text);
            if (parsed instanceof ParseResult.Failure failure) {
                return error(scenePath, failure.message());
            }
            var document = parsed.unwrap();
            var tree = NodeTreeBuilder.buildTree(document, maxDepth);
            if (tree.isEmpty()) {
                return error(scenePath, "Scene has no nodes");
            }
            var report = objectMapper.createObjectNode();
            report.put("scenePath", scenePath);
            report.put("nodeCount",
                       document.nodes()
                               .size());
            report.set("tree", treeJson(tree.get()));
            report.set("nodes", nodesJson(document));
            report.put("display", AsciiTreeRenderer.render(tree.get()));
            return report;
        } catch (IllegalArgumentException e) {
            return error(scenePath, e.getMessage());
        }
    }

    /**
     * {@code {scenePath, display}} with the ASCII rendering only.
     */
    public ObjectNode asciiReport(String scenePath, String text, int maxDepth) {
        var full = treeReport(scenePath, text, maxDepth);
        if (full.has("error")) {
            return full;
        }
        var report = objectMapper.createObjectNode();
        report.put("scenePath", scenePath);
        report.set("display", full.get("display"));
        return report;
    }

    /**
     * {@code {scenePath, uid}} from the scene header; {@code uid} is null when the header has none.
     */
    public ObjectNode uidReport(String scenePath, String text) {
        try {
            var parsed = parser.parse(text);
            if (parsed instanceof ParseResult.Failure failure) {
                return error(scenePath, failure.message());
            }
            var report = objectMapper.createObjectNode();
            report.put("scenePath", scenePath);
            report.put("uid",
                       parsed.unwrap()
                             .header()
                             .uid()
                             .orElse(null));
            return report;
        } catch (IllegalArgumentException e) {
            return error(scenePath, e.getMessage());
        }
    }

    public String toJson(JsonNode report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                               .writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize report", e);
        }
    }

    private ObjectNode error(String scenePath, String message) {
        log.warn("Scene report for {} failed: {}", scenePath, message);
        var error = objectMapper.createObjectNode();
        error.put("error", message);
        error.put("scenePath", scenePath);
        return error;
    }

    private ObjectNode treeJson(TreeNode node) {
        var json = objectMapper.createObjectNode();
        json.put("name", node.name());
        json.put("type", node.type());
        json.put("path", node.path());
        json.put("hasScript", node.hasScript());
        json.put("scriptPath",
                 node.scriptPath()
                     .orElse(null));
        var keys = json.putArray("propertyKeys");
        node.propertyKeys()
            .forEach(keys::add);
        var children = json.putArray("children");
        node.children()
            .forEach(child -> children.add(treeJson(child)));
        return json;
    }

    private JsonNode nodesJson(SceneDocument document) {
        var index = NodeIndex.of(document);
        var nodes = objectMapper.createArrayNode();
        for (var node : document.nodes()) {
            var json = nodes.addObject();
            json.put("id", node.id());
            json.put("name", node.name());
            json.put("type",
                     node.type()
                         .orElse(TreeNode.DEFAULT_TYPE));
            json.put("parent",
                     node.parent()
                         .orElse(null));
            json.put("path",
                     index.pathOf(node)
                          .orElse(null));
            json.put("script",
                     node.scriptRef()
                         .orElse(null));
            var groups = json.putArray("groups");
            node.groups()
                .forEach(groups::add);
            json.set("properties", ValueJson.toJson(node.properties()));
        }
        return nodes;
    }
}
