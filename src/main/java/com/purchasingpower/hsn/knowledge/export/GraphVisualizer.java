package com.purchasingpower.hsn.knowledge.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.purchasingpower.hsn.core.GraphEdge;
import com.purchasingpower.hsn.core.GraphNode;
import com.purchasingpower.hsn.knowledge.GraphSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders an interactive HTML page (vis-network) of a graph snapshot.
 * The page is written for people; nothing reads it back.
 *
 * @since 1.0.0
 */
@Slf4j
public class GraphVisualizer {

    private static final String TEMPLATE = "templates/graph-visualization.mustache";

    private final ObjectWriter jsonWriter;
    private final Mustache mustache;

    public GraphVisualizer(ObjectMapper objectMapper) {
        this.jsonWriter = objectMapper.writer().with(new ScriptSafeEscapes());
        MustacheFactory mustacheFactory = new DefaultMustacheFactory();
        this.mustache = mustacheFactory.compile(TEMPLATE);
    }

    public void write(GraphSnapshot snapshot, Path path) throws IOException {
        log.info("Generating interactive visualization at {}...", path);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            mustache.execute(writer, scope(snapshot));
        }
        log.info("Visualization saved");
    }

    public String render(GraphSnapshot snapshot) throws JsonProcessingException {
        StringWriter writer = new StringWriter();
        mustache.execute(writer, scope(snapshot));
        return writer.toString();
    }

    private Map<String, Object> scope(GraphSnapshot snapshot) throws JsonProcessingException {
        List<Map<String, Object>> nodes = snapshot.nodes().stream().map(this::toVisNode).toList();
        List<Map<String, Object>> edges = snapshot.edges().stream().map(this::toVisEdge).toList();

        Map<String, Object> scope = new HashMap<>();
        scope.put("title", "HSN Knowledge Graph");
        scope.put("nodeCount", nodes.size());
        scope.put("edgeCount", edges.size());
        scope.put("nodesJson", jsonWriter.writeValueAsString(nodes));
        scope.put("edgesJson", jsonWriter.writeValueAsString(edges));
        return scope;
    }

    private Map<String, Object> toVisNode(GraphNode node) {
        Map<String, Object> vis = new LinkedHashMap<>();
        vis.put("id", node.getId());
        vis.put("label", node.getId());
        vis.put("group", node.getLabel().getDisplayName());
        vis.put("title", node.getLabel().getDisplayName() + ": " + node.getDescription());
        return vis;
    }

    private Map<String, Object> toVisEdge(GraphEdge edge) {
        Map<String, Object> vis = new LinkedHashMap<>();
        vis.put("from", edge.getSourceId());
        vis.put("to", edge.getTargetId());
        vis.put("label", edge.getRelation().name());
        vis.put("arrows", "to");
        vis.put("dashes", !edge.getRelation().isHierarchy());
        return vis;
    }

    /**
     * JSON is inlined into a {@code <script>} block, so a description holding
     * {@code </script>} must not close it early.
     */
    static final class ScriptSafeEscapes extends CharacterEscapes {

        private static final SerializableString LESS_THAN = new SerializedString("\\u003c");

        private final int[] asciiEscapes;

        ScriptSafeEscapes() {
            asciiEscapes = standardAsciiEscapesForJSON();
            asciiEscapes['<'] = ESCAPE_CUSTOM;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return ch == '<' ? LESS_THAN : null;
        }
    }
}
