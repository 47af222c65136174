package com.purchasingpower.hsn.knowledge.export;

import com.purchasingpower.hsn.core.GraphEdge;
import com.purchasingpower.hsn.core.GraphNode;
import com.purchasingpower.hsn.knowledge.GraphSnapshot;
import lombok.extern.slf4j.Slf4j;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes a {@link GraphSnapshot} as GraphML for offline inspection (Gephi,
 * yEd, networkx).
 *
 * @since 1.0.0
 */
@Slf4j
public final class GraphMlExporter {

    private static final String GRAPHML_NS = "http://graphml.graphdrawing.org/xmlns";

    private GraphMlExporter() {
    }

    public static void write(GraphSnapshot snapshot, Path path) throws IOException {
        log.info("Exporting graph to GraphML at {} ({} nodes, {} edges)",
                path, snapshot.nodes().size(), snapshot.edges().size());

        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            write(snapshot, out);
        }
    }

    public static void write(GraphSnapshot snapshot, OutputStream out) throws IOException {
        try {
            XMLStreamWriter xml = XMLOutputFactory.newFactory()
                    .createXMLStreamWriter(out, StandardCharsets.UTF_8.name());
            xml.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
            xml.writeStartElement("graphml");
            xml.writeDefaultNamespace(GRAPHML_NS);

            writeKey(xml, "d_label", "node", "label");
            writeKey(xml, "d_description", "node", "description");
            writeKey(xml, "d_type", "edge", "type");
            writeKey(xml, "d_score", "edge", "score");

            xml.writeStartElement("graph");
            xml.writeAttribute("id", "hsn");
            xml.writeAttribute("edgedefault", "directed");

            for (GraphNode node : snapshot.nodes()) {
                xml.writeStartElement("node");
                xml.writeAttribute("id", node.getId());
                writeData(xml, "d_label", node.getLabel().getDisplayName());
                writeData(xml, "d_description", node.getDescription());
                xml.writeEndElement();
            }

            int edgeIndex = 0;
            for (GraphEdge edge : snapshot.edges()) {
                xml.writeStartElement("edge");
                xml.writeAttribute("id", "e" + edgeIndex++);
                xml.writeAttribute("source", edge.getSourceId());
                xml.writeAttribute("target", edge.getTargetId());
                writeData(xml, "d_type", edge.getRelation().name());
                Object score = edge.getProperties().get(GraphEdge.SCORE);
                if (score != null) {
                    writeData(xml, "d_score", score.toString());
                }
                xml.writeEndElement();
            }

            xml.writeEndElement();
            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IOException("Failed to write GraphML", e);
        }
    }

    private static void writeKey(XMLStreamWriter xml, String id, String scope, String name) throws XMLStreamException {
        xml.writeEmptyElement("key");
        xml.writeAttribute("id", id);
        xml.writeAttribute("for", scope);
        xml.writeAttribute("attr.name", name);
        xml.writeAttribute("attr.type", "string");
    }

    private static void writeData(XMLStreamWriter xml, String key, String value) throws XMLStreamException {
        xml.writeStartElement("data");
        xml.writeAttribute("key", key);
        xml.writeCharacters(value);
        xml.writeEndElement();
    }
}
