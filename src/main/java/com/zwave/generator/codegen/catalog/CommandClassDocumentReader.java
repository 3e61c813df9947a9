package com.zwave.generator.codegen.catalog;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.zwave.generator.codegen.exception.GenerationException;
import com.zwave.generator.codegen.model.input.MarkupNode;

/**
 * Streams the {@code cmd_class} elements of a command class document.
 *
 * Only elements that are direct children of the document root are reported;
 * {@code cmd_class} elements nested deeper are ignored. Each reported node
 * carries its complete sub-tree.
 *
 * All parseX methods assume the reader is positioned at the START_ELEMENT of
 * the element they parse and leave it at the matching END_ELEMENT.
 */
public class CommandClassDocumentReader {
    private static final Logger log = LoggerFactory.getLogger(CommandClassDocumentReader.class);

    public static final String COMMAND_CLASS_ELEMENT = "cmd_class";

    private static final int COMMAND_CLASS_DEPTH = 1;

    private final XMLInputFactory factory;

    public CommandClassDocumentReader() {
        this.factory = XMLInputFactory.newFactory();
        this.factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        this.factory.setProperty(XMLInputFactory.IS_COALESCING, true);
    }

    /**
     * Reads the document at {@code path}, handing each command class node to {@code sink}.
     *
     * @return number of command class nodes reported
     * @throws IOException if the file cannot be opened or read
     * @throws GenerationException if the document is not well-formed XML
     */
    public int read(Path path, Consumer<MarkupNode> sink) throws IOException {
        log.debug("Opening command class document {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, sink);
        } catch (GenerationException e) {
            throw new GenerationException("Failed to parse " + path + ": " + e.getMessage(), e);
        }
    }

    public int read(InputStream in, Consumer<MarkupNode> sink) {
        XMLStreamReader reader;
        try {
            reader = factory.createXMLStreamReader(in);
        } catch (XMLStreamException e) {
            throw new GenerationException("Cannot open XML stream (" + e.getMessage() + ")", e);
        }

        try {
            return readCommandClasses(reader, sink);
        } catch (XMLStreamException e) {
            throw new GenerationException("Malformed XML (" + e.getMessage() + ")", e);
        } finally {
            closeQuietly(reader);
        }
    }

    /** Convenience for callers that want every node at once. */
    public List<MarkupNode> readAll(InputStream in) {
        List<MarkupNode> nodes = new ArrayList<>();
        read(in, nodes::add);
        return nodes;
    }

    private int readCommandClasses(XMLStreamReader reader, Consumer<MarkupNode> sink) throws XMLStreamException {
        int depth = -1;
        int count = 0;

        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                depth++;
                if (depth == COMMAND_CLASS_DEPTH && COMMAND_CLASS_ELEMENT.equals(reader.getLocalName())) {
                    MarkupNode node = parseElement(reader);
                    depth--;
                    count++;
                    sink.accept(node);
                }
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
            }
        }
        return count;
    }

    private MarkupNode parseElement(XMLStreamReader reader) throws XMLStreamException {
        MarkupNode.MarkupNodeBuilder builder = MarkupNode.builder().elementName(reader.getLocalName());
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            builder.attribute(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
        }

        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                builder.child(parseElement(reader));
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                return builder.build();
            }
        }
        throw new XMLStreamException("Missing end of '" + COMMAND_CLASS_ELEMENT + "' element");
    }

    private static void closeQuietly(XMLStreamReader reader) {
        try {
            reader.close();
        } catch (XMLStreamException e) {
            log.debug("Failed to close XML reader: {}", e.getMessage());
        }
    }
}
