/*
 * PDF-Auto-XHTML - Tagged PDF to XHTML Conversion
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.autoxhtml.document;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.TextNode;
import org.jsoup.nodes.XmlDeclaration;
import org.jsoup.parser.ParseError;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads tagged structure exports into {@link Node} trees. */
public final class SourceDocuments {
    private static final Logger logger = LoggerFactory.getLogger(SourceDocuments.class);

    private static final int MAX_TRACKED_ERRORS = 20;

    private static final XMLInputFactory WELL_FORMEDNESS = newWellFormednessFactory();

    private SourceDocuments() {}

    public static Node.Element parse(Path path) throws SourceParseException {
        String xml;
        try {
            xml = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceParseException("Cannot read " + path, e);
        }
        return parse(xml);
    }

    /**
     * Parses XML text. Tokenizer errors, an empty document, stray top-level text, anything but
     * exactly one root element, and markup that is not well formed (mismatched, unclosed or
     * truncated tags) are fatal.
     */
    public static Node.Element parse(String source) throws SourceParseException {
        if (source == null || source.isBlank()) {
            throw new SourceParseException("Source document is empty");
        }
        String xml = source.startsWith("\uFEFF") ? source.substring(1) : source;
        Parser parser = Parser.xmlParser().setTrackErrors(MAX_TRACKED_ERRORS);
        Document document = parser.parseInput(xml, "");

        List<String> errors = new ArrayList<>();
        for (ParseError error : parser.getErrors()) {
            errors.add(error.toString());
        }
        if (!errors.isEmpty()) {
            throw new SourceParseException("Source document is not well formed", errors);
        }

        org.jsoup.nodes.Element root = null;
        for (org.jsoup.nodes.Node child : document.childNodes()) {
            if (child instanceof org.jsoup.nodes.Element element) {
                if (root != null) {
                    throw new SourceParseException(
                            "Source document has more than one root element: <"
                                    + root.tagName()
                                    + "> and <"
                                    + element.tagName()
                                    + ">");
                }
                root = element;
            } else if (child instanceof TextNode text && !text.isBlank()) {
                throw new SourceParseException(
                        "Source document has text outside the root element");
            }
        }
        if (root == null) {
            throw new SourceParseException("Source document has no root element");
        }
        // jsoup closes and rebalances tags without recording an error
        checkWellFormed(xml);

        Node.Element converted = (Node.Element) convert(root);
        logger.debug(
                "Parsed source <{}> with {} elements",
                converted.name(),
                NodeTree.countElements(converted));
        return converted;
    }

    private static XMLInputFactory newWellFormednessFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        return factory;
    }

    private static void checkWellFormed(String xml) throws SourceParseException {
        XMLStreamReader reader = null;
        try {
            reader = WELL_FORMEDNESS.createXMLStreamReader(new StringReader(xml.stripLeading()));
            while (reader.hasNext()) {
                reader.next();
            }
        } catch (XMLStreamException e) {
            throw new SourceParseException(
                    "Source document is not well formed", List.of(e.getMessage()));
        } finally {
            if (reader != null) {
                try {
                    reader.close();
                } catch (XMLStreamException e) {
                    logger.debug("Could not close well-formedness reader: {}", e.getMessage());
                }
            }
        }
    }

    private static Node convert(org.jsoup.nodes.Node node) {
        if (node instanceof org.jsoup.nodes.Element element) {
            List<Attribute> attributes = new ArrayList<>();
            for (org.jsoup.nodes.Attribute attribute : element.attributes()) {
                attributes.add(new Attribute(attribute.getKey(), attribute.getValue()));
            }
            List<Node> children = new ArrayList<>();
            for (org.jsoup.nodes.Node child : element.childNodes()) {
                Node converted = convert(child);
                if (converted != null) {
                    children.add(converted);
                }
            }
            return new Node.Element(element.tagName(), attributes, children);
        } else if (node instanceof TextNode text) {
            return new Node.Text(text.getWholeText());
        } else if (node instanceof DataNode data) {
            return new Node.Text(data.getWholeData());
        } else if (node instanceof org.jsoup.nodes.Comment comment) {
            return new Node.Comment(comment.getData());
        } else if (node instanceof XmlDeclaration declaration) {
            return new Node.ProcessingInstruction(
                    declaration.name(), declaration.getWholeDeclaration().strip());
        }
        // Doctypes carry nothing a pass reads
        return null;
    }
}
