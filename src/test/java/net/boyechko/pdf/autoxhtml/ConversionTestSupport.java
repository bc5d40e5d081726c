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
package net.boyechko.pdf.autoxhtml;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.autoxhtml.core.ConversionDefaults;
import net.boyechko.pdf.autoxhtml.core.ConversionSettings;
import net.boyechko.pdf.autoxhtml.core.DocumentShell;
import net.boyechko.pdf.autoxhtml.document.Attribute;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.document.SourceDocuments;
import net.boyechko.pdf.autoxhtml.document.SourceParseException;
import net.boyechko.pdf.autoxhtml.rules.RuleTable;
import net.boyechko.pdf.autoxhtml.rules.TreeRewriter;

/** Shorthands for building trees and running single passes in tests. */
public final class ConversionTestSupport {
    private ConversionTestSupport() {}

    public static ConversionSettings settings() {
        return ConversionSettings.defaults();
    }

    public static Node.Element source(String xml) {
        try {
            return SourceDocuments.parse(xml);
        } catch (SourceParseException e) {
            throw new AssertionError("Test source did not parse: " + e.getMessage(), e);
        }
    }

    /** Maps the children of a {@code TaggedPDF-doc} root through the structural mapping pass. */
    public static List<Node> mapStructure(String bodyXml) {
        return mapStructure(bodyXml, settings());
    }

    public static List<Node> mapStructure(String bodyXml, ConversionSettings settings) {
        Node.Element root = source("<TaggedPDF-doc>" + bodyXml + "</TaggedPDF-doc>");
        return ConversionDefaults.structuralMapping().apply(root, settings);
    }

    /** A shelled document whose container holds {@code content}. */
    public static Node.Element shelled(Node... content) {
        return DocumentShell.wrap(List.of(content));
    }

    public static Node.Element run(RuleTable table, Node.Element document) {
        return run(table, document, settings());
    }

    public static Node.Element run(
            RuleTable table, Node.Element document, ConversionSettings settings) {
        return new TreeRewriter(table).mapElement(document, settings);
    }

    public static Node.Element el(String name, Node... children) {
        return Node.element(name, children);
    }

    /** Element with attributes given as alternating name/value pairs. */
    public static Node.Element el(String name, String[] attributes, Node... children) {
        List<Attribute> list = new ArrayList<>();
        for (int i = 0; i + 1 < attributes.length; i += 2) {
            list.add(new Attribute(attributes[i], attributes[i + 1]));
        }
        return Node.element(name, list, List.of(children));
    }

    public static String[] attrs(String... nameValuePairs) {
        return nameValuePairs;
    }

    public static Node.Text text(String content) {
        return Node.text(content);
    }

    public static Node.Element onlyElement(List<Node> nodes) {
        if (nodes.size() != 1 || !(nodes.get(0) instanceof Node.Element element)) {
            throw new AssertionError("Expected exactly one element, got " + nodes);
        }
        return element;
    }
}
