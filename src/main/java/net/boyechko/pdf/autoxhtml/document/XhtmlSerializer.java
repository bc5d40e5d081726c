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

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Entities;
import org.jsoup.nodes.TextNode;
import org.jsoup.nodes.XmlDeclaration;
import org.jsoup.parser.ParseSettings;
import org.jsoup.parser.Tag;

/**
 * Writes an output tree as XHTML. Void elements such as {@code img} and {@code meta} are written
 * self-closed; every other element gets an end tag even when empty.
 */
public final class XhtmlSerializer {
    private static final Pattern PSEUDO_ATTRIBUTE =
            Pattern.compile("([^\\s=]+)(?:\\s*=\\s*\"([^\"]*)\")?");

    private final boolean prettyPrint;

    public XhtmlSerializer(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    public String serialize(Node.Element root) {
        Document document = new Document("");
        document.outputSettings()
                .syntax(Document.OutputSettings.Syntax.xml)
                .escapeMode(Entities.EscapeMode.xhtml)
                .charset(StandardCharsets.UTF_8)
                .prettyPrint(prettyPrint)
                .indentAmount(2);

        XmlDeclaration declaration = new XmlDeclaration("xml", false);
        declaration.attr("version", "1.0");
        declaration.attr("encoding", "UTF-8");
        document.appendChild(declaration);
        document.appendChild(toJsoup(root));
        return document.outerHtml();
    }

    private static org.jsoup.nodes.Node toJsoup(Node node) {
        if (node instanceof Node.Element element) {
            org.jsoup.nodes.Element out =
                    new org.jsoup.nodes.Element(
                            Tag.valueOf(element.name(), ParseSettings.preserveCase), "");
            for (Attribute attribute : element.attributes()) {
                out.attr(attribute.name(), attribute.value());
            }
            for (Node child : element.children()) {
                if (child instanceof Node.Text text && element.hasName("style")) {
                    // Style sheets are written as character data
                    out.appendChild(new DataNode(text.content()));
                } else {
                    out.appendChild(toJsoup(child));
                }
            }
            return out;
        } else if (node instanceof Node.Text text) {
            return new TextNode(text.content());
        } else if (node instanceof Node.Comment comment) {
            return new org.jsoup.nodes.Comment(comment.content());
        }
        Node.ProcessingInstruction pi = (Node.ProcessingInstruction) node;
        XmlDeclaration instruction = new XmlDeclaration(pi.target(), false);
        Matcher m = PSEUDO_ATTRIBUTE.matcher(pi.data());
        while (m.find()) {
            instruction.attr(m.group(1), m.group(2) != null ? m.group(2) : "");
        }
        return instruction;
    }
}
