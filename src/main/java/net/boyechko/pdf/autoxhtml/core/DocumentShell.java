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
package net.boyechko.pdf.autoxhtml.core;

import java.util.List;
import net.boyechko.pdf.autoxhtml.document.Annotations;
import net.boyechko.pdf.autoxhtml.document.Attribute;
import net.boyechko.pdf.autoxhtml.document.Node;

/**
 * The fixed output document around the mapped content: an XHTML {@code html} root whose head
 * carries the charset, a title and the diagnostic style block, and whose body holds one {@code
 * div.pdf-content} container.
 */
public final class DocumentShell {
    public static final String XHTML_NAMESPACE = "http://www.w3.org/1999/xhtml";
    public static final String CONTAINER_CLASS = "pdf-content";
    public static final String TITLE = "PDF Conversion";

    /** Selectors are keyed on the annotation names; renaming either side breaks the other. */
    static final String DIAGNOSTIC_STYLE =
            String.join(
                    "\n",
                    "",
                    "[" + Annotations.NUMBER_SCHEME + "=\"note\"] { font-style: italic; }",
                    "[" + Annotations.NUMBER + "]::before { content: attr("
                            + Annotations.NUMBER
                            + ") \" \"; color: #555; }",
                    "tr[" + Annotations.ASYMMETRIC + "=\"true\"] { outline: 2px solid #d9534f; }",
                    "tr[" + Annotations.CELL_COUNT + "]::after { content: attr("
                            + Annotations.CELL_COUNT
                            + ") \" cells\"; font-size: 0.75em; color: #d9534f; }",
                    "tr[" + Annotations.EXPECTED_COUNT + "] { background: #fdf2f2; }",
                    "[" + Annotations.CELL_ADDED + "=\"true\"] { background: #fff3cd; }",
                    "");

    private DocumentShell() {}

    public static Node.Element wrap(List<Node> content) {
        Node.Element head =
                Node.element(
                        "head",
                        Node.element(
                                "meta", List.of(new Attribute("charset", "UTF-8")), List.of()),
                        Node.element("title", Node.text(TITLE)),
                        Node.element(
                                "style",
                                List.of(new Attribute("type", "text/css")),
                                List.of(Node.text(DIAGNOSTIC_STYLE))));
        Node.Element container =
                Node.element("div", List.of(new Attribute("class", CONTAINER_CLASS)), content);
        return Node.element(
                "html",
                List.of(new Attribute("xmlns", XHTML_NAMESPACE)),
                List.of(head, Node.element("body", container)));
    }

    public static boolean isContainer(Node.Element element) {
        return element.hasName("div")
                && element.attribute("class").filter(CONTAINER_CLASS::equals).isPresent();
    }

    /** The content container of a shelled document, or null if the shape was lost. */
    public static Node.Element container(Node.Element document) {
        for (Node.Element body : document.elementChildren("body")) {
            for (Node.Element child : body.elementChildren()) {
                if (isContainer(child)) {
                    return child;
                }
            }
        }
        return null;
    }
}
