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
package net.boyechko.pdf.autoxhtml.validation;

import java.util.List;
import net.boyechko.pdf.autoxhtml.document.Node;

/**
 * Immutable context passed to visitors during output tree traversal.
 *
 * @param node the element being visited
 * @param path positional path, e.g. {@code /html[1]/body[1]/div[1]/table[2]}
 * @param parentName name of the parent element, null at the root
 * @param depth depth in the tree (0 = root)
 * @param globalIndex index in traversal order (1-based)
 */
public record VisitorContext(
        Node.Element node, String path, String parentName, int depth, int globalIndex) {

    public String name() {
        return node.name();
    }

    public List<Node.Element> children() {
        return node.elementChildren();
    }

    public boolean hasName(String elementName) {
        return node.hasName(elementName);
    }

    public boolean hasAnyName(String... elementNames) {
        return node.hasAnyName(elementNames);
    }
}
