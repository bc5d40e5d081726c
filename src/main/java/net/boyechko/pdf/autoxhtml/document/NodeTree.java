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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/** Utilities for navigating and summarizing {@link Node} trees. */
public final class NodeTree {
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");
    private static final int MAX_DISPLAY_LENGTH = 30;

    private NodeTree() {}

    /** Collapses runs of whitespace to single spaces and trims the ends. */
    public static String normalizeSpace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE_RUN.matcher(text).replaceAll(" ").trim();
    }

    /** Normalized text content of a node; empty for comments and processing instructions. */
    public static String normalizedText(Node node) {
        if (node instanceof Node.Element e) {
            return normalizeSpace(e.textContent());
        } else if (node instanceof Node.Text t) {
            return normalizeSpace(t.content());
        }
        return "";
    }

    /** Returns true if the element has no attributes and nothing but whitespace inside. */
    public static boolean isBareAndBlank(Node.Element element) {
        if (!element.attributes().isEmpty()) {
            return false;
        }
        for (Node child : element.children()) {
            if (child instanceof Node.Text t) {
                if (!t.isBlank()) return false;
            } else if (child instanceof Node.Element) {
                return false;
            }
        }
        return true;
    }

    /** Finds the first element in document order (the root included) matching the predicate. */
    public static Node.Element findFirst(Node.Element root, Predicate<Node.Element> predicate) {
        if (predicate.test(root)) {
            return root;
        }
        for (Node.Element child : root.elementChildren()) {
            Node.Element found = findFirst(child, predicate);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    public static Node.Element findFirstByName(Node.Element root, String name) {
        return findFirst(root, e -> e.hasName(name));
    }

    /** All elements below the root (root excluded) matching the predicate, in document order. */
    public static List<Node.Element> descendants(
            Node.Element root, Predicate<Node.Element> predicate) {
        List<Node.Element> out = new ArrayList<>();
        collect(root, predicate, out);
        return out;
    }

    private static void collect(
            Node.Element parent, Predicate<Node.Element> predicate, List<Node.Element> out) {
        for (Node.Element child : parent.elementChildren()) {
            if (predicate.test(child)) {
                out.add(child);
            }
            collect(child, predicate, out);
        }
    }

    /** Counts element nodes in the tree, root included. */
    public static int countElements(Node.Element root) {
        int count = 1;
        for (Node.Element child : root.elementChildren()) {
            count += countElements(child);
        }
        return count;
    }

    /** Renders the element structure as an indented outline, one element per line. */
    public static String toIndentedTreeString(Node.Element root) {
        StringBuilder sb = new StringBuilder();
        appendOutline(root, 0, sb);
        return sb.toString();
    }

    private static void appendOutline(Node.Element element, int depth, StringBuilder sb) {
        sb.append("  ".repeat(depth)).append(element.name());
        for (Attribute attribute : element.attributes()) {
            sb.append(' ').append(attribute.name()).append("=\"").append(attribute.value());
            sb.append('"');
        }
        String ownText = ownText(element);
        if (!ownText.isEmpty()) {
            sb.append(" \"").append(truncateText(ownText)).append('"');
        }
        sb.append('\n');
        for (Node.Element child : element.elementChildren()) {
            appendOutline(child, depth + 1, sb);
        }
    }

    private static String ownText(Node.Element element) {
        StringBuilder sb = new StringBuilder();
        for (Node child : element.children()) {
            if (child instanceof Node.Text t) {
                sb.append(t.content()).append(' ');
            }
        }
        return normalizeSpace(sb.toString());
    }

    /** Truncates text to a reasonable display length for log and report output. */
    public static String truncateText(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength - 1) + "…";
    }

    public static String truncateText(String text) {
        return truncateText(text, MAX_DISPLAY_LENGTH);
    }
}
