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
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A node of the document tree shared by every conversion pass.
 *
 * <p>Nodes are immutable values. A pass never edits a tree in place; it builds a new tree from
 * the previous one.
 */
public sealed interface Node
        permits Node.Element, Node.Text, Node.Comment, Node.ProcessingInstruction {

    static Element element(String name, List<Attribute> attributes, List<Node> children) {
        return new Element(name, attributes, children);
    }

    static Element element(String name, List<Node> children) {
        return new Element(name, List.of(), children);
    }

    static Element element(String name, Node... children) {
        return new Element(name, List.of(), List.of(children));
    }

    static Text text(String content) {
        return new Text(content);
    }

    /** Element with an ordered list of uniquely named attributes and ordered children. */
    record Element(String name, List<Attribute> attributes, List<Node> children) implements Node {
        public Element {
            if (name == null || name.isEmpty()) {
                throw new IllegalArgumentException("Element name must not be empty");
            }
            attributes = List.copyOf(attributes);
            children = List.copyOf(children);
            Set<String> seen = new HashSet<>();
            for (Attribute attribute : attributes) {
                if (!seen.add(attribute.name())) {
                    throw new IllegalArgumentException(
                            "Duplicate attribute '" + attribute.name() + "' on <" + name + ">");
                }
            }
        }

        public boolean hasName(String other) {
            return name.equals(other);
        }

        public boolean hasAnyName(String... names) {
            for (String n : names) {
                if (name.equals(n)) return true;
            }
            return false;
        }

        public Optional<String> attribute(String attributeName) {
            for (Attribute attribute : attributes) {
                if (attribute.name().equals(attributeName)) {
                    return Optional.of(attribute.value());
                }
            }
            return Optional.empty();
        }

        public boolean hasAttribute(String attributeName) {
            return attribute(attributeName).isPresent();
        }

        /** Returns a copy with the attribute set, replacing an existing value in place. */
        public Element withAttribute(String attributeName, String value) {
            List<Attribute> updated = new ArrayList<>(attributes.size() + 1);
            boolean replaced = false;
            for (Attribute attribute : attributes) {
                if (attribute.name().equals(attributeName)) {
                    updated.add(new Attribute(attributeName, value));
                    replaced = true;
                } else {
                    updated.add(attribute);
                }
            }
            if (!replaced) {
                updated.add(new Attribute(attributeName, value));
            }
            return new Element(name, updated, children);
        }

        public Element withoutAttribute(String attributeName) {
            if (!hasAttribute(attributeName)) {
                return this;
            }
            List<Attribute> updated =
                    attributes.stream().filter(a -> !a.name().equals(attributeName)).toList();
            return new Element(name, updated, children);
        }

        public Element withChildren(List<Node> newChildren) {
            return new Element(name, attributes, newChildren);
        }

        public Element withName(String newName) {
            return new Element(newName, attributes, children);
        }

        /** Returns the direct element children, skipping text and other node kinds. */
        public List<Element> elementChildren() {
            List<Element> out = new ArrayList<>();
            for (Node child : children) {
                if (child instanceof Element e) {
                    out.add(e);
                }
            }
            return out;
        }

        public List<Element> elementChildren(String childName) {
            return elementChildren().stream().filter(e -> e.hasName(childName)).toList();
        }

        public boolean hasElementChild(String childName) {
            return children.stream()
                    .anyMatch(c -> c instanceof Element e && e.hasName(childName));
        }

        /** Concatenation of all descendant text, in document order. */
        public String textContent() {
            StringBuilder sb = new StringBuilder();
            appendText(this, sb);
            return sb.toString();
        }

        private static void appendText(Node node, StringBuilder sb) {
            if (node instanceof Text t) {
                sb.append(t.content());
            } else if (node instanceof Element e) {
                for (Node child : e.children()) {
                    appendText(child, sb);
                }
            }
        }
    }

    record Text(String content) implements Node {
        public Text {
            content = content == null ? "" : content;
        }

        public boolean isBlank() {
            return content.isBlank();
        }
    }

    /** Only present in source trees; the first pass removes every comment. */
    record Comment(String content) implements Node {}

    record ProcessingInstruction(String target, String data) implements Node {
        public ProcessingInstruction {
            data = data == null ? "" : data;
        }
    }
}
