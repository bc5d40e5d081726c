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
package net.boyechko.pdf.autoxhtml.rules;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.boyechko.pdf.autoxhtml.core.ConversionException;
import net.boyechko.pdf.autoxhtml.core.ConversionSettings;
import net.boyechko.pdf.autoxhtml.document.Attribute;
import net.boyechko.pdf.autoxhtml.document.Node;

/**
 * Recursive tree map parameterized by a {@link RuleTable}: every node is handed to the table,
 * and rules recurse through the {@link RuleContext} they receive. Mapping never mutates the
 * input; it returns a new tree.
 */
public final class TreeRewriter {
    private final RuleTable table;

    public TreeRewriter(RuleTable table) {
        this.table = table;
    }

    public RuleTable table() {
        return table;
    }

    /** Maps a whole tree. A root may rewrite to zero, one or several nodes. */
    public List<Node> map(Node.Element root, ConversionSettings settings) {
        return dispatch(root, RuleContext.root(this, settings, root));
    }

    /** Maps a tree whose root must survive as exactly one element. */
    public Node.Element mapElement(Node.Element root, ConversionSettings settings) {
        List<Node> result = map(root, settings);
        if (result.size() != 1 || !(result.get(0) instanceof Node.Element mapped)) {
            throw new ConversionException(
                    table.scope().label(),
                    "root <" + root.name() + "> rewrote to " + result.size() + " nodes");
        }
        return mapped;
    }

    List<Node> dispatch(Node node, RuleContext ctx) {
        return table.apply(node, ctx);
    }

    List<Node> rewriteChildren(Node.Element element, RuleContext ctx) {
        List<Node> out = new ArrayList<>();
        List<Node> children = element.children();
        List<RuleContext> contexts = ctx.childContexts(element);
        for (int i = 0; i < children.size(); i++) {
            out.addAll(dispatch(children.get(i), contexts.get(i)));
        }
        return out;
    }

    List<Attribute> rewriteAttributes(Node.Element element, RuleContext ctx) {
        List<Attribute> out = new ArrayList<>(element.attributes().size());
        for (Attribute attribute : element.attributes()) {
            Optional<Attribute> rewritten = table.applyAttribute(element, attribute, ctx);
            rewritten.ifPresent(
                    a -> {
                        // A rename may collide with an attribute already copied
                        out.removeIf(existing -> existing.name().equals(a.name()));
                        out.add(a);
                    });
        }
        return out;
    }

    // == Positional paths ==============================================

    static String step(Node node, int position) {
        return kindName(node) + "[" + position + "]";
    }

    /** Path steps of all children of {@code parent}, numbering same-named siblings. */
    static List<String> childSteps(Node.Element parent) {
        List<String> steps = new ArrayList<>(parent.children().size());
        Map<String, Integer> seen = new HashMap<>();
        for (Node child : parent.children()) {
            steps.add(step(child, seen.merge(kindName(child), 1, Integer::sum)));
        }
        return steps;
    }

    private static String kindName(Node node) {
        if (node instanceof Node.Element e) {
            return e.name();
        } else if (node instanceof Node.Text) {
            return "text()";
        } else if (node instanceof Node.Comment) {
            return "comment()";
        }
        return "processing-instruction()";
    }
}
