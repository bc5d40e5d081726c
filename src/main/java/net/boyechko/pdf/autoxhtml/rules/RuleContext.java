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
import java.util.List;
import net.boyechko.pdf.autoxhtml.core.ConversionSettings;
import net.boyechko.pdf.autoxhtml.document.Attribute;
import net.boyechko.pdf.autoxhtml.document.Node;

/**
 * Where in the input tree a node is being rewritten.
 *
 * @param rewriter the rewriter driving the current pass
 * @param settings conversion settings
 * @param ancestors names of the node's ancestors, outermost first
 * @param path positional path of the node, e.g. {@code /Document[1]/Table[2]}
 * @param depth number of ancestors
 */
public record RuleContext(
        TreeRewriter rewriter,
        ConversionSettings settings,
        List<String> ancestors,
        String path,
        int depth) {

    public RuleContext {
        ancestors = List.copyOf(ancestors);
    }

    static RuleContext root(TreeRewriter rewriter, ConversionSettings settings, Node root) {
        return new RuleContext(rewriter, settings, List.of(), "/" + TreeRewriter.step(root, 1), 0);
    }

    /**
     * Contexts of every child of {@code parent} (the node of this context), index for index. Build
     * them once per parent and rewrite each child with {@link #rewrite}.
     */
    public List<RuleContext> childContexts(Node.Element parent) {
        List<String> childAncestors = new ArrayList<>(ancestors.size() + 1);
        childAncestors.addAll(ancestors);
        childAncestors.add(parent.name());
        List<String> shared = List.copyOf(childAncestors);

        List<RuleContext> contexts = new ArrayList<>(parent.children().size());
        for (String step : TreeRewriter.childSteps(parent)) {
            contexts.add(new RuleContext(rewriter, settings, shared, path + "/" + step, depth + 1));
        }
        return contexts;
    }

    public String parentName() {
        return ancestors.isEmpty() ? null : ancestors.get(ancestors.size() - 1);
    }

    public boolean within(String ancestorName) {
        return ancestors.contains(ancestorName);
    }

    /** Rewrites a node standing at this context's position. */
    public List<Node> rewrite(Node node) {
        return rewriter.dispatch(node, this);
    }

    /** Rewrites all children of the element at this context's position. */
    public List<Node> rewriteChildren(Node.Element element) {
        return rewriter.rewriteChildren(element, this);
    }

    public List<Attribute> rewriteAttributes(Node.Element element) {
        return rewriter.rewriteAttributes(element, this);
    }

    /** The element renamed, with its attributes and children rewritten. */
    public Node.Element copyAs(Node.Element element, String newName) {
        return new Node.Element(newName, rewriteAttributes(element), rewriteChildren(element));
    }

    public Node.Element copy(Node.Element element) {
        return copyAs(element, element.name());
    }
}
