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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.issue.IssueList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Walks an output tree once, invoking multiple visitors at each element. */
public class NodeTreeWalker {
    private static final Logger logger = LoggerFactory.getLogger(NodeTreeWalker.class);

    private final List<NodeVisitor> visitors = new ArrayList<>();

    private int globalIndex;

    public NodeTreeWalker addVisitor(NodeVisitor visitor) {
        visitors.add(visitor);
        return this;
    }

    public IssueList walk(Node.Element root) {
        this.globalIndex = 0;

        for (NodeVisitor visitor : visitors) {
            visitor.beforeTraversal();
        }

        walkElement(root, "/" + root.name() + "[1]", null, 0);

        IssueList allIssues = new IssueList();
        for (NodeVisitor visitor : visitors) {
            visitor.afterTraversal();
            allIssues.addAll(visitor.getIssues());
        }
        return allIssues;
    }

    private void walkElement(Node.Element node, String path, String parentName, int depth) {
        globalIndex++;
        VisitorContext ctx = new VisitorContext(node, path, parentName, depth, globalIndex);

        // Call enterElement on all visitors; track if any want to skip children
        boolean continueToChildren = true;
        for (NodeVisitor visitor : visitors) {
            try {
                if (!visitor.enterElement(ctx)) {
                    continueToChildren = false;
                }
            } catch (RuntimeException e) {
                logger.error(
                        "Error in visitor {} at {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }

        if (continueToChildren) {
            Map<String, Integer> positions = new HashMap<>();
            for (Node.Element child : ctx.children()) {
                int position = positions.merge(child.name(), 1, Integer::sum);
                walkElement(
                        child,
                        path + "/" + child.name() + "[" + position + "]",
                        node.name(),
                        depth + 1);
            }
        }

        for (NodeVisitor visitor : visitors) {
            try {
                visitor.leaveElement(ctx);
            } catch (RuntimeException e) {
                logger.error(
                        "Error in visitor {} leaving {}: {}",
                        visitor.name(),
                        ctx.path(),
                        e.getMessage());
            }
        }
    }
}
