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
import java.util.List;
import java.util.function.Supplier;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.issue.IssueList;

/** Runs the audit visitors over a finished output tree in a single walk. */
public class AuditEngine {
    private final List<Supplier<NodeVisitor>> visitorSuppliers;

    public AuditEngine(List<Supplier<NodeVisitor>> visitorSuppliers) {
        this.visitorSuppliers = List.copyOf(visitorSuppliers);
    }

    public IssueList audit(Node.Element document) {
        NodeTreeWalker walker = new NodeTreeWalker();
        for (NodeVisitor visitor : instantiateVisitors()) {
            walker.addVisitor(visitor);
        }
        return walker.walk(document);
    }

    private List<NodeVisitor> instantiateVisitors() {
        List<NodeVisitor> visitors = new ArrayList<>(visitorSuppliers.size());
        for (Supplier<NodeVisitor> visitorSupplier : visitorSuppliers) {
            NodeVisitor visitor = visitorSupplier.get();
            if (visitor == null) {
                throw new IllegalStateException("Visitor supplier returned null");
            }
            visitors.add(visitor);
        }
        return visitors;
    }
}
