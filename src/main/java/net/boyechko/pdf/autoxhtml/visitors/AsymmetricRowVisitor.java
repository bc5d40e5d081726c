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
package net.boyechko.pdf.autoxhtml.visitors;

import net.boyechko.pdf.autoxhtml.document.Annotations;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.issue.Issue;
import net.boyechko.pdf.autoxhtml.issue.IssueList;
import net.boyechko.pdf.autoxhtml.issue.IssueLoc;
import net.boyechko.pdf.autoxhtml.issue.IssueSev;
import net.boyechko.pdf.autoxhtml.issue.IssueType;
import net.boyechko.pdf.autoxhtml.passes.TableShape;
import net.boyechko.pdf.autoxhtml.validation.NodeVisitor;
import net.boyechko.pdf.autoxhtml.validation.VisitorContext;

/**
 * Reports table rows annotated as asymmetric: rows that were padded (already repaired) and rows
 * wider than their header row (left for manual review).
 */
public class AsymmetricRowVisitor implements NodeVisitor {
    private final IssueList issues = new IssueList();

    @Override
    public String name() {
        return "Asymmetric Row Visitor";
    }

    @Override
    public String description() {
        return "Table rows should be as wide as the header row";
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        if (!ctx.hasName("tr") || !isFlagged(ctx.node())) {
            return true;
        }
        Node.Element row = ctx.node();
        String detected = row.attribute(Annotations.CELL_COUNT).orElse("?");
        String expected = row.attribute(Annotations.EXPECTED_COUNT).orElse("?");
        long added =
                TableShape.cells(row).stream()
                        .filter(c -> c.hasAttribute(Annotations.CELL_ADDED))
                        .count();

        if (added > 0) {
            Issue issue =
                    new Issue(
                            IssueType.ROW_PADDED,
                            IssueSev.INFO,
                            IssueLoc.atNode(ctx.path(), ctx.name()),
                            "Row had " + detected + " cells, header row has " + expected);
            issue.markResolved("Padded row with " + added + " empty cell(s)");
            issues.add(issue);
        } else if (expected.matches("\\d+")
                && TableShape.cellCount(row) > Integer.parseInt(expected)) {
            issues.add(
                    new Issue(
                            IssueType.EXCESS_CELLS,
                            IssueSev.WARNING,
                            IssueLoc.atNode(ctx.path(), ctx.name()),
                            "Row has " + detected + " cells, header row has " + expected));
        }
        return true;
    }

    private static boolean isFlagged(Node.Element row) {
        return row.attribute(Annotations.ASYMMETRIC).filter(Annotations.TRUE::equals).isPresent();
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
