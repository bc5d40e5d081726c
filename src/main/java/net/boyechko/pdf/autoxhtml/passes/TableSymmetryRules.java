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
package net.boyechko.pdf.autoxhtml.passes;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.autoxhtml.document.Annotations;
import net.boyechko.pdf.autoxhtml.document.Attribute;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.rules.Pattern;
import net.boyechko.pdf.autoxhtml.rules.Rule;
import net.boyechko.pdf.autoxhtml.rules.RuleContext;
import net.boyechko.pdf.autoxhtml.rules.RuleOutcome;
import net.boyechko.pdf.autoxhtml.rules.RuleSet;

/**
 * Pads rows narrower than their table with empty cells marked {@code data-cell-added}. Rows
 * wider than expected are left alone; their asymmetry annotation is what reports them.
 */
public final class TableSymmetryRules implements RuleSet {

    @Override
    public List<Rule> rules() {
        return List.of(Rule.forElement("pad-rows", Pattern.element("table"), 10, this::table));
    }

    private RuleOutcome table(Node.Element table, RuleContext ctx) {
        Node.Element copied = ctx.copy(table);
        int scanned = TableShape.expectedCount(copied);
        return RuleOutcome.emit(
                TableShape.mapRows(
                        copied,
                        row -> {
                            int recorded = TableShape.recordedExpectedCount(row);
                            return pad(row, recorded >= 0 ? recorded : scanned);
                        }));
    }

    /** Appends cells of the trailing cell's kind until the row is {@code expected} wide. */
    static Node.Element pad(Node.Element row, int expected) {
        int missing = expected - TableShape.cellCount(row);
        if (missing <= 0) {
            return row;
        }
        List<Node.Element> cells = TableShape.cells(row);
        String kind = cells.isEmpty() ? "td" : cells.get(cells.size() - 1).name();

        List<Node> children = new ArrayList<>(row.children());
        for (int i = 0; i < missing; i++) {
            children.add(
                    Node.element(
                            kind,
                            List.of(new Attribute(Annotations.CELL_ADDED, Annotations.TRUE)),
                            List.of()));
        }
        return row.withChildren(children);
    }
}
