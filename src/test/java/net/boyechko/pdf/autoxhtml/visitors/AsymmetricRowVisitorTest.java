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

import static net.boyechko.pdf.autoxhtml.ConversionTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.issue.Issue;
import net.boyechko.pdf.autoxhtml.issue.IssueList;
import net.boyechko.pdf.autoxhtml.issue.IssueSev;
import net.boyechko.pdf.autoxhtml.issue.IssueType;
import net.boyechko.pdf.autoxhtml.validation.NodeTreeWalker;
import org.junit.jupiter.api.Test;

public class AsymmetricRowVisitorTest {

    private static final String[] FLAGGED_NARROW =
            attrs(
                    "data-asymmetric", "true",
                    "data-cell-count", "1",
                    "data-expected-count", "2");

    private static IssueList audit(Node.Element table) {
        return new NodeTreeWalker().addVisitor(new AsymmetricRowVisitor()).walk(table);
    }

    @Test
    void paddedRowIsReportedResolved() {
        Node.Element table =
                el(
                        "table",
                        el("tr", el("th"), el("th")),
                        el(
                                "tr",
                                FLAGGED_NARROW,
                                el("td"),
                                el("td", attrs("data-cell-added", "true"))));

        IssueList issues = audit(table);

        assertEquals(1, issues.size());
        Issue issue = issues.get(0);
        assertEquals(IssueType.ROW_PADDED, issue.type());
        assertEquals(IssueSev.INFO, issue.severity());
        assertTrue(issue.isResolved());
        assertEquals("Padded row with 1 empty cell(s)", issue.resolutionNote());
        assertEquals("/table[1]/tr[2]", issue.where().path());
    }

    @Test
    void wideRowNeedsManualReview() {
        Node.Element table =
                el(
                        "table",
                        el(
                                "tr",
                                attrs(
                                        "data-asymmetric", "true",
                                        "data-cell-count", "3",
                                        "data-expected-count", "2"),
                                el("td"),
                                el("td"),
                                el("td")));

        IssueList issues = audit(table);

        assertEquals(1, issues.size());
        assertEquals(IssueType.EXCESS_CELLS, issues.get(0).type());
        assertEquals(IssueSev.WARNING, issues.get(0).severity());
        assertFalse(issues.get(0).isResolved());
        assertEquals("Row has 3 cells, header row has 2", issues.get(0).message());
    }

    @Test
    void unflaggedRowsAreIgnored() {
        Node.Element table = el("table", el("tr", el("td")), el("tr", el("td"), el("td")));
        assertTrue(audit(table).isEmpty());
    }

    @Test
    void flaggedNarrowRowWithoutPaddingIsNotReported() {
        Node.Element table = el("table", el("tr", FLAGGED_NARROW, el("td")));
        assertTrue(audit(table).isEmpty());
    }
}
