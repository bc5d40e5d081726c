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

import static net.boyechko.pdf.autoxhtml.ConversionTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.boyechko.pdf.autoxhtml.core.ConversionDefaults;
import net.boyechko.pdf.autoxhtml.document.Annotations;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.document.NodeTree;
import org.junit.jupiter.api.Test;

public class TableSymmetryRulesTest {

    private static Node.Element cleanupThenPad(Node.Element document) {
        Node.Element cleaned = run(ConversionDefaults.cleanupTable(), document);
        return run(ConversionDefaults.symmetryTable(), cleaned);
    }

    private static List<Node.Element> rowsOf(Node.Element document) {
        return TableShape.rows(NodeTree.findFirstByName(document, "table"));
    }

    @Test
    void narrowRowsArePaddedToTheHeaderWidth() {
        Node.Element document =
                shelled(
                        el(
                                "table",
                                el("thead", el("tr", el("th"), el("th"), el("th"))),
                                el("tbody", el("tr", el("td", text("a"))), el("tr"))));

        List<Node.Element> rows = rowsOf(cleanupThenPad(document));

        int expected = TableShape.expectedCount(NodeTree.findFirstByName(document, "table"));
        for (Node.Element row : rows) {
            assertTrue(TableShape.cellCount(row) >= expected, "Row too narrow: " + row);
        }
        Node.Element padded = rows.get(1);
        assertEquals(3, TableShape.cells(padded).size());
        assertEquals("a", padded.textContent());
        assertEquals(
                2,
                TableShape.cells(padded).stream()
                        .filter(c -> c.hasAttribute(Annotations.CELL_ADDED))
                        .count());
        assertTrue(
                padded.hasAttribute(Annotations.ASYMMETRIC),
                "Padded rows keep their asymmetry annotation");
        assertEquals(List.of("td", "td", "td"), cellNames(rows.get(2)));
    }

    @Test
    void paddingCopiesTheTrailingCellKind() {
        Node.Element row = el("tr", el("th", text("Total")));
        Node.Element padded = TableSymmetryRules.pad(row, 3);

        assertEquals(List.of("th", "th", "th"), cellNames(padded));
        assertTrue(padded.elementChildren().get(2).children().isEmpty());
    }

    @Test
    void wideRowsAreLeftAlone() {
        Node.Element wide = el("tr", el("td"), el("td"), el("td"));
        assertSame(wide, TableSymmetryRules.pad(wide, 2));
    }

    @Test
    void paddingIsIdempotent() {
        Node.Element document =
                shelled(
                        el(
                                "table",
                                el("tr", el("th"), el("th")),
                                el("tr", el("td")),
                                el("tr", el("td"), el("td"), el("td"))));

        Node.Element once = cleanupThenPad(document);
        Node.Element twice = run(ConversionDefaults.symmetryTable(), once);

        assertEquals(once, twice);
    }

    @Test
    void tableWithoutAnnotationsIsPaddedToTheScannedWidth() {
        Node.Element document =
                shelled(el("table", el("tr", el("td"), el("td")), el("tr", el("td"))));

        Node.Element out = run(ConversionDefaults.symmetryTable(), document);

        assertEquals(2, TableShape.cellCount(rowsOf(out).get(1)));
    }

    private static List<String> cellNames(Node.Element row) {
        return TableShape.cells(row).stream().map(Node.Element::name).toList();
    }
}
