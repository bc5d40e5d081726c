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
import net.boyechko.pdf.autoxhtml.document.Node;
import org.junit.jupiter.api.Test;

public class ListRulesTest {

    @Test
    void numberedListBecomesOrderedListWithVisibleLabels() {
        Node.Element ol =
                onlyElement(
                        mapStructure(
                                "<L ListNumbering=\"Decimal\">"
                                        + "<LI><Lbl>1.</Lbl><LBody>First</LBody></LI>"
                                        + "<LI><Lbl>2.</Lbl><LBody>Second</LBody></LI>"
                                        + "</L>"));

        assertEquals("ol", ol.name());
        assertTrue(ol.attributes().isEmpty(), "ListNumbering is not an HTML attribute");
        List<Node.Element> items = ol.elementChildren("li");
        assertEquals(2, items.size());

        Node.Element label = items.get(0).elementChildren().get(0);
        assertEquals("span", label.name());
        assertEquals("lbl", label.attribute("class").orElseThrow());
        assertEquals("1.", label.textContent());
        assertEquals("1.First", items.get(0).textContent());
    }

    @Test
    void bulletListDropsGlyphLabelsAndPromotesBodies() {
        Node.Element ul =
                onlyElement(
                        mapStructure(
                                "<L><LI><Lbl>•</Lbl><LBody><P>Apples</P></LBody></LI>"
                                        + "<LI><Lbl> - </Lbl><LBody><P>Pears</P></LBody></LI></L>"));

        assertEquals("ul", ul.name());
        for (Node.Element li : ul.elementChildren("li")) {
            assertEquals(1, li.children().size());
            assertEquals("p", li.elementChildren().get(0).name());
        }
    }

    @Test
    void unknownNumberingFallsBackToUnorderedList() {
        Node.Element list =
                onlyElement(mapStructure("<L ListNumbering=\"Disc\"><LI>x</LI></L>"));
        assertEquals("ul", list.name());
    }

    @Test
    void bulletGlyphs() {
        assertTrue(ListRules.isBulletGlyph("•"));
        assertTrue(ListRules.isBulletGlyph(""));
        assertFalse(ListRules.isBulletGlyph("a)"));
        assertFalse(ListRules.isBulletGlyph("1."));
    }
}
