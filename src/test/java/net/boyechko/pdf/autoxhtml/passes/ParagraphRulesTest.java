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

public class ParagraphRulesTest {

    private static List<String> names(List<Node> nodes) {
        return nodes.stream().map(n -> ((Node.Element) n).name()).toList();
    }

    private static List<String> texts(List<Node> nodes) {
        return nodes.stream().map(n -> ((Node.Element) n).textContent()).toList();
    }

    @Test
    void paragraphBecomesLowercaseWithNormalizedText() {
        Node.Element p = onlyElement(mapStructure("<P xml:lang=\"en\">  Some   text </P>"));
        assertEquals("p", p.name());
        assertEquals("Some text", p.textContent());
        assertFalse(p.hasAttribute("xml:lang"));
    }

    @Test
    void emptyParagraphIsDropped() {
        assertTrue(mapStructure("<P>   </P><P/>").isEmpty());
    }

    @Test
    void nestedParagraphsAndLooseTextBecomeSiblings() {
        List<Node> out = mapStructure("<P><P>one</P>free text<P>two</P></P>");

        assertEquals(List.of("p", "p", "p"), names(out));
        assertEquals(List.of("one", "free text", "two"), texts(out));
    }

    @Test
    void runWithoutTextIsPromotedBare() {
        List<Node> out =
                mapStructure("<P><P>one</P><Figure><ImageData src=\"i/a.png\"/></Figure></P>");

        assertEquals(List.of("p", "img"), names(out));
    }

    @Test
    void referencesInsideUnwrappedParagraphsAreDropped() {
        List<Node> out = mapStructure("<P><P>one</P><Reference>1</Reference></P>");
        assertEquals(List.of("p"), names(out));
    }

    @Test
    void runningHeaderParagraphsAreDropped() {
        List<Node> out =
                mapStructure(
                        "<P>ACME  Annual\nReport</P><P>Real content</P>",
                        settings().withRunningHeaders(List.of("ACME Annual Report")));

        assertEquals(List.of("Real content"), texts(out));
    }

    @Test
    void paragraphsAreKeptWithoutRunningHeaders() {
        assertEquals(1, mapStructure("<P>ACME Annual Report</P>").size());
    }
}
