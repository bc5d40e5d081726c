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

import net.boyechko.pdf.autoxhtml.document.Annotations;
import net.boyechko.pdf.autoxhtml.document.Node;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class HeaderRulesTest {

    @ParameterizedTest(name = "{0} becomes {1}")
    @CsvSource({"H1, h1", "H2, h2", "H3, h3", "H4, h4", "H5, h5", "H6, h6", "H, h2"})
    void headingLevelsAreMapped(String source, String target) {
        Node.Element heading =
                onlyElement(mapStructure("<" + source + ">Overview</" + source + ">"));
        assertEquals(target, heading.name());
        assertEquals("Overview", heading.textContent());
    }

    @Test
    void emptyHeadingIsDropped() {
        assertTrue(mapStructure("<H3>  </H3>").isEmpty());
    }

    @ParameterizedTest(name = "\"{0}\" is {1} {2}")
    @CsvSource({
        "1.2 Scope, decimal, 1.2, Scope",
        "3. Methods, decimal, 3, Methods",
        "IV. Results, roman-upper, IV, Results",
        "ii) Caveats, roman-lower, ii, Caveats",
        "A. Appendix, alpha-upper, A, Appendix",
        "b) Detail, alpha-lower, b, Detail",
        "Note 3 Sources differ, note, 3, Sources differ"
    })
    void leadingNumberIsSplitIntoAnnotations(
            String text, String scheme, String number, String remainder) {
        Node.Element heading = onlyElement(mapStructure("<H2>" + text + "</H2>"));

        assertEquals(scheme, heading.attribute(Annotations.NUMBER_SCHEME).orElseThrow());
        assertEquals(number, heading.attribute(Annotations.NUMBER).orElseThrow());
        assertEquals(remainder, heading.textContent());
    }

    @Test
    void textWithoutALeadingNumberIsLeftAlone() {
        assertNull(HeaderRules.detect("Introduction"));
        assertNull(HeaderRules.detect("2024 Budget"), "Four-digit years are not section numbers");
        assertNull(HeaderRules.detect("A"));

        Node.Element heading = onlyElement(mapStructure("<H1>Introduction</H1>"));
        assertFalse(heading.hasAttribute(Annotations.NUMBER));
    }
}
