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

import static net.boyechko.pdf.autoxhtml.ConversionTestSupport.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.autoxhtml.document.Node;
import org.junit.jupiter.api.Test;

public class TreeRewriterTest {

    @Test
    void contextCarriesAncestorsAndPositionalPath() {
        List<String> seen = new ArrayList<>();
        RuleTable table =
                RuleTable.builder(Scope.STRUCTURE)
                        .add(
                                Rule.forElement(
                                        "record-cells",
                                        Pattern.element("td"),
                                        1,
                                        (e, ctx) -> {
                                            seen.add(ctx.path() + " " + ctx.ancestors());
                                            return RuleOutcome.emit(ctx.copy(e));
                                        }))
                        .build();

        run(table, el("table", el("tr", el("td"), text("x"), el("td")), el("tr", el("td"))));

        assertEquals(
                List.of(
                        "/table[1]/tr[1]/td[1] [table, tr]",
                        "/table[1]/tr[1]/td[2] [table, tr]",
                        "/table[1]/tr[2]/td[1] [table, tr]"),
                seen);
    }

    @Test
    void childStepsNumberEachKindSeparately() {
        Node.Element parent =
                el("tr", el("td"), text("a"), el("th"), el("td"), text("b"), el("td"));

        assertEquals(
                List.of("td[1]", "text()[1]", "th[1]", "td[2]", "text()[2]", "td[3]"),
                TreeRewriter.childSteps(parent));
    }

    @Test
    void childContextsOfAWideRowKeepTheirPositions() {
        Node[] cells = new Node[5000];
        for (int i = 0; i < cells.length; i++) {
            cells[i] = el("td", text(Integer.toString(i)));
        }
        Node.Element row = el("tr", cells);
        RuleContext rowContext =
                new RuleContext(null, settings(), List.of("table"), "/table[1]/tr[1]", 1);

        List<RuleContext> contexts = rowContext.childContexts(row);

        assertEquals(5000, contexts.size());
        assertEquals("/table[1]/tr[1]/td[1]", contexts.get(0).path());
        assertEquals("/table[1]/tr[1]/td[5000]", contexts.get(4999).path());
        assertEquals(List.of("table", "tr"), contexts.get(4999).ancestors());
        assertEquals(2, contexts.get(4999).depth());
    }

    @Test
    void aRuleMayPromoteChildrenIntoItsParent() {
        RuleTable table =
                RuleTable.builder(Scope.STRUCTURE)
                        .add(
                                Rule.forElement(
                                        "unwrap",
                                        Pattern.element("Part"),
                                        1,
                                        (e, ctx) -> RuleOutcome.emit(ctx.rewriteChildren(e))))
                        .build();

        Node.Element out = run(table, el("div", el("Part", el("a"), el("b")), el("c")));

        assertEquals(
                List.of("a", "b", "c"),
                out.elementChildren().stream().map(Node.Element::name).toList());
    }

    @Test
    void inputTreeIsNotModified() {
        Node.Element input = el("P", text("  spaced  "));
        run(RuleTable.builder(Scope.CLEANUP).build(), input);
        assertEquals("  spaced  ", ((Node.Text) input.children().get(0)).content());
    }

    @Test
    void processingInstructionPatternMatchesTarget() {
        RuleTable table =
                RuleTable.builder(Scope.STRUCTURE)
                        .add(
                                Rule.dropping(
                                        "drop-marker",
                                        Pattern.processingInstruction("pdf-marker"),
                                        10))
                        .build();
        Node.Element input =
                el(
                        "div",
                        new Node.ProcessingInstruction("pdf-marker", "page=1"),
                        new Node.ProcessingInstruction("other", ""));

        Node.Element output = run(table, input);

        assertEquals(List.of(new Node.ProcessingInstruction("other", "")), output.children());
    }

    @Test
    void patternSpecificityCountsNameParentsAndCondition() {
        assertEquals(0, Pattern.anyElement().specificity());
        assertEquals(1, Pattern.element("th").specificity());
        assertEquals(3, Pattern.element("th").under("tbody", "tr").specificity());
        assertEquals(2, Pattern.element("P").where((n, c) -> true).specificity());
    }
}
