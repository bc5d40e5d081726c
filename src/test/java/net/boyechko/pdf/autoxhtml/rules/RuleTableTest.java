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

import java.util.List;
import net.boyechko.pdf.autoxhtml.core.ConversionException;
import net.boyechko.pdf.autoxhtml.document.Node;
import org.junit.jupiter.api.Test;

public class RuleTableTest {

    private static Rule renaming(String ruleName, Pattern pattern, int priority, String to) {
        return Rule.forElement(
                ruleName, pattern, priority, (e, ctx) -> RuleOutcome.emit(ctx.copyAs(e, to)));
    }

    @Test
    void higherPriorityRuleWins() {
        RuleTable table =
                RuleTable.builder(Scope.STRUCTURE)
                        .add(renaming("low", Pattern.element("P"), 1, "low"))
                        .add(renaming("high", Pattern.element("P"), 5, "high"))
                        .build();

        Node.Element out = run(table, el("P", text("x")));

        assertEquals("high", out.name());
    }

    @Test
    void equalPriorityPrefersTheMoreSpecificPattern() {
        RuleTable table =
                RuleTable.builder(Scope.STRUCTURE)
                        .add(renaming("any", Pattern.anyElement(), 1, "any"))
                        .add(renaming("nested", Pattern.element("b").under("a"), 1, "nested"))
                        .add(renaming("named", Pattern.element("b"), 1, "named"))
                        .build();

        Node.Element out = run(table, el("a", el("b"), el("c", el("b"))));

        List<Node.Element> children = out.elementChildren();
        assertEquals("any", out.name());
        assertEquals("nested", children.get(0).name());
        assertEquals("named", children.get(1).elementChildren().get(0).name());
    }

    @Test
    void registrationOrderBreaksRemainingTies() {
        RuleTable table =
                RuleTable.builder(Scope.STRUCTURE)
                        .add(renaming("first", Pattern.element("P"), 1, "first"))
                        .add(renaming("second", Pattern.element("P"), 1, "second"))
                        .build();

        assertEquals("first", table.rules().get(0).name());
        assertEquals("first", run(table, el("P")).name());
    }

    @Test
    void fallthroughHandsTheNodeToTheNextRule() {
        RuleTable table =
                RuleTable.builder(Scope.STRUCTURE)
                        .add(
                                Rule.of(
                                        "declines",
                                        Pattern.element("P"),
                                        5,
                                        (n, c) -> RuleOutcome.fallthrough()))
                        .add(renaming("accepts", Pattern.element("P"), 1, "p"))
                        .build();

        assertEquals("p", run(table, el("P")).name());
    }

    @Test
    void identityRulesMakeDispatchTotal() {
        RuleTable empty = RuleTable.builder(Scope.CLEANUP).build();
        Node.Element input =
                el(
                        "Unknown",
                        attrs("class", "k"),
                        el("Other", text("  a   b  ")),
                        new Node.Comment("gone"),
                        new Node.ProcessingInstruction("keep", "x=\"1\""));

        Node.Element out = run(empty, input);

        assertEquals("Unknown", out.name());
        assertEquals("k", out.attribute("class").orElseThrow());
        assertEquals(2, out.children().size(), "Comment should be suppressed");
        assertEquals(List.of(text("a b")), out.elementChildren().get(0).children());
        assertInstanceOf(Node.ProcessingInstruction.class, out.children().get(1));
    }

    @Test
    void blankTextIsDropped() {
        RuleTable empty = RuleTable.builder(Scope.CLEANUP).build();
        Node.Element out = run(empty, el("p", text("   "), el("b", text("x")), text("\n")));
        assertEquals(1, out.children().size());
    }

    @Test
    void textInsideStyleIsKeptVerbatim() {
        RuleTable empty = RuleTable.builder(Scope.CLEANUP).build();
        String css = "\np { color: red; }\n";
        Node.Element out = run(empty, el("style", text(css)));
        assertEquals(List.of(text(css)), out.children());
    }

    @Test
    void languageTagsAreDroppedInEveryScope() {
        for (Scope scope : Scope.values()) {
            RuleTable table =
                    RuleTable.builder(scope)
                            .add(AttributeRule.copying("copy-all", 100))
                            .build();
            Node.Element out =
                    run(table, el("span", attrs("xml:lang", "en", "lang", "en", "id", "s1")));
            assertFalse(out.hasAttribute("xml:lang"), scope + " kept xml:lang");
            assertFalse(out.hasAttribute("lang"), scope + " kept lang");
            assertTrue(out.hasAttribute("id"));
        }
    }

    @Test
    void renamedAttributeReplacesAnExistingOneOfTheSameName() {
        RuleTable table =
                RuleTable.builder(Scope.STRUCTURE)
                        .add(AttributeRule.renaming("rename", 10, "TD", "ColSpan", "colspan"))
                        .build();

        Node.Element out = run(table, el("TD", attrs("colspan", "1", "ColSpan", "3")));

        assertEquals(1, out.attributes().size());
        assertEquals("3", out.attribute("colspan").orElseThrow());
    }

    @Test
    void rootThatDoesNotSurviveAsOneElementFailsThePass() {
        RuleTable table =
                RuleTable.builder(Scope.CLEANUP)
                        .add(Rule.dropping("drop-root", Pattern.element("html"), 1))
                        .build();
        assertThrows(ConversionException.class, () -> run(table, el("html")));
    }
}
