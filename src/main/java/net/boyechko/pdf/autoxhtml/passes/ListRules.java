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

import java.util.List;
import java.util.Optional;
import java.util.Set;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.document.NodeTree;
import net.boyechko.pdf.autoxhtml.rules.AttributeRule;
import net.boyechko.pdf.autoxhtml.rules.Pattern;
import net.boyechko.pdf.autoxhtml.rules.Rule;
import net.boyechko.pdf.autoxhtml.rules.RuleContext;
import net.boyechko.pdf.autoxhtml.rules.RuleOutcome;
import net.boyechko.pdf.autoxhtml.rules.RuleSet;

/** List rules: {@code L}, {@code LI}, {@code Lbl} and {@code LBody}. */
public final class ListRules implements RuleSet {

    /** ListNumbering values that render as an ordered list. */
    private static final Set<String> ORDERED_NUMBERING =
            Set.of("Decimal", "UpperRoman", "LowerRoman", "UpperAlpha", "LowerAlpha");

    private static final Set<String> BULLET_GLYPHS =
            Set.of("•", "◦", "▪", "▫", "‣", "⁃", "●", "○", "■", "□", "►", "▸", "–", "-", "*", "·", "");

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.forElement("list", Pattern.element("L"), 10, this::list),
                Rule.forElement(
                        "list-item",
                        Pattern.element("LI"),
                        10,
                        (element, ctx) -> RuleOutcome.emit(ctx.copyAs(element, "li"))),
                Rule.dropping(
                        "drop-bullet-label",
                        Pattern.element("Lbl")
                                .where((node, ctx) -> isBulletGlyph(NodeTree.normalizedText(node))),
                        20),
                Rule.forElement("label", Pattern.element("Lbl"), 10, this::label),
                Rule.forElement(
                        "list-body",
                        Pattern.element("LBody"),
                        10,
                        (element, ctx) -> RuleOutcome.emit(ctx.rewriteChildren(element))));
    }

    @Override
    public List<AttributeRule> attributeRules() {
        return List.of(
                new AttributeRule(
                        "drop-list-numbering",
                        10,
                        (owner, attribute) ->
                                owner.hasName("L") && attribute.name().equals("ListNumbering"),
                        attribute -> Optional.empty()));
    }

    private RuleOutcome list(Node.Element list, RuleContext ctx) {
        boolean ordered =
                list.attribute("ListNumbering").filter(ORDERED_NUMBERING::contains).isPresent();
        return RuleOutcome.emit(ctx.copyAs(list, ordered ? "ol" : "ul"));
    }

    private RuleOutcome label(Node.Element label, RuleContext ctx) {
        Node.Element span = ctx.copyAs(label, "span");
        return RuleOutcome.emit(span.withAttribute("class", "lbl"));
    }

    static boolean isBulletGlyph(String normalizedText) {
        return BULLET_GLYPHS.contains(normalizedText);
    }
}
