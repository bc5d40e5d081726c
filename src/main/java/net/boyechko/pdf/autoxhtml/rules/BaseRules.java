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

import java.util.List;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.document.NodeTree;

/**
 * Rules shared by every scope: the language-tag override and the identity fallbacks.
 *
 * <p>The identity element copy keeps the name, rewrites attributes through the attribute rules
 * and children through the table. Text is whitespace-normalized and dropped when blank, except
 * inside {@code style}. Comments are suppressed and processing instructions pass through.
 */
public final class BaseRules implements RuleSet {
    public static final BaseRules INSTANCE = new BaseRules();

    private BaseRules() {}

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.of(
                        "preserve-style-text",
                        Pattern.text().under("style"),
                        Rule.FALLBACK_PRIORITY + 1,
                        (node, ctx) -> RuleOutcome.emit(node)),
                Rule.forElement(
                        "identity-element",
                        Pattern.anyElement(),
                        Rule.FALLBACK_PRIORITY,
                        (element, ctx) -> RuleOutcome.emit(ctx.copy(element))),
                Rule.of(
                        "identity-text",
                        Pattern.text(),
                        Rule.FALLBACK_PRIORITY,
                        (node, ctx) -> {
                            String normalized = NodeTree.normalizedText(node);
                            return normalized.isEmpty()
                                    ? RuleOutcome.drop()
                                    : RuleOutcome.emit(Node.text(normalized));
                        }),
                Rule.dropping("suppress-comment", Pattern.comment(), Rule.FALLBACK_PRIORITY),
                Rule.of(
                        "identity-processing-instruction",
                        Pattern.anyProcessingInstruction(),
                        Rule.FALLBACK_PRIORITY,
                        (node, ctx) -> RuleOutcome.emit(node)));
    }

    @Override
    public List<AttributeRule> attributeRules() {
        return List.of(
                AttributeRule.dropping(
                        "drop-language-tag", Rule.OVERRIDE_PRIORITY, "xml:lang", "lang"),
                AttributeRule.copying("identity-attribute", Rule.FALLBACK_PRIORITY));
    }
}
