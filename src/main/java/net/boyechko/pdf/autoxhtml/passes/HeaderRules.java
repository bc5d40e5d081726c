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
import java.util.regex.Matcher;
import net.boyechko.pdf.autoxhtml.document.Annotations;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.document.NodeTree;
import net.boyechko.pdf.autoxhtml.rules.Pattern;
import net.boyechko.pdf.autoxhtml.rules.Rule;
import net.boyechko.pdf.autoxhtml.rules.RuleContext;
import net.boyechko.pdf.autoxhtml.rules.RuleOutcome;
import net.boyechko.pdf.autoxhtml.rules.RuleSet;

/**
 * Heading rules. {@code H1}…{@code H6} keep their level and the generic {@code H} becomes {@code
 * h2}. A leading section number is split off the heading text into {@code data-number}, with its
 * style in {@code data-numberscheme}.
 */
public final class HeaderRules implements RuleSet {

    /** Numbering styles, tried in order; roman comes before alphabetic so "I." reads as one. */
    enum NumberScheme {
        NOTE("note", "^(?:Note|NOTE)\\s+(\\d+)[.:]?\\s+(.+)$"),
        DECIMAL("decimal", "^(\\d{1,3}(?:\\.\\d+)*)\\.?\\s+(.+)$"),
        ROMAN_UPPER("roman-upper", "^([IVXLCDM]+)[.)]\\s+(.+)$"),
        ROMAN_LOWER("roman-lower", "^([ivxlcdm]+)[.)]\\s+(.+)$"),
        ALPHA_UPPER("alpha-upper", "^([A-Z])[.)]\\s+(.+)$"),
        ALPHA_LOWER("alpha-lower", "^([a-z])[.)]\\s+(.+)$");

        private final String attributeValue;
        private final java.util.regex.Pattern regex;

        NumberScheme(String attributeValue, String regex) {
            this.attributeValue = attributeValue;
            this.regex = java.util.regex.Pattern.compile(regex);
        }

        String attributeValue() {
            return attributeValue;
        }
    }

    /** A heading number split from the text that followed it. */
    record Numbering(NumberScheme scheme, String number, String remainder) {}

    @Override
    public List<Rule> rules() {
        List<Rule> rules = new ArrayList<>();
        for (int level = 1; level <= 6; level++) {
            String target = "h" + level;
            rules.add(
                    Rule.forElement(
                            "heading-" + level,
                            Pattern.element("H" + level),
                            10,
                            (element, ctx) -> heading(element, target, ctx)));
        }
        rules.add(
                Rule.forElement(
                        "generic-heading",
                        Pattern.element("H"),
                        10,
                        (element, ctx) -> heading(element, "h2", ctx)));
        return rules;
    }

    private RuleOutcome heading(Node.Element source, String target, RuleContext ctx) {
        if (NodeTree.normalizedText(source).isEmpty()) {
            return RuleOutcome.drop();
        }
        Node.Element heading = ctx.copyAs(source, target);
        List<Node> children = heading.children();
        if (children.isEmpty() || !(children.get(0) instanceof Node.Text first)) {
            return RuleOutcome.emit(heading);
        }
        Numbering numbering = detect(first.content());
        if (numbering == null) {
            return RuleOutcome.emit(heading);
        }
        List<Node> rest = new ArrayList<>(children);
        rest.set(0, Node.text(numbering.remainder()));
        return RuleOutcome.emit(
                heading.withChildren(rest)
                        .withAttribute(
                                Annotations.NUMBER_SCHEME, numbering.scheme().attributeValue())
                        .withAttribute(Annotations.NUMBER, numbering.number()));
    }

    /** Detects a leading number in normalized heading text; null when there is none. */
    static Numbering detect(String text) {
        String normalized = NodeTree.normalizeSpace(text);
        for (NumberScheme scheme : NumberScheme.values()) {
            Matcher m = scheme.regex.matcher(normalized);
            if (m.matches()) {
                return new Numbering(scheme, m.group(1), m.group(2));
            }
        }
        return null;
    }
}
