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
import java.util.function.BiPredicate;
import net.boyechko.pdf.autoxhtml.document.Node;

/**
 * Node pattern used to select rules. A pattern names a node kind, optionally an element name or
 * processing-instruction target, optionally the names of the closest ancestors, and optionally an
 * extra condition.
 *
 * <p>Specificity orders equal-priority rules: a kind-only pattern scores 0, a named one 1, each
 * ancestor step adds 1 and a condition adds 1.
 */
public final class Pattern {

    enum Kind {
        ELEMENT,
        TEXT,
        COMMENT,
        PROCESSING_INSTRUCTION
    }

    private final Kind kind;
    private final String name;
    private final List<String> parents;
    private final BiPredicate<Node, RuleContext> condition;

    private Pattern(
            Kind kind,
            String name,
            List<String> parents,
            BiPredicate<Node, RuleContext> condition) {
        this.kind = kind;
        this.name = name;
        this.parents = List.copyOf(parents);
        this.condition = condition;
    }

    public static Pattern element(String name) {
        return new Pattern(Kind.ELEMENT, name, List.of(), null);
    }

    public static Pattern anyElement() {
        return new Pattern(Kind.ELEMENT, null, List.of(), null);
    }

    public static Pattern text() {
        return new Pattern(Kind.TEXT, null, List.of(), null);
    }

    public static Pattern comment() {
        return new Pattern(Kind.COMMENT, null, List.of(), null);
    }

    public static Pattern processingInstruction(String target) {
        return new Pattern(Kind.PROCESSING_INSTRUCTION, target, List.of(), null);
    }

    public static Pattern anyProcessingInstruction() {
        return new Pattern(Kind.PROCESSING_INSTRUCTION, null, List.of(), null);
    }

    /**
     * Requires the closest ancestors to carry these names, outermost first: {@code
     * element("th").under("tbody", "tr")} matches a {@code th} whose parent is a {@code tr} whose
     * parent is a {@code tbody}.
     */
    public Pattern under(String... ancestorNames) {
        return new Pattern(kind, name, List.of(ancestorNames), condition);
    }

    public Pattern where(BiPredicate<Node, RuleContext> extraCondition) {
        BiPredicate<Node, RuleContext> combined =
                condition == null ? extraCondition : condition.and(extraCondition);
        return new Pattern(kind, name, parents, combined);
    }

    public boolean matches(Node node, RuleContext ctx) {
        if (!kindMatches(node)) {
            return false;
        }
        if (!parentsMatch(ctx.ancestors())) {
            return false;
        }
        return condition == null || condition.test(node, ctx);
    }

    private boolean kindMatches(Node node) {
        switch (kind) {
            case ELEMENT:
                return node instanceof Node.Element e && (name == null || e.hasName(name));
            case TEXT:
                return node instanceof Node.Text;
            case COMMENT:
                return node instanceof Node.Comment;
            case PROCESSING_INSTRUCTION:
                return node instanceof Node.ProcessingInstruction pi
                        && (name == null || name.equals(pi.target()));
            default:
                return false;
        }
    }

    private boolean parentsMatch(List<String> ancestors) {
        if (parents.isEmpty()) {
            return true;
        }
        if (ancestors.size() < parents.size()) {
            return false;
        }
        int offset = ancestors.size() - parents.size();
        for (int i = 0; i < parents.size(); i++) {
            if (!parents.get(i).equals(ancestors.get(offset + i))) {
                return false;
            }
        }
        return true;
    }

    public int specificity() {
        int score = name != null ? 1 : 0;
        score += parents.size();
        if (condition != null) {
            score++;
        }
        return score;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (String parent : parents) {
            sb.append(parent).append('/');
        }
        switch (kind) {
            case ELEMENT -> sb.append(name != null ? name : "*");
            case TEXT -> sb.append("text()");
            case COMMENT -> sb.append("comment()");
            case PROCESSING_INSTRUCTION ->
                    sb.append("processing-instruction(")
                            .append(name != null ? name : "")
                            .append(')');
        }
        if (condition != null) {
            sb.append("[…]");
        }
        return sb.toString();
    }
}
