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

import java.util.Objects;
import net.boyechko.pdf.autoxhtml.document.Node;

/**
 * A named, prioritized rewrite rule: when {@link #pattern()} matches a node, {@link #handler()}
 * produces the replacement fragment or falls through to the next candidate.
 */
public record Rule(String name, Pattern pattern, int priority, Handler handler) {

    /** Priority of the identity rules every table ends with. */
    public static final int FALLBACK_PRIORITY = -1000;

    /** Priority of the cross-cutting overrides active in every scope. */
    public static final int OVERRIDE_PRIORITY = 1000;

    @FunctionalInterface
    public interface Handler {
        RuleOutcome apply(Node node, RuleContext ctx);
    }

    @FunctionalInterface
    public interface ElementHandler {
        RuleOutcome apply(Node.Element element, RuleContext ctx);
    }

    public Rule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(handler, "handler");
    }

    public static Rule of(String name, Pattern pattern, int priority, Handler handler) {
        return new Rule(name, pattern, priority, handler);
    }

    /** Rule whose pattern only ever matches elements, so the handler can take one directly. */
    public static Rule forElement(
            String name, Pattern pattern, int priority, ElementHandler handler) {
        return new Rule(
                name,
                pattern,
                priority,
                (node, ctx) ->
                        node instanceof Node.Element e
                                ? handler.apply(e, ctx)
                                : RuleOutcome.fallthrough());
    }

    /** Convenience for a rule that never falls through. */
    public static Rule dropping(String name, Pattern pattern, int priority) {
        return new Rule(name, pattern, priority, (node, ctx) -> RuleOutcome.drop());
    }

    public boolean matches(Node node, RuleContext ctx) {
        return pattern.matches(node, ctx);
    }

    @Override
    public String toString() {
        return name + " [" + pattern + ", priority " + priority + "]";
    }
}
