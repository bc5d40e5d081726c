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

/**
 * Result of offering a node to a rule handler. {@link Matched} ends dispatch with the given output
 * fragment (possibly empty); {@link Fallthrough} hands the node to the next candidate rule.
 */
public sealed interface RuleOutcome permits RuleOutcome.Matched, RuleOutcome.Fallthrough {

    record Matched(List<Node> nodes) implements RuleOutcome {
        public Matched {
            nodes = List.copyOf(nodes);
        }
    }

    record Fallthrough() implements RuleOutcome {}

    static RuleOutcome emit(Node node) {
        return new Matched(List.of(node));
    }

    static RuleOutcome emit(List<Node> nodes) {
        return new Matched(nodes);
    }

    static RuleOutcome drop() {
        return new Matched(List.of());
    }

    static RuleOutcome fallthrough() {
        return new Fallthrough();
    }
}
