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
import net.boyechko.pdf.autoxhtml.core.ConversionSettings;
import net.boyechko.pdf.autoxhtml.document.Annotations;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.issue.Issue;
import net.boyechko.pdf.autoxhtml.issue.IssueList;
import net.boyechko.pdf.autoxhtml.issue.IssueLoc;
import net.boyechko.pdf.autoxhtml.issue.IssueSev;
import net.boyechko.pdf.autoxhtml.issue.IssueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes every span of content delimited by {@code data-strip="start"} and {@code
 * data-strip="stop"} markers, in document order and across element boundaries, and erases the
 * markers from everything that survives.
 *
 * <p>The traversal threads a single "stripping" flag into and out of each call. The start and
 * stop elements are removed together with their subtrees. An element entered while stripping is
 * kept, as a shell, only when a descendant after the stop survives. A start while already
 * stripping and a stop outside a span change nothing.
 */
public class RangeStripper implements Pass {
    private static final Logger logger = LoggerFactory.getLogger(RangeStripper.class);

    /** Surviving nodes of one subtree and the flag after it. */
    record StripResult(List<Node> nodes, boolean stripping) {}

    @Override
    public String name() {
        return "Range stripping";
    }

    @Override
    public PassResult apply(Node.Element document, ConversionSettings settings) {
        StripResult result = strip(document, false);
        IssueList issues = new IssueList();
        if (result.stripping()) {
            logger.warn("Strip range opened but never closed; content removed to end of document");
            issues.add(
                    new Issue(
                            IssueType.UNCLOSED_STRIP_RANGE,
                            IssueSev.WARNING,
                            IssueLoc.none(),
                            "Strip range never closed; everything after its start was removed"));
        }
        if (result.nodes().isEmpty()) {
            // A start marker on the root itself leaves an empty root
            return new PassResult(
                    document.withoutAttribute(Annotations.STRIP).withChildren(List.of()),
                    issues,
                    0);
        }
        return new PassResult((Node.Element) result.nodes().get(0), issues, 0);
    }

    static StripResult strip(Node node, boolean stripping) {
        if (!(node instanceof Node.Element element)) {
            return new StripResult(stripping ? List.of() : List.of(node), stripping);
        }
        String marker = element.attribute(Annotations.STRIP).orElse("");
        if (!stripping && Annotations.STRIP_START.equals(marker)) {
            return new StripResult(List.of(), stripChildren(element, true).stripping());
        }
        if (stripping && Annotations.STRIP_STOP.equals(marker)) {
            // Inclusive end: markers inside the dropped subtree are never seen
            return new StripResult(List.of(), false);
        }

        StripResult children = stripChildren(element, stripping);
        if (stripping && children.nodes().isEmpty()) {
            return new StripResult(List.of(), children.stripping());
        }
        Node.Element kept =
                element.withoutAttribute(Annotations.STRIP).withChildren(children.nodes());
        return new StripResult(List.of(kept), children.stripping());
    }

    private static StripResult stripChildren(Node.Element element, boolean stripping) {
        List<Node> out = new ArrayList<>();
        boolean state = stripping;
        for (Node child : element.children()) {
            StripResult result = strip(child, state);
            out.addAll(result.nodes());
            state = result.stripping();
        }
        return new StripResult(out, state);
    }
}
