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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.autoxhtml.core.ConversionSettings;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.issue.Issue;
import net.boyechko.pdf.autoxhtml.issue.IssueList;
import net.boyechko.pdf.autoxhtml.issue.IssueLoc;
import net.boyechko.pdf.autoxhtml.issue.IssueSev;
import net.boyechko.pdf.autoxhtml.issue.IssueType;

/**
 * Re-levels headings against the first one in document order. The first heading becomes {@code
 * h1} and later headings at its level become {@code h2}. Shallower headings become {@code h1}.
 * Deeper headings keep their depth below the level last given to a first-level or shallower
 * heading, capped at {@code h6}. Skipped levels are kept.
 */
public class HeaderLevelNormalizer implements Pass {

    @Override
    public String name() {
        return "Header normalization";
    }

    @Override
    public PassResult apply(Node.Element document, ConversionSettings settings) {
        Walk walk = new Walk();
        Node.Element normalized = walk.element(document, "/" + document.name() + "[1]");
        return new PassResult(normalized, walk.issues, walk.issues.size());
    }

    static int level(Node.Element element) {
        String name = element.name();
        if (name.length() == 2 && name.charAt(0) == 'h') {
            char digit = name.charAt(1);
            if (digit >= '1' && digit <= '6') {
                return digit - '0';
            }
        }
        return 0;
    }

    /** State of one normalization walk. */
    private static final class Walk {
        private final IssueList issues = new IssueList();
        private int firstLevel;
        private int anchor = 1;

        int target(int level) {
            if (firstLevel == 0) {
                firstLevel = level;
                anchor = 1;
            } else if (level == firstLevel) {
                anchor = 2;
            } else if (level < firstLevel) {
                anchor = 1;
            } else {
                return Math.min(6, anchor + level - firstLevel);
            }
            return anchor;
        }

        Node.Element element(Node.Element element, String path) {
            Node.Element result = element;
            int level = level(element);
            if (level > 0) {
                int target = target(level);
                if (target != level) {
                    result = element.withName("h" + target);
                    Issue issue =
                            new Issue(
                                    IssueType.HEADER_LEVEL_ADJUSTED,
                                    IssueSev.INFO,
                                    IssueLoc.atNode(path, element.name()),
                                    "Heading h"
                                            + level
                                            + " re-leveled against the first heading h"
                                            + firstLevel);
                    issue.markResolved("Changed h" + level + " to h" + target);
                    issues.add(issue);
                }
            }
            if (element.elementChildren().isEmpty()) {
                return result;
            }
            List<Node> children = new ArrayList<>(element.children().size());
            Map<String, Integer> positions = new HashMap<>();
            for (Node child : element.children()) {
                if (child instanceof Node.Element e) {
                    int position = positions.merge(e.name(), 1, Integer::sum);
                    children.add(this.element(e, path + "/" + e.name() + "[" + position + "]"));
                } else {
                    children.add(child);
                }
            }
            return result.withChildren(children);
        }
    }
}
