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
package net.boyechko.pdf.autoxhtml.visitors;

import java.util.LinkedHashMap;
import java.util.Map;
import net.boyechko.pdf.autoxhtml.issue.Issue;
import net.boyechko.pdf.autoxhtml.issue.IssueList;
import net.boyechko.pdf.autoxhtml.issue.IssueLoc;
import net.boyechko.pdf.autoxhtml.issue.IssueSev;
import net.boyechko.pdf.autoxhtml.issue.IssueType;
import net.boyechko.pdf.autoxhtml.validation.HtmlElementNames;
import net.boyechko.pdf.autoxhtml.validation.NodeVisitor;
import net.boyechko.pdf.autoxhtml.validation.VisitorContext;

/**
 * Detects output elements with no HTML counterpart, typically source elements no rule mapped.
 * Reports one issue per element name, located at its first occurrence.
 */
public class NonHtmlElementVisitor implements NodeVisitor {
    private final Map<String, String> firstPathByName = new LinkedHashMap<>();
    private final Map<String, Integer> countByName = new LinkedHashMap<>();
    private final IssueList issues = new IssueList();

    @Override
    public String name() {
        return "Non-HTML Element Visitor";
    }

    @Override
    public String description() {
        return "Output elements should be lowercase HTML elements";
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        String elementName = ctx.name();
        if (!HtmlElementNames.isHtmlElement(elementName)) {
            firstPathByName.putIfAbsent(elementName, ctx.path());
            countByName.merge(elementName, 1, Integer::sum);
        }
        return true;
    }

    @Override
    public void afterTraversal() {
        for (Map.Entry<String, String> entry : firstPathByName.entrySet()) {
            String elementName = entry.getKey();
            int count = countByName.get(elementName);
            StringBuilder message =
                    new StringBuilder("'")
                            .append(elementName)
                            .append("' is not a valid HTML element");
            if (!elementName.equals(elementName.toLowerCase())) {
                message.append(" (HTML elements must be lowercase)");
            }
            if (count > 1) {
                message.append(", ").append(count).append(" occurrences");
            }
            issues.add(
                    new Issue(
                            IssueType.NON_HTML_ELEMENT,
                            IssueSev.WARNING,
                            IssueLoc.atNode(entry.getValue(), elementName),
                            message.toString()));
        }
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
