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

import net.boyechko.pdf.autoxhtml.issue.Issue;
import net.boyechko.pdf.autoxhtml.issue.IssueList;
import net.boyechko.pdf.autoxhtml.issue.IssueLoc;
import net.boyechko.pdf.autoxhtml.issue.IssueSev;
import net.boyechko.pdf.autoxhtml.issue.IssueType;
import net.boyechko.pdf.autoxhtml.validation.NodeVisitor;
import net.boyechko.pdf.autoxhtml.validation.VisitorContext;

/** Detects images whose source path ends at the asset folder because the source had none. */
public class DegenerateImagePathVisitor implements NodeVisitor {
    private final IssueList issues = new IssueList();

    @Override
    public String name() {
        return "Degenerate Image Path Visitor";
    }

    @Override
    public String description() {
        return "Images should point at a file";
    }

    @Override
    public boolean enterElement(VisitorContext ctx) {
        if (ctx.hasName("img")) {
            String src = ctx.node().attribute("src").orElse("");
            if (src.isEmpty() || src.endsWith("/")) {
                issues.add(
                        new Issue(
                                IssueType.DEGENERATE_IMAGE_PATH,
                                IssueSev.WARNING,
                                IssueLoc.atNode(ctx.path(), ctx.name()),
                                "Image has no file name: '" + src + "'"));
            }
        }
        return true;
    }

    @Override
    public IssueList getIssues() {
        return issues;
    }
}
