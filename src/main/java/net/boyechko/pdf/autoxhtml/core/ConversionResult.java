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
package net.boyechko.pdf.autoxhtml.core;

import java.util.List;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.issue.IssueList;

/**
 * Outcome of converting one document.
 *
 * @param document the output tree, null when the conversion was aborted
 * @param issues every issue found, resolved or not
 * @param passesRun names of the passes that ran, in order
 * @param tablesProcessed number of tables in the output
 * @param headersNormalized number of headings whose level was changed
 * @param elapsedMillis wall-clock conversion time
 */
public record ConversionResult(
        Node.Element document,
        IssueList issues,
        List<String> passesRun,
        int tablesProcessed,
        int headersNormalized,
        long elapsedMillis) {

    /** Returns an aborted result with no output document and the given fatal issues. */
    public static ConversionResult aborted(IssueList fatalIssues, long elapsedMillis) {
        return new ConversionResult(null, fatalIssues, List.of(), 0, 0, elapsedMillis);
    }

    public boolean isAborted() {
        return document == null;
    }

    public IssueList remainingIssues() {
        return issues.getRemainingIssues();
    }

    public IssueList resolvedIssues() {
        return issues.getResolvedIssues();
    }
}
