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

import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.issue.IssueList;

/**
 * Output of a {@link Pass}.
 *
 * @param document the new tree
 * @param issues anomalies only the pass itself can observe
 * @param changes number of nodes the pass rewrote, for reporting
 */
public record PassResult(Node.Element document, IssueList issues, int changes) {

    public static PassResult of(Node.Element document) {
        return new PassResult(document, new IssueList(), 0);
    }
}
