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
package net.boyechko.pdf.autoxhtml.issue;

/** Represents the type of an issue found while converting a document. */
public enum IssueType {
    // Fatal issues (conversion cannot continue)
    SOURCE_NOT_PARSEABLE("source documents that failed to parse"),

    // Table issues
    ROW_PADDED("table rows padded with empty cells"),
    EXCESS_CELLS("table rows with more cells than the header row"),

    // Content issues
    DEGENERATE_IMAGE_PATH("images without a source path"),
    NON_HTML_ELEMENT("elements with no HTML counterpart"),
    HEADER_LEVEL_ADJUSTED("headings moved to a different level"),
    UNCLOSED_STRIP_RANGE("strip ranges never closed");

    private final String groupLabel;

    IssueType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
