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

/** Represents an issue found while converting a document. */
public final class Issue {
    private final IssueType type;
    private final IssueSev severity;
    private final IssueLoc where;
    private final String message;

    private boolean resolved;
    private String resolutionNote;

    public Issue(IssueType type, IssueSev sev, String message) {
        this(type, sev, IssueLoc.none(), message);
    }

    public Issue(IssueType type, IssueSev sev, IssueLoc where, String message) {
        this.type = type;
        this.severity = sev;
        this.where = where;
        this.message = message;
    }

    public IssueType type() {
        return type;
    }

    public IssueSev severity() {
        return severity;
    }

    public IssueLoc where() {
        return where;
    }

    public String message() {
        return message;
    }

    public boolean isResolved() {
        return resolved;
    }

    public String resolutionNote() {
        return resolutionNote;
    }

    /** Marks the issue as repaired by the conversion itself. */
    public void markResolved(String note) {
        this.resolved = true;
        this.resolutionNote = note;
    }

    @Override
    public String toString() {
        String at = where.path() != null ? " at " + where.path() : "";
        return severity + " " + type + at + ": " + message;
    }
}
