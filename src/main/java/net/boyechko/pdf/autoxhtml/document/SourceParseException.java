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
package net.boyechko.pdf.autoxhtml.document;

import java.util.List;

/** The source could not be read as a single well-formed tagged structure tree. */
public class SourceParseException extends Exception {
    private final List<String> parseErrors;

    public SourceParseException(String message) {
        this(message, List.of());
    }

    public SourceParseException(String message, List<String> parseErrors) {
        super(parseErrors.isEmpty() ? message : message + ": " + String.join("; ", parseErrors));
        this.parseErrors = List.copyOf(parseErrors);
    }

    public SourceParseException(String message, Throwable cause) {
        super(message + ": " + cause.getMessage(), cause);
        this.parseErrors = List.of();
    }

    public List<String> parseErrors() {
        return parseErrors;
    }
}
