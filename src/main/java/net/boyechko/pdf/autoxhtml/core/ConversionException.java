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

/** Unexpected failure inside a conversion pass. Reported once to the caller; never retried. */
public class ConversionException extends RuntimeException {
    private final String passName;

    public ConversionException(String passName, String message) {
        super(passName + ": " + message);
        this.passName = passName;
    }

    public ConversionException(String passName, String message, Throwable cause) {
        super(passName + ": " + message, cause);
        this.passName = passName;
    }

    public String passName() {
        return passName;
    }
}
