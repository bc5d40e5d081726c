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

/**
 * Console verbosity, from least to most verbose. Each level includes everything shown at the
 * levels before it.
 */
public enum VerbosityLevel {
    /** Errors and the final status line */
    QUIET,

    /** Per-pass progress and the issue summary (default) */
    NORMAL,

    /** Adds the outline of the output tree */
    VERBOSE,

    /** Adds debug logs from every pass */
    DEBUG;

    public boolean isAtLeast(VerbosityLevel other) {
        return ordinal() >= other.ordinal();
    }
}
