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

/**
 * Names of the diagnostic and control attributes exchanged between passes and surfaced in the
 * output. The output style block selects on these exact names.
 */
public final class Annotations {
    private Annotations() {}

    public static final String ASYMMETRIC = "data-asymmetric";
    public static final String CELL_COUNT = "data-cell-count";
    public static final String EXPECTED_COUNT = "data-expected-count";
    public static final String CELL_ADDED = "data-cell-added";

    public static final String NUMBER_SCHEME = "data-numberscheme";
    public static final String NUMBER = "data-number";

    /** Control marker written upstream and erased by the range stripper. */
    public static final String STRIP = "data-strip";

    public static final String STRIP_START = "start";
    public static final String STRIP_STOP = "stop";

    public static final String TRUE = "true";

    public static final List<String> STYLED =
            List.of(NUMBER_SCHEME, NUMBER, ASYMMETRIC, CELL_COUNT, EXPECTED_COUNT, CELL_ADDED);
}
