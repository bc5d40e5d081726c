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

/** Where in the output tree an issue was found. */
public sealed interface IssueLoc {
    record None() implements IssueLoc {}

    record AtNode(String path, String elementName) implements IssueLoc {}

    static IssueLoc none() {
        return new None();
    }

    static IssueLoc atNode(String path, String elementName) {
        return new AtNode(path, elementName);
    }

    /** Returns the positional path if available, null otherwise. */
    default String path() {
        if (this instanceof AtNode at) {
            return at.path();
        }
        return null;
    }
}
