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

import net.boyechko.pdf.autoxhtml.core.ConversionSettings;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.rules.RuleTable;
import net.boyechko.pdf.autoxhtml.rules.TreeRewriter;

/** A pass that is literally a map of the tree through one scope's rule table. */
public class RuleTablePass implements Pass {
    private final RuleTable table;

    public RuleTablePass(RuleTable table) {
        this.table = table;
    }

    @Override
    public String name() {
        return table.scope().label();
    }

    public RuleTable table() {
        return table;
    }

    @Override
    public PassResult apply(Node.Element document, ConversionSettings settings) {
        return PassResult.of(new TreeRewriter(table).mapElement(document, settings));
    }
}
