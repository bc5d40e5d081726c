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

import java.util.List;
import net.boyechko.pdf.autoxhtml.core.ConversionSettings;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.rules.RuleTable;
import net.boyechko.pdf.autoxhtml.rules.TreeRewriter;

/**
 * The first pass: maps the source vocabulary to XHTML. Unlike the later passes it works on the
 * bare source tree, and its output is the content that goes into the document shell.
 */
public class StructuralMapping {
    private final RuleTable table;

    public StructuralMapping(RuleTable table) {
        this.table = table;
    }

    public String name() {
        return table.scope().label();
    }

    public List<Node> apply(Node.Element source, ConversionSettings settings) {
        return new TreeRewriter(table).map(source, settings);
    }
}
