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
import net.boyechko.pdf.autoxhtml.rules.Pattern;
import net.boyechko.pdf.autoxhtml.rules.Rule;
import net.boyechko.pdf.autoxhtml.rules.RuleOutcome;
import net.boyechko.pdf.autoxhtml.rules.RuleSet;

/** Header cells in body rows become data cells, keeping their attributes and content. */
public final class BodyCellRules implements RuleSet {

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.forElement(
                        "demote-body-header-cell",
                        Pattern.element("th").under("tbody", "tr"),
                        10,
                        (cell, ctx) -> RuleOutcome.emit(ctx.copyAs(cell, "td"))));
    }
}
