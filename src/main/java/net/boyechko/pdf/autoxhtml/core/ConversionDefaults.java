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

import java.util.List;
import java.util.function.Supplier;
import net.boyechko.pdf.autoxhtml.passes.BodyCellRules;
import net.boyechko.pdf.autoxhtml.passes.CleanupRules;
import net.boyechko.pdf.autoxhtml.passes.HeaderRules;
import net.boyechko.pdf.autoxhtml.passes.ListRules;
import net.boyechko.pdf.autoxhtml.passes.ParagraphRules;
import net.boyechko.pdf.autoxhtml.passes.Pass;
import net.boyechko.pdf.autoxhtml.passes.RangeStripper;
import net.boyechko.pdf.autoxhtml.passes.RuleTablePass;
import net.boyechko.pdf.autoxhtml.passes.StructuralMapping;
import net.boyechko.pdf.autoxhtml.passes.StructuralMappingRules;
import net.boyechko.pdf.autoxhtml.passes.TableRules;
import net.boyechko.pdf.autoxhtml.passes.TableSymmetryRules;
import net.boyechko.pdf.autoxhtml.rules.RuleTable;
import net.boyechko.pdf.autoxhtml.rules.Scope;
import net.boyechko.pdf.autoxhtml.validation.NodeVisitor;
import net.boyechko.pdf.autoxhtml.visitors.AsymmetricRowVisitor;
import net.boyechko.pdf.autoxhtml.visitors.DegenerateImagePathVisitor;
import net.boyechko.pdf.autoxhtml.visitors.NonHtmlElementVisitor;

public final class ConversionDefaults {
    private ConversionDefaults() {}

    public static RuleTable structureTable() {
        return RuleTable.builder(Scope.STRUCTURE)
                .add(new StructuralMappingRules())
                .add(new ParagraphRules())
                .add(new HeaderRules())
                .add(new TableRules())
                .add(new ListRules())
                .build();
    }

    public static RuleTable cleanupTable() {
        return RuleTable.builder(Scope.CLEANUP).add(new CleanupRules()).build();
    }

    public static RuleTable symmetryTable() {
        return RuleTable.builder(Scope.SYMMETRY).add(new TableSymmetryRules()).build();
    }

    public static RuleTable bodyCellTable() {
        return RuleTable.builder(Scope.BODY_CELLS).add(new BodyCellRules()).build();
    }

    public static StructuralMapping structuralMapping() {
        return new StructuralMapping(structureTable());
    }

    /** Passes two to five, in the order they must run. */
    public static List<Pass> shellPasses() {
        return List.of(
                new RuleTablePass(cleanupTable()),
                new RuleTablePass(symmetryTable()),
                new RuleTablePass(bodyCellTable()),
                new RangeStripper());
    }

    public static List<Supplier<NodeVisitor>> auditVisitors() {
        return List.of(
                AsymmetricRowVisitor::new,
                DegenerateImagePathVisitor::new,
                NonHtmlElementVisitor::new);
    }
}
