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
import net.boyechko.pdf.autoxhtml.core.DocumentShell;
import net.boyechko.pdf.autoxhtml.document.Annotations;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.document.NodeTree;
import net.boyechko.pdf.autoxhtml.rules.Pattern;
import net.boyechko.pdf.autoxhtml.rules.Rule;
import net.boyechko.pdf.autoxhtml.rules.RuleContext;
import net.boyechko.pdf.autoxhtml.rules.RuleOutcome;
import net.boyechko.pdf.autoxhtml.rules.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cleanup of the mapped document: running-header boilerplate that survived the first pass is
 * removed from the body, and table rows whose width differs from the header row are annotated.
 * Cells are never removed or changed.
 */
public final class CleanupRules implements RuleSet {
    private static final Logger logger = LoggerFactory.getLogger(CleanupRules.class);

    private static final String[] BOILERPLATE_CARRIERS = {
        "p", "span", "div", "li", "h1", "h2", "h3", "h4", "h5", "h6"
    };

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.dropping(
                        "drop-boilerplate-element",
                        Pattern.anyElement().where(CleanupRules::isBoilerplateElement),
                        20),
                Rule.dropping(
                        "drop-boilerplate-text",
                        Pattern.text().where(CleanupRules::isBoilerplateText),
                        20),
                Rule.forElement("annotate-rows", Pattern.element("table"), 10, this::table));
    }

    private static boolean isBoilerplateElement(Node node, RuleContext ctx) {
        Node.Element element = (Node.Element) node;
        if (!ctx.within("body") || !element.hasAnyName(BOILERPLATE_CARRIERS)) {
            return false;
        }
        if (DocumentShell.isContainer(element)
                || NodeTree.findFirstByName(element, "table") != null) {
            return false;
        }
        return ctx.settings().isRunningHeader(NodeTree.normalizedText(element));
    }

    private static boolean isBoilerplateText(Node node, RuleContext ctx) {
        if (!ctx.within("body") || ctx.within("td") || ctx.within("th")) {
            return false;
        }
        return ctx.settings().isRunningHeader(NodeTree.normalizedText(node));
    }

    private RuleOutcome table(Node.Element table, RuleContext ctx) {
        Node.Element copied = ctx.copy(table);
        int expected = TableShape.expectedCount(copied);
        return RuleOutcome.emit(
                TableShape.mapRows(
                        copied,
                        row -> {
                            int actual = TableShape.cellCount(row);
                            if (actual == expected) {
                                return row;
                            }
                            logger.debug(
                                    "Row in table at {} has {} cells, expected {}",
                                    ctx.path(),
                                    actual,
                                    expected);
                            return row.withAttribute(Annotations.ASYMMETRIC, Annotations.TRUE)
                                    .withAttribute(Annotations.CELL_COUNT, String.valueOf(actual))
                                    .withAttribute(
                                            Annotations.EXPECTED_COUNT, String.valueOf(expected));
                        }));
    }
}
