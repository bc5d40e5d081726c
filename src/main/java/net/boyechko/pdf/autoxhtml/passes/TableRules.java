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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.autoxhtml.document.Attribute;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.rules.AttributeRule;
import net.boyechko.pdf.autoxhtml.rules.Pattern;
import net.boyechko.pdf.autoxhtml.rules.Rule;
import net.boyechko.pdf.autoxhtml.rules.RuleContext;
import net.boyechko.pdf.autoxhtml.rules.RuleOutcome;
import net.boyechko.pdf.autoxhtml.rules.RuleSet;

/**
 * Table rules. Each {@code Table} is emitted inside a {@code div.tablewrapper}; rows placed
 * directly in the table are split into a {@code thead} of leading all-header rows and a {@code
 * tbody} of the rest.
 */
public final class TableRules implements RuleSet {
    static final String WRAPPER_CLASS = "tablewrapper";

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.forElement("table", Pattern.element("Table"), 10, this::table),
                renamed("THead", "thead"),
                renamed("TBody", "tbody"),
                renamed("TFoot", "tfoot"),
                renamed("TR", "tr"),
                renamed("TH", "th"),
                renamed("TD", "td"),
                renamed("Caption", "caption"));
    }

    @Override
    public List<AttributeRule> attributeRules() {
        return List.of(
                AttributeRule.renaming("th-colspan", 10, "TH", "ColSpan", "colspan"),
                AttributeRule.renaming("td-colspan", 10, "TD", "ColSpan", "colspan"),
                AttributeRule.renaming("th-rowspan", 10, "TH", "RowSpan", "rowspan"),
                AttributeRule.renaming("td-rowspan", 10, "TD", "RowSpan", "rowspan"),
                AttributeRule.renaming("th-scope", 10, "TH", "Scope", "scope"));
    }

    private static Rule renamed(String source, String target) {
        return Rule.forElement(
                source.toLowerCase() + "-element",
                Pattern.element(source),
                10,
                (element, ctx) -> RuleOutcome.emit(ctx.copyAs(element, target)));
    }

    private RuleOutcome table(Node.Element table, RuleContext ctx) {
        List<Node> content = new ArrayList<>();
        List<Node> headRows = new ArrayList<>();
        List<Node> bodyRows = new ArrayList<>();
        int groupsAt = -1;

        List<Node> children = table.children();
        List<RuleContext> contexts = ctx.childContexts(table);
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            if (child instanceof Node.Element row && row.hasName("TR")) {
                if (groupsAt < 0) {
                    groupsAt = content.size();
                }
                List<Node> rewritten = contexts.get(i).rewrite(child);
                if (bodyRows.isEmpty() && isHeaderRow(row)) {
                    headRows.addAll(rewritten);
                } else {
                    bodyRows.addAll(rewritten);
                }
            } else {
                content.addAll(contexts.get(i).rewrite(child));
            }
        }
        if (groupsAt >= 0) {
            List<Node> groups = new ArrayList<>(2);
            if (!headRows.isEmpty()) {
                groups.add(Node.element("thead", headRows));
            }
            if (!bodyRows.isEmpty()) {
                groups.add(Node.element("tbody", bodyRows));
            }
            content.addAll(groupsAt, groups);
        }

        Node.Element htmlTable = Node.element("table", ctx.rewriteAttributes(table), content);
        return RuleOutcome.emit(
                Node.element(
                        "div",
                        List.of(
                                new Attribute("class", WRAPPER_CLASS),
                                new Attribute("id", wrapperId(ctx.path()))),
                        List.of(htmlTable)));
    }

    private static boolean isHeaderRow(Node.Element row) {
        List<Node.Element> cells = row.elementChildren();
        return !cells.isEmpty() && cells.stream().allMatch(c -> c.hasName("TH"));
    }

    /** {@code /Document[1]/Table[2]} becomes {@code tablewrapper_Document-1-Table-2}. */
    static String wrapperId(String path) {
        String id = path.replaceAll("[^A-Za-z0-9]+", "-").replaceAll("^-|-$", "");
        return WRAPPER_CLASS + "_" + id;
    }
}
