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
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.document.NodeTree;
import net.boyechko.pdf.autoxhtml.rules.Pattern;
import net.boyechko.pdf.autoxhtml.rules.Rule;
import net.boyechko.pdf.autoxhtml.rules.RuleContext;
import net.boyechko.pdf.autoxhtml.rules.RuleOutcome;
import net.boyechko.pdf.autoxhtml.rules.RuleSet;

/**
 * Paragraph rules, highest priority first: running headers are dropped, paragraphs holding
 * nested paragraphs are unwrapped, and any other paragraph with text becomes a {@code p}.
 */
public final class ParagraphRules implements RuleSet {

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.dropping(
                        "drop-running-header",
                        Pattern.element("P")
                                .where(
                                        (node, ctx) ->
                                                ctx.settings()
                                                        .isRunningHeader(
                                                                NodeTree.normalizedText(node))),
                        30),
                Rule.forElement(
                        "unwrap-nested-paragraphs",
                        Pattern.element("P")
                                .where((node, ctx) -> ((Node.Element) node).hasElementChild("P")),
                        20,
                        this::unwrap),
                Rule.forElement("paragraph", Pattern.element("P"), 10, this::paragraph));
    }

    private RuleOutcome paragraph(Node.Element p, RuleContext ctx) {
        if (NodeTree.normalizedText(p).isEmpty()) {
            return RuleOutcome.drop();
        }
        return RuleOutcome.emit(ctx.copyAs(p, "p"));
    }

    /**
     * Nested paragraphs become siblings. Content between them is gathered into runs; a run with
     * text becomes a new paragraph, a run without text is promoted as is. Reference children are
     * dropped.
     */
    private RuleOutcome unwrap(Node.Element p, RuleContext ctx) {
        List<Node> out = new ArrayList<>();
        List<Node> run = new ArrayList<>();
        List<Node> children = p.children();
        List<RuleContext> contexts = ctx.childContexts(p);
        for (int i = 0; i < children.size(); i++) {
            Node child = children.get(i);
            if (child instanceof Node.Element e && e.hasName("Reference")) {
                continue;
            }
            if (child instanceof Node.Element e && e.hasName("P")) {
                flushRun(run, out);
                out.addAll(contexts.get(i).rewrite(child));
            } else {
                run.addAll(contexts.get(i).rewrite(child));
            }
        }
        flushRun(run, out);
        return RuleOutcome.emit(out);
    }

    private static void flushRun(List<Node> run, List<Node> out) {
        if (run.isEmpty()) {
            return;
        }
        StringBuilder text = new StringBuilder();
        for (Node node : run) {
            text.append(NodeTree.normalizedText(node)).append(' ');
        }
        if (NodeTree.normalizeSpace(text.toString()).isEmpty()) {
            out.addAll(run);
        } else {
            out.add(Node.element("p", run));
        }
        run.clear();
    }
}
