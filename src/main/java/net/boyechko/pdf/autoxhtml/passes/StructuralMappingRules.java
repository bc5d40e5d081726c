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
import net.boyechko.pdf.autoxhtml.document.NodeTree;
import net.boyechko.pdf.autoxhtml.rules.Pattern;
import net.boyechko.pdf.autoxhtml.rules.Rule;
import net.boyechko.pdf.autoxhtml.rules.RuleContext;
import net.boyechko.pdf.autoxhtml.rules.RuleOutcome;
import net.boyechko.pdf.autoxhtml.rules.RuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Source-to-target mapping of wrappers, metadata noise, artifacts, links, references, figures
 * and image references. Paragraphs, headings, tables and lists have their own rule sets.
 */
public final class StructuralMappingRules implements RuleSet {
    private static final Logger logger = LoggerFactory.getLogger(StructuralMappingRules.class);

    static final String ASSET_ROOT = "/dataserviceassets/";
    static final String ASSET_FOLDER = "/images/from-conversion/";

    private static final int NOISE_PRIORITY = 50;
    private static final int MAPPING_PRIORITY = 10;

    @Override
    public List<Rule> rules() {
        return List.of(
                Rule.dropping(
                        "suppress-noise-element",
                        Pattern.anyElement()
                                .where(
                                        (node, ctx) ->
                                                ctx.settings()
                                                        .noiseElements()
                                                        .contains(((Node.Element) node).name())),
                        NOISE_PRIORITY),
                Rule.dropping(
                        "suppress-noise-instruction",
                        Pattern.anyProcessingInstruction()
                                .where(
                                        (node, ctx) ->
                                                ctx.settings()
                                                        .noiseInstructions()
                                                        .contains(
                                                                ((Node.ProcessingInstruction) node)
                                                                        .target())),
                        NOISE_PRIORITY),
                Rule.forElement(
                        "unwrap-wrapper",
                        Pattern.anyElement()
                                .where(
                                        (node, ctx) ->
                                                ctx.settings()
                                                        .wrapperElements()
                                                        .contains(((Node.Element) node).name())),
                        MAPPING_PRIORITY,
                        (element, ctx) -> RuleOutcome.emit(ctx.rewriteChildren(element))),
                Rule.forElement(
                        "artifact", Pattern.element("Artifact"), MAPPING_PRIORITY, this::artifact),
                Rule.forElement("link", Pattern.element("Link"), MAPPING_PRIORITY, this::link),
                Rule.forElement(
                        "reference",
                        Pattern.element("Reference"),
                        MAPPING_PRIORITY,
                        this::reference),
                Rule.forElement(
                        "figure", Pattern.element("Figure"), MAPPING_PRIORITY, this::figure),
                Rule.forElement(
                        "image-data", Pattern.element("ImageData"), MAPPING_PRIORITY, this::image));
    }

    private RuleOutcome artifact(Node.Element artifact, RuleContext ctx) {
        if (NodeTree.isBareAndBlank(artifact)) {
            return RuleOutcome.drop();
        }
        return RuleOutcome.emit(ctx.rewriteChildren(artifact));
    }

    /** The text content of a link is its target. */
    private RuleOutcome link(Node.Element link, RuleContext ctx) {
        return RuleOutcome.emit(
                Node.element(
                        "a",
                        List.of(new Attribute("href", link.textContent())),
                        ctx.rewriteChildren(link)));
    }

    /** References resolve elsewhere; the placeholder target yields to a source {@code href}. */
    private RuleOutcome reference(Node.Element reference, RuleContext ctx) {
        Node.Element anchor = Node.element("a", List.of(new Attribute("href", "#")), List.of());
        for (Attribute attribute : ctx.rewriteAttributes(reference)) {
            anchor = anchor.withAttribute(attribute.name(), attribute.value());
        }
        return RuleOutcome.emit(anchor.withChildren(ctx.rewriteChildren(reference)));
    }

    private RuleOutcome figure(Node.Element figure, RuleContext ctx) {
        List<Node> out = new ArrayList<>();
        List<String> looseText = new ArrayList<>();
        List<Node> children = figure.children();
        List<RuleContext> contexts = ctx.childContexts(figure);
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) instanceof Node.Text text) {
                looseText.add(text.content());
            } else {
                out.addAll(contexts.get(i).rewrite(children.get(i)));
            }
        }
        String caption = NodeTree.normalizeSpace(String.join(" ", looseText));
        if (!caption.isEmpty()) {
            out.add(Node.element("p", Node.text(caption)));
        }
        return RuleOutcome.emit(out);
    }

    private RuleOutcome image(Node.Element imageData, RuleContext ctx) {
        String src = imageData.attribute("src").orElse("");
        if (src.isBlank()) {
            logger.warn("Image reference at {} has no source path", ctx.path());
        }
        return RuleOutcome.emit(
                Node.element(
                        "img",
                        List.of(
                                new Attribute("src", assetPath(ctx.settings().projectId(), src)),
                                new Attribute("alt", "")),
                        List.of()));
    }

    /**
     * Rebuilds a source image path under the project's asset folder, dropping its first path
     * segment: {@code images/fig1.png} becomes {@code
     * /dataserviceassets/<project>/images/from-conversion/fig1.png}. An empty path yields the
     * folder itself.
     */
    static String assetPath(String projectId, String src) {
        String file = src.strip();
        int slash = file.indexOf('/');
        if (slash >= 0) {
            file = file.substring(slash + 1);
        }
        return ASSET_ROOT + projectId + ASSET_FOLDER + file;
    }
}
