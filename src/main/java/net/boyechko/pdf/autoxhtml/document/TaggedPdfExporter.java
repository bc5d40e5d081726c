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

import com.itextpdf.kernel.exceptions.PdfException;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfNumber;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.tagging.IStructureNode;
import com.itextpdf.kernel.pdf.tagging.PdfMcr;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import com.itextpdf.kernel.pdf.tagging.PdfStructTreeRoot;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the structure tree of a tagged PDF into the source vocabulary: one element per structure
 * element, named by its (role-mapped) structure type, with the text of its marked content as
 * text children.
 */
public final class TaggedPdfExporter {
    private static final Logger logger = LoggerFactory.getLogger(TaggedPdfExporter.class);

    public static final String ROOT_NAME = "TaggedPDF-doc";

    private final PdfDocument document;
    private final PdfDictionary roleMap;
    private final McidTextExtractor textExtractor;

    private TaggedPdfExporter(PdfDocument document) {
        this.document = document;
        this.roleMap = document.getStructTreeRoot().getRoleMap();
        this.textExtractor = new McidTextExtractor(document);
    }

    public static Node.Element export(Path pdf) throws SourceParseException {
        try (PdfDocument document = new PdfDocument(new PdfReader(pdf.toFile()))) {
            return export(document);
        } catch (IOException | PdfException e) {
            throw new SourceParseException("Cannot read PDF " + pdf, e);
        }
    }

    public static Node.Element export(PdfDocument document) throws SourceParseException {
        if (!document.isTagged() || document.getStructTreeRoot() == null) {
            throw new SourceParseException("PDF has no structure tree; only tagged PDFs convert");
        }
        TaggedPdfExporter exporter = new TaggedPdfExporter(document);
        Node.Element root = exporter.exportRoot(document.getStructTreeRoot());
        logger.debug(
                "Exported structure tree with {} elements from {} pages",
                NodeTree.countElements(root),
                document.getNumberOfPages());
        return root;
    }

    private Node.Element exportRoot(PdfStructTreeRoot root) {
        List<Node> children = new ArrayList<>();
        for (IStructureNode kid : root.getKids()) {
            if (kid instanceof PdfStructElem elem) {
                children.add(exportElement(elem));
            }
        }
        return Node.element(ROOT_NAME, children);
    }

    private Node.Element exportElement(PdfStructElem elem) {
        String role = mappedRole(elem);
        List<Attribute> attributes = new ArrayList<>();

        PdfString alt = elem.getAlt();
        if (alt != null) {
            attributes.add(new Attribute("alt", alt.toUnicodeString()));
        }
        PdfString lang = elem.getLang();
        if (lang != null) {
            attributes.add(new Attribute("xml:lang", lang.toUnicodeString()));
        }
        addLayoutAttribute(elem, PdfName.ColSpan, "ColSpan", attributes);
        addLayoutAttribute(elem, PdfName.RowSpan, "RowSpan", attributes);
        addLayoutAttribute(elem, PdfName.ListNumbering, "ListNumbering", attributes);

        List<Node> children = new ArrayList<>();
        List<IStructureNode> kids = elem.getKids();
        if (kids != null) {
            for (IStructureNode kid : kids) {
                if (kid instanceof PdfStructElem child) {
                    children.add(exportElement(child));
                } else if (kid instanceof PdfMcr mcr) {
                    String text = mcrText(mcr);
                    if (!text.isEmpty()) {
                        children.add(Node.text(text));
                    }
                }
            }
        }
        return new Node.Element(role, attributes, joinTextRuns(children));
    }

    private String mcrText(PdfMcr mcr) {
        int mcid = mcr.getMcid();
        PdfDictionary pageObject = mcr.getPageObject();
        if (mcid < 0 || pageObject == null) {
            return "";
        }
        return textExtractor.textFor(document.getPageNumber(pageObject), mcid);
    }

    /** Adjacent marked-content texts become one text node, separated by a space. */
    private static List<Node> joinTextRuns(List<Node> children) {
        List<Node> joined = new ArrayList<>(children.size());
        for (Node child : children) {
            int last = joined.size() - 1;
            if (child instanceof Node.Text text
                    && last >= 0
                    && joined.get(last) instanceof Node.Text previous) {
                joined.set(last, Node.text(previous.content() + " " + text.content()));
            } else {
                joined.add(child);
            }
        }
        return joined;
    }

    private String mappedRole(PdfStructElem elem) {
        PdfName role = elem.getRole();
        if (roleMap != null) {
            PdfName mapped = roleMap.getAsName(role);
            if (mapped != null) {
                return mapped.getValue();
            }
        }
        return role.getValue();
    }

    /** Copies a layout attribute from the element's /A dictionary (or array of them). */
    private static void addLayoutAttribute(
            PdfStructElem elem, PdfName key, String name, List<Attribute> attributes) {
        PdfObject a = elem.getPdfObject().get(PdfName.A);
        PdfObject value = null;
        if (a instanceof PdfDictionary dict) {
            value = dict.get(key);
        } else if (a instanceof PdfArray array) {
            for (int i = 0; i < array.size() && value == null; i++) {
                if (array.get(i) instanceof PdfDictionary dict) {
                    value = dict.get(key);
                }
            }
        }
        if (value instanceof PdfNumber number) {
            attributes.add(new Attribute(name, String.valueOf(number.intValue())));
        } else if (value instanceof PdfName pdfName) {
            attributes.add(new Attribute(name, pdfName.getValue()));
        }
    }
}
