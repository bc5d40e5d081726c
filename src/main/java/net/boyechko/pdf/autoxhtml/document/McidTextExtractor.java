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

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfPage;
import com.itextpdf.kernel.pdf.canvas.parser.EventType;
import com.itextpdf.kernel.pdf.canvas.parser.PdfCanvasProcessor;
import com.itextpdf.kernel.pdf.canvas.parser.data.IEventData;
import com.itextpdf.kernel.pdf.canvas.parser.data.TextRenderInfo;
import com.itextpdf.kernel.pdf.canvas.parser.listener.IEventListener;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the text of marked-content sequences (by MCID) from the pages of one document. Each
 * page's content stream is processed once; the text of every MCID on it is kept.
 */
final class McidTextExtractor {
    private static final Logger logger = LoggerFactory.getLogger(McidTextExtractor.class);
    private static final double ARTIFICIAL_SPACING_RATIO = 0.3;

    private final PdfDocument document;
    private final Map<Integer, Map<Integer, String>> textByPage = new HashMap<>();

    McidTextExtractor(PdfDocument document) {
        this.document = document;
    }

    /** Text of one MCID on a page; empty when the page or MCID has none. */
    String textFor(int pageNumber, int mcid) {
        if (pageNumber < 1 || pageNumber > document.getNumberOfPages()) {
            logger.debug(
                    "Invalid page number {} for document with {} pages",
                    pageNumber,
                    document.getNumberOfPages());
            return "";
        }
        return textByPage.computeIfAbsent(pageNumber, this::extractPage).getOrDefault(mcid, "");
    }

    private Map<Integer, String> extractPage(int pageNumber) {
        PdfPage page = document.getPage(pageNumber);
        McidCollector collector = new McidCollector();
        new PdfCanvasProcessor(collector).processPageContent(page);

        Map<Integer, String> texts = new HashMap<>();
        collector.texts.forEach((mcid, raw) -> texts.put(mcid, cleanExtractedText(raw.toString())));
        logger.debug("Extracted text of {} MCIDs on page {}", texts.size(), pageNumber);
        return texts;
    }

    /** Collects rendered text per MCID from the graphics state. */
    private static class McidCollector implements IEventListener {
        private final Map<Integer, StringBuilder> texts = new HashMap<>();

        @Override
        public void eventOccurred(IEventData data, EventType type) {
            if (type != EventType.RENDER_TEXT) {
                return;
            }
            TextRenderInfo textInfo = (TextRenderInfo) data;
            int mcid = textInfo.getMcid();
            String text = textInfo.getText();
            if (mcid < 0 || text == null || text.trim().isEmpty()) {
                return;
            }
            StringBuilder sb = texts.computeIfAbsent(mcid, k -> new StringBuilder());
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(text);
        }

        @Override
        public Set<EventType> getSupportedEvents() {
            return Set.of(EventType.RENDER_TEXT);
        }
    }

    /** Cleans extracted text by removing replacement characters and normalizing whitespace. */
    static String cleanExtractedText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        // Unicode replacement character
        String cleaned = text.replace("�", "");

        // Glyph-by-glyph runs come out as "T i t l e"
        if (hasArtificialSpacing(cleaned)) {
            cleaned = cleaned.replaceAll("(?<=\\S) (?=\\S)", "");
        }

        return NodeTree.normalizeSpace(cleaned);
    }

    /** More than 30% single-character words means the spacing is an extraction artifact. */
    private static boolean hasArtificialSpacing(String text) {
        String[] words = text.trim().split("\\s+");
        if (words.length < 2) {
            return false;
        }
        long singleCharWords = Arrays.stream(words).filter(w -> w.length() == 1).count();
        double ratio = (double) singleCharWords / words.length;
        return ratio > ARTIFICIAL_SPACING_RATIO;
    }
}
