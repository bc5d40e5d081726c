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
package net.boyechko.pdf.autoxhtml;

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.layout.Document;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.io.TempDir;

/** Base for tests that build PDFs; persists them via -Dpdf.autoxhtml.testOutputDir. */
public abstract class PdfTestBase {
    @TempDir Path tempDir;
    private Path outputDir;
    private String testClassName;
    private String testMethodName;

    @BeforeEach
    void captureTestName(TestInfo testInfo) {
        testClassName =
                testInfo.getTestClass()
                        .map(Class::getSimpleName)
                        .orElse(getClass().getSimpleName());
        testMethodName = testInfo.getTestMethod().map(method -> method.getName()).orElse("test");
    }

    protected final Path testOutputPath(String filename) {
        return testOutputDir().resolve(filename);
    }

    /** Returns {baseDir}/{testClassName}/, creating it if needed. */
    protected final Path testOutputDir() {
        if (outputDir != null) {
            return outputDir;
        }
        String configured = System.getProperty("pdf.autoxhtml.testOutputDir");
        Path baseDir = configured != null && !configured.isBlank() ? Path.of(configured) : tempDir;
        String className = testClassName != null ? testClassName : getClass().getSimpleName();
        Path dir = baseDir.resolve(className);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create test output dir: " + dir, e);
        }
        outputDir = dir;
        return outputDir;
    }

    /** Callback for adding content to a test PDF via the iText layout API. */
    @FunctionalInterface
    protected interface TestPdfContent {
        void addTo(PdfDocument pdfDoc, Document document) throws Exception;
    }

    /** Creates a tagged PDF named after the running test. */
    protected final Path createTestPdf(TestPdfContent content) throws Exception {
        return createPdf(testOutputPath(testMethodName + ".pdf"), true, content);
    }

    protected final Path createUntaggedPdf(TestPdfContent content) throws Exception {
        return createPdf(testOutputPath(testMethodName + "_untagged.pdf"), false, content);
    }

    private static Path createPdf(Path outputPath, boolean tagged, TestPdfContent content)
            throws Exception {
        try (PdfWriter writer = new PdfWriter(outputPath.toString());
                PdfDocument pdfDoc = new PdfDocument(writer)) {
            if (tagged) {
                pdfDoc.setTagged();
            }
            Document document = new Document(pdfDoc);
            content.addTo(pdfDoc, document);
            document.close();
        }
        return outputPath;
    }
}
