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

import static org.junit.jupiter.api.Assertions.*;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.boyechko.pdf.autoxhtml.document.NodeTree;
import net.boyechko.pdf.autoxhtml.document.SourceDocuments;
import net.boyechko.pdf.autoxhtml.document.XhtmlSerializer;
import net.boyechko.pdf.autoxhtml.issue.IssueType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Converts the sources under {@code golden/} and compares the outline of the output content with
 * the stored {@code .outline} file next to each source.
 */
public class GoldenOutputTest {

    private static final ConversionSettings SETTINGS =
            ConversionSettings.defaults()
                    .withProjectId("acme42")
                    .withRunningHeaders(List.of("ACME Corp Annual Report"));

    private static ConversionResult convert(String name) throws IOException {
        ConversionService service =
                new ConversionService.ConversionServiceBuilder()
                        .withSettings(SETTINGS)
                        .withListener(new NoOpConversionListener())
                        .build();
        return service.convertXml(resource("/golden/" + name + ".xml"));
    }

    private static String resource(String path) throws IOException {
        try (InputStream in = GoldenOutputTest.class.getResourceAsStream(path)) {
            assertNotNull(in, "Missing test resource " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"annual-report", "strip-markers"})
    void outputMatchesStoredOutline(String name) throws IOException {
        ConversionResult result = convert(name);
        assertFalse(result.isAborted());

        List<String> expected = resource("/golden/" + name + ".outline").lines().toList();
        List<String> actual =
                NodeTree.toIndentedTreeString(DocumentShell.container(result.document()))
                        .lines()
                        .toList();

        Patch<String> patch = DiffUtils.diff(expected, actual);
        if (!patch.getDeltas().isEmpty()) {
            List<String> diff =
                    UnifiedDiffUtils.generateUnifiedDiff(
                            name + ".outline", "actual", expected, patch, 2);
            fail("Output differs from " + name + ".outline:\n" + String.join("\n", diff));
        }
    }

    @Test
    void annualReportIssues() throws IOException {
        ConversionResult result = convert("annual-report");

        assertEquals(1, result.tablesProcessed());
        assertEquals(0, result.headersNormalized());
        assertEquals(1, result.resolvedIssues().ofType(IssueType.ROW_PADDED).size());
        assertEquals(1, result.resolvedIssues().size());
        assertEquals(1, result.remainingIssues().size());
        assertEquals(IssueType.EXCESS_CELLS, result.remainingIssues().get(0).type());
    }

    @Test
    void serializedOutputParsesBack() throws Exception {
        ConversionResult result = convert("annual-report");
        String xhtml = new XhtmlSerializer(true).serialize(result.document());

        assertTrue(xhtml.startsWith("<?xml"));
        assertEquals("html", SourceDocuments.parse(xhtml).name());
        assertTrue(
                xhtml.contains("id=\"tablewrapper_TaggedPDF-doc-1-Document-1-Sect-1-Table-1\""));
    }
}
