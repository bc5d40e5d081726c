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
package net.boyechko.pdf.autoxhtml.ui;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.boyechko.pdf.autoxhtml.core.ConversionService;
import net.boyechko.pdf.autoxhtml.core.ConversionSettings;
import net.boyechko.pdf.autoxhtml.core.VerbosityLevel;
import net.boyechko.pdf.autoxhtml.issue.Issue;
import net.boyechko.pdf.autoxhtml.issue.IssueList;
import net.boyechko.pdf.autoxhtml.issue.IssueLoc;
import net.boyechko.pdf.autoxhtml.issue.IssueSev;
import net.boyechko.pdf.autoxhtml.issue.IssueType;
import org.junit.jupiter.api.Test;

public class ConversionReporterTest {

    private static final String SOURCE =
            "<TaggedPDF-doc>"
                    + "<H2>Results</H2>"
                    + "<Table>"
                    + "<TR><TH>A</TH><TH>B</TH></TR>"
                    + "<TR><TD>1</TD></TR>"
                    + "<TR><TD>1</TD><TD>2</TD><TD>3</TD></TR>"
                    + "</Table>"
                    + "</TaggedPDF-doc>";

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private ConversionReporter reporter(VerbosityLevel verbosity) {
        return new ConversionReporter(
                new PrintStream(buffer, true, StandardCharsets.UTF_8), verbosity);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private String convert(VerbosityLevel verbosity) {
        new ConversionService.ConversionServiceBuilder()
                .withSettings(ConversionSettings.defaults().withNormalizeHeaders(true))
                .withListener(reporter(verbosity))
                .build()
                .convertXml(SOURCE);
        return output();
    }

    @Test
    void printsEachPhaseInABox() {
        String out = convert(VerbosityLevel.NORMAL);

        assertTrue(out.contains("┌─ Structural mapping "), out);
        assertTrue(out.contains("┌─ Table symmetry repair "), out);
        assertTrue(out.contains("┌─ Output audit "), out);
        assertTrue(out.contains("┌─ Summary "), out);
        assertTrue(out.trim().endsWith("└─╯"), out);
    }

    @Test
    void summaryCountsRepairsAndListsRemainingIssues() {
        String out = convert(VerbosityLevel.NORMAL);

        assertTrue(out.contains("○ Issues detected: 3"), out);
        assertTrue(out.contains("✓ Repaired: 2"), out);
        assertTrue(out.contains("▸ Needs manual review"), out);
        assertTrue(out.contains("✗ Row has 3 cells, header row has 2"), out);
        assertFalse(out.contains("Padded row with"), out);
    }

    @Test
    void verboseShowsRepairsWithPathsAndOutline() {
        String out = convert(VerbosityLevel.VERBOSE);

        assertTrue(out.contains("✓ Padded row with 1 empty cell(s)"), out);
        assertTrue(out.contains("(/html[1]/body[1]/div[1]/div[1]/table[1]/tbody[1]/tr[1])"), out);
        assertTrue(out.contains("✓ Changed h2 to h1"), out);
        assertTrue(out.contains("div class=\"pdf-content\""), out);
    }

    @Test
    void quietPrintsOnlyErrors() {
        ConversionReporter reporter = reporter(VerbosityLevel.QUIET);
        reporter.onPhaseStart("Cleanup");
        reporter.onSuccess("Done");
        reporter.onError("Source document is empty");
        reporter.onSummary(new IssueList());

        assertEquals("│ ⛔️ Source document is empty", output().strip());
    }

    @Test
    void cleanSummaryNamesTheAuditRules() {
        ConversionReporter reporter = reporter(VerbosityLevel.NORMAL);
        reporter.onSummary(new IssueList());

        assertTrue(output().contains("audit rules and found no issues"), output());
    }

    @Test
    void warningIconFollowsSeverity() {
        ConversionReporter reporter = reporter(VerbosityLevel.NORMAL);
        reporter.onWarning(
                new Issue(
                        IssueType.NON_HTML_ELEMENT,
                        IssueSev.WARNING,
                        IssueLoc.atNode("/html[1]/body[1]/Span[1]", "Span"),
                        "'Span' is not a valid HTML element"));
        reporter.onWarning(
                new Issue(IssueType.SOURCE_NOT_PARSEABLE, IssueSev.FATAL, "Not well formed"));

        List<String> lines = output().lines().toList();
        assertEquals("│ ✗ 'Span' is not a valid HTML element", lines.get(0));
        assertEquals("│ ⛔️ Not well formed", lines.get(1));
    }

    @Test
    void wordWrapBreaksAtSpaces() {
        assertEquals(List.of(), ConversionReporter.wordWrap("", 10));
        assertEquals(List.of("short"), ConversionReporter.wordWrap("short", 10));
        assertEquals(
                List.of("alpha beta", "gamma", "delta"),
                ConversionReporter.wordWrap("alpha beta gamma delta", 10));
        assertEquals(
                List.of("overlongword", "x"), ConversionReporter.wordWrap("overlongword x", 5));
    }

    @Test
    void wordWrapBreaksLongPathsAfterSeparators() {
        assertEquals(
                List.of("at /html[1]/", "body[1]/div[2]"),
                ConversionReporter.wordWrap("at /html[1]/body[1]/div[2]", 14));
        assertEquals(
                List.of("/html[1]/body[1]/", "table[1]/tr[12]"),
                ConversionReporter.wordWrap("/html[1]/body[1]/table[1]/tr[12]", 17));
    }
}
