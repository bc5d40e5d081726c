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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.autoxhtml.core.ConversionDefaults;
import net.boyechko.pdf.autoxhtml.core.ConversionListener;
import net.boyechko.pdf.autoxhtml.core.VerbosityLevel;
import net.boyechko.pdf.autoxhtml.issue.Issue;
import net.boyechko.pdf.autoxhtml.issue.IssueList;
import org.slf4j.LoggerFactory;

/** Console reporter that prints each pass in its own box, followed by an issue summary. */
public class ConversionReporter implements ConversionListener {
    private final PrintStream output;
    private final VerbosityLevel verbosity;

    private static final String SUCCESS = "✓";
    private static final String ERROR = "⛔️";
    private static final String WARNING = "✗";
    private static final String INFO = "○";

    private static final String INDENT = "│ ";
    private static final String SUBSECTION_MARK = "▸";
    private static final int HEADER_WIDTH = 68;
    private static final int LINE_WIDTH = 80;

    private boolean phaseOpen = false;
    private boolean subsectionOpen = false;
    private final ListAppender<ILoggingEvent> logBuffer;

    public ConversionReporter(PrintStream output, VerbosityLevel verbosity) {
        this.output = output;
        this.verbosity = verbosity;
        Logger appLogger = (Logger) LoggerFactory.getLogger("net.boyechko.pdf.autoxhtml");
        logBuffer = new ListAppender<>();
        logBuffer.start();
        appLogger.addAppender(logBuffer);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        if (verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            closePhaseBoxIfOpen();
            printBoxHeader(phaseName);
            phaseOpen = true;
        }
    }

    @Override
    public void onSubsection(String header) {
        if (verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            if (subsectionOpen) {
                printEmptyLine();
            }
            printLine(header, SUBSECTION_MARK);
            subsectionOpen = true;
        }
    }

    @Override
    public void onIssueGroup(String groupLabel, List<Issue> issues) {
        if (issues.isEmpty()) return;

        printLine(issues.size() + " " + groupLabel, WARNING);

        if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            for (Issue issue : issues) {
                printLine(withPath(issue.message(), issue), WARNING, VerbosityLevel.VERBOSE);
            }
        }
    }

    @Override
    public void onSummary(IssueList allIssues) {
        if (verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            int detected = allIssues.size();
            int resolved = allIssues.getResolvedIssues().size();
            int remaining = allIssues.getRemainingIssues().size();

            closePhaseBoxIfOpen();
            printBoxHeader("Summary");

            if (detected == 0) {
                printLine(
                        "Checked the output against "
                                + ConversionDefaults.auditVisitors().size()
                                + " audit rules and found no issues",
                        SUCCESS);
            } else {
                printLine("Issues detected: " + detected, INFO);
                printLine("Repaired: " + resolved, SUCCESS);
                if (remaining > 0) {
                    printEmptyLine();
                    onSubsection("Needs manual review");
                    for (Issue issue : allIssues.getRemainingIssues()) {
                        printLine(issue.message(), iconFor(issue));
                    }
                }
            }
            printBoxFooter();
        }
    }

    @Override
    public void onSuccess(String message) {
        printLine(message, SUCCESS);
    }

    @Override
    public void onIssueResolved(Issue issue) {
        printLine(withPath(issue.resolutionNote(), issue), SUCCESS, VerbosityLevel.VERBOSE);
    }

    @Override
    public void onError(String message) {
        printLine(message, ERROR, VerbosityLevel.QUIET);
    }

    @Override
    public void onWarning(Issue issue) {
        printLine(withPath(issue.message(), issue), iconFor(issue));
    }

    @Override
    public void onInfo(String message) {
        printLine(message, INFO);
    }

    @Override
    public void onVerboseOutput(String message) {
        if (verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            output.print(message);
        }
    }

    private static String iconFor(Issue issue) {
        return switch (issue.severity()) {
            case FATAL, ERROR -> ERROR;
            case WARNING -> WARNING;
            case INFO -> INFO;
        };
    }

    private String withPath(String message, Issue issue) {
        String path = issue.where().path();
        if (path == null || !verbosity.isAtLeast(VerbosityLevel.VERBOSE)) {
            return message;
        }
        return message + " (" + path + ")";
    }

    private void closePhaseBoxIfOpen() {
        if (phaseOpen && verbosity.isAtLeast(VerbosityLevel.NORMAL)) {
            printBoxFooter();
            phaseOpen = false;
            subsectionOpen = false;
        }
    }

    private void printBoxHeader(String title) {
        int filler = Math.max(0, HEADER_WIDTH - title.length() - 1);
        output.println("┌─ " + title + " " + "─".repeat(filler) + "─╮");
        output.println("│");
    }

    private void printBoxFooter() {
        drainLogBuffer();
        output.println("│");
        output.println("└─╯");
    }

    /** Flushes log events captured since the last drain into the open box. */
    private void drainLogBuffer() {
        if (logBuffer.list.isEmpty()) return;
        List<ILoggingEvent> events = new ArrayList<>(logBuffer.list);
        logBuffer.list.clear();
        printEmptyLine();
        for (ILoggingEvent event : events) {
            String icon = event.getLevel().isGreaterOrEqual(Level.ERROR) ? ERROR : INFO;
            String origin = event.getLoggerName();
            printLine(
                    "[" + event.getLevel() + "] " + origin + ": " + event.getFormattedMessage(),
                    icon);
        }
    }

    /**
     * Prints an indented line with the given message and icon, word-wrapping long messages to stay
     * within the box width.
     */
    private void printLine(String message, String icon, VerbosityLevel level) {
        if (!verbosity.isAtLeast(level)) {
            return;
        }
        String prefix = INDENT + icon + " ";
        String continuationPrefix = INDENT + "  ";
        List<String> lines = wordWrap(message, LINE_WIDTH);
        if (lines.isEmpty()) {
            output.println(prefix.stripTrailing());
            return;
        }
        output.println(prefix + lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            output.println(continuationPrefix + lines.get(i));
        }
    }

    private void printLine(String message, String icon) {
        printLine(message, icon, VerbosityLevel.NORMAL);
    }

    private void printEmptyLine() {
        printLine("", "", VerbosityLevel.QUIET);
    }

    /**
     * Word-wraps text to fit within maxWidth characters per line. Element paths have no spaces, so
     * an overlong word is also broken after a path separator when it has one.
     */
    static List<String> wordWrap(String text, int maxWidth) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        if (text.length() <= maxWidth) {
            return List.of(text);
        }

        List<String> lines = new ArrayList<>();
        StringBuilder currentLine = new StringBuilder();

        for (String word : text.split(" ")) {
            for (String piece : splitPath(word, maxWidth)) {
                if (currentLine.length() == 0) {
                    currentLine.append(piece);
                } else if (currentLine.length() + 1 + piece.length() <= maxWidth) {
                    currentLine.append(' ').append(piece);
                } else {
                    lines.add(currentLine.toString());
                    currentLine.setLength(0);
                    currentLine.append(piece);
                }
            }
        }
        if (currentLine.length() > 0) {
            lines.add(currentLine.toString());
        }
        return lines;
    }

    private static List<String> splitPath(String word, int maxWidth) {
        List<String> pieces = new ArrayList<>();
        String rest = word;
        while (rest.length() > maxWidth) {
            int cut = rest.lastIndexOf('/', maxWidth - 1);
            if (cut <= 0) {
                break;
            }
            pieces.add(rest.substring(0, cut + 1));
            rest = rest.substring(cut + 1);
        }
        pieces.add(rest);
        return pieces;
    }
}
