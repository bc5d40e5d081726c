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

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import java.util.List;
import net.boyechko.pdf.autoxhtml.core.ConversionListener;
import net.boyechko.pdf.autoxhtml.issue.Issue;
import net.boyechko.pdf.autoxhtml.issue.IssueList;
import net.boyechko.pdf.autoxhtml.issue.IssueSev;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;

/**
 * A {@link ConversionListener} that routes all events through SLF4J, for callers without a
 * console. The running pass is kept in the MDC under {@value #PASS_KEY}, so a layout can print
 * it with {@code %X{pass}}.
 */
public class LoggingListener implements ConversionListener {
    public static final String PASS_KEY = "pass";
    public static final String LOGGER_NAME = "net.boyechko.pdf.autoxhtml.conversion";

    static final String CONSOLE_APPENDER_NAME = "AUTOXHTML_CONSOLE";
    private static final String CONSOLE_PATTERN = "%-5level [%X{" + PASS_KEY + "}] %msg%n";

    private static final Logger logger = LoggerFactory.getLogger(LOGGER_NAME);

    /** Creates a listener whose events are also printed to stdout, without the root appenders. */
    public static LoggingListener withConsoleOutput() {
        ensureConsoleAppender();
        return new LoggingListener();
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger conversionLogger = ctx.getLogger(LOGGER_NAME);
        if (conversionLogger.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern(CONSOLE_PATTERN);
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setEncoder(encoder);
        console.start();

        conversionLogger.addAppender(console);
        conversionLogger.setAdditive(false);
    }

    @Override
    public void onPhaseStart(String phaseName) {
        MDC.put(PASS_KEY, phaseName);
        logger.debug("Pass started");
    }

    @Override
    public void onSuccess(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onWarning(Issue issue) {
        logger.atLevel(levelFor(issue.severity()))
                .addKeyValue("type", issue.type())
                .log("{}{}", issue.message(), location(issue));
    }

    @Override
    public void onIssueGroup(String groupLabel, List<Issue> issues) {
        logger.info("{} {}", issues.size(), groupLabel);
        for (Issue issue : issues) {
            onWarning(issue);
        }
    }

    @Override
    public void onIssueResolved(Issue issue) {
        logger.info("Repaired {}{}", issue.resolutionNote(), location(issue));
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    /** Multi-line output such as the tree outline, one event per line. */
    @Override
    public void onVerboseOutput(String message) {
        if (logger.isDebugEnabled()) {
            message.lines().forEach(line -> logger.debug("{}", line));
        }
    }

    @Override
    public void onSummary(IssueList allIssues) {
        MDC.put(PASS_KEY, "Summary");
        try {
            logger.info(
                    "{} issue(s) detected, {} repaired, {} left for review",
                    allIssues.size(),
                    allIssues.getResolvedIssues().size(),
                    allIssues.getRemainingIssues().size());
        } finally {
            MDC.remove(PASS_KEY);
        }
    }

    private static Level levelFor(IssueSev severity) {
        return switch (severity) {
            case INFO -> Level.INFO;
            case WARNING -> Level.WARN;
            case ERROR, FATAL -> Level.ERROR;
        };
    }

    private static String location(Issue issue) {
        String path = issue.where().path();
        return path == null ? "" : " at " + path;
    }
}
