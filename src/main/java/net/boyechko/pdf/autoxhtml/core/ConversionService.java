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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import net.boyechko.pdf.autoxhtml.document.Node;
import net.boyechko.pdf.autoxhtml.document.NodeTree;
import net.boyechko.pdf.autoxhtml.document.SourceDocuments;
import net.boyechko.pdf.autoxhtml.document.SourceParseException;
import net.boyechko.pdf.autoxhtml.document.TaggedPdfExporter;
import net.boyechko.pdf.autoxhtml.issue.Issue;
import net.boyechko.pdf.autoxhtml.issue.IssueList;
import net.boyechko.pdf.autoxhtml.issue.IssueSev;
import net.boyechko.pdf.autoxhtml.issue.IssueType;
import net.boyechko.pdf.autoxhtml.passes.HeaderLevelNormalizer;
import net.boyechko.pdf.autoxhtml.passes.Pass;
import net.boyechko.pdf.autoxhtml.passes.PassResult;
import net.boyechko.pdf.autoxhtml.passes.StructuralMapping;
import net.boyechko.pdf.autoxhtml.validation.AuditEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the conversion of one document: structural mapping, the document shell, the
 * cleanup, symmetry, body-cell and range-stripping passes, optional heading normalization and the
 * output audit.
 *
 * <p>A service holds only immutable configuration and may convert documents concurrently.
 */
public class ConversionService {
    private static final Logger logger = LoggerFactory.getLogger(ConversionService.class);

    private static final int MIN_GROUP_SIZE_FOR_GROUPING = 3;

    private final ConversionSettings settings;
    private final ConversionListener listener;
    private final StructuralMapping structuralMapping;
    private final List<Pass> passes;
    private final Pass headerNormalizer;
    private final AuditEngine auditEngine;
    private final boolean printOutline;

    public static class ConversionServiceBuilder {
        private ConversionSettings settings;
        private ConversionListener listener;
        private boolean printOutline;

        public ConversionServiceBuilder withSettings(ConversionSettings settings) {
            this.settings = settings;
            return this;
        }

        public ConversionServiceBuilder withListener(ConversionListener listener) {
            this.listener = listener;
            return this;
        }

        public ConversionServiceBuilder withPrintOutline(boolean printOutline) {
            this.printOutline = printOutline;
            return this;
        }

        public ConversionService build() {
            if (settings == null) {
                throw new IllegalStateException(
                        "ConversionSettings must be provided via withSettings(...) before building ConversionService");
            }
            if (listener == null) {
                throw new IllegalStateException(
                        "ConversionListener must be provided via withListener(...) before building ConversionService");
            }
            return new ConversionService(this);
        }
    }

    private ConversionService(ConversionServiceBuilder builder) {
        this.settings = builder.settings;
        this.listener = builder.listener;
        this.printOutline = builder.printOutline;
        this.structuralMapping = ConversionDefaults.structuralMapping();
        this.passes = ConversionDefaults.shellPasses();
        this.headerNormalizer = new HeaderLevelNormalizer();
        this.auditEngine = new AuditEngine(ConversionDefaults.auditVisitors());
    }

    public ConversionSettings settings() {
        return settings;
    }

    /** Converts a source XML export or, by extension, a tagged PDF. */
    public ConversionResult convertFile(Path input) {
        String fileName = input.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".pdf")) {
            return convertPdf(input);
        }
        long start = System.nanoTime();
        listener.onPhaseStart("Reading source");
        try {
            return convert(SourceDocuments.parse(input));
        } catch (SourceParseException e) {
            return abort(e, start);
        }
    }

    public ConversionResult convertXml(String xml) {
        long start = System.nanoTime();
        listener.onPhaseStart("Reading source");
        try {
            return convert(SourceDocuments.parse(xml));
        } catch (SourceParseException e) {
            return abort(e, start);
        }
    }

    public ConversionResult convertPdf(Path pdf) {
        long start = System.nanoTime();
        listener.onPhaseStart("Reading structure tree");
        try {
            return convert(TaggedPdfExporter.export(pdf));
        } catch (SourceParseException e) {
            return abort(e, start);
        }
    }

    /** Runs every pass over an already parsed source tree. */
    public ConversionResult convert(Node.Element source) {
        long start = System.nanoTime();
        IssueList issues = new IssueList();
        List<String> passesRun = new ArrayList<>();

        listener.onPhaseStart(structuralMapping.name());
        List<Node> content =
                run(structuralMapping.name(), () -> structuralMapping.apply(source, settings));
        passesRun.add(structuralMapping.name());
        Node.Element document = DocumentShell.wrap(content);
        listener.onSuccess(
                "Mapped "
                        + NodeTree.countElements(source)
                        + " source elements to "
                        + (NodeTree.countElements(DocumentShell.container(document)) - 1)
                        + " output elements");

        for (Pass pass : passes) {
            document = runPass(pass, document, issues, passesRun).document();
        }

        int headersNormalized = 0;
        if (settings.normalizeHeaders()) {
            PassResult normalized = runPass(headerNormalizer, document, issues, passesRun);
            document = normalized.document();
            headersNormalized = normalized.changes();
        }

        if (printOutline) {
            listener.onVerboseOutput(NodeTree.toIndentedTreeString(document));
        }

        listener.onPhaseStart("Output audit");
        IssueList auditIssues = auditEngine.audit(document);
        issues.addAll(auditIssues);
        if (auditIssues.isEmpty()) {
            listener.onSuccess("No issues found");
        }
        reportIssues(issues);
        listener.onSummary(issues);

        int tables = NodeTree.descendants(document, e -> e.hasName("table")).size();
        long elapsed = elapsedMillis(start);
        logger.debug("Conversion finished in {} ms", elapsed);
        return new ConversionResult(
                document, issues, passesRun, tables, headersNormalized, elapsed);
    }

    private PassResult runPass(
            Pass pass, Node.Element document, IssueList issues, List<String> passesRun) {
        listener.onPhaseStart(pass.name());
        PassResult result = run(pass.name(), () -> pass.apply(document, settings));
        passesRun.add(pass.name());
        issues.addAll(result.issues());
        if (result.changes() > 0) {
            listener.onSuccess(result.changes() + " change(s)");
        } else if (result.issues().isEmpty()) {
            listener.onSuccess("Done");
        }
        return result;
    }

    /** Runs one pass, attributing any unexpected failure to it. */
    private static <T> T run(String passName, Supplier<T> pass) {
        try {
            return pass.get();
        } catch (ConversionException e) {
            throw e;
        } catch (RuntimeException e) {
            logger.error("{} failed: {}", passName, e.getMessage());
            throw new ConversionException(passName, e.getMessage(), e);
        }
    }

    private ConversionResult abort(SourceParseException e, long start) {
        logger.error("Source rejected: {}", e.getMessage());
        listener.onError(e.getMessage());
        IssueList fatal =
                new IssueList(
                        new Issue(IssueType.SOURCE_NOT_PARSEABLE, IssueSev.FATAL, e.getMessage()));
        listener.onSummary(fatal);
        return ConversionResult.aborted(fatal, elapsedMillis(start));
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    // == Reporting helpers ============================================

    private void reportIssues(IssueList issues) {
        IssueList resolved = issues.getResolvedIssues();
        if (!resolved.isEmpty()) {
            listener.onRepairsSectionStart();
            for (Issue issue : resolved) {
                listener.onIssueResolved(issue);
            }
        }
        IssueList remaining = issues.getRemainingIssues();
        if (!remaining.isEmpty()) {
            listener.onManualReviewSectionStart();
            reportIssuesGrouped(remaining);
        }
    }

    private void reportIssuesGrouped(IssueList issues) {
        Map<IssueType, List<Issue>> grouped =
                issues.stream()
                        .collect(
                                Collectors.groupingBy(
                                        Issue::type,
                                        () -> new EnumMap<>(IssueType.class),
                                        Collectors.toList()));

        for (Map.Entry<IssueType, List<Issue>> entry : grouped.entrySet()) {
            List<Issue> groupIssues = entry.getValue();

            if (groupIssues.size() >= MIN_GROUP_SIZE_FOR_GROUPING) {
                listener.onIssueGroup(entry.getKey().groupLabel(), groupIssues);
            } else {
                for (Issue issue : groupIssues) {
                    listener.onWarning(issue);
                }
            }
        }
    }
}
