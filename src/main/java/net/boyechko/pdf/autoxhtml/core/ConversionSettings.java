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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.boyechko.pdf.autoxhtml.document.NodeTree;

/**
 * Immutable settings for one conversion.
 *
 * @param projectId substituted into rewritten image paths; blank means {@value #DEFAULT_PROJECT_ID}
 * @param runningHeaders page furniture strings, stored whitespace-normalized
 * @param normalizeHeaders whether heading levels are normalized after the last pass
 * @param prettyPrint whether the serializer indents its output
 * @param wrapperElements source elements whose children are promoted in place
 * @param noiseElements source elements suppressed with their subtree
 * @param noiseInstructions processing-instruction targets suppressed in the source
 */
public record ConversionSettings(
        String projectId,
        List<String> runningHeaders,
        boolean normalizeHeaders,
        boolean prettyPrint,
        Set<String> wrapperElements,
        Set<String> noiseElements,
        Set<String> noiseInstructions) {

    public static final String DEFAULT_PROJECT_ID = "unknown";

    public ConversionSettings {
        projectId =
                projectId == null || projectId.isBlank() ? DEFAULT_PROJECT_ID : projectId.strip();
        runningHeaders =
                runningHeaders.stream()
                        .map(NodeTree::normalizeSpace)
                        .filter(s -> !s.isEmpty())
                        .distinct()
                        .toList();
        wrapperElements = Set.copyOf(wrapperElements);
        noiseElements = Set.copyOf(noiseElements);
        noiseInstructions = Set.copyOf(noiseInstructions);
    }

    ConversionSettings(
            String projectId,
            List<String> runningHeaders,
            boolean normalizeHeaders,
            boolean prettyPrint,
            List<String> wrapperElements,
            List<String> noiseElements,
            List<String> noiseInstructions) {
        this(
                projectId,
                runningHeaders,
                normalizeHeaders,
                prettyPrint,
                new LinkedHashSet<>(wrapperElements),
                new LinkedHashSet<>(noiseElements),
                new LinkedHashSet<>(noiseInstructions));
    }

    /** Settings from the bundled {@code conversion-defaults.yaml}. */
    public static ConversionSettings defaults() {
        return ConversionConfig.loadDefault().toSettings();
    }

    public boolean isRunningHeader(String normalizedText) {
        return !normalizedText.isEmpty() && runningHeaders.contains(normalizedText);
    }

    public ConversionSettings withProjectId(String newProjectId) {
        return new ConversionSettings(
                newProjectId,
                runningHeaders,
                normalizeHeaders,
                prettyPrint,
                wrapperElements,
                noiseElements,
                noiseInstructions);
    }

    public ConversionSettings withRunningHeaders(List<String> newRunningHeaders) {
        return new ConversionSettings(
                projectId,
                newRunningHeaders,
                normalizeHeaders,
                prettyPrint,
                wrapperElements,
                noiseElements,
                noiseInstructions);
    }

    public ConversionSettings withNormalizeHeaders(boolean enabled) {
        return new ConversionSettings(
                projectId,
                runningHeaders,
                enabled,
                prettyPrint,
                wrapperElements,
                noiseElements,
                noiseInstructions);
    }

    public ConversionSettings withPrettyPrint(boolean enabled) {
        return new ConversionSettings(
                projectId,
                runningHeaders,
                normalizeHeaders,
                enabled,
                wrapperElements,
                noiseElements,
                noiseInstructions);
    }
}
