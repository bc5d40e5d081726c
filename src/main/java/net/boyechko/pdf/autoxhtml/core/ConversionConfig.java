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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * YAML-backed conversion configuration. Field names follow the keys of {@code
 * conversion-defaults.yaml}; a key left out of a file stays {@code null} so that files can be
 * layered with {@link #overlaidWith(ConversionConfig)}.
 */
public final class ConversionConfig {
    private static final String DEFAULT_CONFIG_RESOURCE = "/conversion-defaults.yaml";
    private static final Logger logger = LoggerFactory.getLogger(ConversionConfig.class);

    public String project_id;
    public List<String> running_headers;
    public Boolean normalize_headers;
    public Boolean pretty_print;
    public List<String> wrapper_elements;
    public List<String> noise_elements;
    public List<String> noise_instructions;

    /**
     * Load configuration from classpath resource (e.g., from src/main/resources/)
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static ConversionConfig fromResource(String resourcePath) {
        try (InputStream inputStream = ConversionConfig.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            ConversionConfig config = parse(inputStream);
            logger.debug("Loaded conversion config from resource {}", resourcePath);
            return config;
        } catch (IOException | RuntimeException e) {
            logger.error(
                    "Failed to load conversion config from resource {}: {}",
                    resourcePath,
                    e.getMessage());
            throw new RuntimeException(
                    "Failed to load config from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }
    }

    /** Load configuration from a user-supplied YAML file. */
    public static ConversionConfig fromFile(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Config file not found: " + path);
        }
        try (InputStream inputStream = Files.newInputStream(path)) {
            ConversionConfig config = parse(inputStream);
            logger.debug("Loaded conversion config from {}", path);
            return config;
        } catch (IOException | RuntimeException e) {
            throw new RuntimeException(
                    "Failed to load config from " + path + ": " + e.getMessage(), e);
        }
    }

    /** Load default configuration from standard location */
    public static ConversionConfig loadDefault() {
        return fromResource(DEFAULT_CONFIG_RESOURCE);
    }

    private static ConversionConfig parse(InputStream inputStream) {
        Yaml yaml = new Yaml(new Constructor(ConversionConfig.class, new LoaderOptions()));
        ConversionConfig config = yaml.load(inputStream);
        // An empty document loads as null
        return config != null ? config : new ConversionConfig();
    }

    /** Returns a new config where every key set in {@code override} replaces this one's. */
    public ConversionConfig overlaidWith(ConversionConfig override) {
        ConversionConfig merged = new ConversionConfig();
        merged.project_id = pick(override.project_id, project_id);
        merged.running_headers = pick(override.running_headers, running_headers);
        merged.normalize_headers = pick(override.normalize_headers, normalize_headers);
        merged.pretty_print = pick(override.pretty_print, pretty_print);
        merged.wrapper_elements = pick(override.wrapper_elements, wrapper_elements);
        merged.noise_elements = pick(override.noise_elements, noise_elements);
        merged.noise_instructions = pick(override.noise_instructions, noise_instructions);
        return merged;
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    public ConversionSettings toSettings() {
        return new ConversionSettings(
                project_id,
                orEmpty(running_headers),
                Boolean.TRUE.equals(normalize_headers),
                pretty_print == null || pretty_print,
                orEmpty(wrapper_elements),
                orEmpty(noise_elements),
                orEmpty(noise_instructions));
    }

    private static List<String> orEmpty(List<String> values) {
        return values != null ? values : List.of();
    }
}
