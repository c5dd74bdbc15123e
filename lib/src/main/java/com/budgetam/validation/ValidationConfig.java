package com.budgetam.validation;

import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.SourceKind;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Tolerances and per-check severities. Values come from the bundled {@code budget-validation.properties},
 * then an optional override file, then system properties prefixed with {@code budgetam.validation.}.
 */
public final class ValidationConfig {
    public static final String RESOURCE = "budget-validation.properties";
    public static final String SYSTEM_PREFIX = "budgetam.validation.";

    private static final Logger LOGGER = Logger.getLogger(ValidationConfig.class.getName());

    private final Properties properties;

    private ValidationConfig(Properties properties) {
        this.properties = properties;
    }

    public static ValidationConfig defaults() {
        return load(null);
    }

    /**
     * @param overrideFile properties file layered over the bundled defaults, or {@code null}
     */
    public static ValidationConfig load(Path overrideFile) {
        Properties properties = new Properties();
        try (InputStream in = ValidationConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            properties.load(in);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, ex);
        }
        if (overrideFile != null) {
            try (Reader reader = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
                properties.load(reader);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read validation config " + overrideFile, ex);
            }
            LOGGER.log(Level.FINE, "Loaded validation overrides from {0}", overrideFile);
        }
        for (String name : System.getProperties().stringPropertyNames()) {
            if (name.startsWith(SYSTEM_PREFIX)) {
                properties.setProperty(name.substring(SYSTEM_PREFIX.length()), System.getProperty(name));
            }
        }
        return new ValidationConfig(properties);
    }

    /** Absolute tolerance for hierarchical sums of the given source kind. */
    public double tolerance(SourceKind kind) {
        Objects.requireNonNull(kind, "kind");
        String key;
        if (kind == SourceKind.BUDGET_LAW) {
            key = "tolerance.budget_law";
        } else if (kind == SourceKind.MTEP) {
            key = "tolerance.mtep";
        } else {
            key = "tolerance.spending";
        }
        return number(key);
    }

    public double percentageTolerance() {
        return number("tolerance.percentage");
    }

    /** Severity of a check at a level; unconfigured pairs default to error. */
    public Severity severity(String checkId, HierarchyLevel level) {
        String value = properties.getProperty("severity." + checkId + "." + level.key());
        return value == null ? Severity.ERROR : Severity.parse(value);
    }

    private double number(String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            throw new IllegalStateException("Missing validation setting " + key);
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalStateException("Invalid number for " + key + ": " + value, ex);
        }
    }
}
