package com.budgetam.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.SourceKind;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class ValidationConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void bundledDefaults() {
        ValidationConfig config = ValidationConfig.defaults();

        assertEquals(1.0, config.tolerance(SourceKind.BUDGET_LAW));
        assertEquals(5.0, config.tolerance(SourceKind.SPENDING_Q123));
        assertEquals(0.5, config.tolerance(SourceKind.MTEP));
        assertEquals(0.001, config.percentageTolerance());
        assertEquals(Severity.WARNING, config.severity("negative_totals", HierarchyLevel.PROGRAM));
        assertEquals(Severity.ERROR, config.severity("negative_totals", HierarchyLevel.STATE_BODY));
        assertEquals(Severity.ERROR, config.severity("unknown_check", HierarchyLevel.OVERALL));
    }

    @Test
    void overrideFileReplacesBundledValues() throws Exception {
        Path file = tempDir.resolve("validation.properties");
        Files.writeString(file, "tolerance.spending=10\nseverity.negative_totals.program=error\n");

        ValidationConfig config = ValidationConfig.load(file);

        assertEquals(10.0, config.tolerance(SourceKind.SPENDING_Q1234));
        assertEquals(Severity.ERROR, config.severity("negative_totals", HierarchyLevel.PROGRAM));
        assertEquals(1.0, config.tolerance(SourceKind.BUDGET_LAW));
    }

    @Test
    void systemPropertiesWin() {
        String key = ValidationConfig.SYSTEM_PREFIX + "tolerance.budget_law";
        System.setProperty(key, "2.5");
        try {
            assertEquals(2.5, ValidationConfig.defaults().tolerance(SourceKind.BUDGET_LAW));
        } finally {
            System.clearProperty(key);
        }
    }

    @Test
    void badValuesAreRejected() throws Exception {
        Path file = tempDir.resolve("bad.properties");
        Files.writeString(file, "tolerance.mtep=lots\nseverity.required_fields.overall=fatal\n");
        ValidationConfig config = ValidationConfig.load(file);

        assertThrows(IllegalStateException.class, () -> config.tolerance(SourceKind.MTEP));
        assertThrows(IllegalArgumentException.class,
                () -> config.severity("required_fields", HierarchyLevel.OVERALL));
        assertThrows(UncheckedIOException.class, () -> ValidationConfig.load(tempDir.resolve("missing.properties")));
    }
}
