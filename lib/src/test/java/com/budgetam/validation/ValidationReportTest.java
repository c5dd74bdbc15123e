package com.budgetam.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.budgetam.schema.SourceKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class ValidationReportTest {

    private static final ReportMetadata METADATA =
            new ReportMetadata(SourceKind.SPENDING_Q1, 2024, "spending_q1.xlsx", Instant.parse("2024-05-01T10:00:00Z"));

    @TempDir
    Path tempDir;

    private static ValidationReport mixed() {
        return new ValidationReport(METADATA, List.of(
                CheckResult.passed("required_fields", Severity.ERROR),
                CheckResult.failed("negative_totals", Severity.WARNING, 2, List.of("a", "b")),
                CheckResult.failed("hierarchical_totals", Severity.ERROR, 1, List.of("SB [state_body_total]")),
                CheckResult.failed("execution_exceeds_100", Severity.WARNING, 3, List.of("c"))));
    }

    @Test
    void countsSumFailuresPerSeverity() {
        ValidationReport report = mixed();

        assertEquals(1, report.getErrorCount());
        assertEquals(5, report.getWarningCount());
        assertEquals(1, report.getPassedChecks().size());
        assertEquals(
                List.of("execution_exceeds_100", "negative_totals"),
                report.getFailedChecks(Severity.WARNING).stream().map(CheckResult::getCheckId).toList());
        assertTrue(report.hasErrors(false));
    }

    @Test
    void strictModePromotesWarnings() {
        ValidationReport report = new ValidationReport(METADATA, List.of(
                CheckResult.passed("required_fields", Severity.ERROR),
                CheckResult.failed("negative_totals", Severity.WARNING, 1, List.of("x"))));

        assertFalse(report.hasErrors(false));
        assertTrue(report.hasErrors(true));
    }

    @Test
    void jsonGroupsResultsIntoBuckets() throws Exception {
        Path file = tempDir.resolve("report.json");
        mixed().writeJson(file);

        JsonNode root = new ObjectMapper().readTree(Files.readString(file, StandardCharsets.UTF_8));
        assertEquals("SPENDING_Q1", root.path("metadata").path("source_type").asText());
        assertEquals(2024, root.path("metadata").path("year").asInt());
        assertEquals("2024-05-01T10:00:00Z", root.path("metadata").path("generated_at").asText());

        JsonNode summary = root.path("summary");
        assertEquals(4, summary.path("total").asInt());
        assertEquals(1, summary.path("passed").asInt());
        assertEquals(2, summary.path("with_warnings").asInt());
        assertEquals(1, summary.path("with_errors").asInt());
        assertEquals(5, summary.path("warning_count").asInt());

        JsonNode error = root.path("error_checks").get(0);
        assertEquals("hierarchical_totals", error.path("check_id").asText());
        assertEquals("error", error.path("severity").asText());
        assertEquals(1, error.path("fail_count").asInt());
        assertEquals("SB [state_body_total]", error.path("messages").get(0).asText());
        assertEquals(2, root.path("warning_checks").size());
    }

    @Test
    void markdownListsFailuresBySeverity() {
        String markdown = mixed().toMarkdown();

        assertTrue(markdown.startsWith("# Validation Report: spending_q1.xlsx\n"));
        assertTrue(markdown.contains("- **Failed:** 3 ❌\n"));
        assertTrue(markdown.contains("## ❌ Errors\n\n### ❌ hierarchical_totals (1 failures)\n\n- SB [state_body_total]\n"));
        assertTrue(markdown.contains("### ⚠️ negative_totals (2 failures)\n\n- a\n- b\n"));
        assertTrue(markdown.contains("## ✅ Passed Checks\n\n- **required_fields**\n"));
        assertFalse(markdown.contains("All Checks Passed"));
    }

    @Test
    void cleanReportSaysSo() {
        ValidationReport report =
                new ValidationReport(METADATA, List.of(CheckResult.passed("required_fields", Severity.ERROR)));

        assertTrue(report.toMarkdown().contains("## ✅ All Checks Passed\n\nNo validation issues found."));
        assertTrue(report.toConsoleSummary().endsWith("\n✅ All validation checks passed!\n"));
    }

    @Test
    void consoleSummaryListsErrorsBeforeWarnings() {
        String summary = mixed().toConsoleSummary();

        assertTrue(summary.contains("  Source: SPENDING_Q1 (spending_q1.xlsx)\n"));
        assertTrue(summary.contains("  Checks: 4 total, 1 passed, 3 failed\n"));
        assertTrue(summary.indexOf("❌ hierarchical_totals (error): 1 failures")
                < summary.indexOf("⚠️ execution_exceeds_100 (warning): 3 failures"));
        assertTrue(summary.contains("   - a\n   - b\n"));
    }
}
