package com.budgetam.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated results of one validation run. Failed results are bucketed by severity; the error and
 * warning counts are the summed failure counts of those buckets.
 */
public final class ValidationReport {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ReportMetadata metadata;
    private final List<CheckResult> results;

    public ValidationReport(ReportMetadata metadata, List<CheckResult> results) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.results = List.copyOf(Objects.requireNonNull(results, "results"));
    }

    public ReportMetadata getMetadata() {
        return metadata;
    }

    public List<CheckResult> getResults() {
        return results;
    }

    public List<CheckResult> getPassedChecks() {
        List<CheckResult> passed = new ArrayList<>();
        for (CheckResult result : results) {
            if (result.isPassed()) {
                passed.add(result);
            }
        }
        return passed;
    }

    /**
     * Failed results sorted by check id.
     *
     * @param severity only results of this severity, or {@code null} for all
     */
    public List<CheckResult> getFailedChecks(Severity severity) {
        List<CheckResult> failed = new ArrayList<>();
        for (CheckResult result : results) {
            if (!result.isPassed() && (severity == null || result.getSeverity() == severity)) {
                failed.add(result);
            }
        }
        failed.sort(Comparator.comparing(CheckResult::getCheckId));
        return failed;
    }

    public int getErrorCount() {
        return failureTotal(Severity.ERROR);
    }

    public int getWarningCount() {
        return failureTotal(Severity.WARNING);
    }

    /** Errors always fail the report; in strict mode warnings do too. */
    public boolean hasErrors(boolean strict) {
        for (CheckResult result : results) {
            if (result.isPassed()) {
                continue;
            }
            if (result.getSeverity() == Severity.ERROR || strict) {
                return true;
            }
        }
        return false;
    }

    public String toJson() {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode meta = root.putObject("metadata");
        meta.put("source_type", metadata.getSourceKind().name());
        meta.put("year", metadata.getYear());
        meta.put("source", metadata.getSource());
        meta.put("generated_at", metadata.getGeneratedAt().toString());

        List<CheckResult> passed = getPassedChecks();
        List<CheckResult> warnings = getFailedChecks(Severity.WARNING);
        List<CheckResult> errors = getFailedChecks(Severity.ERROR);
        ObjectNode summary = root.putObject("summary");
        summary.put("total", results.size());
        summary.put("passed", passed.size());
        summary.put("with_warnings", warnings.size());
        summary.put("with_errors", errors.size());
        summary.put("error_count", getErrorCount());
        summary.put("warning_count", getWarningCount());

        writeBucket(root.putArray("passed_checks"), passed);
        writeBucket(root.putArray("warning_checks"), warnings);
        writeBucket(root.putArray("error_checks"), errors);
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to render validation report", ex);
        }
    }

    public void writeJson(Path file) throws IOException {
        Files.writeString(file, toJson(), StandardCharsets.UTF_8);
    }

    public void writeMarkdown(Path file) throws IOException {
        Files.writeString(file, toMarkdown(), StandardCharsets.UTF_8);
    }

    public String toMarkdown() {
        List<CheckResult> passed = getPassedChecks();
        List<CheckResult> errors = getFailedChecks(Severity.ERROR);
        List<CheckResult> warnings = getFailedChecks(Severity.WARNING);

        StringBuilder out = new StringBuilder();
        out.append("# Validation Report: ").append(metadata.getSource()).append("\n\n");
        out.append("**Source Type:** ").append(metadata.getSourceKind().name()).append("  \n");
        out.append("**Year:** ").append(metadata.getYear()).append("  \n");
        out.append("**Generated:** ").append(metadata.getGeneratedAt()).append("\n\n");

        out.append("## Summary\n\n");
        out.append("- **Total Checks:** ").append(results.size()).append('\n');
        out.append("- **Passed:** ").append(passed.size()).append(" ✅\n");
        out.append("- **Failed:** ").append(errors.size() + warnings.size()).append(" ❌\n");
        out.append("- **Errors:** ").append(getErrorCount()).append('\n');
        out.append("- **Warnings:** ").append(getWarningCount()).append("\n\n");

        if (errors.isEmpty() && warnings.isEmpty()) {
            out.append("## ✅ All Checks Passed\n\n");
            out.append("No validation issues found.\n\n");
        }
        appendFailures(out, "## ❌ Errors", "❌", errors);
        appendFailures(out, "## ⚠️ Warnings", "⚠️", warnings);

        if (!passed.isEmpty()) {
            out.append("## ✅ Passed Checks\n\n");
            Set<String> ids = new LinkedHashSet<>();
            for (CheckResult result : passed) {
                ids.add(result.getCheckId());
            }
            for (String id : ids) {
                out.append("- **").append(id).append("**\n");
            }
        }
        return out.toString();
    }

    public String toConsoleSummary() {
        List<CheckResult> failed = new ArrayList<>();
        failed.addAll(getFailedChecks(Severity.ERROR));
        failed.addAll(getFailedChecks(Severity.WARNING));

        StringBuilder out = new StringBuilder();
        out.append("Validation Summary:\n");
        out.append("  Source: ").append(metadata.getSourceKind().name())
                .append(" (").append(metadata.getSource()).append(")\n");
        out.append("  Checks: ").append(results.size()).append(" total, ")
                .append(results.size() - failed.size()).append(" passed, ")
                .append(failed.size()).append(" failed\n");
        out.append("  Errors: ").append(getErrorCount()).append('\n');
        out.append("  Warnings: ").append(getWarningCount()).append('\n');
        if (failed.isEmpty()) {
            out.append("\n✅ All validation checks passed!\n");
            return out.toString();
        }
        out.append("\nFailed Checks:\n");
        for (CheckResult result : failed) {
            String icon = result.getSeverity() == Severity.ERROR ? "❌" : "⚠️";
            out.append(icon).append(' ').append(result.getCheckId())
                    .append(" (").append(result.getSeverity().label()).append("): ")
                    .append(result.getFailCount()).append(" failures\n");
            for (String message : result.getMessages()) {
                out.append("   - ").append(message).append('\n');
            }
        }
        return out.toString();
    }

    private int failureTotal(Severity severity) {
        int total = 0;
        for (CheckResult result : results) {
            if (!result.isPassed() && result.getSeverity() == severity) {
                total += result.getFailCount();
            }
        }
        return total;
    }

    private static void writeBucket(ArrayNode bucket, List<CheckResult> entries) {
        for (CheckResult result : entries) {
            ObjectNode node = bucket.addObject();
            node.put("check_id", result.getCheckId());
            node.put("severity", result.getSeverity().label());
            node.put("fail_count", result.getFailCount());
            ArrayNode messages = node.putArray("messages");
            for (String message : result.getMessages()) {
                messages.add(message);
            }
        }
    }

    private static void appendFailures(StringBuilder out, String heading, String icon, List<CheckResult> failed) {
        if (failed.isEmpty()) {
            return;
        }
        out.append(heading).append("\n\n");
        for (CheckResult result : failed) {
            out.append("### ").append(icon).append(' ').append(result.getCheckId())
                    .append(" (").append(result.getFailCount()).append(" failures)\n\n");
            for (String message : result.getMessages()) {
                out.append("- ").append(message).append('\n');
            }
            out.append('\n');
        }
    }
}
