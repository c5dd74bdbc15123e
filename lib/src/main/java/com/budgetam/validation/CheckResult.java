package com.budgetam.validation;

import java.util.List;
import java.util.Objects;

/** Outcome of one check at one level. A result passes exactly when it has no failures. */
public final class CheckResult {
    private final String checkId;
    private final Severity severity;
    private final boolean passed;
    private final int failCount;
    private final List<String> messages;

    public CheckResult(String checkId, Severity severity, boolean passed, int failCount, List<String> messages) {
        this.checkId = Objects.requireNonNull(checkId, "checkId");
        this.severity = Objects.requireNonNull(severity, "severity");
        if (failCount < 0) {
            throw new IllegalArgumentException("failCount must be >= 0: " + failCount);
        }
        if (passed != (failCount == 0)) {
            throw new IllegalArgumentException(
                    "passed=" + passed + " is inconsistent with failCount=" + failCount + " for " + checkId);
        }
        this.passed = passed;
        this.failCount = failCount;
        this.messages = List.copyOf(messages);
    }

    public static CheckResult passed(String checkId, Severity severity) {
        return new CheckResult(checkId, severity, true, 0, List.of());
    }

    public static CheckResult failed(String checkId, Severity severity, int failCount, List<String> messages) {
        return new CheckResult(checkId, severity, false, failCount, messages);
    }

    /** Passed when {@code messages} is empty, otherwise failed with one failure per message. */
    public static CheckResult of(String checkId, Severity severity, List<String> messages) {
        return messages.isEmpty() ? passed(checkId, severity) : failed(checkId, severity, messages.size(), messages);
    }

    public String getCheckId() {
        return checkId;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean isPassed() {
        return passed;
    }

    public int getFailCount() {
        return failCount;
    }

    public List<String> getMessages() {
        return messages;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CheckResult that)) {
            return false;
        }
        return passed == that.passed
                && failCount == that.failCount
                && checkId.equals(that.checkId)
                && severity == that.severity
                && messages.equals(that.messages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(checkId, severity, passed, failCount, messages);
    }

    @Override
    public String toString() {
        return "CheckResult{" + checkId + ", " + severity.label() + ", "
                + (passed ? "passed" : failCount + " failures") + "}";
    }
}
