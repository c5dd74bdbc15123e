package com.budgetam.validation;

import com.budgetam.schema.SourceKind;
import java.time.Instant;
import java.util.Objects;

public final class ReportMetadata {
    private final SourceKind sourceKind;
    private final int year;
    private final String source;
    private final Instant generatedAt;

    public ReportMetadata(SourceKind sourceKind, int year, String source, Instant generatedAt) {
        this.sourceKind = Objects.requireNonNull(sourceKind, "sourceKind");
        this.year = year;
        this.source = Objects.requireNonNull(source, "source");
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt");
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    public int getYear() {
        return year;
    }

    /** File name (or other identity) of the validated workbook. */
    public String getSource() {
        return source;
    }

    public Instant getGeneratedAt() {
        return generatedAt;
    }
}
