package com.budgetam.ledger;

import com.budgetam.schema.FieldShape;
import com.budgetam.schema.HierarchyLevel;
import java.util.Objects;

/**
 * One output row: a subprogram (or, for the medium-term plan, a program) together with the
 * identifiers and figures of every level above it. Parent figures are repeated on each row that
 * belongs to them. Instances are immutable.
 */
public final class FlattenedRecord {
    private final int sourceRow;
    private final String stateBody;
    private final Integer programCode;
    private final Integer programCodeExt;
    private final String programName;
    private final String programGoal;
    private final String programResultDesc;
    private final Integer subprogramCode;
    private final String subprogramName;
    private final String subprogramDesc;
    private final String subprogramType;
    private final Amounts stateBodyAmounts;
    private final Amounts programAmounts;
    private final Amounts subprogramAmounts;

    private FlattenedRecord(Builder builder) {
        this.sourceRow = builder.sourceRow;
        this.stateBody = Objects.requireNonNull(builder.stateBody, "stateBody");
        this.programCode = Objects.requireNonNull(builder.programCode, "programCode");
        this.programCodeExt = builder.programCodeExt;
        this.programName = builder.programName;
        this.programGoal = builder.programGoal;
        this.programResultDesc = builder.programResultDesc;
        this.stateBodyAmounts = Objects.requireNonNull(builder.stateBodyAmounts, "stateBodyAmounts");
        this.programAmounts = Objects.requireNonNull(builder.programAmounts, "programAmounts");
        FieldShape shape = stateBodyAmounts.shape();
        if (programAmounts.shape() != shape) {
            throw new IllegalArgumentException("Program figures do not match shape " + shape);
        }
        if (shape.hasSubprogramLevel()) {
            this.subprogramCode = Objects.requireNonNull(builder.subprogramCode, "subprogramCode");
            this.subprogramAmounts = Objects.requireNonNull(builder.subprogramAmounts, "subprogramAmounts");
            if (subprogramAmounts.shape() != shape) {
                throw new IllegalArgumentException("Subprogram figures do not match shape " + shape);
            }
        } else {
            this.subprogramCode = null;
            this.subprogramAmounts = null;
        }
        this.subprogramName = builder.subprogramName;
        this.subprogramDesc = builder.subprogramDesc;
        this.subprogramType = builder.subprogramType;
    }

    public static Builder builder() {
        return new Builder();
    }

    public FieldShape getShape() {
        return stateBodyAmounts.shape();
    }

    /** Zero-based workbook row the record was built from. */
    public int getSourceRow() {
        return sourceRow;
    }

    public String getStateBody() {
        return stateBody;
    }

    public Integer getProgramCode() {
        return programCode;
    }

    /** Leading part of a dash-joined subprogram code; only the 2025 layout carries it. */
    public Integer getProgramCodeExt() {
        return programCodeExt;
    }

    public String getProgramName() {
        return programName;
    }

    public String getProgramGoal() {
        return programGoal;
    }

    public String getProgramResultDesc() {
        return programResultDesc;
    }

    public Integer getSubprogramCode() {
        return subprogramCode;
    }

    public String getSubprogramName() {
        return subprogramName;
    }

    public String getSubprogramDesc() {
        return subprogramDesc;
    }

    public String getSubprogramType() {
        return subprogramType;
    }

    /**
     * Figures of the given level.
     *
     * @return {@code null} for the subprogram level of a two-level workbook
     * @throws IllegalArgumentException for the overall level, which records do not carry
     */
    public Amounts amounts(HierarchyLevel level) {
        return switch (level) {
            case STATE_BODY -> stateBodyAmounts;
            case PROGRAM -> programAmounts;
            case SUBPROGRAM -> subprogramAmounts;
            case OVERALL -> throw new IllegalArgumentException("Records do not carry overall figures");
        };
    }

    /** Text identifier of the given level, used by identifier checks. */
    public String identifier(HierarchyLevel level) {
        return switch (level) {
            case STATE_BODY -> stateBody;
            case PROGRAM -> programName;
            case SUBPROGRAM -> subprogramName;
            case OVERALL -> throw new IllegalArgumentException("Records carry no overall identifier");
        };
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FlattenedRecord that)) {
            return false;
        }
        return sourceRow == that.sourceRow
                && stateBody.equals(that.stateBody)
                && programCode.equals(that.programCode)
                && Objects.equals(programCodeExt, that.programCodeExt)
                && Objects.equals(programName, that.programName)
                && Objects.equals(programGoal, that.programGoal)
                && Objects.equals(programResultDesc, that.programResultDesc)
                && Objects.equals(subprogramCode, that.subprogramCode)
                && Objects.equals(subprogramName, that.subprogramName)
                && Objects.equals(subprogramDesc, that.subprogramDesc)
                && Objects.equals(subprogramType, that.subprogramType)
                && stateBodyAmounts.equals(that.stateBodyAmounts)
                && programAmounts.equals(that.programAmounts)
                && Objects.equals(subprogramAmounts, that.subprogramAmounts);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceRow, stateBody, programCode, subprogramCode, subprogramName);
    }

    @Override
    public String toString() {
        return "FlattenedRecord{row=" + sourceRow
                + ", stateBody='" + stateBody + '\''
                + ", program=" + programCode
                + ", subprogram=" + subprogramCode
                + ", subprogramName='" + subprogramName + '\''
                + '}';
    }

    public static final class Builder {
        private int sourceRow;
        private String stateBody;
        private Integer programCode;
        private Integer programCodeExt;
        private String programName;
        private String programGoal;
        private String programResultDesc;
        private Integer subprogramCode;
        private String subprogramName;
        private String subprogramDesc;
        private String subprogramType;
        private Amounts stateBodyAmounts;
        private Amounts programAmounts;
        private Amounts subprogramAmounts;

        private Builder() {}

        public Builder sourceRow(int sourceRow) {
            this.sourceRow = sourceRow;
            return this;
        }

        public Builder stateBody(String stateBody) {
            this.stateBody = stateBody;
            return this;
        }

        public Builder programCode(Integer programCode) {
            this.programCode = programCode;
            return this;
        }

        public Builder programCodeExt(Integer programCodeExt) {
            this.programCodeExt = programCodeExt;
            return this;
        }

        public Builder programName(String programName) {
            this.programName = programName;
            return this;
        }

        public Builder programGoal(String programGoal) {
            this.programGoal = programGoal;
            return this;
        }

        public Builder programResultDesc(String programResultDesc) {
            this.programResultDesc = programResultDesc;
            return this;
        }

        public Builder subprogramCode(Integer subprogramCode) {
            this.subprogramCode = subprogramCode;
            return this;
        }

        public Builder subprogramName(String subprogramName) {
            this.subprogramName = subprogramName;
            return this;
        }

        public Builder subprogramDesc(String subprogramDesc) {
            this.subprogramDesc = subprogramDesc;
            return this;
        }

        public Builder subprogramType(String subprogramType) {
            this.subprogramType = subprogramType;
            return this;
        }

        public Builder stateBodyAmounts(Amounts amounts) {
            this.stateBodyAmounts = amounts;
            return this;
        }

        public Builder programAmounts(Amounts amounts) {
            this.programAmounts = amounts;
            return this;
        }

        public Builder subprogramAmounts(Amounts amounts) {
            this.subprogramAmounts = amounts;
            return this;
        }

        public FlattenedRecord build() {
            return new FlattenedRecord(this);
        }
    }
}
