package com.budgetam.loader;

import com.budgetam.ledger.Amounts;
import com.budgetam.schema.FieldShape;
import java.util.Objects;

/**
 * The state body and program currently in scope during a scan. Owned by one scan; entering a
 * state body clears the program part.
 */
public final class HierarchyContext {
    private final FieldShape shape;
    private String stateBody = "";
    private Amounts stateBodyAmounts;
    private Integer programCode;
    private String programName = "";
    private String programGoal = "";
    private String programResultDesc = "";
    private Amounts programAmounts;

    public HierarchyContext(FieldShape shape) {
        this.shape = Objects.requireNonNull(shape, "shape");
        this.stateBodyAmounts = Amounts.zero(shape);
        this.programAmounts = Amounts.zero(shape);
    }

    public void enterStateBody(String name, Amounts amounts) {
        this.stateBody = Objects.requireNonNull(name, "name");
        this.stateBodyAmounts = checkShape(amounts);
        resetProgram();
    }

    public void enterProgram(int code, Amounts amounts) {
        this.programCode = code;
        this.programAmounts = checkShape(amounts);
        this.programName = "";
        this.programGoal = "";
        this.programResultDesc = "";
    }

    public void describeProgram(String name, String goal, String resultDesc) {
        this.programName = name;
        this.programGoal = goal;
        this.programResultDesc = resultDesc;
    }

    public void resetProgram() {
        programCode = null;
        programName = "";
        programGoal = "";
        programResultDesc = "";
        programAmounts = Amounts.zero(shape);
    }

    public boolean hasProgram() {
        return programCode != null;
    }

    public FieldShape getShape() {
        return shape;
    }

    public String getStateBody() {
        return stateBody;
    }

    public Amounts getStateBodyAmounts() {
        return stateBodyAmounts;
    }

    /** Code of the current program, or {@code null} between a state body header and its first program. */
    public Integer getProgramCode() {
        return programCode;
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

    public Amounts getProgramAmounts() {
        return programAmounts;
    }

    private Amounts checkShape(Amounts amounts) {
        Objects.requireNonNull(amounts, "amounts");
        if (amounts.shape() != shape) {
            throw new IllegalArgumentException("Expected " + shape + " figures, got " + amounts.shape());
        }
        return amounts;
    }
}
