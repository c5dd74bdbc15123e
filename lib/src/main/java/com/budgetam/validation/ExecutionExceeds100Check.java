package com.budgetam.validation;

import com.budgetam.schema.HierarchyLevel;
import java.util.List;

/** Execution above 100% (a fraction above 1.0). Overspending can be legitimate; defaults to warnings. */
final class ExecutionExceeds100Check extends PercentageBoundsCheck {
    static final String ID = "execution_exceeds_100";

    ExecutionExceeds100Check(ValidationConfig config) {
        super(ID, config, value -> value > 1.0);
    }

    @Override
    String overallMessage(List<String> columns) {
        return "Overall execution > 100%: " + String.join(", ", columns);
    }

    @Override
    String levelMessage(HierarchyLevel level, String column, int rows) {
        return HierarchyView.capitalize(level) + " execution > 100%: " + column + " (" + rows + " rows)";
    }
}
