package com.budgetam.validation;

import com.budgetam.schema.HierarchyLevel;
import java.util.List;

final class NegativePercentagesCheck extends PercentageBoundsCheck {
    static final String ID = "negative_percentages";

    NegativePercentagesCheck(ValidationConfig config) {
        super(ID, config, value -> value < 0);
    }

    @Override
    String overallMessage(List<String> columns) {
        return "Negative overall percentages: " + String.join(", ", columns);
    }

    @Override
    String levelMessage(HierarchyLevel level, String column, int rows) {
        return "Negative " + level.key().replace('_', ' ') + " percentages: " + column + " (" + rows + " rows)";
    }
}
