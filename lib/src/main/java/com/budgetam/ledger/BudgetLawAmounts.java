package com.budgetam.ledger;

import com.budgetam.schema.AmountField;
import com.budgetam.schema.FieldShape;
import java.util.Objects;

public final class BudgetLawAmounts implements Amounts {
    private final Double total;

    public BudgetLawAmounts(Double total) {
        this.total = total;
    }

    public Double getTotal() {
        return total;
    }

    @Override
    public FieldShape shape() {
        return FieldShape.BUDGET_LAW;
    }

    @Override
    public Double get(AmountField field) {
        if (field == AmountField.TOTAL) {
            return total;
        }
        throw new IllegalArgumentException("Budget law figures have no " + field);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof BudgetLawAmounts that && Objects.equals(total, that.total);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(total);
    }

    @Override
    public String toString() {
        return "BudgetLawAmounts{total=" + total + "}";
    }
}
