package com.budgetam.loader;

import com.budgetam.ledger.Amounts;
import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.FieldShape;
import java.util.List;
import java.util.Objects;

/** Turns the scan context plus one leaf row into an output record, and the grand-total row into totals. */
public final class FlattenedRecordBuilder {
    private final FieldShape shape;

    public FlattenedRecordBuilder(FieldShape shape) {
        this.shape = Objects.requireNonNull(shape, "shape");
    }

    public FlattenedRecord subprogramRecord(
            HierarchyContext context,
            int sourceRow,
            SubprogramCode code,
            Amounts amounts,
            String name,
            String description,
            String type) {
        if (!shape.hasSubprogramLevel()) {
            throw new IllegalStateException(shape + " workbooks have no subprogram level");
        }
        return base(context, sourceRow)
                .programCodeExt(code.getProgramCodeExt())
                .subprogramCode(code.getCode())
                .subprogramName(name)
                .subprogramDesc(description)
                .subprogramType(type)
                .subprogramAmounts(amounts)
                .build();
    }

    /** Record for a program of a two-level workbook. */
    public FlattenedRecord programRecord(HierarchyContext context, int sourceRow) {
        if (shape.hasSubprogramLevel()) {
            throw new IllegalStateException(shape + " workbooks emit one record per subprogram");
        }
        return base(context, sourceRow).build();
    }

    /**
     * @param planYear first forecast year; only used for plan workbooks
     */
    public OverallTotals overall(Amounts amounts, int planYear) {
        OverallTotals.Builder builder = OverallTotals.builder(shape);
        for (AmountField field : shape.fields()) {
            builder.put(field, amounts.get(field));
        }
        if (shape == FieldShape.PLAN) {
            builder.planYears(List.of(planYear, planYear + 1, planYear + 2));
        }
        return builder.build();
    }

    private static FlattenedRecord.Builder base(HierarchyContext context, int sourceRow) {
        return FlattenedRecord.builder()
                .sourceRow(sourceRow)
                .stateBody(context.getStateBody())
                .programCode(context.getProgramCode())
                .programName(context.getProgramName())
                .programGoal(context.getProgramGoal())
                .programResultDesc(context.getProgramResultDesc())
                .stateBodyAmounts(context.getStateBodyAmounts())
                .programAmounts(context.getProgramAmounts());
    }
}
