package com.budgetam.loader;

import com.budgetam.workbook.CellText;
import com.budgetam.workbook.RawRow;

/**
 * Grammar of the medium-term expenditure plan: column 0 program code, column 1 text, columns 2-4
 * the three forecast-year figures. Two levels only.
 */
final class PlanRowClassifier implements RowClassifier {

    @Override
    public RowType classify(RawRow row) {
        if (row.isBlank(0, 5)) {
            return RowType.EMPTY;
        }
        for (int column = 0; column < 3; column++) {
            if (GRAND_TOTAL_MARKER.equals(CellText.normalizeLabel(row.cell(column)))) {
                return RowType.GRAND_TOTAL;
            }
        }
        boolean figures = CellText.isNumeric(row.cell(2))
                && CellText.isNumeric(row.cell(3))
                && CellText.isNumeric(row.cell(4));
        if (row.isBlank(0) && !row.isBlank(1) && figures) {
            return RowType.STATE_BODY_HEADER;
        }
        if (CellText.isNumeric(row.cell(0)) && !row.isBlank(1) && figures) {
            return RowType.PROGRAM_HEADER;
        }
        if (row.isBlank(0) && !row.isBlank(1) && row.isBlank(2, 5)) {
            return RowType.DETAIL_LINE;
        }
        return RowType.UNKNOWN;
    }
}
