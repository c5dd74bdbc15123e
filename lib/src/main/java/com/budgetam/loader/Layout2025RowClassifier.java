package com.budgetam.loader;

import com.budgetam.workbook.CellText;
import com.budgetam.workbook.RawRow;

/**
 * Grammar of the 2025 budget law: descriptions sit on the header rows themselves (columns 3-5) and
 * every figure is in column 6. Subprograms carry a dash-joined code in column 2, so there is no
 * marker row and no detail line.
 */
final class Layout2025RowClassifier implements RowClassifier {

    @Override
    public RowType classify(RawRow row) {
        if (row.isBlank(0, 7)) {
            return RowType.EMPTY;
        }
        if (GRAND_TOTAL_MARKER.equals(CellText.normalizeLabel(row.cell(0)))) {
            return RowType.GRAND_TOTAL;
        }
        if (!row.isBlank(0) && CellText.isNumeric(row.cell(6))) {
            return RowType.STATE_BODY_HEADER;
        }
        if (row.isBlank(0)
                && CellText.isNumeric(row.cell(1))
                && !row.isBlank(3)
                && !row.isBlank(4)
                && !row.isBlank(6)) {
            return RowType.PROGRAM_HEADER;
        }
        if (row.isBlank(0)
                && row.isBlank(1)
                && row.cell(2).contains("-")
                && !row.isBlank(3)
                && !row.isBlank(4)
                && !row.isBlank(5)
                && !row.isBlank(6)) {
            return RowType.SUBPROGRAM_HEADER;
        }
        return RowType.UNKNOWN;
    }
}
