package com.budgetam.loader;

import com.budgetam.workbook.CellText;
import com.budgetam.workbook.RawRow;

/**
 * Grammar of the 2019-2024 budget laws and spending reports: column 0 program code, column 1
 * subprogram code, column 2 text, column 3 first figure.
 */
final class LegacyRowClassifier implements RowClassifier {

    @Override
    public RowType classify(RawRow row) {
        if (row.isBlank(0, 4)) {
            return RowType.EMPTY;
        }
        for (int column = 0; column < 3; column++) {
            if (GRAND_TOTAL_MARKER.equals(CellText.normalizeLabel(row.cell(column)))) {
                return RowType.GRAND_TOTAL;
            }
        }
        for (int column = 0; column < 3; column++) {
            if (SUBPROGRAM_MARKER.equals(CellText.normalize(row.cell(column)))) {
                return RowType.SUBPROGRAM_MARKER;
            }
        }
        boolean code = !row.isBlank(0);
        boolean subCode = !row.isBlank(1);
        boolean text = !row.isBlank(2);
        boolean amount = CellText.isNumeric(row.cell(3));
        if (!code && !subCode && text && amount) {
            return RowType.STATE_BODY_HEADER;
        }
        if (code && CellText.isNumeric(row.cell(0)) && !subCode && text && amount) {
            return RowType.PROGRAM_HEADER;
        }
        if (!code && subCode && text && amount && isSubprogramCode(row.cell(1))) {
            return RowType.SUBPROGRAM_HEADER;
        }
        if (!code && !subCode && text && row.isBlank(3)) {
            return RowType.DETAIL_LINE;
        }
        return RowType.UNKNOWN;
    }

    /** A bare number or a {@code <program>-<subprogram>} pair of numbers. */
    static boolean isSubprogramCode(String value) {
        if (value.indexOf('-') < 0) {
            return CellText.isNumeric(value);
        }
        String[] parts = value.split("-", -1);
        return parts.length == 2 && CellText.isNumeric(parts[0]) && CellText.isNumeric(parts[1]);
    }
}
