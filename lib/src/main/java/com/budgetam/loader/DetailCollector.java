package com.budgetam.loader;

import com.budgetam.workbook.CellText;
import com.budgetam.workbook.RawRow;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the five-line block that follows a program or subprogram header. Lines at offsets 0, 2 and 4
 * are values (name, then goal/description, then result/type); lines 1 and 3 are labels.
 *
 * <p>Under {@link Policy#STRICT} value lines must be detail lines or empty, and label lines must be
 * non-empty detail lines containing the expected label; anything else raises
 * {@link DetailLabelMismatchException}. Under {@link Policy#OPTIONAL} nothing is enforced and the
 * block ends early at the next header row.
 */
public final class DetailCollector {
    private static final Logger LOGGER = Logger.getLogger(DetailCollector.class.getName());

    public static final int WINDOW = 5;

    public enum Policy {
        STRICT,
        OPTIONAL
    }

    private final RowClassifier classifier;
    private final int textColumn;
    private final Policy policy;

    public DetailCollector(RowClassifier classifier, int textColumn, Policy policy) {
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.textColumn = textColumn;
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public Policy getPolicy() {
        return policy;
    }

    /**
     * Collects the block starting at {@code start}. Rows past the end of the sheet read as empty.
     *
     * @param labels expected label texts; ignored under the optional policy
     */
    public DetailBlock collect(List<RawRow> rows, int start, DetailLabels labels)
            throws DetailLabelMismatchException {
        if (policy == Policy.OPTIONAL) {
            return collectOptional(rows, start);
        }
        return collectStrict(rows, start, Objects.requireNonNull(labels, "labels"));
    }

    private DetailBlock collectStrict(List<RawRow> rows, int start, DetailLabels labels)
            throws DetailLabelMismatchException {
        List<String> lines = new ArrayList<>(WINDOW);
        List<Integer> emptyValueRows = new ArrayList<>();
        for (int offset = 0; offset < WINDOW; offset++) {
            RawRow row = rowAt(rows, start + offset);
            String text = row.cell(textColumn);
            RowType type = classifier.classify(row);
            lines.add(text);
            if (offset % 2 == 0) {
                if (type == RowType.EMPTY) {
                    LOGGER.log(
                            Level.WARNING,
                            "Optional value line {0} (row {1}) is empty",
                            new Object[] {offset + 1, row.getNumber()});
                    emptyValueRows.add(row.getNumber());
                } else if (type != RowType.DETAIL_LINE) {
                    throw new DetailLabelMismatchException(
                            row.getNumber(), "DETAIL_LINE or EMPTY value line", type + " " + row.getCells());
                }
                continue;
            }
            String expected = labels.expectedAt(offset);
            if (type != RowType.DETAIL_LINE || text.isEmpty()) {
                throw new DetailLabelMismatchException(row.getNumber(), expected, type + " " + row.getCells());
            }
            String normalized = CellText.normalize(text);
            if (!normalized.contains(expected)) {
                throw new DetailLabelMismatchException(row.getNumber(), expected, normalized);
            }
        }
        return new DetailBlock(lines, start + WINDOW, emptyValueRows);
    }

    private DetailBlock collectOptional(List<RawRow> rows, int start) {
        List<String> lines = new ArrayList<>(WINDOW);
        int next = start;
        boolean stopped = false;
        for (int offset = 0; offset < WINDOW; offset++) {
            int index = start + offset;
            if (!stopped && index < rows.size() && classifier.classify(rows.get(index)).isHeader()) {
                stopped = true;
            }
            if (stopped) {
                lines.add("");
                continue;
            }
            lines.add(rowAt(rows, index).cell(textColumn));
            next = index + 1;
        }
        return new DetailBlock(lines, next, List.of());
    }

    private static RawRow rowAt(List<RawRow> rows, int index) {
        return index < rows.size() ? rows.get(index) : RawRow.empty(index);
    }
}
