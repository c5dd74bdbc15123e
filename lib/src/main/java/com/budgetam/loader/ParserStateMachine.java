package com.budgetam.loader;

import com.budgetam.ledger.Amounts;
import com.budgetam.ledger.BudgetDataset;
import com.budgetam.ledger.FlattenedRecord;
import com.budgetam.ledger.OverallTotals;
import com.budgetam.schema.AmountField;
import com.budgetam.schema.ColumnSchema;
import com.budgetam.schema.FieldShape;
import com.budgetam.schema.HierarchyLevel;
import com.budgetam.schema.WorkbookLayout;
import com.budgetam.workbook.CellText;
import com.budgetam.workbook.RawRow;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single forward scan over the rows of one workbook. Each row is classified, the state advances on
 * the row type alone (see {@link #transition}), and data is extracted only for the (state, row type)
 * pairs that carry it. Program and subprogram headers of the 2019-2024 layout consume the detail
 * block that follows them; the plan layout reads its program details without label checks.
 *
 * <p>Instances hold no per-scan state and may be reused; every call to {@link #scan} starts from
 * {@link ProcessingState#INIT} with a fresh context.
 */
public final class ParserStateMachine {
    private static final Logger LOGGER = Logger.getLogger(ParserStateMachine.class.getName());

    private final ColumnSchema schema;
    private final int year;
    private final RowClassifier classifier;
    private final DetailCollector detailCollector;
    private final FlattenedRecordBuilder recordBuilder;

    public ParserStateMachine(ColumnSchema schema, int year) {
        this.schema = Objects.requireNonNull(schema, "schema");
        this.year = year;
        this.classifier = RowClassifier.forLayout(schema.getLayout());
        this.detailCollector = switch (schema.getLayout()) {
            case LEGACY -> new DetailCollector(classifier, 2, DetailCollector.Policy.STRICT);
            case PLAN -> new DetailCollector(classifier, 1, DetailCollector.Policy.OPTIONAL);
            case LAYOUT_2025 -> null;
        };
        this.recordBuilder = new FlattenedRecordBuilder(schema.getShape());
    }

    public ColumnSchema getSchema() {
        return schema;
    }

    public RowClassifier getClassifier() {
        return classifier;
    }

    /**
     * Next state for a classified row. The grand total always leads to {@code READY}; before it,
     * every other row leaves the scan in {@code INIT} so no hierarchy row is accepted early.
     */
    public static ProcessingState transition(ProcessingState state, RowType type) {
        if (type == RowType.GRAND_TOTAL) {
            return ProcessingState.READY;
        }
        if (state == ProcessingState.INIT) {
            return ProcessingState.INIT;
        }
        return switch (type) {
            case STATE_BODY_HEADER -> ProcessingState.STATE_BODY;
            case PROGRAM_HEADER -> ProcessingState.PROGRAM;
            case SUBPROGRAM_MARKER -> ProcessingState.SUBPROGRAM;
            default -> state;
        };
    }

    /**
     * Scans all rows of one workbook.
     *
     * @param sourceName identity of the input, used in messages and carried by the dataset
     * @throws MissingGrandTotalException if no grand-total row is found
     * @throws InvalidGrandTotalException if the budget-law grand total is not numeric
     * @throws DetailLabelMismatchException if a detail block does not follow the expected layout
     */
    public LoaderResult scan(List<RawRow> rows, String sourceName) throws LoaderException {
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(sourceName, "sourceName");
        return new Scan(rows, sourceName).run();
    }

    private final class Scan {
        private final List<RawRow> rows;
        private final String sourceName;
        private final HierarchyContext context = new HierarchyContext(schema.getShape());
        private final List<FlattenedRecord> records = new ArrayList<>();
        private final List<LoaderMessage> messages = new ArrayList<>();
        private final ScanStatistics statistics = new ScanStatistics();
        private OverallTotals overall;

        Scan(List<RawRow> rows, String sourceName) {
            this.rows = rows;
            this.sourceName = sourceName;
        }

        LoaderResult run() throws LoaderException {
            ProcessingState state = ProcessingState.INIT;
            int index = 0;
            while (index < rows.size()) {
                RawRow row = rows.get(index);
                RowType type = classifier.classify(row);
                statistics.recordRow(type, state);
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.log(
                            Level.FINE,
                            "Row {0}: state={1}, type={2}, cells={3}",
                            new Object[] {row.getNumber(), state, type, row.getCells()});
                }
                state = transition(state, type);
                index = handle(state, type, row, index);
            }
            if (overall == null) {
                throw new MissingGrandTotalException(sourceName);
            }
            LOGGER.log(
                    Level.INFO,
                    "Processed {0} records from {1} ({2} rows skipped)",
                    new Object[] {records.size(), sourceName, statistics.getSkippedRows()});
            BudgetDataset dataset =
                    new BudgetDataset(schema.getSourceKind(), year, sourceName, records, overall);
            return new LoaderResult(dataset, messages, statistics);
        }

        /** Extracts data for the row and returns the index of the next row to classify. */
        private int handle(ProcessingState state, RowType type, RawRow row, int index) throws LoaderException {
            switch (type) {
                case GRAND_TOTAL:
                    readOverall(row);
                    return index + 1;
                case STATE_BODY_HEADER:
                    if (state == ProcessingState.STATE_BODY) {
                        context.enterStateBody(stateBodyName(row), readAmounts(row, HierarchyLevel.STATE_BODY));
                        LOGGER.log(Level.FINE, "New state body: {0}", context.getStateBody());
                    }
                    return index + 1;
                case PROGRAM_HEADER:
                    return state == ProcessingState.PROGRAM ? readProgram(row, index) : index + 1;
                case SUBPROGRAM_HEADER:
                    return acceptsSubprogram(state) ? readSubprogram(row, index) : index + 1;
                default:
                    return index + 1;
            }
        }

        private void readOverall(RawRow row) throws InvalidGrandTotalException {
            if (overall != null) {
                warn(row, "Duplicate grand total row ignored");
                return;
            }
            if (schema.getShape() == FieldShape.BUDGET_LAW) {
                String total = row.cell(schema.columns(HierarchyLevel.OVERALL).get(AmountField.TOTAL));
                if (!CellText.isNumeric(total)) {
                    throw new InvalidGrandTotalException(row.getNumber(), total);
                }
            }
            overall = recordBuilder.overall(readAmounts(row, HierarchyLevel.OVERALL), year);
            LOGGER.log(Level.INFO, "Found overall row {0}: {1}", new Object[] {row.getNumber(), overall.asMap()});
        }

        private int readProgram(RawRow row, int index) throws DetailLabelMismatchException {
            int code;
            try {
                code = CellText.parseCode(row.cell(programCodeColumn()));
            } catch (NumberFormatException ex) {
                context.resetProgram();
                skip(row, "Invalid program code '" + row.cell(programCodeColumn()) + "'");
                return index + 1;
            }
            context.enterProgram(code, readAmounts(row, HierarchyLevel.PROGRAM));
            int next = index + 1;
            switch (schema.getLayout()) {
                case LEGACY: {
                    DetailBlock block = detailCollector.collect(rows, index + 1, DetailLabels.PROGRAM);
                    reportEmptyLines(block);
                    context.describeProgram(block.name(), block.secondValue(), block.thirdValue());
                    next = block.getNextIndex();
                    break;
                }
                case LAYOUT_2025:
                    context.describeProgram(row.cell(3), row.cell(4), row.cell(5));
                    break;
                case PLAN: {
                    DetailBlock block = detailCollector.collect(rows, index + 1, null);
                    String name = block.name().isEmpty() ? row.cell(1) : block.name();
                    context.describeProgram(name, block.secondValue(), block.thirdValue());
                    emit(recordBuilder.programRecord(context, row.getIndex()));
                    next = block.getNextIndex();
                    break;
                }
                default:
                    throw new IllegalStateException("Unsupported layout " + schema.getLayout());
            }
            LOGGER.log(
                    Level.FINE,
                    "New program {0}: {1}",
                    new Object[] {context.getProgramCode(), context.getProgramName()});
            return next;
        }

        private int readSubprogram(RawRow row, int index) throws DetailLabelMismatchException {
            if (!context.hasProgram()) {
                skip(row, "Subprogram row outside any program");
                return index + 1;
            }
            String rawCode = row.cell(subprogramCodeColumn());
            SubprogramCode code;
            try {
                code = schema.getLayout() == WorkbookLayout.LAYOUT_2025
                        ? SubprogramCode.parseDashed(rawCode)
                        : SubprogramCode.parseLegacy(rawCode);
            } catch (NumberFormatException ex) {
                skip(row, "Invalid subprogram code '" + rawCode + "': " + ex.getMessage());
                return index + 1;
            }
            if (schema.getLayout() == WorkbookLayout.LAYOUT_2025) {
                String total = row.cell(6);
                if (!CellText.isNumeric(total)) {
                    skip(row, "Subprogram total is not numeric: '" + total + "'");
                    return index + 1;
                }
                emit(recordBuilder.subprogramRecord(
                        context,
                        row.getIndex(),
                        code,
                        readAmounts(row, HierarchyLevel.SUBPROGRAM),
                        row.cell(3),
                        row.cell(4),
                        row.cell(5)));
                return index + 1;
            }
            Amounts amounts = readAmounts(row, HierarchyLevel.SUBPROGRAM);
            DetailBlock block = detailCollector.collect(rows, index + 1, DetailLabels.SUBPROGRAM);
            reportEmptyLines(block);
            emit(recordBuilder.subprogramRecord(
                    context, row.getIndex(), code, amounts, block.name(), block.secondValue(), block.thirdValue()));
            return block.getNextIndex();
        }

        private Amounts readAmounts(RawRow row, HierarchyLevel level) {
            Map<AmountField, Double> values = new EnumMap<>(AmountField.class);
            for (Map.Entry<AmountField, Integer> entry : schema.columns(level).entrySet()) {
                String text = row.cell(entry.getValue());
                values.put(
                        entry.getKey(),
                        entry.getKey().isPercentage() ? CellText.parseFraction(text) : CellText.parseAmount(text));
            }
            return Amounts.of(schema.getShape(), values);
        }

        private void emit(FlattenedRecord record) {
            records.add(record);
            statistics.recordEmitted();
            LOGGER.log(Level.FINE, "Emitted {0}", record);
        }

        private void reportEmptyLines(DetailBlock block) {
            for (int rowNumber : block.getEmptyValueRows()) {
                messages.add(LoaderMessage.warning("Optional detail line is empty", sourceName, rowNumber));
            }
        }

        private void skip(RawRow row, String reason) {
            statistics.recordSkipped();
            warn(row, reason);
        }

        private void warn(RawRow row, String reason) {
            messages.add(LoaderMessage.warning(reason, sourceName, row.getNumber()));
            LOGGER.log(Level.WARNING, "{0} row {1}: {2}", new Object[] {sourceName, row.getNumber(), reason});
        }
    }

    private boolean acceptsSubprogram(ProcessingState state) {
        return switch (schema.getLayout()) {
            case LEGACY -> state == ProcessingState.SUBPROGRAM;
            case LAYOUT_2025 -> state != ProcessingState.INIT;
            case PLAN -> false;
        };
    }

    private String stateBodyName(RawRow row) {
        return switch (schema.getLayout()) {
            case LEGACY -> row.cell(2);
            case LAYOUT_2025 -> row.cell(0);
            case PLAN -> row.cell(1);
        };
    }

    private int programCodeColumn() {
        return schema.getLayout() == WorkbookLayout.LAYOUT_2025 ? 1 : 0;
    }

    private int subprogramCodeColumn() {
        return schema.getLayout() == WorkbookLayout.LAYOUT_2025 ? 2 : 1;
    }
}
