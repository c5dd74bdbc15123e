package com.budgetam.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static mapping from logical financial fields to workbook column positions for one source kind
 * and layout. All published layouts place a level's figures in the same columns as its parent's,
 * so every level resolves to the same positions; lookups still go through the level so callers do
 * not depend on that.
 */
public final class ColumnSchema {

    private final SourceKind sourceKind;
    private final WorkbookLayout layout;
    private final int width;
    private final Map<AmountField, Integer> positions;

    private ColumnSchema(
            SourceKind sourceKind, WorkbookLayout layout, int width, Map<AmountField, Integer> positions) {
        this.sourceKind = sourceKind;
        this.layout = layout;
        this.width = width;
        this.positions = Collections.unmodifiableMap(new LinkedHashMap<>(positions));
    }

    public static ColumnSchema forSource(SourceKind kind, int year) {
        return forSource(kind, WorkbookLayout.of(kind, year));
    }

    public static ColumnSchema forSource(SourceKind kind, WorkbookLayout layout) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(layout, "layout");
        switch (layout) {
            case LEGACY:
                return legacy(kind);
            case LAYOUT_2025:
                if (kind != SourceKind.BUDGET_LAW) {
                    throw new IllegalArgumentException("2025 layout only exists for budget laws, not " + kind);
                }
                return new ColumnSchema(kind, layout, 7, Map.of(AmountField.TOTAL, 6));
            case PLAN:
                if (kind != SourceKind.MTEP) {
                    throw new IllegalArgumentException("Plan layout only exists for MTEP, not " + kind);
                }
                return new ColumnSchema(kind, layout, 6, sequential(kind.shape(), 2));
            default:
                throw new IllegalArgumentException("Unsupported layout: " + layout);
        }
    }

    private static ColumnSchema legacy(SourceKind kind) {
        FieldShape shape = kind.shape();
        if (shape == FieldShape.PLAN) {
            throw new IllegalArgumentException("Legacy layout does not carry plan figures");
        }
        // Columns 0-2 hold codes and text; figures start at column 3 in workbook order.
        Map<AmountField, Integer> positions = sequential(shape, 3);
        return new ColumnSchema(kind, WorkbookLayout.LEGACY, 3 + shape.fields().size(), positions);
    }

    private static Map<AmountField, Integer> sequential(FieldShape shape, int firstColumn) {
        Map<AmountField, Integer> positions = new LinkedHashMap<>();
        int column = firstColumn;
        for (AmountField field : shape.fields()) {
            positions.put(field, column++);
        }
        return positions;
    }

    public SourceKind getSourceKind() {
        return sourceKind;
    }

    public WorkbookLayout getLayout() {
        return layout;
    }

    public FieldShape getShape() {
        return sourceKind.shape();
    }

    /** Number of logical columns read from each row. */
    public int getWidth() {
        return width;
    }

    /** Field positions for the given level, in workbook column order. */
    public Map<AmountField, Integer> columns(HierarchyLevel level) {
        Objects.requireNonNull(level, "level");
        if (level == HierarchyLevel.SUBPROGRAM && !getShape().hasSubprogramLevel()) {
            return Map.of();
        }
        return positions;
    }

    /** Column names for the given level, e.g. {@code program_actual}, in workbook column order. */
    public List<String> columnNames(HierarchyLevel level) {
        return columns(level).keySet().stream().map(level::column).toList();
    }

    public Set<Integer> percentageColumns() {
        Set<Integer> columns = new LinkedHashSet<>();
        for (Map.Entry<AmountField, Integer> entry : positions.entrySet()) {
            if (entry.getKey().isPercentage()) {
                columns.add(entry.getValue());
            }
        }
        return Collections.unmodifiableSet(columns);
    }
}
