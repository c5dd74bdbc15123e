package com.budgetam.loader;

import com.budgetam.schema.ColumnSchema;
import com.budgetam.schema.SourceKind;
import com.budgetam.workbook.RawRow;
import com.budgetam.workbook.WorkbookReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/** Entry point for turning one budget workbook into a dataset. */
public final class BudgetLoader {

    public LoaderResult load(Path workbook, SourceKind kind, int year) throws LoaderException {
        Objects.requireNonNull(workbook, "workbook");
        ColumnSchema schema = ColumnSchema.forSource(kind, year);
        List<RawRow> rows;
        try {
            rows = new WorkbookReader(schema.getWidth()).read(workbook);
        } catch (IOException ex) {
            throw new WorkbookReadException("Failed to read workbook " + workbook + ": " + ex.getMessage(), ex);
        }
        Path fileName = workbook.getFileName();
        String sourceName = fileName == null ? workbook.toString() : fileName.toString();
        return new ParserStateMachine(schema, year).scan(rows, sourceName);
    }
}
