package com.budgetam.workbook;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.apache.poi.EmptyFileException;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.UnsupportedFileFormatException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.ss.util.NumberToTextConverter;

/**
 * Reads the first sheet of an {@code .xls}/{@code .xlsx} workbook into trimmed text rows. Every
 * physical row up to the last one is returned, blank rows included, so row indexes match the sheet.
 */
public final class WorkbookReader {
    private static final Logger LOGGER = Logger.getLogger(WorkbookReader.class.getName());

    private final int width;

    /**
     * @param width number of leading columns to read from each row
     */
    public WorkbookReader(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive: " + width);
        }
        this.width = width;
    }

    public List<RawRow> read(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (Workbook workbook = WorkbookFactory.create(path.toFile(), null, true)) {
            if (workbook.getNumberOfSheets() == 0) {
                throw new IOException("Workbook has no sheets: " + path);
            }
            Sheet sheet = workbook.getSheetAt(0);
            int lastRow = sheet.getLastRowNum();
            List<RawRow> rows = new ArrayList<>(Math.max(lastRow + 1, 0));
            for (int index = 0; index <= lastRow; index++) {
                rows.add(readRow(index, sheet.getRow(index)));
            }
            LOGGER.log(
                    Level.FINE,
                    "Read {0} rows from sheet ''{1}'' of {2}",
                    new Object[] {rows.size(), sheet.getSheetName(), path.getFileName()});
            return rows;
        } catch (EncryptedDocumentException | EmptyFileException | UnsupportedFileFormatException ex) {
            throw new IOException("Unreadable workbook " + path + ": " + ex.getMessage(), ex);
        }
    }

    private RawRow readRow(int index, Row row) {
        if (row == null) {
            return RawRow.empty(index);
        }
        List<String> cells = new ArrayList<>(width);
        for (int column = 0; column < width; column++) {
            cells.add(cellText(row.getCell(column)));
        }
        return new RawRow(index, cells);
    }

    static String cellText(Cell cell) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType();
        if (type == CellType.FORMULA) {
            type = cell.getCachedFormulaResultType();
        }
        switch (type) {
            case STRING:
                return cell.getRichStringCellValue().getString().trim();
            case NUMERIC:
                return NumberToTextConverter.toText(cell.getNumericCellValue());
            case BOOLEAN:
                return cell.getBooleanCellValue() ? "TRUE" : "FALSE";
            default:
                return "";
        }
    }
}
