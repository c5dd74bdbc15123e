package com.budgetam.workbook;

import static com.budgetam.testing.TestWorkbooks.row;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.budgetam.testing.TestWorkbooks;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class WorkbookReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void readsFirstSheetAsTrimmedText() throws IOException {
        Path file = TestWorkbooks.write(
                tempDir,
                "cells.xlsx",
                List.of(row("  Ընդամենը ", null, "text", 1000000), row(), row(null, "11001", null, 12.5)));

        List<RawRow> rows = new WorkbookReader(4).read(file);

        assertEquals(3, rows.size());
        assertEquals(List.of("Ընդամենը", "", "text", "1000000"), rows.get(0).getCells());
        assertEquals(List.of("", "", "", ""), rows.get(1).getCells());
        assertEquals("12.5", rows.get(2).cell(3));
        assertEquals(3, rows.get(2).getNumber());
    }

    @Test
    void readsOnlyConfiguredWidth() throws IOException {
        Path file = TestWorkbooks.write(tempDir, "wide.xlsx", List.of(row("a", "b", "c", "d", "e")));

        List<RawRow> rows = new WorkbookReader(2).read(file);

        assertEquals(List.of("a", "b"), rows.get(0).getCells());
    }

    @Test
    void rejectsFilesThatAreNotWorkbooks() throws IOException {
        Path file = tempDir.resolve("notes.xlsx");
        Files.writeString(file, "not a workbook", StandardCharsets.UTF_8);

        assertThrows(IOException.class, () -> new WorkbookReader(4).read(file));
    }
}
