package com.budgetam.tools;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.budgetam.testing.TestWorkbooks;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Logger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class BudgetBatchCliTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) {
        return BudgetBatchCli.run(
                args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void validWorkbooksProduceReports() throws Exception {
        Path law = TestWorkbooks.write(tempDir, "law.xlsx", TestWorkbooks.legacyBudgetLaw());
        Path plan = TestWorkbooks.write(tempDir, "plan.xlsx", TestWorkbooks.plan());
        Path reports = tempDir.resolve("reports");

        int code = run("--report-dir", reports.toString(), "--threads", "2", "2023:BUDGET_LAW:" + law, "2024:mtep:" + plan);

        assertEquals(0, code, stdout());
        List<String> lines = stdout().lines().toList();
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).startsWith("2023 BUDGET_LAW OK 4 records"), lines.get(0));
        assertTrue(lines.get(1).startsWith("2024 MTEP OK 3 records"), lines.get(1));
        assertTrue(Files.exists(reports.resolve("2023_BUDGET_LAW_report.md")));
        assertTrue(Files.readString(reports.resolve("2024_MTEP_report.json")).contains("\"source_type\" : \"MTEP\""));
    }

    @Test
    void oneFailingInputDoesNotStopTheOthers() throws Exception {
        List<List<Object>> rows = TestWorkbooks.legacyBudgetLaw();
        rows.remove(2);
        Path noTotal = TestWorkbooks.write(tempDir, "no-total.xlsx", rows);
        Path law = TestWorkbooks.write(tempDir, "law.xlsx", TestWorkbooks.legacyBudgetLaw());

        int code = run("2022:BUDGET_LAW:" + noTotal, "2023:BUDGET_LAW:" + law);

        assertEquals(1, code);
        List<String> lines = stdout().lines().toList();
        assertTrue(lines.get(0).startsWith("2022 BUDGET_LAW FAIL"), lines.get(0));
        assertTrue(lines.get(1).startsWith("2023 BUDGET_LAW OK"), lines.get(1));
    }

    @Test
    void strictModeFailsOnWarnings() throws Exception {
        List<List<Object>> rows = TestWorkbooks.legacyBudgetLaw();
        // a negative subprogram figure is only a warning
        rows.set(11, TestWorkbooks.row(null, "11001", "Subprogram 1", -150_000));
        rows.set(17, TestWorkbooks.row(null, "11002", "Subprogram 2", 450_000));
        Path law = TestWorkbooks.write(tempDir, "law.xlsx", rows);

        assertEquals(0, run("2023:BUDGET_LAW:" + law));
        assertEquals(1, run("--strict", "2023:BUDGET_LAW:" + law));
        assertTrue(stdout().contains("validation failed: 0 errors, 1 warnings"), stdout());
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, run());
        assertEquals(2, run("--threads", "0", "2023:BUDGET_LAW:x.xlsx"));
        assertEquals(2, run("2023-BUDGET_LAW-x.xlsx"));
        assertEquals(2, run("--bogus", "2023:BUDGET_LAW:x.xlsx"));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Usage: BudgetBatchCli"));
    }

    @Test
    void verboseLoggingInstallsOneConsoleHandler() throws Exception {
        Path law = TestWorkbooks.write(tempDir, "law.xlsx", TestWorkbooks.legacyBudgetLaw());

        run("--verbose", "2023:BUDGET_LAW:" + law);
        run("--verbose", "2023:BUDGET_LAW:" + law);

        int consoleHandlers = 0;
        for (Handler handler : Logger.getLogger("com.budgetam").getHandlers()) {
            if (handler instanceof ConsoleHandler) {
                consoleHandlers++;
            }
        }
        assertEquals(1, consoleHandlers);
    }
}
