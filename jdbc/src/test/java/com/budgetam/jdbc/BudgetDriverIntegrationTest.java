package com.budgetam.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.budgetam.testing.BudgetWorkbooks;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLWarning;
import java.sql.Statement;
import java.util.List;
import java.util.Properties;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class BudgetDriverIntegrationTest {

    @TempDir
    Path tempDir;

    @BeforeAll
    static void registerDriver() throws Exception {
        Class.forName("com.budgetam.jdbc.BudgetDriver");
    }

    private String url(Path workbook) {
        return "jdbc:budgetam:" + workbook + "?source=BUDGET_LAW&year=2025";
    }

    @Test
    void driverQueriesFlattenedRecords() throws Exception {
        Path workbook = BudgetWorkbooks.write(tempDir, "law.xlsx", BudgetWorkbooks.budgetLaw());
        try (Connection connection = DriverManager.getConnection(url(workbook));
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery(
                        "SELECT \"state_body\", COUNT(*), SUM(\"subprogram_total\") FROM \"budget\".\"records\" "
                                + "GROUP BY \"state_body\" ORDER BY \"state_body\"")) {
            assertTrue(rs.next());
            assertEquals("Ministry of Finance", rs.getString(1));
            assertEquals(2, rs.getInt(2));
            assertEquals(300.0, rs.getDouble(3));
            assertTrue(rs.next());
            assertEquals("Ministry of Justice", rs.getString(1));
            assertEquals(2, rs.getInt(2));
            assertFalse(rs.next());
        }
    }

    @Test
    void overallAndCheckResultsAreQueryable() throws Exception {
        Path workbook = BudgetWorkbooks.write(tempDir, "law.xlsx", BudgetWorkbooks.budgetLaw());
        try (Connection connection = DriverManager.getConnection(url(workbook));
                Statement statement = connection.createStatement()) {
            try (ResultSet rs = statement.executeQuery("SELECT \"field\", \"value\" FROM \"overall\"")) {
                assertTrue(rs.next());
                assertEquals("overall_total", rs.getString(1));
                assertEquals(500.0, rs.getDouble(2));
                assertFalse(rs.next());
            }
            try (ResultSet rs = statement.executeQuery(
                    "SELECT COUNT(*), SUM(CASE WHEN \"passed\" THEN 0 ELSE 1 END) FROM \"check_results\"")) {
                assertTrue(rs.next());
                assertEquals(16, rs.getInt(1));
                assertEquals(0, rs.getInt(2));
            }
        }
    }

    @Test
    void propertiesMayReplaceUrlParameters() throws Exception {
        Path workbook = BudgetWorkbooks.write(tempDir, "law.xlsx", BudgetWorkbooks.budgetLaw());
        Properties info = new Properties();
        info.setProperty("source", "budget_law");
        info.setProperty("year", "2025");
        try (Connection connection = DriverManager.getConnection("jdbc:budgetam:" + workbook.toUri(), info)) {
            DatabaseMetaData metaData = connection.getMetaData();
            assertEquals("Budget Workbook", metaData.getDatabaseProductName());
            assertEquals("Budget JDBC Driver (Calcite)", metaData.getDriverName());
            assertNull(connection.getWarnings());
        }
    }

    @Test
    void loaderWarningsBecomeSqlWarnings() throws Exception {
        List<List<Object>> rows = BudgetWorkbooks.budgetLaw();
        rows.add(BudgetWorkbooks.row(BudgetWorkbooks.TOTAL, null, null, null, null, null, 999));
        Path workbook = BudgetWorkbooks.write(tempDir, "law.xlsx", rows);
        try (Connection connection = DriverManager.getConnection(url(workbook))) {
            SQLWarning warning = connection.getWarnings();
            assertNotNull(warning);
            assertTrue(warning.getMessage().contains("Duplicate grand total row ignored"), warning.getMessage());
            connection.clearWarnings();
            assertNull(connection.getWarnings());
        }
    }

    @Test
    void workbookWithoutGrandTotalFailsToConnect() throws Exception {
        List<List<Object>> rows = BudgetWorkbooks.budgetLaw();
        rows.remove(0);
        Path workbook = BudgetWorkbooks.write(tempDir, "law.xlsx", rows);

        SQLException ex = assertThrows(SQLException.class, () -> DriverManager.getConnection(url(workbook)));
        assertTrue(ex.getMessage().startsWith("Failed to load workbook"), ex.getMessage());
    }

    @Test
    void badConnectionParametersAreRejected() throws Exception {
        Path workbook = BudgetWorkbooks.write(tempDir, "law.xlsx", BudgetWorkbooks.budgetLaw());

        assertThrows(SQLException.class,
                () -> DriverManager.getConnection("jdbc:budgetam:" + workbook + "?source=LEDGER&year=2025"));
        assertThrows(SQLException.class,
                () -> DriverManager.getConnection("jdbc:budgetam:" + workbook + "?source=BUDGET_LAW"));
        assertThrows(SQLException.class,
                () -> DriverManager.getConnection("jdbc:budgetam:" + tempDir.resolve("missing.xlsx")
                        + "?source=BUDGET_LAW&year=2025"));
    }

    @Test
    void urlParsing() throws Exception {
        Path workbook = BudgetWorkbooks.write(tempDir, "law.xlsx", BudgetWorkbooks.budgetLaw());
        BudgetDriver driver = new BudgetDriver();

        BudgetDriver.ParsedUrl parsed = BudgetDriver.parseUrl(url(workbook));

        assertEquals(workbook.toAbsolutePath(), parsed.workbookPath());
        assertEquals("BUDGET_LAW", parsed.properties().getProperty("source"));
        assertEquals("2025", parsed.properties().getProperty("year"));
        assertTrue(driver.acceptsURL("jdbc:budgetam:/tmp/x.xlsx"));
        assertFalse(driver.acceptsURL("jdbc:calcite:"));
        assertNull(driver.connect("jdbc:calcite:", new Properties()));
        assertThrows(SQLException.class, () -> BudgetDriver.parseUrl("jdbc:budgetam:"));
    }
}
