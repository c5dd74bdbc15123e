package com.budgetam.calcite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.budgetam.testing.BudgetWorkbooks;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class BudgetSchemaFactoryTest {

    @TempDir
    Path tempDir;

    private static Properties modelProperties(Path workbook, String source) {
        String model =
                """
                inline:{
                  "version":"1.0",
                  "defaultSchema":"budget",
                  "schemas":[
                    {
                      "type":"custom",
                      "name":"budget",
                      "factory":"com.budgetam.calcite.BudgetSchemaFactory",
                      "operand":{"path":"%s","source":"%s","year":"2025"}
                    }
                  ]
                }
                """
                        .formatted(workbook.toString().replace("\\", "\\\\"), source);
        Properties props = new Properties();
        props.setProperty("model", model);
        props.setProperty("lex", "JAVA");
        props.setProperty("quoting", "DOUBLE_QUOTE");
        props.setProperty("caseSensitive", "true");
        return props;
    }

    @Test
    void modelFileExposesRecordsTable() throws Exception {
        Class.forName("org.apache.calcite.jdbc.Driver");
        Path workbook = BudgetWorkbooks.write(tempDir, "law.xlsx", BudgetWorkbooks.budgetLaw());

        Properties props = modelProperties(workbook, "BUDGET_LAW");
        try (Connection connection = DriverManager.getConnection("jdbc:calcite:", props);
                Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery(
                        "SELECT \"subprogram_code\", \"subprogram_name\" FROM \"budget\".\"records\" "
                                + "WHERE \"program_code\" = 1010 ORDER BY \"subprogram_code\"")) {
            assertTrue(rs.next());
            assertEquals(11001, rs.getInt(1));
            assertEquals("Tax administration", rs.getString(2));
            assertTrue(rs.next());
            assertEquals("Debt management", rs.getString(2));
        }
    }

    @Test
    void unknownSourceKindFailsSchemaCreation() throws Exception {
        Class.forName("org.apache.calcite.jdbc.Driver");
        Path workbook = BudgetWorkbooks.write(tempDir, "law.xlsx", BudgetWorkbooks.budgetLaw());

        Exception ex = assertThrows(Exception.class,
                () -> DriverManager.getConnection("jdbc:calcite:", modelProperties(workbook, "LEDGER")).close());
        assertTrue(causeChainMentions(ex, "Unknown source kind: LEDGER"), ex.toString());
    }

    private static boolean causeChainMentions(Throwable error, String text) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current.getMessage() != null && current.getMessage().contains(text)) {
                return true;
            }
        }
        return false;
    }
}
