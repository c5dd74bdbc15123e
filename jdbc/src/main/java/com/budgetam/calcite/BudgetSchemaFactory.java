package com.budgetam.calcite;

import com.budgetam.loader.BudgetLoader;
import com.budgetam.loader.LoaderException;
import com.budgetam.loader.LoaderResult;
import com.budgetam.schema.SourceKind;
import com.budgetam.validation.ValidationRegistry;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import org.apache.calcite.schema.Schema;
import org.apache.calcite.schema.SchemaFactory;
import org.apache.calcite.schema.SchemaPlus;

/**
 * Calcite {@link SchemaFactory} for model files. Operands: {@code path}, {@code source} (a source
 * kind name) and {@code year}.
 */
public final class BudgetSchemaFactory implements SchemaFactory {

    @Override
    public Schema create(SchemaPlus parentSchema, String name, Map<String, Object> operand) {
        Objects.requireNonNull(parentSchema, "parentSchema");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(operand, "operand");
        Path path = Paths.get(require(operand, "path")).toAbsolutePath().normalize();
        SourceKind kind = SourceKind.parse(require(operand, "source"));
        int year;
        try {
            year = Integer.parseInt(require(operand, "year").trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Budget schema operand 'year' must be an integer", ex);
        }
        LoaderResult result;
        try {
            result = new BudgetLoader().load(path, kind, year);
        } catch (LoaderException ex) {
            throw new IllegalStateException("Failed to load workbook: " + path, ex);
        }
        return new BudgetSchema(
                result.getDataset(),
                ValidationRegistry.defaultChecks()
                        .run(result.getDataset().getRecords(), result.getDataset().getOverall(), kind));
    }

    private static String require(Map<String, Object> operand, String key) {
        Object value = operand.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Budget schema operand must include '" + key + "'");
        }
        return value.toString();
    }
}
