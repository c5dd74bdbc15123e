package com.budgetam.calcite;

import com.budgetam.table.ColumnDescriptor;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeName;

final class CalciteTypeMapper {

    private CalciteTypeMapper() {}

    static RelDataType toRelDataType(RelDataTypeFactory factory, ColumnDescriptor column) {
        RelDataType baseType = factory.createSqlType(mapSqlType(column.getJdbcType()));
        return column.isNullable() ? factory.createTypeWithNullability(baseType, true) : baseType;
    }

    private static SqlTypeName mapSqlType(int jdbcType) {
        return switch (jdbcType) {
            case java.sql.Types.INTEGER -> SqlTypeName.INTEGER;
            case java.sql.Types.VARCHAR -> SqlTypeName.VARCHAR;
            case java.sql.Types.DOUBLE -> SqlTypeName.DOUBLE;
            case java.sql.Types.BOOLEAN -> SqlTypeName.BOOLEAN;
            default -> SqlTypeName.ANY;
        };
    }
}
