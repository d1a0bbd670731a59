package com.lfunc.prelabel.calcite;

import com.lfunc.prelabel.gamma.GammaData;
import com.lfunc.prelabel.number.ExactReal;
import com.lfunc.prelabel.record.FieldDescriptor;
import com.lfunc.prelabel.record.FieldType;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.sql.type.SqlTypeName;

/**
 * Calcite column types for record fields, and the matching row values. Exact reals are exposed
 * as {@code DOUBLE}; their literal text stays available through the record codec.
 */
final class CalciteTypeMapper {

    private CalciteTypeMapper() {}

    static RelDataType toRelDataType(RelDataTypeFactory factory, FieldDescriptor field) {
        RelDataType type =
                switch (field.getType()) {
                    case TEXT, GAMMA_FACTORS -> factory.createSqlType(SqlTypeName.VARCHAR);
                    case BOOLEAN -> factory.createSqlType(SqlTypeName.BOOLEAN);
                    case SMALLINT -> factory.createSqlType(SqlTypeName.INTEGER);
                    case BIGINT -> factory.createSqlType(SqlTypeName.BIGINT);
                    case BIG_INTEGER -> factory.createSqlType(SqlTypeName.DECIMAL);
                    case REAL_LITERAL, DOUBLE -> factory.createSqlType(SqlTypeName.DOUBLE);
                    case SMALLINT_ARRAY -> array(factory, SqlTypeName.INTEGER);
                    case BIGINT_ARRAY -> array(factory, SqlTypeName.BIGINT);
                    case NUMERIC_ARRAY -> array(factory, SqlTypeName.DOUBLE);
                };
        return field.isNullable() ? factory.createTypeWithNullability(type, true) : type;
    }

    /** Converts a record value to the Java type Calcite expects for {@code type}. */
    static Object toRowValue(FieldType type, Object value) {
        if (value == null) {
            return null;
        }
        return switch (type) {
            case GAMMA_FACTORS -> ((GammaData) value).render();
            case BIG_INTEGER -> new BigDecimal((BigInteger) value);
            case REAL_LITERAL -> ((ExactReal) value).toDouble();
            case BIGINT_ARRAY -> {
                List<Long> longs = new ArrayList<>();
                for (Object element : (List<?>) value) {
                    longs.add(((Number) element).longValue());
                }
                yield longs;
            }
            case NUMERIC_ARRAY -> {
                List<Double> doubles = new ArrayList<>();
                for (Object element : (List<?>) value) {
                    doubles.add(((ExactReal) element).toDouble());
                }
                yield doubles;
            }
            default -> value;
        };
    }

    private static RelDataType array(RelDataTypeFactory factory, SqlTypeName element) {
        return factory.createArrayType(
                factory.createTypeWithNullability(factory.createSqlType(element), true), -1);
    }
}
