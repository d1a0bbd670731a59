package com.lfunc.prelabel.calcite;

import com.lfunc.prelabel.label.LabelRecord;
import com.lfunc.prelabel.record.FieldDescriptor;
import com.lfunc.prelabel.record.RecordLayout;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.calcite.DataContext;
import org.apache.calcite.linq4j.Enumerable;
import org.apache.calcite.linq4j.Linq4j;
import org.apache.calcite.rel.type.RelDataType;
import org.apache.calcite.rel.type.RelDataTypeFactory;
import org.apache.calcite.schema.ScannableTable;
import org.apache.calcite.schema.impl.AbstractTable;

/** Read-only table of labeled records with the columns of {@link RecordLayout#OUTPUT}. */
public final class LabeledRecordTable extends AbstractTable implements ScannableTable {

    private final List<Object[]> rows;

    public LabeledRecordTable(List<LabelRecord> records) {
        this.rows = materializeRows(records);
    }

    @Override
    public RelDataType getRowType(RelDataTypeFactory typeFactory) {
        RelDataTypeFactory.Builder builder = typeFactory.builder();
        for (FieldDescriptor field : RecordLayout.OUTPUT.getFields()) {
            builder.add(field.getName(), CalciteTypeMapper.toRelDataType(typeFactory, field));
        }
        return builder.build();
    }

    @Override
    public Enumerable<Object[]> scan(DataContext root) {
        return Linq4j.asEnumerable(rows);
    }

    int rowCount() {
        return rows.size();
    }

    private static List<Object[]> materializeRows(List<LabelRecord> records) {
        List<FieldDescriptor> fields = RecordLayout.OUTPUT.getFields();
        List<Object[]> rows = new ArrayList<>(records.size());
        for (LabelRecord record : records) {
            Map<String, Object> values = record.toFieldMap();
            Object[] row = new Object[fields.size()];
            for (int i = 0; i < row.length; i++) {
                FieldDescriptor field = fields.get(i);
                row[i] = CalciteTypeMapper.toRowValue(field.getType(), values.get(field.getName()));
            }
            rows.add(row);
        }
        return rows;
    }
}
