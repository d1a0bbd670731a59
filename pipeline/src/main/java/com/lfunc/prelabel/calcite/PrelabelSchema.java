package com.lfunc.prelabel.calcite;

import com.lfunc.prelabel.label.LabelRecord;
import java.util.List;
import java.util.Map;
import org.apache.calcite.schema.Table;
import org.apache.calcite.schema.impl.AbstractSchema;

/** Schema exposing one batch of labeled records as the table {@value #TABLE_NAME}. */
public final class PrelabelSchema extends AbstractSchema {
    public static final String TABLE_NAME = "lfunc_labeled";

    private final Map<String, Table> tables;

    public PrelabelSchema(List<LabelRecord> records) {
        this.tables = Map.of(TABLE_NAME, new LabeledRecordTable(records));
    }

    @Override
    protected Map<String, Table> getTableMap() {
        return tables;
    }
}
