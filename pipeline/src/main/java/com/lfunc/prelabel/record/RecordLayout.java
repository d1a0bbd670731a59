package com.lfunc.prelabel.record;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Ordered columns of a {@code |}-delimited record line. */
public final class RecordLayout {
    static final String INPUT_NAMES =
            "id|origin|primitive|conductor|central_character|self_dual|motivic_weight|Lhash|degree"
                    + "|order_of_vanishing|algebraic|z1|gamma_factors|trace_hash|root_angle";
    static final String INPUT_TYPES =
            "bigint|text|boolean|numeric|text|boolean|smallint|text|smallint|smallint|boolean"
                    + "|numeric|jsonb|bigint|double precision";
    static final String OUTPUT_NAMES =
            INPUT_NAMES
                    + "|prelabel|analytic_conductor|mu_real|mu_imag|double_nu_real|double_nu_imag"
                    + "|bad_primes";
    static final String OUTPUT_TYPES =
            INPUT_TYPES
                    + "|text|double precision|smallint[]|numeric[]|smallint[]|numeric[]|bigint[]";

    public static final RecordLayout INPUT = fromHeader("lfunc_input", INPUT_NAMES, INPUT_TYPES);
    public static final RecordLayout OUTPUT = fromHeader("lfunc_labeled", OUTPUT_NAMES, OUTPUT_TYPES);

    private final String name;
    private final List<FieldDescriptor> fields;

    public RecordLayout(String name, List<FieldDescriptor> fields) {
        this.name = Objects.requireNonNull(name, "name");
        this.fields = List.copyOf(fields);
    }

    /**
     * Builds a layout from {@code |}-separated column names and SQL type names.
     *
     * @throws UnsupportedFieldTypeException if a type has no codec.
     */
    public static RecordLayout fromHeader(String name, String names, String types) {
        String[] columnNames = names.split("\\|", -1);
        String[] columnTypes = types.split("\\|", -1);
        if (columnNames.length != columnTypes.length) {
            throw new IllegalArgumentException(
                    columnNames.length + " column names but " + columnTypes.length + " types");
        }
        List<FieldDescriptor> fields = new ArrayList<>(columnNames.length);
        for (int i = 0; i < columnNames.length; i++) {
            fields.add(
                    new FieldDescriptor(
                            columnNames[i],
                            columnTypes[i],
                            FieldType.forColumn(columnNames[i], columnTypes[i]),
                            true));
        }
        return new RecordLayout(name, fields);
    }

    public String getName() {
        return name;
    }

    public List<FieldDescriptor> getFields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }
}
