package com.lfunc.prelabel.calcite;

import com.lfunc.prelabel.label.LabelRecord;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.SchemaPlus;

/** Opens Calcite connections with a batch of labeled records registered as schema {@code lfunc}. */
public final class CalciteConnectionFactory {
    public static final String SCHEMA_NAME = "lfunc";

    private CalciteConnectionFactory() {}

    public static Connection connect(List<LabelRecord> records, Properties properties)
            throws SQLException {
        Objects.requireNonNull(records, "records");
        Properties calciteProps = new Properties();
        if (properties != null) {
            calciteProps.putAll(properties);
        }
        setDefault(calciteProps, "lex", "JAVA");
        setDefault(calciteProps, "quoting", "DOUBLE_QUOTE");
        setDefault(calciteProps, "quotedCasing", "UNCHANGED");
        setDefault(calciteProps, "unquotedCasing", "UNCHANGED");
        setDefault(calciteProps, "caseSensitive", "true");

        Connection connection = DriverManager.getConnection("jdbc:calcite:", calciteProps);
        CalciteConnection calcite = connection.unwrap(CalciteConnection.class);
        SchemaPlus root = calcite.getRootSchema();
        root.add(SCHEMA_NAME, new PrelabelSchema(records));
        calcite.setSchema(SCHEMA_NAME);
        return connection;
    }

    private static void setDefault(Properties properties, String key, String value) {
        if (!properties.containsKey(key)) {
            properties.setProperty(key, value);
        }
    }
}
