package com.flexledger.jdbc.calcite;

import com.flexledger.engine.RunResult;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import org.apache.calcite.jdbc.CalciteConnection;
import org.apache.calcite.schema.SchemaPlus;

/**
 * Helper for opening Calcite connections that are pre-wired with the ledger schema.
 */
public final class CalciteConnectionFactory {

    public static final String SCHEMA_NAME = "flexledger";

    private CalciteConnectionFactory() {}

    public static Connection connect(RunResult runResult, Properties properties) throws SQLException {
        Objects.requireNonNull(runResult, "runResult");
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
        root.add(SCHEMA_NAME, new FlexLedgerSchema(runResult));
        calcite.setSchema(SCHEMA_NAME);
        return connection;
    }

    private static void setDefault(Properties properties, String key, String value) {
        if (!properties.containsKey(key)) {
            properties.setProperty(key, value);
        }
    }
}
