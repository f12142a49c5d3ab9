package com.flexledger.jdbc;

import com.flexledger.engine.EngineConfig;
import com.flexledger.engine.LedgerEngine;
import com.flexledger.engine.RunResult;
import com.flexledger.jdbc.calcite.CalciteConnectionFactory;
import com.flexledger.ledger.LedgerException;
import com.flexledger.ledger.LedgerMessage;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Driver;
import java.sql.DriverManager;
import java.sql.DriverPropertyInfo;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLWarning;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC driver that posts a Flex Query export and exposes the journal, trial balance and holdings
 * through a Calcite connection.
 *
 * <p>URL form: {@code jdbc:flexledger:<path or file: URI>[?key=value&...]}. Keys are the
 * {@link EngineConfig} keys; anything else is passed through to Calcite.
 */
public final class FlexLedgerDriver implements Driver {

    static final String URL_PREFIX = "jdbc:flexledger:";
    private static final String WARNING_PREFIX = "[FlexLedger JDBC] ";
    private static final Logger LOGGER = Logger.getLogger(FlexLedgerDriver.class.getName());

    private static final Set<String> ENGINE_KEYS =
            Set.of(
                    EngineConfig.PERIOD_END,
                    EngineConfig.REPORTING_CURRENCY,
                    EngineConfig.RATE_URL_TEMPLATE,
                    EngineConfig.RATE_DIRECTORY,
                    EngineConfig.TRANSACTION_COST_POLICY,
                    EngineConfig.BOOKING_METHOD,
                    EngineConfig.BALANCE_TOLERANCE,
                    EngineConfig.OWNERS_LOAN);

    static {
        try {
            DriverManager.registerDriver(new FlexLedgerDriver());
        } catch (SQLException ex) {
            throw new ExceptionInInitializerError(ex);
        }
    }

    @Override
    public Connection connect(String url, Properties info) throws SQLException {
        if (!acceptsURL(url)) {
            return null;
        }
        ParsedUrl parsed = parseUrl(url);
        Properties properties = new Properties();
        if (info != null) {
            for (String name : info.stringPropertyNames()) {
                properties.setProperty(name, info.getProperty(name));
            }
        }
        properties.putAll(parsed.properties);

        EngineConfig config;
        try {
            config = EngineConfig.fromProperties(properties);
        } catch (IllegalArgumentException ex) {
            throw new SQLException(ex.getMessage(), ex);
        }
        RunResult result;
        try {
            result = new LedgerEngine(config).run(parsed.exportPath);
        } catch (LedgerException ex) {
            throw new SQLException("Failed to post export: " + parsed.exportPath + ": " + ex.getMessage(), ex);
        }

        Properties calciteProperties = new Properties();
        for (String name : properties.stringPropertyNames()) {
            if (!ENGINE_KEYS.contains(name)) {
                calciteProperties.setProperty(name, properties.getProperty(name));
            }
        }
        Connection connection = CalciteConnectionFactory.connect(result, calciteProperties);
        logMessages(result, parsed.exportPath);
        return wrapCalciteConnection(connection, buildWarningChain(result, parsed.exportPath));
    }

    @Override
    public boolean acceptsURL(String url) {
        return url != null && url.startsWith(URL_PREFIX);
    }

    @Override
    public DriverPropertyInfo[] getPropertyInfo(String url, Properties info) {
        return new DriverPropertyInfo[] {
            property(EngineConfig.PERIOD_END, "Last date included in the run (ISO yyyy-MM-dd).", null),
            property(EngineConfig.REPORTING_CURRENCY, "Reporting currency code.", "GBP"),
            property(EngineConfig.RATE_DIRECTORY, "Directory of cached monthly rate CSV files.", null),
            property(EngineConfig.RATE_URL_TEMPLATE, "URL template for monthly rate downloads.", null),
            property(
                    EngineConfig.TRANSACTION_COST_POLICY,
                    "How commissions are treated: CAPITALIZE or EXPENSE.",
                    "CAPITALIZE"),
            property(EngineConfig.BOOKING_METHOD, "Lot relief order: FIFO or LIFO.", "FIFO"),
            property(EngineConfig.BALANCE_TOLERANCE, "Largest debit/credit difference still balanced.", "0.01"),
            property(EngineConfig.OWNERS_LOAN, "Owner's loan CSV posted alongside the export.", null)
        };
    }

    @Override
    public int getMajorVersion() {
        return Version.MAJOR;
    }

    @Override
    public int getMinorVersion() {
        return Version.MINOR;
    }

    @Override
    public boolean jdbcCompliant() {
        return false;
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException("Logging hierarchy not implemented.");
    }

    private static DriverPropertyInfo property(String name, String description, String defaultValue) {
        DriverPropertyInfo info = new DriverPropertyInfo(name, defaultValue);
        info.required = false;
        info.description = description;
        return info;
    }

    static ParsedUrl parseUrl(String url) throws SQLException {
        String remainder = url.substring(URL_PREFIX.length());
        if (remainder.isEmpty()) {
            throw new SQLException("Export path missing from JDBC URL.");
        }

        String pathSegment = remainder;
        Properties props = new Properties();
        int paramIndex = remainder.indexOf('?');
        if (paramIndex >= 0) {
            pathSegment = remainder.substring(0, paramIndex);
            String query = remainder.substring(paramIndex + 1);
            for (String pair : query.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key = eq >= 0 ? pair.substring(0, eq) : pair;
                String value = eq >= 0 ? pair.substring(eq + 1) : "";
                props.setProperty(decode(key), decode(value));
            }
        }
        if (pathSegment.isEmpty()) {
            throw new SQLException("Export path missing from JDBC URL.");
        }

        Path exportPath;
        if (pathSegment.startsWith("file:")) {
            try {
                exportPath = Paths.get(URI.create(pathSegment));
            } catch (IllegalArgumentException ex) {
                throw new SQLException("Invalid file URI in JDBC URL: " + pathSegment, ex);
            }
        } else {
            exportPath = Paths.get(pathSegment);
        }
        exportPath = exportPath.toAbsolutePath().normalize();

        if (!Files.exists(exportPath)) {
            throw new SQLException("Export file not found: " + exportPath);
        }
        if (!Files.isReadable(exportPath)) {
            throw new SQLException("Export file is not readable: " + exportPath);
        }
        return new ParsedUrl(exportPath, props);
    }

    private static String decode(String text) throws SQLException {
        try {
            return URLDecoder.decode(text, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            throw new SQLException("Malformed JDBC URL parameter: " + text, ex);
        }
    }

    static SQLWarning buildWarningChain(RunResult result, Path exportPath) {
        SQLWarning head = null;
        SQLWarning tail = null;
        for (LedgerMessage message : result.getMessages()) {
            if (message.getLevel() == LedgerMessage.Level.INFO) {
                continue;
            }
            StringBuilder text = new StringBuilder(WARNING_PREFIX).append(message.getMessage());
            text.append(" (").append(exportPath.getFileName());
            if (message.getSourceLineno() > 0) {
                text.append(" row ").append(message.getSourceLineno());
            }
            text.append(')');
            SQLWarning warning = new SQLWarning(text.toString());
            if (head == null) {
                head = warning;
            } else {
                tail.setNextWarning(warning);
            }
            tail = warning;
        }
        return head;
    }

    private static void logMessages(RunResult result, Path exportPath) {
        List<LedgerMessage> messages = result.getMessages();
        for (LedgerMessage message : messages) {
            Level level =
                    switch (message.getLevel()) {
                        case INFO -> Level.FINE;
                        case WARNING -> Level.WARNING;
                        case ERROR -> Level.SEVERE;
                    };
            LOGGER.log(level, WARNING_PREFIX + "{0} ({1})", new Object[] {message.getMessage(), exportPath.getFileName()});
        }
        LOGGER.info(
                () ->
                        WARNING_PREFIX + exportPath.getFileName() + ": " + result.getEntries().size()
                                + " entries, status " + result.getStatus());
    }

    private Connection wrapCalciteConnection(Connection delegate, SQLWarning warnings) {
        return (Connection)
                Proxy.newProxyInstance(
                        Connection.class.getClassLoader(),
                        new Class<?>[] {Connection.class},
                        new DelegatingHandler(delegate) {
                            private SQLWarning localWarnings = warnings;

                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                if ("getMetaData".equals(method.getName()) && args == null) {
                                    return wrapCalciteMetaData((DatabaseMetaData) invokeDelegate(method, null));
                                } else if ("getWarnings".equals(method.getName())) {
                                    return localWarnings;
                                } else if ("clearWarnings".equals(method.getName())) {
                                    localWarnings = null;
                                    return null;
                                }
                                return super.handle(proxy, method, args);
                            }
                        });
    }

    private DatabaseMetaData wrapCalciteMetaData(DatabaseMetaData delegate) {
        return (DatabaseMetaData)
                Proxy.newProxyInstance(
                        DatabaseMetaData.class.getClassLoader(),
                        new Class<?>[] {DatabaseMetaData.class},
                        new DelegatingHandler(delegate) {
                            @Override
                            Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                                return switch (method.getName()) {
                                    case "getDatabaseProductName" -> "FlexLedger";
                                    case "getDatabaseProductVersion", "getDriverVersion" -> Version.RUNTIME;
                                    case "getDriverName" -> "FlexLedger JDBC Driver (Calcite)";
                                    case "getDriverMajorVersion" -> Version.MAJOR;
                                    case "getDriverMinorVersion" -> Version.MINOR;
                                    default -> super.handle(proxy, method, args);
                                };
                            }
                        });
    }

    record ParsedUrl(Path exportPath, Properties properties) {}

    private abstract static class DelegatingHandler implements InvocationHandler {
        private final Object delegate;

        DelegatingHandler(Object delegate) {
            this.delegate = delegate;
        }

        @Override
        public Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
            if (method.getDeclaringClass() == Object.class) {
                return invokeDelegate(method, args);
            }
            return handle(proxy, method, args);
        }

        Object handle(Object proxy, Method method, Object[] args) throws Throwable {
            return invokeDelegate(method, args);
        }

        Object invokeDelegate(Method method, Object[] args) throws Throwable {
            try {
                return method.invoke(delegate, args);
            } catch (InvocationTargetException ex) {
                throw ex.getCause();
            }
        }
    }
}
