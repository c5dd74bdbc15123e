package com.budgetam.jdbc;

import com.budgetam.Version;
import com.budgetam.calcite.CalciteConnectionFactory;
import com.budgetam.loader.BudgetLoader;
import com.budgetam.loader.LoaderException;
import com.budgetam.loader.LoaderMessage;
import com.budgetam.loader.LoaderResult;
import com.budgetam.schema.SourceKind;
import com.budgetam.validation.CheckResult;
import com.budgetam.validation.ValidationRegistry;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JDBC driver that opens Calcite-backed connections over one budget workbook.
 *
 * <p>URL form: {@code jdbc:budgetam:<path>?source=<KIND>&year=<N>}. Both parameters may also be
 * passed as connection properties.
 */
public final class BudgetDriver implements Driver {

    static final String URL_PREFIX = "jdbc:budgetam:";
    static final String SOURCE_PROPERTY = "source";
    static final String YEAR_PROPERTY = "year";
    private static final Logger LOGGER = Logger.getLogger(BudgetDriver.class.getName());

    static {
        try {
            DriverManager.registerDriver(new BudgetDriver());
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
            properties.putAll(info);
        }
        properties.putAll(parsed.properties());
        SourceKind kind = sourceKind(properties);
        int year = year(properties);
        properties.remove(SOURCE_PROPERTY);
        properties.remove(YEAR_PROPERTY);

        LoaderResult loaderResult;
        try {
            loaderResult = new BudgetLoader().load(parsed.workbookPath(), kind, year);
        } catch (LoaderException ex) {
            throw new SQLException("Failed to load workbook " + parsed.workbookPath() + ": " + ex.getMessage(), ex);
        }
        List<CheckResult> checkResults = ValidationRegistry.defaultChecks()
                .run(loaderResult.getDataset().getRecords(), loaderResult.getDataset().getOverall(), kind);
        Connection connection = CalciteConnectionFactory.connect(loaderResult.getDataset(), checkResults, properties);
        logWarnings(loaderResult, parsed.workbookPath());
        return wrapCalciteConnection(connection, buildWarningChain(loaderResult, parsed.workbookPath()));
    }

    @Override
    public boolean acceptsURL(String url) {
        return url != null && url.startsWith(URL_PREFIX);
    }

    @Override
    public DriverPropertyInfo[] getPropertyInfo(String url, Properties info) {
        DriverPropertyInfo source = new DriverPropertyInfo(SOURCE_PROPERTY, null);
        source.required = true;
        source.description = "Source kind of the workbook, e.g. BUDGET_LAW or SPENDING_Q12.";
        source.choices = new String[SourceKind.values().length];
        for (int i = 0; i < SourceKind.values().length; i++) {
            source.choices[i] = SourceKind.values()[i].name();
        }
        DriverPropertyInfo year = new DriverPropertyInfo(YEAR_PROPERTY, null);
        year.required = true;
        year.description = "Fiscal year of the workbook; selects the column layout.";
        return new DriverPropertyInfo[] {source, year};
    }

    @Override
    public int getMajorVersion() {
        return Version.major();
    }

    @Override
    public int getMinorVersion() {
        return Version.minor();
    }

    @Override
    public boolean jdbcCompliant() {
        return false;
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException("Logging hierarchy not implemented.");
    }

    static ParsedUrl parseUrl(String url) throws SQLException {
        String remainder = url.substring(URL_PREFIX.length());
        if (remainder.isEmpty()) {
            throw new SQLException("Workbook path missing from JDBC URL.");
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
                if (eq >= 0) {
                    props.setProperty(pair.substring(0, eq), pair.substring(eq + 1));
                } else {
                    props.setProperty(pair, "");
                }
            }
        }

        Path workbookPath;
        if (pathSegment.startsWith("file:")) {
            try {
                workbookPath = Paths.get(java.net.URI.create(pathSegment));
            } catch (IllegalArgumentException ex) {
                throw new SQLException("Invalid file URI in JDBC URL: " + pathSegment, ex);
            }
        } else {
            workbookPath = Paths.get(pathSegment);
        }
        workbookPath = workbookPath.normalize();

        if (!Files.exists(workbookPath)) {
            throw new SQLException("Workbook file not found: " + workbookPath);
        }
        if (!Files.isReadable(workbookPath)) {
            throw new SQLException("Workbook file is not readable: " + workbookPath);
        }
        return new ParsedUrl(workbookPath.toAbsolutePath(), props);
    }

    private static SourceKind sourceKind(Properties properties) throws SQLException {
        try {
            return SourceKind.parse(properties.getProperty(SOURCE_PROPERTY));
        } catch (IllegalArgumentException ex) {
            throw new SQLException(ex.getMessage(), ex);
        }
    }

    private static int year(Properties properties) throws SQLException {
        String value = properties.getProperty(YEAR_PROPERTY);
        if (value == null || value.isBlank()) {
            throw new SQLException("Fiscal year missing; pass year=<N> in the URL or properties.");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new SQLException("Invalid fiscal year: " + value, ex);
        }
    }

    private static SQLWarning buildWarningChain(LoaderResult loaderResult, Path workbookPath) {
        SQLWarning head = null;
        SQLWarning tail = null;
        for (LoaderMessage message : loaderResult.getMessages()) {
            if (message.getLevel() != LoaderMessage.Level.WARNING) {
                continue;
            }
            SQLWarning warning = new SQLWarning("[Budget JDBC] " + message.getMessage() + " ("
                    + workbookPath.getFileName() + ", row " + message.getRow() + ")");
            if (head == null) {
                head = warning;
            } else {
                tail.setNextWarning(warning);
            }
            tail = warning;
        }
        return head;
    }

    private static void logWarnings(LoaderResult loaderResult, Path workbookPath) {
        for (LoaderMessage message : loaderResult.getMessages()) {
            if (message.getLevel() != LoaderMessage.Level.WARNING) {
                continue;
            }
            LOGGER.log(
                    Level.WARNING,
                    "[Budget JDBC] {0} ({1})",
                    new Object[] {message.getMessage(), workbookPath.getFileName()});
        }
    }

    private static Connection wrapCalciteConnection(Connection delegate, SQLWarning warnings) {
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class<?>[] {Connection.class},
                new DelegatingHandler(delegate) {
                    private SQLWarning localWarnings = warnings;

                    @Override
                    Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                        return switch (method.getName()) {
                            case "getWarnings" -> localWarnings;
                            case "clearWarnings" -> {
                                localWarnings = null;
                                yield null;
                            }
                            case "getMetaData" -> wrapMetaData((DatabaseMetaData) invokeDelegate(method, args));
                            default -> super.handle(proxy, method, args);
                        };
                    }
                });
    }

    private static DatabaseMetaData wrapMetaData(DatabaseMetaData delegate) {
        return (DatabaseMetaData) Proxy.newProxyInstance(
                DatabaseMetaData.class.getClassLoader(),
                new Class<?>[] {DatabaseMetaData.class},
                new DelegatingHandler(delegate) {
                    @Override
                    Object handle(Object proxy, Method method, Object[] args) throws Throwable {
                        return switch (method.getName()) {
                            case "getDatabaseProductName" -> "Budget Workbook";
                            case "getDatabaseProductVersion", "getDriverVersion" -> Version.FULL;
                            case "getDriverName" -> "Budget JDBC Driver (Calcite)";
                            default -> super.handle(proxy, method, args);
                        };
                    }
                });
    }

    record ParsedUrl(Path workbookPath, Properties properties) {}

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

        final Object invokeDelegate(Method method, Object[] args) throws Throwable {
            try {
                return method.invoke(delegate, args);
            } catch (InvocationTargetException ex) {
                throw ex.getCause();
            }
        }
    }
}
