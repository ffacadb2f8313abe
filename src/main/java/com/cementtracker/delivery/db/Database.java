package com.cementtracker.delivery.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Connection manager for the report store: a local SQLite file or a PostgreSQL schema.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");
    private static final int SQLITE_BUSY_TIMEOUT_MS = 5000;

    public enum Dialect {
        SQLITE,
        POSTGRES
    }

    private final DataSource dataSource;
    private final String jdbcUrl;
    private final Dialect dialect;
    private final String schema;
    private final boolean sqlLogEnabled;

    public Database(String jdbcUrl, String user, String pass, String schema, boolean sqlLogEnabled) {
        if (isBlank(jdbcUrl)) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        this.jdbcUrl = jdbcUrl.trim();
        this.sqlLogEnabled = sqlLogEnabled;
        String lower = this.jdbcUrl.toLowerCase(Locale.ROOT);
        if (lower.startsWith("jdbc:sqlite:")) {
            this.dialect = Dialect.SQLITE;
            this.schema = "";
            this.dataSource = sqliteDataSource(this.jdbcUrl);
        } else if (lower.startsWith("jdbc:postgresql:")) {
            this.dialect = Dialect.POSTGRES;
            this.schema = normalizeSchema(schema);
            this.dataSource = postgresDataSource(this.jdbcUrl, user, pass, this.schema);
        } else {
            throw new IllegalArgumentException("db.url must be jdbc:sqlite:<file> or jdbc:postgresql://...");
        }
    }

    public static Database sqlite(Path file) {
        return new Database("jdbc:sqlite:" + file.toAbsolutePath(), "", "", "", false);
    }

    /**
     * Opens a connection. Any failure here means the store is unreachable and is reported as
     * {@link SQLNonTransientConnectionException}.
     */
    public Connection connect() throws SQLException {
        try {
            prepareSqliteDirectory();
            Connection raw = dataSource.getConnection();
            if (dialect == Dialect.POSTGRES) {
                try (Statement st = raw.createStatement()) {
                    st.execute("SET search_path TO " + schema + ", public");
                }
            }
            return sqlLogEnabled ? SqlLogProxy.wrapConnection(raw, SQL_LOG) : raw;
        } catch (SQLException e) {
            String cwd = Paths.get(".").toAbsolutePath().normalize().toString();
            String details = "DB connect failed: jdbc_url=" + maskedJdbcUrl()
                    + ", dialect=" + dialect
                    + ", cwd=" + cwd
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            LOG.error(details);
            throw new SQLNonTransientConnectionException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    public Dialect dialect() {
        return dialect;
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        String out = jdbcUrl;
        out = out.replaceAll("(?i)(password=)[^&]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out;
    }

    private void prepareSqliteDirectory() throws SQLException {
        if (dialect != Dialect.SQLITE) {
            return;
        }
        Path file = sqliteFile();
        if (file == null || file.getParent() == null) {
            return;
        }
        try {
            Files.createDirectories(file.getParent());
        } catch (IOException e) {
            throw new SQLException("cannot create database directory " + file.getParent() + ": " + e.getMessage(), e);
        }
    }

    Path sqliteFile() {
        String path = jdbcUrl.substring("jdbc:sqlite:".length());
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.isEmpty() || path.startsWith(":memory:") || path.startsWith("file:")) {
            return null;
        }
        return Paths.get(path);
    }

    private static DataSource sqliteDataSource(String url) {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(SQLITE_BUSY_TIMEOUT_MS);
        SQLiteDataSource ds = new SQLiteDataSource(config);
        ds.setUrl(url);
        return ds;
    }

    private static DataSource postgresDataSource(String url, String user, String pass, String schema) {
        PGSimpleDataSource pg = new PGSimpleDataSource();
        pg.setUrl(url);
        if (!isBlank(user)) {
            pg.setUser(user.trim());
        }
        if (pass != null) {
            pg.setPassword(pass);
        }
        pg.setCurrentSchema(schema);
        pg.setApplicationName("cement-tracker");
        return pg;
    }

    private static String normalizeSchema(String raw) {
        String value = isBlank(raw) ? "cement" : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.schema, allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private String classifyConnectFailure(SQLException e) {
        String msg = safe(e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("permission denied") || msg.contains("access is denied")) {
            return "permission";
        }
        if (msg.contains("locked")) {
            return "locked";
        }
        if (msg.contains("no such file") || msg.contains("cannot open") || msg.contains("cannot create")) {
            return "missing_dir";
        }
        if (msg.contains("password authentication")) {
            return "credentials";
        }
        return "connection_error";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
