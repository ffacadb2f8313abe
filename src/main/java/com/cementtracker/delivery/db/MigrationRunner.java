package com.cementtracker.delivery.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent schema setup for SQLite and PostgreSQL.
 * <p>
 * Existing tables are left as they are; adding the bag weight column to an older
 * {@code delivery_reports} table is done by {@link DeliveryReportDao#addDerivedColumnAndBackfill}.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    public static final int TARGET_VERSION = 2;

    public void run(Database database) throws SQLException {
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            if (database.dialect() == Database.Dialect.POSTGRES) {
                st.execute("CREATE SCHEMA IF NOT EXISTS " + database.schema());
                st.execute("SET search_path TO " + database.schema() + ", public");
            }
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TEXT NOT NULL" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements(database.dialect())) {
                    lastSql = sql;
                    st.execute(sql);
                }
                if (currentVersion != TARGET_VERSION) {
                    writeSchemaVersion(conn, TARGET_VERSION);
                    LOG.info("Schema version {} -> {}", currentVersion, TARGET_VERSION);
                }
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
        }
    }

    private List<String> buildStatements(Database.Dialect dialect) {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS delivery_reports (" +
                "date TEXT PRIMARY KEY," +
                "short INTEGER," +
                "excess INTEGER," +
                "per_bag_short_excess DOUBLE PRECISION," +
                "bag_weight DOUBLE PRECISION," +
                "email_subject TEXT," +
                "email_received TEXT" +
                ")");

        String idColumn = dialect == Database.Dialect.POSTGRES
                ? "id BIGSERIAL PRIMARY KEY"
                : "id INTEGER PRIMARY KEY AUTOINCREMENT";
        sqls.add("CREATE TABLE IF NOT EXISTS sync_runs (" +
                idColumn + "," +
                "trigger_name TEXT NOT NULL," +
                "started_at TEXT NOT NULL," +
                "finished_at TEXT NULL," +
                "window_from TEXT NOT NULL," +
                "window_to TEXT NOT NULL," +
                "status TEXT NOT NULL," +
                "processed INTEGER NOT NULL DEFAULT 0," +
                "excluded INTEGER NOT NULL DEFAULT 0," +
                "parse_failed INTEGER NOT NULL DEFAULT 0," +
                "superseded INTEGER NOT NULL DEFAULT 0," +
                "synced INTEGER NOT NULL DEFAULT 0," +
                "store_failed INTEGER NOT NULL DEFAULT 0," +
                "cancelled INTEGER NOT NULL DEFAULT 0," +
                "failures_json TEXT NULL," +
                "telemetry TEXT NULL" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_sync_runs_started ON sync_runs(started_at)");
        return sqls;
    }

    int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && value.trim().matches("\\d+")) {
                    return Integer.parseInt(value.trim());
                }
            }
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, ?) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.setString(2, Instant.now().toString());
            ps.executeUpdate();
        }
    }

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
