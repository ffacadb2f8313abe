package com.cementtracker.delivery.db;

import com.cementtracker.delivery.db.mybatis.DeliveryReportMapper;
import com.cementtracker.delivery.db.mybatis.DeliveryReportRow;
import com.cementtracker.delivery.db.mybatis.MyBatisSupport;
import com.cementtracker.delivery.model.ReportRecord;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * {@link ReportStore} over the {@code delivery_reports} table. The column layout matches the
 * files written by the earlier tracker, so existing databases open unchanged.
 */
public final class DeliveryReportDao implements ReportStore {
    private static final Logger LOG = LogManager.getLogger(DeliveryReportDao.class);
    static final DateTimeFormatter RECEIVED_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String TABLE = "delivery_reports";
    private static final String DERIVED_COLUMN = "bag_weight";

    private final Database database;
    private final MigrationRunner migrationRunner;

    public DeliveryReportDao(Database database) {
        this(database, new MigrationRunner());
    }

    public DeliveryReportDao(Database database, MigrationRunner migrationRunner) {
        this.database = database;
        this.migrationRunner = migrationRunner;
    }

    public Database database() {
        return database;
    }

    @Override
    public void ensureSchema() throws SQLException {
        migrationRunner.run(database);
    }

    @Override
    public boolean hasDerivedColumn() throws SQLException {
        try (Connection conn = database.connect()) {
            return hasColumn(conn, DERIVED_COLUMN);
        }
    }

    @Override
    public int addDerivedColumnAndBackfill(DoubleUnaryOperator bagWeightFormula) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            try {
                DeliveryReportMapper mapper = session.getMapper(DeliveryReportMapper.class);
                if (!hasColumn(conn, DERIVED_COLUMN)) {
                    mapper.addBagWeightColumn();
                }
                int updated = 0;
                for (DeliveryReportRow row : mapper.selectPerBagValues()) {
                    double perBag = row.getPerBagShortExcess();
                    updated += mapper.updateBagWeight(row.getDate(), bagWeightFormula.applyAsDouble(perBag));
                }
                conn.commit();
                return updated;
            } catch (PersistenceException e) {
                SQLException cause = MyBatisSupport.unwrap(e);
                rollbackQuietly(conn, cause);
                throw cause;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            }
        }
    }

    @Override
    public List<ReportRecord> getAll() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return toRecords(session.getMapper(DeliveryReportMapper.class).selectAll());
        } catch (PersistenceException e) {
            throw MyBatisSupport.unwrap(e);
        }
    }

    @Override
    public List<ReportRecord> findRange(LocalDate from, LocalDate to) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return toRecords(session.getMapper(DeliveryReportMapper.class)
                    .selectRange(from.toString(), to.toString()));
        } catch (PersistenceException e) {
            throw MyBatisSupport.unwrap(e);
        }
    }

    @Override
    public Optional<ReportRecord> findByDate(LocalDate date) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            DeliveryReportRow row = session.getMapper(DeliveryReportMapper.class).selectByDate(date.toString());
            return row == null ? Optional.empty() : Optional.of(toRecord(row));
        } catch (PersistenceException e) {
            throw MyBatisSupport.unwrap(e);
        }
    }

    @Override
    public void upsertByKey(LocalDate date, ReportRecord record) throws SQLException {
        DeliveryReportRow row = DeliveryReportRow.builder()
                .date(date.toString())
                .shortKg(record.shortKg)
                .excessKg(record.excessKg)
                .perBagShortExcess(finiteOrNull(record.perBagShortExcess))
                .bagWeight(finiteOrNull(record.bagWeightKg))
                .emailSubject(record.sourceSubject)
                .emailReceived(record.sourceReceivedAt == null ? null : RECEIVED_FORMAT.format(record.sourceReceivedAt))
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(DeliveryReportMapper.class).upsertReport(row);
        } catch (PersistenceException e) {
            throw MyBatisSupport.unwrap(e);
        }
    }

    @Override
    public boolean deleteByKey(LocalDate date) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(DeliveryReportMapper.class).deleteByDate(date.toString()) > 0;
        } catch (PersistenceException e) {
            throw MyBatisSupport.unwrap(e);
        }
    }

    private boolean hasColumn(Connection conn, String column) throws SQLException {
        DatabaseMetaData meta = conn.getMetaData();
        String schema = database.dialect() == Database.Dialect.POSTGRES ? database.schema() : null;
        try (ResultSet rs = meta.getColumns(null, schema, TABLE, column)) {
            return rs.next();
        }
    }

    private List<ReportRecord> toRecords(List<DeliveryReportRow> rows) {
        List<ReportRecord> out = new ArrayList<>(rows.size());
        for (DeliveryReportRow row : rows) {
            if (row != null) {
                out.add(toRecord(row));
            }
        }
        return out;
    }

    private ReportRecord toRecord(DeliveryReportRow row) {
        return ReportRecord.builder()
                .date(LocalDate.parse(row.getDate().trim()))
                .shortKg(row.getShortKg() == null ? 0 : row.getShortKg())
                .excessKg(row.getExcessKg() == null ? 0 : row.getExcessKg())
                .perBagShortExcess(row.getPerBagShortExcess() == null ? Double.NaN : row.getPerBagShortExcess())
                .bagWeightKg(row.getBagWeight() == null ? Double.NaN : row.getBagWeight())
                .sourceSubject(row.getEmailSubject() == null ? "" : row.getEmailSubject())
                .sourceReceivedAt(parseReceived(row.getEmailReceived()))
                .build();
    }

    static LocalDateTime parseReceived(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String text = raw.trim();
        try {
            return LocalDateTime.parse(text, RECEIVED_FORMAT);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text);
            } catch (DateTimeParseException ignored) {
                LOG.debug("Unreadable email_received value '{}'", text);
                return null;
            }
        }
    }

    private Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }

    private void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }
}
