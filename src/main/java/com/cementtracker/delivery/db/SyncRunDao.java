package com.cementtracker.delivery.db;

import com.cementtracker.delivery.db.mybatis.MyBatisSupport;
import com.cementtracker.delivery.db.mybatis.SyncRunInsertParam;
import com.cementtracker.delivery.db.mybatis.SyncRunMapper;
import com.cementtracker.delivery.db.mybatis.SyncRunRow;
import com.cementtracker.delivery.model.SyncFailure;
import com.cementtracker.delivery.model.SyncSummary;
import com.cementtracker.delivery.sync.SyncJournal;
import org.apache.ibatis.exceptions.PersistenceException;
import org.apache.ibatis.session.SqlSession;
import org.json.JSONArray;
import org.json.JSONObject;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

/**
 * Journal of sync sessions in {@code sync_runs}.
 */
public final class SyncRunDao implements SyncJournal {
    private final Database database;

    public SyncRunDao(Database database) {
        this.database = database;
    }

    @Override
    public void record(SyncSummary summary, String trigger, Instant startedAt, Instant finishedAt) throws SQLException {
        SyncRunInsertParam row = SyncRunInsertParam.builder()
                .triggerName(trigger)
                .startedAt(startedAt == null ? Instant.now().toString() : startedAt.toString())
                .finishedAt(finishedAt == null ? null : finishedAt.toString())
                .windowFrom(summary.request.fromDate().toString())
                .windowTo(summary.request.toDate().toString())
                .status(summary.state == null ? "UNKNOWN" : summary.state.name())
                .processed(summary.processedCount)
                .excluded(summary.excludedCount)
                .parseFailed(summary.parseFailedCount)
                .superseded(summary.supersededCount)
                .synced(summary.syncedCount)
                .storeFailed(summary.storeFailedCount)
                .cancelled(summary.cancelled ? 1 : 0)
                .failuresJson(failuresJson(summary.failures))
                .telemetry(summary.telemetry)
                .build();
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            session.getMapper(SyncRunMapper.class).insertRun(row);
        } catch (PersistenceException e) {
            throw MyBatisSupport.unwrap(e);
        }
    }

    /**
     * Newest runs first.
     */
    public List<SyncRunRow> listRecent(int limit) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(SyncRunMapper.class).listRecentRuns(Math.max(1, limit));
        } catch (PersistenceException e) {
            throw MyBatisSupport.unwrap(e);
        }
    }

    static String failuresJson(List<SyncFailure> failures) {
        JSONArray array = new JSONArray();
        if (failures != null) {
            for (SyncFailure failure : failures) {
                array.put(new JSONObject()
                        .put("subject", failure.subject())
                        .put("reason", failure.reason().label()));
            }
        }
        return array.toString();
    }
}
