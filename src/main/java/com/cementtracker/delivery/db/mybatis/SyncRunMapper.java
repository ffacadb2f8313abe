package com.cementtracker.delivery.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

/**
 * SQL for the {@code sync_runs} journal.
 */
public interface SyncRunMapper {
    @Insert("INSERT INTO sync_runs(trigger_name, started_at, finished_at, window_from, window_to, status, processed, " +
            "excluded, parse_failed, superseded, synced, store_failed, cancelled, failures_json, telemetry) " +
            "VALUES(#{triggerName}, #{startedAt}, #{finishedAt}, #{windowFrom}, #{windowTo}, #{status}, #{processed}, " +
            "#{excluded}, #{parseFailed}, #{superseded}, #{synced}, #{storeFailed}, #{cancelled}, #{failuresJson}, #{telemetry})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertRun(SyncRunInsertParam run);

    @Select("SELECT id, trigger_name, started_at, finished_at, window_from, window_to, status, processed, synced, " +
            "excluded, parse_failed, cancelled, failures_json FROM sync_runs ORDER BY id DESC LIMIT #{limit}")
    List<SyncRunRow> listRecentRuns(@Param("limit") int limit);
}
