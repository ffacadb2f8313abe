package com.cementtracker.delivery.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Insert parameters for one journal row; {@code id} is filled in by the driver.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncRunInsertParam {
    private Long id;
    private String triggerName;
    private String startedAt;
    private String finishedAt;
    private String windowFrom;
    private String windowTo;
    private String status;
    private int processed;
    private int excluded;
    private int parseFailed;
    private int superseded;
    private int synced;
    private int storeFailed;
    private int cancelled;
    private String failuresJson;
    private String telemetry;
}
