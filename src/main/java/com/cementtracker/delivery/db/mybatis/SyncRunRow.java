package com.cementtracker.delivery.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One journal row as read back for the history command.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncRunRow {
    private Long id;
    private String triggerName;
    private String startedAt;
    private String finishedAt;
    private String windowFrom;
    private String windowTo;
    private String status;
    private Integer processed;
    private Integer synced;
    private Integer excluded;
    private Integer parseFailed;
    private Integer cancelled;
    private String failuresJson;
}
