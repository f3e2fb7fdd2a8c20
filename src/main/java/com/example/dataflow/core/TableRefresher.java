package com.example.dataflow.core;

import com.example.dataflow.core.model.RefreshOutcome;

/**
 * Runs one refresh cycle for a table. Shared by the scheduler and the manual trigger.
 */
public interface TableRefresher {

    /**
     * Runs one full fetch, transform, validate, commit and report cycle.
     *
     * @param tableName The registered table to refresh.
     * @return The outcome, already recorded in the audit log and the table's status.
     * @throws com.example.dataflow.core.exception.InvalidInputException  if the table name is blank.
     * @throws com.example.dataflow.core.exception.TableNotFoundException if the table is not registered.
     */
    RefreshOutcome refresh(String tableName);
}
