package com.adtech.batch.orchestrate;

import com.adtech.common.model.SourceTable;

import java.time.Instant;

/**
 * 테이블 한 번의 동기화 결과
 */
public final class TableSyncResult {

    public enum Outcome {
        SUCCEEDED, FAILED, SKIPPED, STOPPED
    }

    private final SourceTable table;
    private final Outcome outcome;
    private final SyncRunState failedStage;
    private final int rowsLoaded;
    private final int pages;
    private final Instant watermarkBefore;
    private final Instant watermarkAfter;
    private final Exception error;

    private TableSyncResult(SourceTable table, Outcome outcome, SyncRunState failedStage, int rowsLoaded, int pages,
                            Instant watermarkBefore, Instant watermarkAfter, Exception error) {
        this.table = table;
        this.outcome = outcome;
        this.failedStage = failedStage;
        this.rowsLoaded = rowsLoaded;
        this.pages = pages;
        this.watermarkBefore = watermarkBefore;
        this.watermarkAfter = watermarkAfter;
        this.error = error;
    }

    static TableSyncResult succeeded(SourceTable table, int rows, int pages, Instant before, Instant after) {
        return new TableSyncResult(table, Outcome.SUCCEEDED, null, rows, pages, before, after, null);
    }

    static TableSyncResult stopped(SourceTable table, int rows, int pages, Instant before, Instant after) {
        return new TableSyncResult(table, Outcome.STOPPED, null, rows, pages, before, after, null);
    }

    static TableSyncResult failed(SourceTable table, SyncRunState stage, int rows, int pages,
                                  Instant before, Instant after, Exception error) {
        return new TableSyncResult(table, Outcome.FAILED, stage, rows, pages, before, after, error);
    }

    static TableSyncResult skipped(SourceTable table) {
        return new TableSyncResult(table, Outcome.SKIPPED, null, 0, 0, null, null, null);
    }

    public SourceTable getTable() {
        return table;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isFailed() {
        return outcome == Outcome.FAILED;
    }

    /**
     * 실패한 단계 (실패가 아니면 null)
     */
    public SyncRunState getFailedStage() {
        return failedStage;
    }

    public int getRowsLoaded() {
        return rowsLoaded;
    }

    public int getPages() {
        return pages;
    }

    public Instant getWatermarkBefore() {
        return watermarkBefore;
    }

    public Instant getWatermarkAfter() {
        return watermarkAfter;
    }

    public Exception getError() {
        return error;
    }

    @Override
    public String toString() {
        return table.getTableName() + "{" + outcome +
                (failedStage != null ? "@" + failedStage : "") +
                ", rows=" + rowsLoaded +
                ", pages=" + pages +
                ", watermark=" + watermarkBefore + " -> " + watermarkAfter +
                (error != null ? ", error=" + error.getMessage() : "") +
                '}';
    }
}
