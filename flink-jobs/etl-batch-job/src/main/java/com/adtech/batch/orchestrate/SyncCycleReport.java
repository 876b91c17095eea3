package com.adtech.batch.orchestrate;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 한 동기화 주기의 결과 요약
 */
public final class SyncCycleReport {

    private final long cycle;
    private final Instant startedAt;
    private final Duration elapsed;
    private final List<TableSyncResult> results;

    public SyncCycleReport(long cycle, Instant startedAt, Duration elapsed, List<TableSyncResult> results) {
        this.cycle = cycle;
        this.startedAt = startedAt;
        this.elapsed = elapsed;
        this.results = Collections.unmodifiableList(results);
    }

    public long getCycle() {
        return cycle;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public List<TableSyncResult> getResults() {
        return results;
    }

    public boolean isSuccessful() {
        return results.stream().noneMatch(r -> r.getOutcome() == TableSyncResult.Outcome.FAILED
                || r.getOutcome() == TableSyncResult.Outcome.SKIPPED);
    }

    public int getTotalRows() {
        return results.stream().mapToInt(TableSyncResult::getRowsLoaded).sum();
    }

    @Override
    public String toString() {
        return "SyncCycleReport{cycle=" + cycle +
                ", elapsed=" + elapsed.toMillis() + "ms" +
                ", totalRows=" + getTotalRows() +
                ", results=" + results +
                '}';
    }
}
