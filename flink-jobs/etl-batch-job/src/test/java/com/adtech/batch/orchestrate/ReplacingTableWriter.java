package com.adtech.batch.orchestrate;

import com.adtech.batch.load.RowWriter;
import com.adtech.common.error.SyncException;
import com.adtech.common.error.WriteException;
import com.adtech.common.model.AnalyticalTable;
import com.adtech.common.transform.AnalyticalRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 테스트용 분석 테이블: append 된 모든 버전을 보관하고
 * ReplacingMergeTree(sync_version, is_deleted) FINAL 결과를 계산합니다.
 */
class ReplacingTableWriter implements RowWriter {

    private final List<AnalyticalRow> appended = new ArrayList<>();
    private int failuresRemaining;

    void failNextWrites(int times) {
        this.failuresRemaining = times;
    }

    List<AnalyticalRow> getAppended() {
        return appended;
    }

    @Override
    public void write(AnalyticalTable table, List<AnalyticalRow> rows) throws SyncException {
        if (failuresRemaining > 0) {
            failuresRemaining--;
            throw new WriteException("Code: 252. Too many parts");
        }
        appended.addAll(rows);
    }

    /**
     * id 별 최대 sync_version (같으면 나중에 쓴 행) 중 tombstone 이 아닌 행
     */
    Map<Long, AnalyticalRow> current(AnalyticalTable table) {
        Map<Long, AnalyticalRow> latest = new TreeMap<>();
        for (AnalyticalRow row : appended) {
            if (row.getTable() != table) {
                continue;
            }
            AnalyticalRow existing = latest.get(row.getEntityId());
            if (existing == null || row.getSyncVersion() >= existing.getSyncVersion()) {
                latest.put(row.getEntityId(), row);
            }
        }
        latest.values().removeIf(AnalyticalRow::isDeleted);
        return latest;
    }
}
