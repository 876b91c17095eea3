package com.adtech.batch.extract;

import com.adtech.common.model.SourceRow;
import com.adtech.common.model.SourceTable;

import java.time.Instant;
import java.util.Collections;
import java.util.List;

/**
 * 추출된 한 페이지 (cursor, id 오름차순)
 * <p>
 * 확정 가능한 cursor ({@link #committableCursor()}):
 * <ul>
 *   <li>마지막 페이지: 페이지의 최대 cursor</li>
 *   <li>중간 페이지: 마지막 행의 cursor 보다 엄격히 작은 최대 cursor.
 *       마지막 cursor 와 같은 값을 가진 행이 다음 페이지에 이어질 수 있기 때문입니다.
 *       모든 행이 같은 cursor 이면 null</li>
 * </ul>
 */
public final class ExtractionPage {

    private final SourceTable table;
    private final List<SourceRow> rows;
    private final List<Instant> cursors;
    private final PageKey lastKey;
    private final boolean last;

    public ExtractionPage(SourceTable table, List<SourceRow> rows, List<Instant> cursors, PageKey lastKey,
                          boolean last) {
        if (rows.size() != cursors.size()) {
            throw new IllegalArgumentException("rows and cursors differ in size");
        }
        this.table = table;
        this.rows = Collections.unmodifiableList(rows);
        this.cursors = Collections.unmodifiableList(cursors);
        this.lastKey = lastKey;
        this.last = last;
    }

    public static ExtractionPage empty(SourceTable table) {
        return new ExtractionPage(table, Collections.emptyList(), Collections.emptyList(), null, true);
    }

    public SourceTable getTable() {
        return table;
    }

    public List<SourceRow> getRows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public int size() {
        return rows.size();
    }

    /**
     * 더 가져올 행이 없으면 true
     */
    public boolean isLast() {
        return last;
    }

    /**
     * 다음 페이지 조회 시작 위치 (빈 페이지면 null)
     */
    public PageKey getLastKey() {
        return lastKey;
    }

    /**
     * 페이지의 최대 cursor (빈 페이지면 null)
     */
    public Instant maxCursor() {
        return cursors.isEmpty() ? null : cursors.get(cursors.size() - 1);
    }

    public Instant committableCursor() {
        Instant max = maxCursor();
        if (max == null || last) {
            return max;
        }
        for (int i = cursors.size() - 1; i >= 0; i--) {
            if (cursors.get(i).isBefore(max)) {
                return cursors.get(i);
            }
        }
        return null;
    }
}
