package com.adtech.batch.load;

import java.time.Instant;

/**
 * 적재 결과: 확정된 행 수와 이 적재로 확정된 cursor
 */
public final class LoadResult {

    private static final LoadResult EMPTY = new LoadResult(0, null);

    private final int rowCount;
    private final Instant committedCursor;

    public LoadResult(int rowCount, Instant committedCursor) {
        this.rowCount = rowCount;
        this.committedCursor = committedCursor;
    }

    public static LoadResult empty() {
        return EMPTY;
    }

    public int getRowCount() {
        return rowCount;
    }

    /**
     * watermark 후보 (원본 cursor 정밀도, 확정할 cursor 가 없으면 null)
     */
    public Instant getCommittedCursor() {
        return committedCursor;
    }

    @Override
    public String toString() {
        return "LoadResult{rowCount=" + rowCount + ", committedCursor=" + committedCursor + '}';
    }
}
