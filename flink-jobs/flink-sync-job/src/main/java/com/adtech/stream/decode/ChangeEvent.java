package com.adtech.stream.decode;

import com.adtech.common.model.SourceRow;
import com.adtech.common.model.SourceTable;

import java.io.Serializable;
import java.util.Objects;

/**
 * 디코딩된 CDC 이벤트
 * <ul>
 *   <li>CREATE / UPDATE: 변경 후 image (after)</li>
 *   <li>DELETE: 변경 전 image (before)</li>
 * </ul>
 * 어느 image 인지는 operation 으로 결정되므로 이벤트마다 하나의 row image 만 가집니다.
 */
public final class ChangeEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    private final SourceTable table;
    private final ChangeOperation operation;
    private final SourceRow row;
    private final long sourceTsMs;

    private ChangeEvent(SourceTable table, ChangeOperation operation, SourceRow row, long sourceTsMs) {
        this.table = Objects.requireNonNull(table, "table");
        this.operation = Objects.requireNonNull(operation, "operation");
        this.row = Objects.requireNonNull(row, "row");
        this.sourceTsMs = sourceTsMs;
    }

    public static ChangeEvent create(SourceTable table, SourceRow after, long sourceTsMs) {
        return new ChangeEvent(table, ChangeOperation.CREATE, after, sourceTsMs);
    }

    public static ChangeEvent update(SourceTable table, SourceRow after, long sourceTsMs) {
        return new ChangeEvent(table, ChangeOperation.UPDATE, after, sourceTsMs);
    }

    public static ChangeEvent delete(SourceTable table, SourceRow before, long sourceTsMs) {
        return new ChangeEvent(table, ChangeOperation.DELETE, before, sourceTsMs);
    }

    public SourceTable getTable() {
        return table;
    }

    public ChangeOperation getOperation() {
        return operation;
    }

    /**
     * CREATE / UPDATE 는 after image, DELETE 는 before image
     */
    public SourceRow getRow() {
        return row;
    }

    /**
     * 원본 트랜잭션 커밋 시각 (source.ts_ms)
     */
    public long getSourceTsMs() {
        return sourceTsMs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChangeEvent)) {
            return false;
        }
        ChangeEvent that = (ChangeEvent) o;
        return sourceTsMs == that.sourceTsMs
                && table == that.table
                && operation == that.operation
                && row.equals(that.row);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, operation, row, sourceTsMs);
    }

    @Override
    public String toString() {
        return "ChangeEvent{" +
                "table=" + table.getTableName() +
                ", operation=" + operation +
                ", id=" + row.get(SourceTable.ID_COLUMN) +
                ", sourceTsMs=" + sourceTsMs +
                '}';
    }
}
