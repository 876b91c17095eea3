package com.adtech.batch.extract;

import com.adtech.common.model.SourceColumn;
import com.adtech.common.model.SourceTable;

import java.util.stream.Collectors;

/**
 * Keyset paging 추출 쿼리 생성
 * <pre>
 * SELECT id, ... FROM campaign
 * WHERE updated_at &gt; ? AND (updated_at, id) &gt; (?, ?)
 * ORDER BY updated_at, id
 * LIMIT ?
 * </pre>
 */
final class ExtractionQuery {

    private ExtractionQuery() {
    }

    static String build(SourceTable table, boolean hasWatermark, boolean hasAfter) {
        String cursor = table.getCursorColumn();
        String columns = table.getColumns().stream()
                              .map(SourceColumn::getName)
                              .collect(Collectors.joining(", "));

        StringBuilder sql = new StringBuilder()
                .append("SELECT ").append(columns)
                .append(" FROM ").append(table.getTableName())
                .append(" WHERE ").append(cursor).append(" IS NOT NULL");
        if (hasWatermark) {
            sql.append(" AND ").append(cursor).append(" > ?");
        }
        if (hasAfter) {
            sql.append(" AND (").append(cursor).append(", ").append(SourceTable.ID_COLUMN).append(") > (?, ?)");
        }
        sql.append(" ORDER BY ").append(cursor).append(", ").append(SourceTable.ID_COLUMN)
           .append(" LIMIT ?");
        return sql.toString();
    }
}
