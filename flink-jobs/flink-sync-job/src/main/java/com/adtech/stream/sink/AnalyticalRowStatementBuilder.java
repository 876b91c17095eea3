package com.adtech.stream.sink;

import com.adtech.common.model.AnalyticalTable;
import com.adtech.common.transform.AnalyticalRow;
import org.apache.flink.connector.jdbc.JdbcStatementBuilder;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * PreparedStatement에 AnalyticalRow 데이터를 바인딩
 * 바인딩 순서는 {@link AnalyticalTable#insertSql()} 의 컬럼 순서와 같습니다.
 */
public class AnalyticalRowStatementBuilder implements JdbcStatementBuilder<AnalyticalRow> {
    private static final long serialVersionUID = 1L;

    private final AnalyticalTable table;

    public AnalyticalRowStatementBuilder(AnalyticalTable table) {
        this.table = table;
    }

    @Override
    public void accept(PreparedStatement ps, AnalyticalRow row) throws SQLException {
        if (row.getTable() != table) {
            throw new IllegalStateException("Row for " + row.getTable().getTableName()
                    + " routed to the " + table.getTableName() + " sink");
        }
        row.bind(ps);
    }
}
