package com.adtech.batch.load;

import com.adtech.common.error.SyncException;
import com.adtech.common.jdbc.JdbcConnectionFactory;
import com.adtech.common.jdbc.SqlErrors;
import com.adtech.common.model.AnalyticalTable;
import com.adtech.common.transform.AnalyticalRow;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;

/**
 * ClickHouse JDBC batch insert
 * ClickHouse 는 한 INSERT 블록을 하나로 받아들이므로 페이지 전체를 executeBatch 한 번으로 보냅니다.
 */
public class ClickHouseRowWriter implements RowWriter {

    private final JdbcConnectionFactory connectionFactory;
    private final int queryTimeoutSeconds;

    public ClickHouseRowWriter(JdbcConnectionFactory connectionFactory, int queryTimeoutSeconds) {
        this.connectionFactory = connectionFactory;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public void write(AnalyticalTable table, List<AnalyticalRow> rows) throws SyncException {
        try (Connection connection = connectionFactory.open();
             PreparedStatement ps = connection.prepareStatement(table.insertSql())) {
            ps.setQueryTimeout(queryTimeoutSeconds);
            for (AnalyticalRow row : rows) {
                row.bind(ps);
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            throw SqlErrors.onWrite("Insert into " + table.getTableName() + " failed (" + rows.size() + " rows)", e);
        }
    }
}
