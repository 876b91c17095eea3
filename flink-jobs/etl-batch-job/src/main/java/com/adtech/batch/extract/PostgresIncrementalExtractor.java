package com.adtech.batch.extract;

import com.adtech.common.error.SyncException;
import com.adtech.common.jdbc.JdbcConnectionFactory;
import com.adtech.common.jdbc.SqlErrors;
import com.adtech.common.model.SourceColumn;
import com.adtech.common.model.SourceRow;
import com.adtech.common.model.SourceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PostgreSQL 증분 추출기
 * <p>
 * 원본 timestamp 컬럼은 UTC 기준 {@code timestamp without time zone} 으로 간주합니다.
 * 한 페이지 조회마다 커넥션을 열고, {@code batch.extract.timeout.seconds} 를 query timeout 으로 적용합니다.
 */
public class PostgresIncrementalExtractor implements IncrementalExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(PostgresIncrementalExtractor.class);

    private final JdbcConnectionFactory connectionFactory;
    private final int queryTimeoutSeconds;

    public PostgresIncrementalExtractor(JdbcConnectionFactory connectionFactory, int queryTimeoutSeconds) {
        this.connectionFactory = connectionFactory;
        this.queryTimeoutSeconds = queryTimeoutSeconds;
    }

    @Override
    public ExtractionPage fetchPage(SourceTable table, Instant watermark, PageKey after, int pageSize)
            throws SyncException {
        String sql = ExtractionQuery.build(table, watermark != null, after != null);

        try (Connection connection = connectionFactory.open();
             PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setFetchSize(pageSize + 1);

            int index = 1;
            if (watermark != null) {
                ps.setObject(index++, toTimestampParameter(watermark));
            }
            if (after != null) {
                ps.setObject(index++, toTimestampParameter(after.getCursor()));
                ps.setLong(index++, after.getId());
            }
            // 한 행 더 읽어서 다음 페이지 존재 여부 판단
            ps.setInt(index, pageSize + 1);

            List<SourceRow> rows = new ArrayList<>();
            List<Instant> cursors = new ArrayList<>();
            boolean hasMore = false;
            PageKey lastKey = null;

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    if (rows.size() == pageSize) {
                        hasMore = true;
                        break;
                    }
                    Map<String, Object> values = readRow(table, rs);
                    Instant cursor = toInstant((Timestamp) values.get(table.getCursorColumn()));
                    long id = rs.getLong(SourceTable.ID_COLUMN);

                    rows.add(new SourceRow(values));
                    cursors.add(cursor);
                    lastKey = new PageKey(cursor, id);
                }
            }

            LOG.debug("추출: table={}, watermark={}, after={}, rows={}, hasMore={}",
                    table.getTableName(), watermark, after, rows.size(), hasMore);
            return new ExtractionPage(table, rows, cursors, lastKey, !hasMore);

        } catch (SQLException e) {
            throw SqlErrors.onRead("Extraction from " + table.getTableName() + " failed", e);
        }
    }

    private static Map<String, Object> readRow(SourceTable table, ResultSet rs) throws SQLException {
        Map<String, Object> values = new LinkedHashMap<>();
        for (SourceColumn column : table.getColumns()) {
            String name = column.getName();
            Object value;
            switch (column.getType()) {
                case BIGINT:
                    long number = rs.getLong(name);
                    value = rs.wasNull() ? null : number;
                    break;
                case DECIMAL:
                    value = rs.getBigDecimal(name);
                    break;
                case DATE:
                    value = rs.getDate(name);
                    break;
                case TIMESTAMP:
                    value = rs.getTimestamp(name);
                    break;
                default:
                    value = rs.getString(name);
                    break;
            }
            values.put(name, value);
        }
        return values;
    }

    static LocalDateTime toTimestampParameter(Instant cursor) {
        return LocalDateTime.ofInstant(cursor, ZoneOffset.UTC);
    }

    static Instant toInstant(Timestamp timestamp) {
        return timestamp.toLocalDateTime().toInstant(ZoneOffset.UTC);
    }
}
