package com.adtech.batch.watermark;

import com.adtech.common.error.SyncException;
import com.adtech.common.jdbc.JdbcConnectionFactory;
import com.adtech.common.jdbc.SqlErrors;
import com.adtech.common.model.SourceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * ClickHouse etl_watermark 테이블 기반 watermark 저장소
 * <p>
 * 행을 덮어쓰지 않고 append 만 하며, 유효 watermark 는 테이블별 최대 cursor_value 입니다.
 * 따라서 늦게 도착한 작은 값이 기록되더라도 watermark 가 뒤로 가지 않습니다.
 * cursor 는 PostgreSQL timestamp 정밀도(microsecond)로 저장합니다.
 */
public class ClickHouseWatermarkStore implements WatermarkStore {

    private static final Logger LOG = LoggerFactory.getLogger(ClickHouseWatermarkStore.class);

    static final String SELECT_SQL =
            "SELECT toUnixTimestamp64Micro(cursor_value) FROM etl_watermark WHERE table_name = ? "
                    + "ORDER BY cursor_value DESC LIMIT 1";
    static final String INSERT_SQL = "INSERT INTO etl_watermark (table_name, cursor_value) VALUES (?, ?)";

    private static final DateTimeFormatter CURSOR_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

    private final JdbcConnectionFactory connectionFactory;

    public ClickHouseWatermarkStore(JdbcConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
    }

    @Override
    public Instant get(SourceTable table) throws SyncException {
        try (Connection connection = connectionFactory.open();
             PreparedStatement ps = connection.prepareStatement(SELECT_SQL)) {
            ps.setString(1, table.getTableName());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return null;
                }
                long micros = rs.getLong(1);
                return Instant.EPOCH.plus(micros, ChronoUnit.MICROS);
            }
        } catch (SQLException e) {
            throw SqlErrors.onRead("Failed to read watermark for " + table.getTableName(), e);
        }
    }

    @Override
    public void set(SourceTable table, Instant cursor) throws SyncException {
        Instant current = get(table);
        if (current != null && !cursor.isAfter(current)) {
            if (cursor.isBefore(current)) {
                LOG.warn("⚠️  Watermark 역행 요청 무시: table={}, current={}, requested={}",
                        table.getTableName(), current, cursor);
            }
            return;
        }

        try (Connection connection = connectionFactory.open();
             PreparedStatement ps = connection.prepareStatement(INSERT_SQL)) {
            ps.setString(1, table.getTableName());
            // DateTime64(6, 'UTC') 컬럼은 문자열을 컬럼 타임존으로 해석
            ps.setString(2, CURSOR_FORMAT.format(cursor));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw SqlErrors.onWrite("Failed to write watermark for " + table.getTableName(), e);
        }
        LOG.debug("Watermark 기록: table={}, cursor={}", table.getTableName(), cursor);
    }

    static String format(Instant cursor) {
        return CURSOR_FORMAT.format(cursor);
    }
}
