package com.adtech.batch.load;

import com.adtech.common.error.ConnectionException;
import com.adtech.common.error.WriteException;
import com.adtech.common.jdbc.JdbcConnectionFactory;
import com.adtech.common.model.AnalyticalTable;
import com.adtech.common.transform.AnalyticalRow;
import com.adtech.common.transform.FactEventRow;
import org.junit.Before;
import org.junit.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ClickHouseRowWriter 단위 테스트 (JDBC mock)
 */
public class ClickHouseRowWriterTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    private Connection connection;
    private PreparedStatement statement;
    private ClickHouseRowWriter writer;

    @Before
    public void setUp() throws Exception {
        JdbcConnectionFactory factory = mock(JdbcConnectionFactory.class);
        connection = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        when(factory.open()).thenReturn(connection);
        when(connection.prepareStatement(AnalyticalTable.FACT_CLICKS.insertSql())).thenReturn(statement);
        writer = new ClickHouseRowWriter(factory, 120);
    }

    @Test
    public void testWholePageIsOneBatch() throws Exception {
        // When
        writer.write(AnalyticalTable.FACT_CLICKS, rows());

        // Then
        verify(statement).setQueryTimeout(120);
        verify(statement, times(2)).addBatch();
        verify(statement, times(1)).executeBatch();
        verify(connection).close();
    }

    @Test(expected = WriteException.class)
    public void testRejectedInsert() throws Exception {
        when(statement.executeBatch()).thenThrow(new SQLException("Code: 27. Cannot parse input", "HY000"));

        writer.write(AnalyticalTable.FACT_CLICKS, rows());
    }

    @Test(expected = ConnectionException.class)
    public void testConnectionDropDuringInsert() throws Exception {
        when(statement.executeBatch()).thenThrow(new SQLException("Connection reset", "08S01"));

        writer.write(AnalyticalTable.FACT_CLICKS, rows());
    }

    private static List<AnalyticalRow> rows() {
        return Arrays.asList(
                new FactEventRow(AnalyticalTable.FACT_CLICKS, 1L, 7L, LocalDate.of(2024, 1, 1), T, T, false, T.toEpochMilli()),
                new FactEventRow(AnalyticalTable.FACT_CLICKS, 2L, 7L, LocalDate.of(2024, 1, 1), T, T, false, T.toEpochMilli()));
    }
}
