package com.adtech.common.transform;

import com.adtech.common.model.AnalyticalTable;
import org.junit.Test;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;

import static org.junit.Assert.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * AnalyticalRow#bind 단위 테스트 (PreparedStatement mock)
 */
public class AnalyticalRowBindTest {

    private static final Instant UPDATED = Instant.parse("2024-01-15T09:30:00.250Z");
    private static final Instant CREATED = Instant.parse("2024-01-10T08:00:00Z");

    @Test
    public void testCampaignBindOrderMatchesColumns() throws Exception {
        // Given
        CampaignRow row = new CampaignRow(7L, "Spring", new BigDecimal("2.50"), new BigDecimal("100.00"),
                LocalDate.of(2024, 2, 1), null, 1L, UPDATED, CREATED, false, UPDATED.toEpochMilli());
        PreparedStatement ps = mock(PreparedStatement.class);

        // When
        row.bind(ps);

        // Then: AnalyticalTable.DIM_CAMPAIGN 컬럼 순서
        assertEquals(11, AnalyticalTable.DIM_CAMPAIGN.getColumns().size());
        verify(ps).setLong(1, 7L);
        verify(ps).setString(2, "Spring");
        verify(ps).setBigDecimal(3, new BigDecimal("2.50"));
        verify(ps).setBigDecimal(4, new BigDecimal("100.00"));
        verify(ps).setObject(5, LocalDate.of(2024, 2, 1));
        verify(ps).setNull(6, Types.DATE);
        verify(ps).setLong(7, 1L);
        verify(ps).setObject(8, LocalDateTime.of(2024, 1, 15, 9, 30, 0, 250_000_000));
        verify(ps).setObject(9, LocalDateTime.of(2024, 1, 10, 8, 0));
        verify(ps).setInt(10, 0);
        verify(ps).setLong(11, UPDATED.toEpochMilli());
    }

    @Test
    public void testFactTombstoneBind() throws Exception {
        // Given
        FactEventRow row = new FactEventRow(AnalyticalTable.FACT_CLICKS, 100L, 7L, LocalDate.of(2024, 1, 10),
                CREATED, CREATED, true, CREATED.toEpochMilli() + 1);
        PreparedStatement ps = mock(PreparedStatement.class);

        // When
        row.bind(ps);

        // Then
        verify(ps).setLong(1, 100L);
        verify(ps).setLong(2, 7L);
        verify(ps).setObject(3, LocalDate.of(2024, 1, 10));
        verify(ps).setInt(6, 1);
        verify(ps).setLong(7, CREATED.toEpochMilli() + 1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFactRowRejectsDimensionTable() {
        new FactEventRow(AnalyticalTable.DIM_CAMPAIGN, 1L, 1L, LocalDate.now(), CREATED, CREATED, false, 1L);
    }
}
