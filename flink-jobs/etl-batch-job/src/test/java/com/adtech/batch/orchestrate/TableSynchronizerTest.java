package com.adtech.batch.orchestrate;

import com.adtech.batch.load.BatchLoader;
import com.adtech.batch.watermark.InMemoryWatermarkStore;
import com.adtech.common.error.SyncException;
import com.adtech.common.error.WriteException;
import com.adtech.common.model.AnalyticalTable;
import com.adtech.common.model.SourceTable;
import com.adtech.common.retry.RetryPolicy;
import com.adtech.common.transform.AnalyticalRow;
import com.adtech.common.transform.CampaignRow;
import com.adtech.common.transform.RowTransformer;
import org.junit.Before;
import org.junit.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

/**
 * TableSynchronizer 단위 테스트 (in-memory 원본 / watermark / ReplacingMergeTree)
 */
public class TableSynchronizerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemorySource source;
    private ReplacingTableWriter destination;
    private InMemoryWatermarkStore watermarks;

    @Before
    public void setUp() {
        source = new InMemorySource();
        destination = new ReplacingTableWriter();
        watermarks = new InMemoryWatermarkStore();
    }

    @Test
    public void testInitialLoadAdvancesWatermarkToMaxCursor() {
        // Given
        source.put(SourceTable.CAMPAIGN, campaign(1L, "1.00", T0.plusSeconds(1)));
        source.put(SourceTable.CAMPAIGN, campaign(2L, "2.00", T0.plusSeconds(2)));

        // When
        TableSyncResult result = synchronizer(100, null).sync(SourceTable.CAMPAIGN, () -> false);

        // Then
        assertEquals(TableSyncResult.Outcome.SUCCEEDED, result.getOutcome());
        assertEquals(2, result.getRowsLoaded());
        assertNull(result.getWatermarkBefore());
        assertEquals(T0.plusSeconds(2), watermarks.get(SourceTable.CAMPAIGN));
        assertEquals(2, destination.current(AnalyticalTable.DIM_CAMPAIGN).size());
    }

    @Test
    public void testOnlyRowsAfterWatermarkAreExtracted() {
        // Given: watermark = T0
        watermarks.set(SourceTable.CAMPAIGN, T0);
        source.put(SourceTable.CAMPAIGN, campaign(1L, "1.00", T0));
        source.put(SourceTable.CAMPAIGN, campaign(2L, "1.00", T0.plusSeconds(1)));
        source.put(SourceTable.CAMPAIGN, campaign(3L, "1.00", T0.plusSeconds(2)));
        source.put(SourceTable.CAMPAIGN, campaign(4L, "1.00", T0.plusSeconds(2)));

        // When
        TableSyncResult result = synchronizer(100, null).sync(SourceTable.CAMPAIGN, () -> false);

        // Then: T0 행 제외, 3행, watermark = T0+2
        assertEquals(3, result.getRowsLoaded());
        assertEquals(T0.plusSeconds(2), watermarks.get(SourceTable.CAMPAIGN));
    }

    @Test
    public void testEmptyDeltaLeavesWatermarkUnchanged() {
        watermarks.set(SourceTable.CAMPAIGN, T0);

        TableSyncResult result = synchronizer(100, null).sync(SourceTable.CAMPAIGN, () -> false);

        assertEquals(TableSyncResult.Outcome.SUCCEEDED, result.getOutcome());
        assertEquals(0, result.getRowsLoaded());
        assertEquals(T0, watermarks.get(SourceTable.CAMPAIGN));
        assertTrue(destination.getAppended().isEmpty());
    }

    @Test
    public void testLoadFailureLeavesWatermarkUnchangedAndNextRunRecovers() {
        // Given
        watermarks.set(SourceTable.CAMPAIGN, T0);
        source.put(SourceTable.CAMPAIGN, campaign(1L, "1.00", T0.plusSeconds(1)));
        destination.failNextWrites(1);
        TableSynchronizer synchronizer = synchronizer(100, null);

        // When: 첫 실행 실패
        TableSyncResult failed = synchronizer.sync(SourceTable.CAMPAIGN, () -> false);

        // Then
        assertEquals(TableSyncResult.Outcome.FAILED, failed.getOutcome());
        assertEquals(SyncRunState.LOADING, failed.getFailedStage());
        assertEquals(SyncRunState.FAILED, synchronizer.getState());
        assertEquals(T0, watermarks.get(SourceTable.CAMPAIGN));

        // When: 다음 주기
        TableSyncResult retried = synchronizer.sync(SourceTable.CAMPAIGN, () -> false);

        // Then
        assertEquals(TableSyncResult.Outcome.SUCCEEDED, retried.getOutcome());
        assertEquals(SyncRunState.IDLE, synchronizer.getState());
        assertEquals(T0.plusSeconds(1), watermarks.get(SourceTable.CAMPAIGN));
    }

    @Test
    public void testReplayAfterLostWatermarkConverges() {
        // Given: 한 번 적재
        source.put(SourceTable.CAMPAIGN, campaign(1L, "1.00", T0.plusSeconds(1)));
        source.put(SourceTable.CAMPAIGN, campaign(2L, "2.00", T0.plusSeconds(2)));
        synchronizer(100, null).sync(SourceTable.CAMPAIGN, () -> false);
        Map<Long, AnalyticalRow> firstState = new HashMap<>(destination.current(AnalyticalTable.DIM_CAMPAIGN));

        // When: watermark 기록이 유실되어 같은 구간을 다시 적재
        watermarks = new InMemoryWatermarkStore();
        synchronizer(100, null).sync(SourceTable.CAMPAIGN, () -> false);

        // Then: 행은 두 번 append 되었지만 현재 상태는 동일
        assertEquals(4, destination.getAppended().size());
        assertEquals(firstState, destination.current(AnalyticalTable.DIM_CAMPAIGN));
    }

    @Test
    public void testUpdatedVersionReplacesPrevious() {
        // Given
        source.put(SourceTable.CAMPAIGN, campaign(7L, "1.00", T0.plusSeconds(1)));
        synchronizer(100, null).sync(SourceTable.CAMPAIGN, () -> false);

        // When: bid 변경
        source.put(SourceTable.CAMPAIGN, campaign(7L, "2.50", T0.plusSeconds(5)));
        synchronizer(100, null).sync(SourceTable.CAMPAIGN, () -> false);

        // Then
        CampaignRow current = (CampaignRow) destination.current(AnalyticalTable.DIM_CAMPAIGN).get(7L);
        assertEquals(0, new BigDecimal("2.50").compareTo(current.getBid()));
    }

    @Test
    public void testPagingKeepsRowsSharingBoundaryCursor() {
        // Given: pageSize 2, 경계 cursor T0+2 를 공유하는 행
        source.put(SourceTable.CLICKS, click(1L, T0.plusSeconds(1)));
        source.put(SourceTable.CLICKS, click(2L, T0.plusSeconds(2)));
        source.put(SourceTable.CLICKS, click(3L, T0.plusSeconds(2)));
        source.put(SourceTable.CLICKS, click(4L, T0.plusSeconds(3)));

        // When
        TableSyncResult result = synchronizer(2, null).sync(SourceTable.CLICKS, () -> false);

        // Then
        assertEquals(4, result.getRowsLoaded());
        assertEquals(2, result.getPages());
        assertEquals(4, destination.current(AnalyticalTable.FACT_CLICKS).size());
        assertEquals(T0.plusSeconds(3), watermarks.get(SourceTable.CLICKS));
    }

    @Test
    public void testFailureOnLaterPageLeavesWatermarkAtPreRunValue() {
        // Given: pageSize 2, 3행 → 2 페이지
        source.put(SourceTable.CLICKS, click(1L, T0.plusSeconds(1)));
        source.put(SourceTable.CLICKS, click(2L, T0.plusSeconds(2)));
        source.put(SourceTable.CLICKS, click(3L, T0.plusSeconds(3)));
        // 첫 페이지는 성공, 두 번째 페이지는 거부
        ReplacingTableWriter failingSecond = rejectingWrite(2);
        TableSynchronizer synchronizer = new TableSynchronizer(source, new RowTransformer(), new BatchLoader(failingSecond),
                watermarks, RetryPolicy.immediate(1), 2, null);

        // When
        TableSyncResult result = synchronizer.sync(SourceTable.CLICKS, () -> false);

        // Then: 첫 페이지는 적재되었지만 watermark 는 실행 전 값(null) 그대로
        assertEquals(TableSyncResult.Outcome.FAILED, result.getOutcome());
        assertEquals(SyncRunState.LOADING, result.getFailedStage());
        assertEquals(2, result.getRowsLoaded());
        assertNull(result.getWatermarkAfter());
        assertNull(watermarks.get(SourceTable.CLICKS));
    }

    @Test
    public void testPartialFailureKeepsStoredWatermarkAndNextRunReplaysWindow() {
        // Given
        watermarks.set(SourceTable.CLICKS, T0);
        source.put(SourceTable.CLICKS, click(1L, T0.plusSeconds(1)));
        source.put(SourceTable.CLICKS, click(2L, T0.plusSeconds(2)));
        source.put(SourceTable.CLICKS, click(3L, T0.plusSeconds(3)));
        ReplacingTableWriter failingSecond = rejectingWrite(2);
        TableSynchronizer synchronizer = new TableSynchronizer(source, new RowTransformer(), new BatchLoader(failingSecond),
                watermarks, RetryPolicy.immediate(1), 2, null);

        // When: 첫 실행은 두 번째 페이지에서 실패
        synchronizer.sync(SourceTable.CLICKS, () -> false);

        // Then
        assertEquals(T0, watermarks.get(SourceTable.CLICKS));

        // When: 다음 주기에 같은 구간을 처음부터 다시 적재
        TableSyncResult retried = synchronizer.sync(SourceTable.CLICKS, () -> false);

        // Then: 첫 페이지 행은 중복 append 되지만 현재 상태는 3행
        assertEquals(TableSyncResult.Outcome.SUCCEEDED, retried.getOutcome());
        assertEquals(3, retried.getRowsLoaded());
        assertEquals(T0.plusSeconds(3), watermarks.get(SourceTable.CLICKS));
        assertEquals(3, failingSecond.current(AnalyticalTable.FACT_CLICKS).size());
    }

    @Test
    public void testStopAfterFirstPageCommitsConfirmedCursor() {
        // Given
        source.put(SourceTable.CLICKS, click(1L, T0.plusSeconds(1)));
        source.put(SourceTable.CLICKS, click(2L, T0.plusSeconds(2)));
        source.put(SourceTable.CLICKS, click(3L, T0.plusSeconds(3)));
        AtomicInteger checks = new AtomicInteger();

        // When: 두 번째 페이지 전에 중단 요청
        TableSyncResult result = synchronizer(2, null).sync(SourceTable.CLICKS, () -> checks.incrementAndGet() > 1);

        // Then: 첫 페이지의 확정 가능 cursor (경계 cursor T0+2 미만) 까지만 기록
        assertEquals(TableSyncResult.Outcome.STOPPED, result.getOutcome());
        assertEquals(2, result.getRowsLoaded());
        assertEquals(T0.plusSeconds(1), watermarks.get(SourceTable.CLICKS));
    }

    @Test
    public void testWatermarkKeepsSourcePrecision() {
        // Given: 원본 cursor 는 microsecond, 분석 행은 millisecond
        Instant micros = T0.plusNanos(1_234_567_000L);
        source.put(SourceTable.IMPRESSIONS, impression(1L, micros));
        TableSynchronizer synchronizer = synchronizer(100, null);

        // When
        synchronizer.sync(SourceTable.IMPRESSIONS, () -> false);
        TableSyncResult second = synchronizer.sync(SourceTable.IMPRESSIONS, () -> false);

        // Then: 같은 행을 다시 추출하지 않음
        assertEquals(micros, watermarks.get(SourceTable.IMPRESSIONS));
        assertEquals(0, second.getRowsLoaded());
    }

    @Test
    public void testConnectionFailuresAreRetriedWithinStage() {
        source.put(SourceTable.ADVERTISER, advertiser(1L, T0.plusSeconds(1)));
        source.failConnections(2);

        TableSyncResult result = synchronizer(100, null).sync(SourceTable.ADVERTISER, () -> false);

        assertEquals(TableSyncResult.Outcome.SUCCEEDED, result.getOutcome());
        assertEquals(T0.plusSeconds(1), watermarks.get(SourceTable.ADVERTISER));
    }

    @Test
    public void testExhaustedRetriesFailExtraction() {
        source.put(SourceTable.ADVERTISER, advertiser(1L, T0.plusSeconds(1)));
        source.failConnections(3);

        TableSyncResult result = synchronizer(100, null).sync(SourceTable.ADVERTISER, () -> false);

        assertEquals(SyncRunState.EXTRACTING, result.getFailedStage());
        assertNull(watermarks.get(SourceTable.ADVERTISER));
    }

    @Test
    public void testTransformFailureFailsRunWithoutWriting() {
        // Given: advertiser_id 없는 campaign
        Map<String, Object> broken = campaign(1L, "1.00", T0.plusSeconds(1));
        broken.remove("advertiser_id");
        source.put(SourceTable.CAMPAIGN, broken);

        // When
        TableSyncResult result = synchronizer(100, null).sync(SourceTable.CAMPAIGN, () -> false);

        // Then
        assertEquals(SyncRunState.TRANSFORMING, result.getFailedStage());
        assertTrue(destination.getAppended().isEmpty());
        assertNull(watermarks.get(SourceTable.CAMPAIGN));
    }

    @Test
    public void testOverrideIsUsedWhenNoWatermarkStored() {
        // Given
        source.put(SourceTable.IMPRESSIONS, impression(1L, T0.minusSeconds(10)));
        source.put(SourceTable.IMPRESSIONS, impression(2L, T0.plusSeconds(10)));

        // When
        TableSyncResult result = synchronizer(100, Collections.singletonMap(SourceTable.IMPRESSIONS, T0))
                .sync(SourceTable.IMPRESSIONS, () -> false);

        // Then
        assertEquals(1, result.getRowsLoaded());
        assertEquals(T0.plusSeconds(10), watermarks.get(SourceTable.IMPRESSIONS));
    }

    @Test
    public void testStoredWatermarkWinsOverOverride() {
        watermarks.set(SourceTable.IMPRESSIONS, T0.plusSeconds(20));
        source.put(SourceTable.IMPRESSIONS, impression(2L, T0.plusSeconds(10)));

        TableSyncResult result = synchronizer(100, Collections.singletonMap(SourceTable.IMPRESSIONS, T0))
                .sync(SourceTable.IMPRESSIONS, () -> false);

        assertEquals(0, result.getRowsLoaded());
    }

    @Test
    public void testStopRequestEndsBetweenPages() {
        source.put(SourceTable.CLICKS, click(1L, T0.plusSeconds(1)));

        TableSyncResult result = synchronizer(100, null).sync(SourceTable.CLICKS, () -> true);

        assertEquals(TableSyncResult.Outcome.STOPPED, result.getOutcome());
        assertTrue(source.getFetchLog().isEmpty());
    }

    private static ReplacingTableWriter rejectingWrite(int failingWrite) {
        return new ReplacingTableWriter() {
            private int writes;

            @Override
            public void write(AnalyticalTable table, List<AnalyticalRow> rows) throws SyncException {
                if (++writes == failingWrite) {
                    throw new WriteException("rejected");
                }
                super.write(table, rows);
            }
        };
    }

    private TableSynchronizer synchronizer(int pageSize, Map<SourceTable, Instant> overrides) {
        return new TableSynchronizer(source, new RowTransformer(), new BatchLoader(destination), watermarks,
                RetryPolicy.immediate(3), pageSize, overrides);
    }

    static Map<String, Object> advertiser(long id, Instant updatedAt) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("name", "advertiser-" + id);
        row.put("updated_at", updatedAt);
        row.put("created_at", T0);
        return row;
    }

    static Map<String, Object> campaign(long id, String bid, Instant updatedAt) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("name", "campaign-" + id);
        row.put("bid", new BigDecimal(bid));
        row.put("budget", new BigDecimal("1000.00"));
        row.put("advertiser_id", 1L);
        row.put("updated_at", updatedAt);
        row.put("created_at", T0);
        return row;
    }

    static Map<String, Object> impression(long id, Instant createdAt) {
        Map<String, Object> row = new HashMap<>();
        row.put("id", id);
        row.put("campaign_id", 7L);
        row.put("created_at", createdAt);
        return row;
    }

    static Map<String, Object> click(long id, Instant createdAt) {
        return impression(id, createdAt);
    }
}
