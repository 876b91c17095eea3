package com.adtech.batch.orchestrate;

import com.adtech.batch.extract.ExtractionPage;
import com.adtech.batch.extract.IncrementalExtractor;
import com.adtech.batch.extract.PageKey;
import com.adtech.batch.load.BatchLoader;
import com.adtech.batch.load.LoadResult;
import com.adtech.batch.watermark.WatermarkStore;
import com.adtech.common.error.SyncException;
import com.adtech.common.model.SourceRow;
import com.adtech.common.model.SourceTable;
import com.adtech.common.retry.RetryPolicy;
import com.adtech.common.transform.AnalyticalRow;
import com.adtech.common.transform.RowTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * 한 원본 테이블의 증분 동기화 (Extract → Transform → Load → Commit watermark, 페이지 단위 반복)
 * <p>
 * 페이지마다 적재가 확정한 cursor ({@link ExtractionPage#committableCursor()}) 는 메모리에만 모아 두고,
 * 마지막 페이지까지 성공한 뒤 COMMITTING 단계에서 한 번만 watermark 에 기록합니다.
 * 중간 페이지에서 실패하면 watermark 는 실행 전 값 그대로이며 다음 주기에 같은 구간을 다시 적재합니다.
 * 중단 요청은 페이지 사이에서만 확인하므로 쓰기 도중에는 멈추지 않습니다.
 */
public class TableSynchronizer {

    private static final Logger LOG = LoggerFactory.getLogger(TableSynchronizer.class);

    private final IncrementalExtractor extractor;
    private final RowTransformer transformer;
    private final BatchLoader loader;
    private final WatermarkStore watermarkStore;
    private final RetryPolicy retryPolicy;
    private final int pageSize;
    private final Map<SourceTable, Instant> watermarkOverrides;

    private volatile SyncRunState state = SyncRunState.IDLE;

    public TableSynchronizer(IncrementalExtractor extractor, RowTransformer transformer, BatchLoader loader,
                             WatermarkStore watermarkStore, RetryPolicy retryPolicy, int pageSize,
                             Map<SourceTable, Instant> watermarkOverrides) {
        this.extractor = extractor;
        this.transformer = transformer;
        this.loader = loader;
        this.watermarkStore = watermarkStore;
        this.retryPolicy = retryPolicy;
        this.pageSize = pageSize;
        this.watermarkOverrides = watermarkOverrides != null ? watermarkOverrides : Collections.emptyMap();
    }

    public TableSyncResult sync(SourceTable table, BooleanSupplier stopRequested) {
        String name = table.getTableName();
        Instant stored = null;
        int rows = 0;
        int pages = 0;

        try {
            stored = retryPolicy.execute("Read watermark " + name, () -> watermarkStore.get(table));
            Instant lowerBound = stored != null ? stored : watermarkOverrides.get(table);
            if (stored == null && lowerBound != null) {
                LOG.info("📌 {} 저장된 watermark 없음, override 사용: {}", name, lowerBound);
            }

            // 이번 실행에서 적재가 확정된 최대 cursor (아직 기록 전)
            Instant confirmed = stored;
            PageKey after = null;
            while (true) {
                if (stopRequested.getAsBoolean()) {
                    // 이미 확정된 페이지까지는 기록하고 멈춤 (실패가 아니므로)
                    Instant committed = commit(table, stored, confirmed);
                    LOG.info("⏹️  {} 중단 요청으로 페이지 사이에서 종료 (rows={}, watermark={})", name, rows, committed);
                    transition(table, SyncRunState.IDLE);
                    return TableSyncResult.stopped(table, rows, pages, stored, committed);
                }

                transition(table, SyncRunState.EXTRACTING);
                final Instant bound = lowerBound;
                final PageKey from = after;
                ExtractionPage page = retryPolicy.execute("Extract " + name,
                        () -> extractor.fetchPage(table, bound, from, pageSize));
                if (page.isEmpty()) {
                    break;
                }

                transition(table, SyncRunState.TRANSFORMING);
                List<AnalyticalRow> transformed = new ArrayList<>(page.size());
                for (SourceRow row : page.getRows()) {
                    transformed.add(transformer.transform(table, row));
                }

                transition(table, SyncRunState.LOADING);
                LoadResult result = retryPolicy.execute("Load " + table.getTarget().getTableName(),
                        () -> loader.load(table.getTarget(), transformed, page.committableCursor()));

                Instant candidate = result.getCommittedCursor();
                if (candidate != null && (confirmed == null || candidate.isAfter(confirmed))) {
                    confirmed = candidate;
                }
                rows += result.getRowCount();
                pages++;
                LOG.debug("{} page {} 적재 완료: rows={}, confirmed={}", name, pages, result.getRowCount(), confirmed);

                if (page.isLast()) {
                    break;
                }
                after = page.getLastKey();
            }

            Instant committed = commit(table, stored, confirmed);

            transition(table, SyncRunState.IDLE);
            if (rows == 0) {
                LOG.info("✅ {} 변경 없음 (watermark={})", name, committed);
            } else {
                LOG.info("✅ {} 동기화 완료: rows={}, pages={}, watermark {} → {}", name, rows, pages, stored, committed);
            }
            return TableSyncResult.succeeded(table, rows, pages, stored, committed);

        } catch (SyncException | RuntimeException e) {
            SyncRunState failedStage = state;
            transition(table, SyncRunState.FAILED);
            LOG.error("❌ {} 동기화 실패 (stage={}, watermark={} 유지): {}", name, failedStage, stored, e.getMessage(), e);
            return TableSyncResult.failed(table, failedStage, rows, pages, stored, stored, e);
        }
    }

    /**
     * 확정된 cursor 가 저장된 watermark 보다 크면 기록하고, 기록 후의 watermark 를 반환합니다.
     */
    private Instant commit(SourceTable table, Instant stored, Instant confirmed) throws SyncException {
        if (confirmed == null || (stored != null && !confirmed.isAfter(stored))) {
            return stored;
        }
        transition(table, SyncRunState.COMMITTING);
        retryPolicy.execute("Commit watermark " + table.getTableName(), () -> {
            watermarkStore.set(table, confirmed);
            return null;
        });
        return confirmed;
    }

    public SyncRunState getState() {
        return state;
    }

    private void transition(SourceTable table, SyncRunState next) {
        LOG.debug("{}: {} → {}", table.getTableName(), state, next);
        state = next;
    }
}
