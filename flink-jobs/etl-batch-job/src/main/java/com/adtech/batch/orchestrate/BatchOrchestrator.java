package com.adtech.batch.orchestrate;

import com.adtech.common.model.SourceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Batch ETL 주기 실행기
 * <p>
 * 단일 스레드 scheduler + fixed delay 이므로 실행이 겹치지 않습니다.
 * 한 주기 안에서 dimension 테이블을 먼저, fact 테이블을 나중에 동기화하며
 * dimension 이 하나라도 실패하면 그 주기의 fact 동기화는 건너뜁니다.
 */
public class BatchOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final List<SourceTable> tables;
    private final TableSynchronizer synchronizer;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicLong cycles = new AtomicLong();

    public BatchOrchestrator(List<SourceTable> tables, TableSynchronizer synchronizer, Duration interval) {
        // enum 선언 순서 = dimension → fact
        this.tables = tables.stream()
                            .sorted(Comparator.comparingInt(SourceTable::ordinal))
                            .collect(Collectors.toList());
        this.synchronizer = synchronizer;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "batch-etl-orchestrator");
            thread.setDaemon(false);
            return thread;
        });
    }

    /**
     * 즉시 한 주기를 실행한 뒤 interval 간격으로 반복합니다.
     */
    public void start() {
        LOG.info("🚀 Batch ETL 시작: tables={}, interval={}s",
                tables.stream().map(SourceTable::getTableName).collect(Collectors.toList()), interval.getSeconds());
        scheduler.scheduleWithFixedDelay(this::runScheduledCycle, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * 한 주기 실행 (dimension → fact)
     */
    public SyncCycleReport runCycle() {
        long cycle = cycles.incrementAndGet();
        Instant startedAt = Instant.now();
        LOG.info("🔄 Sync cycle #{} 시작", cycle);

        List<TableSyncResult> results = new ArrayList<>();
        boolean dimensionFailed = false;
        for (SourceTable table : tables) {
            if (stopRequested.get()) {
                break;
            }
            if (!table.isDimension() && dimensionFailed) {
                LOG.warn("⚠️  {} 건너뜀: 이번 주기에 dimension 동기화가 실패했습니다", table.getTableName());
                results.add(TableSyncResult.skipped(table));
                continue;
            }

            TableSyncResult result = synchronizer.sync(table, stopRequested::get);
            results.add(result);
            if (result.isFailed() && table.isDimension()) {
                dimensionFailed = true;
            }
        }

        SyncCycleReport report = new SyncCycleReport(cycle, startedAt, Duration.between(startedAt, Instant.now()), results);
        if (report.isSuccessful()) {
            LOG.info("✅ Sync cycle #{} 완료: {}", cycle, report);
        } else {
            LOG.warn("⚠️  Sync cycle #{} 일부 실패 (다음 주기에 재시도): {}", cycle, report);
        }
        return report;
    }

    private void runScheduledCycle() {
        try {
            runCycle();
        } catch (RuntimeException e) {
            // scheduler 는 예외가 난 작업을 다시 실행하지 않으므로 여기서 기록하고 다음 주기로 넘김
            LOG.error("❌ Sync cycle 예외", e);
        }
    }

    /**
     * 중단 요청 후 진행 중인 페이지가 끝날 때까지 기다립니다.
     */
    public boolean stop(Duration timeout) throws InterruptedException {
        LOG.info("⏹️  Batch ETL 종료 요청");
        stopRequested.set(true);
        scheduler.shutdown();
        boolean terminated = scheduler.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!terminated) {
            LOG.warn("⚠️  {}초 안에 진행 중인 작업이 끝나지 않았습니다", timeout.getSeconds());
        }
        return terminated;
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public List<SourceTable> getTables() {
        return tables;
    }
}
