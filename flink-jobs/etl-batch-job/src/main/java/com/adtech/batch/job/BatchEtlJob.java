package com.adtech.batch.job;

import com.adtech.batch.config.BatchEtlConfig;
import com.adtech.batch.extract.PostgresIncrementalExtractor;
import com.adtech.batch.load.BatchLoader;
import com.adtech.batch.load.ClickHouseRowWriter;
import com.adtech.batch.orchestrate.BatchOrchestrator;
import com.adtech.common.retry.RetryPolicy;
import com.adtech.batch.orchestrate.TableSynchronizer;
import com.adtech.batch.watermark.ClickHouseWatermarkStore;
import com.adtech.batch.watermark.InMemoryWatermarkStore;
import com.adtech.batch.watermark.WatermarkStore;
import com.adtech.common.config.ConfigLoader;
import com.adtech.common.config.ConfigurationException;
import com.adtech.common.error.SyncException;
import com.adtech.common.jdbc.ClickHouseSchemaInitializer;
import com.adtech.common.jdbc.JdbcConnectionFactory;
import com.adtech.common.model.SourceTable;
import com.adtech.common.transform.RowTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Arrays;

/**
 * Batch ETL Job - PostgreSQL 원본을 주기적으로 증분 추출하여 ClickHouse 로 적재
 * 데이터 흐름:
 * PostgreSQL (advertiser, campaign, impressions, clicks)
 *   → Incremental Extractor (watermark 이후 변경분, keyset paging)
 *   → Row Transformer
 *   → Batch Loader (ClickHouse batch insert)
 *   → Watermark Store
 * 실행 방법:
 * java -jar etl-batch-job.jar
 */
public class BatchEtlJob {

    private static final Logger LOG = LoggerFactory.getLogger(BatchEtlJob.class);

    private static final Duration SHUTDOWN_TIMEOUT = Duration.ofMinutes(2);

    public static void main(String[] args) {
        BatchEtlConfig config;
        try {
            config = BatchEtlConfig.from(ConfigLoader.fromClasspath());
        } catch (ConfigurationException e) {
            LOG.error("❌ 설정 오류: {}", e.getMessage());
            System.exit(1);
            return;
        }
        LOG.info("✅ 설정 로드 완료: {}", config);

        JdbcConnectionFactory clickHouse = new JdbcConnectionFactory(config.getClickHouse());
        JdbcConnectionFactory postgres = new JdbcConnectionFactory(config.getPostgres());

        // 1. ClickHouse 스키마 초기화 (선택)
        if (config.isSchemaInit()) {
            try {
                new ClickHouseSchemaInitializer(clickHouse).initialize();
            } catch (SyncException e) {
                LOG.error("❌ ClickHouse 스키마 초기화 실패", e);
                System.exit(1);
                return;
            }
        }

        // 2. 구성 요소 조립
        BatchOrchestrator orchestrator = createOrchestrator(config, clickHouse, postgres);

        // 3. 종료 시 진행 중인 페이지가 끝날 때까지 대기
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                orchestrator.stop(SHUTDOWN_TIMEOUT);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            LOG.info("👋 Batch ETL 종료");
        }, "batch-etl-shutdown"));

        // 4. 주기 실행
        orchestrator.start();
    }

    static BatchOrchestrator createOrchestrator(BatchEtlConfig config, JdbcConnectionFactory clickHouse,
                                                JdbcConnectionFactory postgres) {
        WatermarkStore watermarkStore = config.getWatermarkStoreType() == BatchEtlConfig.WatermarkStoreType.MEMORY
                ? new InMemoryWatermarkStore()
                : new ClickHouseWatermarkStore(clickHouse);

        TableSynchronizer synchronizer = new TableSynchronizer(
                new PostgresIncrementalExtractor(postgres, config.getExtractTimeoutSeconds()),
                new RowTransformer(),
                new BatchLoader(new ClickHouseRowWriter(clickHouse, config.getLoadTimeoutSeconds())),
                watermarkStore,
                RetryPolicy.exponential(config.getRetryMaxAttempts(), config.getRetryInitialBackoffMs()),
                config.getPageSize(),
                config.getWatermarkOverrides());

        return new BatchOrchestrator(Arrays.asList(SourceTable.values()), synchronizer, config.getSyncInterval());
    }
}
