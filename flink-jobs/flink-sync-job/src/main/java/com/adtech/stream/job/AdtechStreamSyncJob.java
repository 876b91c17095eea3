package com.adtech.stream.job;

import com.adtech.common.config.ConfigLoader;
import com.adtech.common.error.SyncException;
import com.adtech.common.jdbc.ClickHouseSchemaInitializer;
import com.adtech.common.jdbc.JdbcConnectionFactory;
import com.adtech.common.transform.AnalyticalRow;
import com.adtech.stream.config.DeadLetterSinkConfig;
import com.adtech.stream.config.DebeziumConnectorRegistrar;
import com.adtech.stream.config.DebeziumSettings;
import com.adtech.stream.config.KafkaSourceConfig;
import com.adtech.stream.config.StreamSyncConfig;
import com.adtech.stream.decode.DecodeFailurePolicy;
import com.adtech.stream.decode.RawChangeMessage;
import com.adtech.stream.process.ChangeEventProcessFunction;
import com.adtech.stream.process.TableBinding;
import com.adtech.stream.process.TableRegistry;
import com.adtech.stream.sink.ClickHouseSink;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.restartstrategy.RestartStrategies;
import org.apache.flink.api.common.time.Time;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * AdTech Stream Sync Job - Debezium CDC 이벤트를 ClickHouse로 동기화
 * 데이터 흐름 (원본 테이블마다 독립된 파이프라인):
 * Kafka Topic (postgres.public.{table})
 *   → Change Event Decoder → Stream Processor (Row Transformer)
 *   → ClickHouse {dim_advertiser | dim_campaign | fact_impressions | fact_clicks}
 * 실행 방법:
 * flink run -c com.adtech.stream.job.AdtechStreamSyncJob flink-sync-job.jar
 */
public class AdtechStreamSyncJob {

    private static final Logger LOG = LoggerFactory.getLogger(AdtechStreamSyncJob.class);

    public static void main(String[] args) throws Exception {
        // 1. 설정 로드 및 검증 (잘못된 설정은 ConfigurationException 으로 기동 중단)
        StreamSyncConfig config = StreamSyncConfig.from(ConfigLoader.fromClasspath());
        TableRegistry registry = new TableRegistry(config.getTopics());
        LOG.info("✅ 설정 로드 완료: {}", config);

        // 2. ClickHouse 스키마 초기화 (선택, sink 가 첫 row 를 쓰기 전에)
        if (config.isSchemaInit()) {
            initializeSchema(config);
        }

        // 3. Debezium connector 등록 (debezium.connect.url 이 있을 때만)
        if (config.getDebezium().isPresent()) {
            registerConnector(config.getDebezium().get());
        }

        // 4. Flink 실행 환경 설정
        final StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        configureCheckpointing(env, config);
        configureRestartStrategy(env, config);
        env.setParallelism(config.getParallelism());
        // row 객체는 모두 불변이므로 chain 사이 복사 불필요
        env.getConfig().enableObjectReuse();

        // 5. 토픽별 파이프라인 생성
        buildPipelines(env, config, registry);

        // 6. Job 실행
        LOG.info("🚀 AdTech Stream Sync Job 시작...");
        for (TableBinding binding : registry.getBindings()) {
            LOG.info("📥 {}", binding);
        }
        LOG.info("⚙️  Parallelism: {}, Decode failure policy: {}",
                env.getParallelism(), config.getDecodeFailurePolicy());

        env.execute("Debezium CDC to ClickHouse - AdTech Sync");
    }

    /**
     * 바인딩마다 Source → Decode/Transform → ClickHouse Sink 파이프라인을 구성합니다.
     * 파이프라인끼리는 상태를 공유하지 않으며 ClickHouse 에만 수렴합니다.
     */
    static void buildPipelines(StreamExecutionEnvironment env, StreamSyncConfig config, TableRegistry registry) {
        for (TableBinding binding : registry.getBindings()) {
            String name = binding.getName();

            // Kafka Source
            KafkaSource<RawChangeMessage> source = KafkaSourceConfig.createSource(config, binding);
            DataStream<RawChangeMessage> messages = env
                    .fromSource(source, WatermarkStrategy.noWatermarks(), "Kafka CDC Source - " + name)
                    .uid("kafka-cdc-source-" + name)
                    .name("Kafka CDC Event Reader - " + name);

            // 디코딩 + 변환
            SingleOutputStreamOperator<AnalyticalRow> rows = messages
                    .process(new ChangeEventProcessFunction(binding, config.getDecodeFailurePolicy()))
                    .uid("cdc-processor-" + name)
                    .name("CDC Event Processor - " + name);

            // ClickHouse Sink
            rows.addSink(ClickHouseSink.createSink(binding.getTarget(), config.getClickHouse(),
                            config.getClickHouseMaxRetries()))
                .uid("clickhouse-sink-" + name)
                .name("ClickHouse Sink - " + binding.getTarget().getTableName());

            // Dead letter (DEAD_LETTER 정책일 때만)
            if (config.getDecodeFailurePolicy() == DecodeFailurePolicy.DEAD_LETTER) {
                rows.getSideOutput(ChangeEventProcessFunction.DEAD_LETTER_TAG)
                    .sinkTo(DeadLetterSinkConfig.createSink(config))
                    .uid("dead-letter-sink-" + name)
                    .name("Dead Letter Sink - " + name);
            }

            LOG.info("✅ {} Pipeline 생성 완료", name);
        }
    }

    static void initializeSchema(StreamSyncConfig config) throws SyncException {
        try {
            new ClickHouseSchemaInitializer(new JdbcConnectionFactory(config.getClickHouse())).initialize();
        } catch (SyncException e) {
            LOG.error("❌ ClickHouse 스키마 초기화 실패: {}", config.getClickHouse(), e);
            throw e;
        }
    }

    private static void registerConnector(DebeziumSettings debezium) throws Exception {
        try (DebeziumConnectorRegistrar registrar = new DebeziumConnectorRegistrar(debezium)) {
            registrar.register();
        } catch (Exception e) {
            LOG.error("❌ Debezium connector 등록 실패: {}", debezium.getConnectUrl(), e);
            throw e;
        }
    }

    /**
     * Checkpoint 설정
     * Kafka offset 은 checkpoint 완료 시에만 commit 되고, JDBC sink 는 checkpoint 시 flush 되므로
     * commit 된 offset 이전의 이벤트는 모두 ClickHouse 에 쓰인 상태입니다 (at-least-once).
     */
    private static void configureCheckpointing(StreamExecutionEnvironment env, StreamSyncConfig config) {
        env.enableCheckpointing(config.getCheckpointIntervalMs());

        CheckpointConfig checkpointConfig = env.getCheckpointConfig();

        // Checkpoint 모드: EXACTLY_ONCE (operator state 기준. ClickHouse 쓰기는 at-least-once)
        checkpointConfig.setCheckpointingMode(CheckpointingMode.EXACTLY_ONCE);

        // Checkpoint 간 최소 간격: interval 의 절반
        checkpointConfig.setMinPauseBetweenCheckpoints(config.getCheckpointIntervalMs() / 2);

        // Checkpoint 타임아웃: 10분
        checkpointConfig.setCheckpointTimeout(600000L);

        // 동시 실행 가능한 Checkpoint 수: 1
        checkpointConfig.setMaxConcurrentCheckpoints(1);

        // Job 취소 시에도 Checkpoint 보존
        checkpointConfig.setExternalizedCheckpointCleanup(
                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION
        );

        // 허용 가능한 Checkpoint 실패 횟수: 3회
        checkpointConfig.setTolerableCheckpointFailureNumber(3);

        checkpointConfig.setCheckpointStorage(config.getCheckpointStorage());

        LOG.info("✅ Checkpoint 설정 완료: interval={}ms, mode=EXACTLY_ONCE, storage={}",
                config.getCheckpointIntervalMs(), config.getCheckpointStorage());
    }

    /**
     * 재시작 전략 설정 (장애 복구)
     * 재시작하면 마지막 checkpoint 의 offset 부터 다시 읽습니다.
     */
    private static void configureRestartStrategy(StreamExecutionEnvironment env, StreamSyncConfig config) {
        env.setRestartStrategy(
                RestartStrategies.fixedDelayRestart(
                        config.getRestartAttempts(), // 최대 재시작 횟수
                        Time.of(config.getRestartDelaySeconds(), TimeUnit.SECONDS) // 재시작 간격
                )
        );

        LOG.info("✅ Restart Strategy 설정 완료: 최대 {}회, {}초 간격",
                config.getRestartAttempts(), config.getRestartDelaySeconds());
    }
}
