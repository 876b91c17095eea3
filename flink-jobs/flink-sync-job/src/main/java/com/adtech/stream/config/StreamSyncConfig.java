package com.adtech.stream.config;

import com.adtech.common.config.ConfigLoader;
import com.adtech.common.config.ConfigurationException;
import com.adtech.common.jdbc.JdbcSettings;
import com.adtech.common.model.SourceTable;
import com.adtech.stream.decode.DecodeFailurePolicy;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flink Sync Job 설정 (application.properties + 환경 변수)
 * 기동 시 한 번 읽고 검증합니다. 잘못된 값은 {@link ConfigurationException} 으로 기동을 중단합니다.
 */
public class StreamSyncConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_TOPIC_PREFIX = "postgres";
    public static final String DEFAULT_DEAD_LETTER_TOPIC = "adtech-cdc-dlq";

    private final String bootstrapServers;
    private final String consumerGroup;
    private final Map<SourceTable, String> topics;
    private final int maxPollRecords;
    private final int sessionTimeoutMs;
    private final DecodeFailurePolicy decodeFailurePolicy;
    private final String deadLetterTopic;
    private final JdbcSettings clickHouse;
    private final int clickHouseMaxRetries;
    private final boolean schemaInit;
    private final int parallelism;
    private final long checkpointIntervalMs;
    private final String checkpointStorage;
    private final int restartAttempts;
    private final int restartDelaySeconds;
    private final DebeziumSettings debezium;

    private StreamSyncConfig(ConfigLoader config) {
        this.bootstrapServers = config.require("kafka.bootstrap.servers");
        this.consumerGroup = config.require("kafka.consumer.group");

        String topicPrefix = config.get("debezium.topic.prefix", DEFAULT_TOPIC_PREFIX);
        Map<SourceTable, String> resolved = new EnumMap<>(SourceTable.class);
        for (SourceTable table : SourceTable.values()) {
            resolved.put(table, config.get("kafka.topic." + table.getTableName(),
                    defaultTopic(topicPrefix, table)));
        }
        this.topics = Collections.unmodifiableMap(resolved);

        this.maxPollRecords = positive(config, "kafka.consumer.max.poll.records", 500);
        this.sessionTimeoutMs = positive(config, "kafka.consumer.session.timeout.ms", 30000);
        this.decodeFailurePolicy = DecodeFailurePolicy.parse(config.get("stream.decode.failure.policy"));
        this.deadLetterTopic = config.get("stream.dead.letter.topic", DEFAULT_DEAD_LETTER_TOPIC);

        this.clickHouse = JdbcSettings.clickHouse(config);
        this.clickHouseMaxRetries = nonNegative(config, "clickhouse.max.retries", 3);
        this.schemaInit = config.getBoolean("clickhouse.schema.init", true);

        this.parallelism = positive(config, "flink.parallelism", 1);
        this.checkpointIntervalMs = config.getLong("flink.checkpoint.interval.ms", 30000L);
        if (checkpointIntervalMs <= 0) {
            throw new ConfigurationException("flink.checkpoint.interval.ms must be positive: " + checkpointIntervalMs);
        }
        this.checkpointStorage = config.get("flink.checkpoint.storage", "file:///tmp/flink-checkpoints/adtech-sync");
        this.restartAttempts = nonNegative(config, "flink.restart.attempts", 3);
        this.restartDelaySeconds = nonNegative(config, "flink.restart.delay.seconds", 10);

        this.debezium = DebeziumSettings.from(config, topicPrefix);
    }

    public static StreamSyncConfig from(ConfigLoader config) {
        return new StreamSyncConfig(config);
    }

    /**
     * Debezium 기본 토픽 이름: {prefix}.public.{table}
     */
    static String defaultTopic(String topicPrefix, SourceTable table) {
        return topicPrefix + ".public." + table.getTableName();
    }

    private static int positive(ConfigLoader config, String key, int defaultValue) {
        int value = config.getInt(key, defaultValue);
        if (value <= 0) {
            throw new ConfigurationException(key + " must be positive: " + value);
        }
        return value;
    }

    private static int nonNegative(ConfigLoader config, String key, int defaultValue) {
        int value = config.getInt(key, defaultValue);
        if (value < 0) {
            throw new ConfigurationException(key + " must not be negative: " + value);
        }
        return value;
    }

    public String getBootstrapServers() {
        return bootstrapServers;
    }

    public String getConsumerGroup() {
        return consumerGroup;
    }

    public Map<SourceTable, String> getTopics() {
        return topics;
    }

    public int getMaxPollRecords() {
        return maxPollRecords;
    }

    public int getSessionTimeoutMs() {
        return sessionTimeoutMs;
    }

    public DecodeFailurePolicy getDecodeFailurePolicy() {
        return decodeFailurePolicy;
    }

    public String getDeadLetterTopic() {
        return deadLetterTopic;
    }

    public JdbcSettings getClickHouse() {
        return clickHouse;
    }

    public int getClickHouseMaxRetries() {
        return clickHouseMaxRetries;
    }

    /**
     * Job 제출 전에 ClickHouse 스키마(CREATE ... IF NOT EXISTS)를 적용할지 여부
     */
    public boolean isSchemaInit() {
        return schemaInit;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    public String getCheckpointStorage() {
        return checkpointStorage;
    }

    public int getRestartAttempts() {
        return restartAttempts;
    }

    public int getRestartDelaySeconds() {
        return restartDelaySeconds;
    }

    /**
     * debezium.connect.url 이 설정된 경우에만 존재
     */
    public Optional<DebeziumSettings> getDebezium() {
        return Optional.ofNullable(debezium);
    }

    @Override
    public String toString() {
        return "StreamSyncConfig{" +
                "bootstrapServers='" + bootstrapServers + '\'' +
                ", consumerGroup='" + consumerGroup + '\'' +
                ", topics=" + topics.values() +
                ", decodeFailurePolicy=" + decodeFailurePolicy +
                ", clickHouse=" + clickHouse +
                ", schemaInit=" + schemaInit +
                ", parallelism=" + parallelism +
                '}';
    }
}
