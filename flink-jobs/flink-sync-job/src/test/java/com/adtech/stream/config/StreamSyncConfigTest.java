package com.adtech.stream.config;

import com.adtech.common.config.ConfigLoader;
import com.adtech.common.config.ConfigurationException;
import com.adtech.common.model.SourceTable;
import com.adtech.stream.decode.DecodeFailurePolicy;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

/**
 * StreamSyncConfig 단위 테스트
 */
public class StreamSyncConfigTest {

    private Properties properties;
    private Map<String, String> environment;

    @Before
    public void setUp() {
        properties = new Properties();
        properties.setProperty("kafka.bootstrap.servers", "localhost:9092");
        properties.setProperty("kafka.consumer.group", "adtech-stream-sync");
        properties.setProperty("clickhouse.url", "jdbc:clickhouse://localhost:8123/analytics");
        environment = new HashMap<>();
    }

    private StreamSyncConfig load() {
        return StreamSyncConfig.from(new ConfigLoader(properties, environment));
    }

    @Test
    public void testDefaults() {
        // When
        StreamSyncConfig config = load();

        // Then
        assertEquals("postgres.public.advertiser", config.getTopics().get(SourceTable.ADVERTISER));
        assertEquals("postgres.public.clicks", config.getTopics().get(SourceTable.CLICKS));
        assertEquals(500, config.getMaxPollRecords());
        assertEquals(30000, config.getSessionTimeoutMs());
        assertEquals(DecodeFailurePolicy.HALT, config.getDecodeFailurePolicy());
        assertEquals("adtech-cdc-dlq", config.getDeadLetterTopic());
        assertEquals(3, config.getClickHouseMaxRetries());
        assertTrue(config.isSchemaInit());
        assertEquals(1, config.getParallelism());
        assertEquals(30000L, config.getCheckpointIntervalMs());
        assertEquals(3, config.getRestartAttempts());
        assertEquals(10, config.getRestartDelaySeconds());
        assertFalse(config.getDebezium().isPresent());
    }

    @Test
    public void testSchemaInitCanBeDisabled() {
        // Given: batch job 이 스키마를 관리하는 배포
        environment.put("CLICKHOUSE_SCHEMA_INIT", "false");

        // When & Then
        assertFalse(load().isSchemaInit());
    }

    @Test
    public void testTopicOverridesAndPrefix() {
        // Given
        properties.setProperty("debezium.topic.prefix", "adtech");
        properties.setProperty("kafka.topic.campaign", "cdc.campaign.v2");

        // When
        StreamSyncConfig config = load();

        // Then: 명시한 토픽 우선, 나머지는 prefix 기준 기본값
        assertEquals("cdc.campaign.v2", config.getTopics().get(SourceTable.CAMPAIGN));
        assertEquals("adtech.public.impressions", config.getTopics().get(SourceTable.IMPRESSIONS));
    }

    @Test
    public void testDeadLetterPolicyFromEnvironment() {
        // Given
        environment.put("STREAM_DECODE_FAILURE_POLICY", "dead-letter");
        environment.put("STREAM_DEAD_LETTER_TOPIC", "cdc-errors");

        // When
        StreamSyncConfig config = load();

        // Then
        assertEquals(DecodeFailurePolicy.DEAD_LETTER, config.getDecodeFailurePolicy());
        assertEquals("cdc-errors", config.getDeadLetterTopic());
    }

    @Test(expected = ConfigurationException.class)
    public void testUnknownPolicyRejected() {
        properties.setProperty("stream.decode.failure.policy", "SKIP");
        load();
    }

    @Test(expected = ConfigurationException.class)
    public void testMissingBootstrapServersRejected() {
        properties.remove("kafka.bootstrap.servers");
        load();
    }

    @Test(expected = ConfigurationException.class)
    public void testNonPositiveParallelismRejected() {
        properties.setProperty("flink.parallelism", "0");
        load();
    }

    @Test
    public void testDebeziumSettingsWhenConnectUrlPresent() {
        // Given
        properties.setProperty("debezium.connect.url", "http://connect:8083/");
        properties.setProperty("debezium.database.hostname", "postgres");
        properties.setProperty("debezium.database.user", "replicator");
        properties.setProperty("debezium.database.dbname", "adtech");

        // When
        DebeziumSettings debezium = load().getDebezium().get();

        // Then
        assertEquals("http://connect:8083", debezium.getConnectUrl());
        assertEquals(DebeziumSettings.DEFAULT_CONNECTOR_NAME, debezium.getConnectorName());
        assertEquals(5432, debezium.getPort());
        assertEquals("postgres", debezium.getTopicPrefix());
        assertTrue(debezium.getPassword().isEmpty());
        assertEquals(30, debezium.getWaitAttempts());
        assertEquals(Duration.ofSeconds(10), debezium.getWaitInterval());
    }

    @Test
    public void testDebeziumWaitSettings() {
        // Given
        properties.setProperty("debezium.connect.url", "http://connect:8083");
        properties.setProperty("debezium.database.hostname", "postgres");
        properties.setProperty("debezium.database.user", "replicator");
        properties.setProperty("debezium.database.dbname", "adtech");
        environment.put("DEBEZIUM_WAIT_ATTEMPTS", "5");
        environment.put("DEBEZIUM_WAIT_INTERVAL_SECONDS", "2");

        // When
        DebeziumSettings debezium = load().getDebezium().get();

        // Then
        assertEquals(5, debezium.getWaitAttempts());
        assertEquals(Duration.ofSeconds(2), debezium.getWaitInterval());
    }

    @Test(expected = ConfigurationException.class)
    public void testDebeziumWaitAttemptsMustBePositive() {
        properties.setProperty("debezium.connect.url", "http://connect:8083");
        properties.setProperty("debezium.database.hostname", "postgres");
        properties.setProperty("debezium.database.user", "replicator");
        properties.setProperty("debezium.database.dbname", "adtech");
        properties.setProperty("debezium.wait.attempts", "0");
        load();
    }

    @Test(expected = ConfigurationException.class)
    public void testDebeziumRequiresDatabaseSettings() {
        properties.setProperty("debezium.connect.url", "http://connect:8083");
        load();
    }
}
