package com.adtech.batch.config;

import com.adtech.common.config.ConfigLoader;
import com.adtech.common.config.ConfigurationException;
import com.adtech.common.jdbc.JdbcSettings;
import com.adtech.common.model.SourceTable;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Batch ETL Job 설정
 * application.properties (+ 환경 변수) 에서 읽고 기동 시점에 검증합니다.
 */
public class BatchEtlConfig {

    public enum WatermarkStoreType {
        CLICKHOUSE, MEMORY
    }

    private static final String OVERRIDE_PREFIX = "batch.watermark.override.";

    private final JdbcSettings clickHouse;
    private final JdbcSettings postgres;
    private final boolean schemaInit;
    private final Duration syncInterval;
    private final int pageSize;
    private final int extractTimeoutSeconds;
    private final int loadTimeoutSeconds;
    private final int retryMaxAttempts;
    private final long retryInitialBackoffMs;
    private final WatermarkStoreType watermarkStoreType;
    private final Map<SourceTable, Instant> watermarkOverrides;

    private BatchEtlConfig(ConfigLoader config) {
        this.clickHouse = JdbcSettings.clickHouse(config);
        this.postgres = JdbcSettings.postgres(config);
        this.schemaInit = config.getBoolean("clickhouse.schema.init", true);
        this.syncInterval = Duration.ofSeconds(positive(config, "batch.sync.interval.seconds",
                config.getLong("batch.sync.interval.seconds", 300L)));
        this.pageSize = (int) positive(config, "batch.page.size", config.getInt("batch.page.size", 5000));
        this.extractTimeoutSeconds = (int) positive(config, "batch.extract.timeout.seconds",
                config.getInt("batch.extract.timeout.seconds", 60));
        this.loadTimeoutSeconds = (int) positive(config, "batch.load.timeout.seconds",
                config.getInt("batch.load.timeout.seconds", 120));
        this.retryMaxAttempts = (int) positive(config, "batch.retry.max.attempts",
                config.getInt("batch.retry.max.attempts", 3));
        this.retryInitialBackoffMs = config.getLong("batch.retry.initial.backoff.ms", 1000L);
        if (retryInitialBackoffMs < 0) {
            throw new ConfigurationException("batch.retry.initial.backoff.ms must not be negative");
        }
        this.watermarkStoreType = parseStoreType(config.get("batch.watermark.store", "clickhouse"));
        this.watermarkOverrides = parseOverrides(config.getWithPrefix(OVERRIDE_PREFIX));
    }

    public static BatchEtlConfig from(ConfigLoader config) {
        return new BatchEtlConfig(config);
    }

    private static long positive(ConfigLoader config, String key, long value) {
        if (value <= 0) {
            throw new ConfigurationException("Setting " + key + " must be positive: " + value);
        }
        return value;
    }

    private static WatermarkStoreType parseStoreType(String value) {
        try {
            return WatermarkStoreType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown batch.watermark.store: " + value, e);
        }
    }

    private static Map<SourceTable, Instant> parseOverrides(Map<String, String> raw) {
        Map<SourceTable, Instant> overrides = new EnumMap<>(SourceTable.class);
        for (Map.Entry<String, String> entry : raw.entrySet()) {
            SourceTable table = SourceTable.fromTableName(entry.getKey())
                    .orElseThrow(() -> new ConfigurationException(
                            "Unknown table in " + OVERRIDE_PREFIX + entry.getKey()));
            try {
                overrides.put(table, Instant.parse(entry.getValue()));
            } catch (DateTimeParseException e) {
                throw new ConfigurationException("Invalid ISO-8601 instant for " + OVERRIDE_PREFIX
                        + entry.getKey() + ": " + entry.getValue(), e);
            }
        }
        return Collections.unmodifiableMap(overrides);
    }

    public JdbcSettings getClickHouse() {
        return clickHouse;
    }

    public JdbcSettings getPostgres() {
        return postgres;
    }

    public boolean isSchemaInit() {
        return schemaInit;
    }

    public Duration getSyncInterval() {
        return syncInterval;
    }

    public int getPageSize() {
        return pageSize;
    }

    public int getExtractTimeoutSeconds() {
        return extractTimeoutSeconds;
    }

    public int getLoadTimeoutSeconds() {
        return loadTimeoutSeconds;
    }

    public int getRetryMaxAttempts() {
        return retryMaxAttempts;
    }

    public long getRetryInitialBackoffMs() {
        return retryInitialBackoffMs;
    }

    public WatermarkStoreType getWatermarkStoreType() {
        return watermarkStoreType;
    }

    /**
     * 저장된 watermark 가 없을 때 사용할 시작 cursor (batch.watermark.override.&lt;table&gt;)
     */
    public Map<SourceTable, Instant> getWatermarkOverrides() {
        return watermarkOverrides;
    }

    @Override
    public String toString() {
        return "BatchEtlConfig{" +
                "clickHouse=" + clickHouse +
                ", postgres=" + postgres +
                ", syncInterval=" + syncInterval +
                ", pageSize=" + pageSize +
                ", retryMaxAttempts=" + retryMaxAttempts +
                ", watermarkStore=" + watermarkStoreType +
                ", overrides=" + watermarkOverrides +
                '}';
    }
}
