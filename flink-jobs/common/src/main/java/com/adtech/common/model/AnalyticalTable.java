package com.adtech.common.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * ClickHouse 분석 테이블 정의
 * <p>
 * 모든 테이블은 ReplacingMergeTree(sync_version, is_deleted) 엔진을 사용합니다.
 * 두 파이프라인(Batch / Stream)은 INSERT 만 수행하고, 중복 버전 정리는 ClickHouse merge 에 맡깁니다.
 * 컬럼 순서는 {@code AnalyticalRow#bind} 의 바인딩 순서와 일치해야 합니다.
 */
public enum AnalyticalTable {

    DIM_ADVERTISER("dim_advertiser", TableKind.DIMENSION,
            "advertiser_id", "name", "updated_at", "created_at", "is_deleted", "sync_version"),

    DIM_CAMPAIGN("dim_campaign", TableKind.DIMENSION,
            "campaign_id", "name", "bid", "budget", "start_date", "end_date", "advertiser_id",
            "updated_at", "created_at", "is_deleted", "sync_version"),

    FACT_IMPRESSIONS("fact_impressions", TableKind.FACT,
            "impression_id", "campaign_id", "event_date", "event_time", "created_at", "is_deleted", "sync_version"),

    FACT_CLICKS("fact_clicks", TableKind.FACT,
            "click_id", "campaign_id", "event_date", "event_time", "created_at", "is_deleted", "sync_version");

    private final String tableName;
    private final TableKind kind;
    private final List<String> columns;

    AnalyticalTable(String tableName, TableKind kind, String... columns) {
        this.tableName = tableName;
        this.kind = kind;
        this.columns = Collections.unmodifiableList(Arrays.asList(columns));
    }

    public String getTableName() {
        return tableName;
    }

    public TableKind getKind() {
        return kind;
    }

    public List<String> getColumns() {
        return columns;
    }

    public String getIdColumn() {
        return columns.get(0);
    }

    /**
     * Batch Loader 와 Stream Sink 가 공유하는 INSERT 문
     */
    public String insertSql() {
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + tableName + " (" + String.join(", ", columns) + ") VALUES (" + placeholders + ")";
    }
}
