package com.adtech.common.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static com.adtech.common.model.ColumnType.BIGINT;
import static com.adtech.common.model.ColumnType.DATE;
import static com.adtech.common.model.ColumnType.DECIMAL;
import static com.adtech.common.model.ColumnType.STRING;
import static com.adtech.common.model.ColumnType.TIMESTAMP;
import static com.adtech.common.model.SourceColumn.of;

/**
 * PostgreSQL 원본 테이블 정의
 * <p>
 * 선언 순서가 Batch 동기화 순서입니다 (dimension → fact).
 * fact 행이 참조하는 advertiser / campaign 이 조회 시점에 dimension 테이블에 존재하도록 합니다.
 */
public enum SourceTable {

    ADVERTISER("advertiser", TableKind.DIMENSION, "updated_at", AnalyticalTable.DIM_ADVERTISER,
            of("id", BIGINT),
            of("name", STRING),
            of("updated_at", TIMESTAMP),
            of("created_at", TIMESTAMP)),

    CAMPAIGN("campaign", TableKind.DIMENSION, "updated_at", AnalyticalTable.DIM_CAMPAIGN,
            of("id", BIGINT),
            of("name", STRING),
            of("bid", DECIMAL),
            of("budget", DECIMAL),
            of("start_date", DATE),
            of("end_date", DATE),
            of("advertiser_id", BIGINT),
            of("updated_at", TIMESTAMP),
            of("created_at", TIMESTAMP)),

    IMPRESSIONS("impressions", TableKind.FACT, "created_at", AnalyticalTable.FACT_IMPRESSIONS,
            of("id", BIGINT),
            of("campaign_id", BIGINT),
            of("created_at", TIMESTAMP)),

    CLICKS("clicks", TableKind.FACT, "created_at", AnalyticalTable.FACT_CLICKS,
            of("id", BIGINT),
            of("campaign_id", BIGINT),
            of("created_at", TIMESTAMP));

    public static final String ID_COLUMN = "id";

    private final String tableName;
    private final TableKind kind;
    private final String cursorColumn;
    private final AnalyticalTable target;
    private final List<SourceColumn> columns;

    SourceTable(String tableName, TableKind kind, String cursorColumn, AnalyticalTable target,
                SourceColumn... columns) {
        this.tableName = tableName;
        this.kind = kind;
        this.cursorColumn = cursorColumn;
        this.target = target;
        this.columns = Collections.unmodifiableList(Arrays.asList(columns));
    }

    public String getTableName() {
        return tableName;
    }

    public TableKind getKind() {
        return kind;
    }

    public boolean isDimension() {
        return kind == TableKind.DIMENSION;
    }

    /**
     * watermark 로 사용하는 단조 증가 컬럼 (dimension: updated_at, fact: created_at)
     */
    public String getCursorColumn() {
        return cursorColumn;
    }

    public AnalyticalTable getTarget() {
        return target;
    }

    public List<SourceColumn> getColumns() {
        return columns;
    }

    public static Optional<SourceTable> fromTableName(String tableName) {
        if (tableName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                     .filter(t -> t.tableName.equalsIgnoreCase(tableName))
                     .findFirst();
    }
}
