package com.adtech.common.model;

/**
 * Source 컬럼 타입. JDBC 추출 시 ResultSet 에서 어떤 Java 타입으로 읽을지 결정합니다.
 */
public enum ColumnType {
    BIGINT,
    STRING,
    DECIMAL,
    DATE,
    TIMESTAMP
}
