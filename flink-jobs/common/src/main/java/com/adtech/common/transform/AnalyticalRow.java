package com.adtech.common.transform;

import com.adtech.common.model.AnalyticalTable;

import java.io.Serializable;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;

/**
 * ClickHouse 분석 테이블에 append 되는 한 행 (한 버전)
 * Batch Loader, Stream Sink 모두 이 인터페이스로 행을 씁니다.
 */
public interface AnalyticalRow extends Serializable {

    AnalyticalTable getTable();

    /**
     * 엔티티 / 이벤트 id (ReplacingMergeTree 정렬 키의 구성 요소)
     */
    long getEntityId();

    /**
     * 원본 cursor 컬럼 값 (dimension: updated_at, fact: created_at)
     * Batch Loader 가 확정한 최대 cursor 를 계산할 때 사용합니다.
     */
    Instant getCursor();

    /**
     * ReplacingMergeTree 버전 컬럼 (epoch millis). 같은 id 중 가장 큰 버전이 현재 상태입니다.
     */
    long getSyncVersion();

    /**
     * 논리 삭제 마커(tombstone) 여부
     */
    boolean isDeleted();

    /**
     * {@link AnalyticalTable#getColumns()} 순서대로 PreparedStatement 에 값을 바인딩합니다.
     */
    void bind(PreparedStatement ps) throws SQLException;
}
