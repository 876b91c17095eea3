package com.adtech.batch.extract;

import com.adtech.common.error.SyncException;
import com.adtech.common.model.SourceTable;

import java.time.Instant;

/**
 * 원본 테이블에서 cursor 컬럼이 watermark 보다 큰 행을 (cursor, id) 오름차순으로 페이지 단위로 읽습니다.
 */
public interface IncrementalExtractor {

    /**
     * @param watermark 확정된 watermark (null 이면 전체 초기 적재)
     * @param after     직전 페이지의 마지막 위치 (첫 페이지면 null)
     * @param pageSize  최대 행 수
     */
    ExtractionPage fetchPage(SourceTable table, Instant watermark, PageKey after, int pageSize)
            throws SyncException;
}
