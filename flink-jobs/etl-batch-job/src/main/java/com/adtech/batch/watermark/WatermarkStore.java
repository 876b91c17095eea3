package com.adtech.batch.watermark;

import com.adtech.common.error.SyncException;
import com.adtech.common.model.SourceTable;

import java.time.Instant;

/**
 * 테이블별 Batch 동기화 진행 위치(watermark) 저장소
 * <p>
 * 테이블당 writer 는 Batch Orchestrator 하나뿐입니다.
 * watermark 는 단조 증가하며, 더 작은 cursor 로의 {@link #set} 은 무시됩니다.
 */
public interface WatermarkStore {

    /**
     * @return 마지막으로 확정된 cursor, 없으면 null (전체 초기 적재)
     */
    Instant get(SourceTable table) throws SyncException;

    /**
     * 적재가 확정된 뒤에만 호출합니다.
     */
    void set(SourceTable table, Instant cursor) throws SyncException;
}
