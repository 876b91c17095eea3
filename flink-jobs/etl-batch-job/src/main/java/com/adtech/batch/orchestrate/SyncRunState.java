package com.adtech.batch.orchestrate;

/**
 * 테이블 한 번의 동기화 실행 상태
 * <pre>
 * IDLE → EXTRACTING → TRANSFORMING → LOADING → COMMITTING → (다음 페이지: EXTRACTING | 완료: IDLE)
 * 어느 단계에서든 → FAILED (watermark 변경 없음, 다음 주기에 재시도)
 * </pre>
 */
public enum SyncRunState {
    IDLE,
    EXTRACTING,
    TRANSFORMING,
    LOADING,
    COMMITTING,
    FAILED
}
