package com.adtech.common.error;

/**
 * 동기화 파이프라인(Batch / Stream) 공통 예외
 * <p>
 * 모든 쓰기가 버전이 붙은 append 이므로 실패한 구간은 다음 주기(또는 재시작 후) 다시 처리(replay)하면 복구됩니다.
 * {@link #isRetriable()}가 true인 실패는 일시적인 장애로 보고 같은 단계 안에서 backoff 후 바로 재시도합니다.
 */
public abstract class SyncException extends Exception {
    private static final long serialVersionUID = 1L;

    protected SyncException(String message) {
        super(message);
    }

    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return 같은 단계 안에서 즉시 재시도할 가치가 있으면 true (연결 끊김, 타임아웃)
     */
    public abstract boolean isRetriable();
}
