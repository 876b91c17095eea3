package com.adtech.common.error;

/**
 * ClickHouse 쓰기 거부 (부분 또는 전체). 배치는 어느 행도 확정되지 않은 것으로 취급하고
 * watermark / offset 을 전진시키지 않습니다.
 * 같은 배치를 바로 다시 보내도 같은 이유로 거부되므로 단계 안에서 재시도하지 않고 다음 주기에 replay 합니다.
 */
public class WriteException extends SyncException {
    private static final long serialVersionUID = 1L;

    public WriteException(String message) {
        super(message);
    }

    public WriteException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
