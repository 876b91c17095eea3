package com.adtech.common.error;

/**
 * Source(PostgreSQL) 또는 Destination(ClickHouse) 연결 실패, 타임아웃
 * backoff 후 재시도하며, 재시도가 모두 실패하면 이번 주기만 FAILED 처리합니다.
 */
public class ConnectionException extends SyncException {
    private static final long serialVersionUID = 1L;

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}
