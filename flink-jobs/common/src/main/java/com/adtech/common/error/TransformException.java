package com.adtech.common.error;

/**
 * Source row 를 분석용 row 로 변환할 수 없음 (id 누락, 숫자/날짜 형식 오류 등)
 */
public class TransformException extends SyncException {
    private static final long serialVersionUID = 1L;

    public TransformException(String message) {
        super(message);
    }

    public TransformException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
