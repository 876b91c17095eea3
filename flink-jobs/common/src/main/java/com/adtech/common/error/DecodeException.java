package com.adtech.common.error;

/**
 * 잘못된 CDC 메시지 (truncated JSON, 알 수 없는 op, row image 누락 등)
 * 같은 메시지를 다시 읽어도 결과가 같으므로 재시도하지 않습니다.
 */
public class DecodeException extends SyncException {
    private static final long serialVersionUID = 1L;

    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}
