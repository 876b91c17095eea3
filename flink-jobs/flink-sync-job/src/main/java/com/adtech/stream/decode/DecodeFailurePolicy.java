package com.adtech.stream.decode;

import com.adtech.common.config.ConfigurationException;

import java.util.Locale;

/**
 * 디코딩(또는 변환)에 실패한 메시지 처리 방식. 기동 시 한 번 결정됩니다.
 */
public enum DecodeFailurePolicy {
    /** 예외로 task 를 실패시킴. offset 이 확정되지 않으므로 해당 파티션은 더 진행하지 않습니다. */
    HALT,
    /** 원본 메시지와 오류를 dead letter 토픽으로 보내고 다음 메시지로 진행 */
    DEAD_LETTER;

    public static DecodeFailurePolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return HALT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown decode failure policy: " + value
                    + " (expected HALT or DEAD_LETTER)", e);
        }
    }
}
