package com.adtech.common.config;

/**
 * 필수 설정 누락 또는 잘못된 설정 값. 기동 시점에 발생하며 프로세스를 시작하지 않습니다.
 */
public class ConfigurationException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
