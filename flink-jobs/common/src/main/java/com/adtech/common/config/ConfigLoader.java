package com.adtech.common.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Properties 파일을 읽어서 설정 값을 제공하는 공통 유틸리티 클래스
 * Batch ETL Job, Flink Sync Job 모두 이 클래스를 통해 설정을 읽습니다.
 * <p>
 * 환경 변수가 같은 이름(대문자, '.' → '_')으로 정의되어 있으면 properties 값보다 우선합니다.
 * 예: {@code kafka.bootstrap.servers} ⇔ {@code KAFKA_BOOTSTRAP_SERVERS}
 */
public class ConfigLoader {

    public static final String CONFIG_FILE = "application.properties";

    private final Properties properties;
    private final Map<String, String> environment;

    public ConfigLoader(Properties properties, Map<String, String> environment) {
        this.properties = properties;
        this.environment = environment != null ? environment : Collections.emptyMap();
    }

    /**
     * 클래스패스의 application.properties 파일과 시스템 환경 변수로 ConfigLoader를 생성합니다.
     */
    public static ConfigLoader fromClasspath() {
        return fromClasspath(CONFIG_FILE);
    }

    public static ConfigLoader fromClasspath(String resource) {
        return new ConfigLoader(loadProperties(resource), System.getenv());
    }

    static Properties loadProperties(String resource) {
        Properties properties = new Properties();
        try (InputStream input = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new ConfigurationException("Unable to find " + resource);
            }
            properties.load(input);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from " + resource, e);
        }
        return properties;
    }

    /**
     * 설정 값을 가져옵니다.
     *
     * @param key 설정 키
     * @return 설정 값 (없으면 null)
     */
    public String get(String key) {
        String fromEnv = environment.get(toEnvironmentKey(key));
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv.trim();
        }
        String value = properties.getProperty(key);
        return value != null && !value.isBlank() ? value.trim() : null;
    }

    /**
     * 설정 값을 가져오며, 값이 없으면 기본값을 반환합니다.
     */
    public String get(String key, String defaultValue) {
        String value = get(key);
        return value != null ? value : defaultValue;
    }

    /**
     * 필수 설정 값을 가져옵니다. 값이 없으면 기동을 중단합니다.
     *
     * @throws ConfigurationException 설정이 없는 경우
     */
    public String require(String key) {
        String value = get(key);
        if (value == null) {
            throw new ConfigurationException("Missing required setting: " + key
                    + " (env " + toEnvironmentKey(key) + ")");
        }
        return value;
    }

    public int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Setting " + key + " is not an integer: " + value, e);
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Setting " + key + " is not a long: " + value, e);
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = get(key);
        return value != null ? Boolean.parseBoolean(value) : defaultValue;
    }

    /**
     * 주어진 prefix로 시작하는 모든 설정을 prefix를 제거한 키로 반환합니다.
     * (예: batch.watermark.override.campaign → campaign)
     * <p>
     * 환경 변수 오버라이드는 properties에 키가 선언된 경우에만 적용됩니다.
     */
    public Map<String, String> getWithPrefix(String prefix) {
        Map<String, String> result = new TreeMap<>();
        for (String name : properties.stringPropertyNames()) {
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                String value = get(name);
                if (value != null) {
                    result.put(name.substring(prefix.length()), value);
                }
            }
        }
        return result;
    }

    static String toEnvironmentKey(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }
}
