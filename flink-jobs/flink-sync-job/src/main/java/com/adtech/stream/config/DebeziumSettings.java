package com.adtech.stream.config;

import com.adtech.common.config.ConfigLoader;

import com.adtech.common.config.ConfigurationException;

import java.io.Serializable;
import java.time.Duration;

/**
 * Kafka Connect 에 등록할 Debezium PostgreSQL connector 설정 (debezium.*)
 * <p>
 * 등록하는 connector 는 time.precision.mode=connect 를 사용하므로 timestamp 컬럼이 epoch millis 로 옵니다.
 * 이 Job 밖에서 직접 등록한 connector 가 기본값(adaptive, timestamp 를 epoch micros 로 전송)을 쓰면
 * 숫자 timestamp 가 millis 로 해석되어 먼 미래 날짜가 되므로, 반드시 같은 모드로 등록해야 합니다.
 */
public class DebeziumSettings implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_CONNECTOR_NAME = "adtech-postgres-connector";
    public static final int DEFAULT_WAIT_ATTEMPTS = 30;
    public static final Duration DEFAULT_WAIT_INTERVAL = Duration.ofSeconds(10);

    private final String connectUrl;
    private final String connectorName;
    private final String hostname;
    private final int port;
    private final String user;
    private final String password;
    private final String dbname;
    private final String topicPrefix;
    private final int waitAttempts;
    private final Duration waitInterval;

    public DebeziumSettings(String connectUrl, String connectorName, String hostname, int port,
                            String user, String password, String dbname, String topicPrefix) {
        this(connectUrl, connectorName, hostname, port, user, password, dbname, topicPrefix,
                DEFAULT_WAIT_ATTEMPTS, DEFAULT_WAIT_INTERVAL);
    }

    /**
     * @param waitAttempts Kafka Connect 가 응답할 때까지 등록을 시도할 횟수
     * @param waitInterval 시도 간격
     */
    public DebeziumSettings(String connectUrl, String connectorName, String hostname, int port,
                            String user, String password, String dbname, String topicPrefix,
                            int waitAttempts, Duration waitInterval) {
        this.connectUrl = stripTrailingSlash(connectUrl);
        this.connectorName = connectorName;
        this.hostname = hostname;
        this.port = port;
        this.user = user;
        this.password = password;
        this.dbname = dbname;
        this.topicPrefix = topicPrefix;
        this.waitAttempts = waitAttempts;
        this.waitInterval = waitInterval;
    }

    /**
     * @return debezium.connect.url 이 없으면 null (connector 등록 생략)
     */
    static DebeziumSettings from(ConfigLoader config, String topicPrefix) {
        String connectUrl = config.get("debezium.connect.url");
        if (connectUrl == null) {
            return null;
        }
        int waitAttempts = config.getInt("debezium.wait.attempts", DEFAULT_WAIT_ATTEMPTS);
        long waitIntervalSeconds = config.getLong("debezium.wait.interval.seconds",
                DEFAULT_WAIT_INTERVAL.getSeconds());
        if (waitAttempts < 1) {
            throw new ConfigurationException("debezium.wait.attempts must be positive: " + waitAttempts);
        }
        if (waitIntervalSeconds < 1) {
            throw new ConfigurationException("debezium.wait.interval.seconds must be positive: " + waitIntervalSeconds);
        }
        return new DebeziumSettings(
                connectUrl,
                config.get("debezium.connector.name", DEFAULT_CONNECTOR_NAME),
                config.require("debezium.database.hostname"),
                config.getInt("debezium.database.port", 5432),
                config.require("debezium.database.user"),
                config.get("debezium.database.password", ""),
                config.require("debezium.database.dbname"),
                topicPrefix,
                waitAttempts,
                Duration.ofSeconds(waitIntervalSeconds));
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public String getConnectUrl() {
        return connectUrl;
    }

    public String getConnectorName() {
        return connectorName;
    }

    public String getHostname() {
        return hostname;
    }

    public int getPort() {
        return port;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        return password;
    }

    public String getDbname() {
        return dbname;
    }

    public String getTopicPrefix() {
        return topicPrefix;
    }

    public int getWaitAttempts() {
        return waitAttempts;
    }

    public Duration getWaitInterval() {
        return waitInterval;
    }
}
