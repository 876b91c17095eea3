package com.adtech.common.jdbc;

import com.adtech.common.config.ConfigLoader;

import java.io.Serializable;
import java.util.Objects;

/**
 * JDBC 접속 정보 (ClickHouse / PostgreSQL 공용)
 * Flink 함수로 전달될 수 있도록 Serializable 입니다.
 */
public final class JdbcSettings implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String CLICKHOUSE_DRIVER = "com.clickhouse.jdbc.ClickHouseDriver";
    public static final String POSTGRES_DRIVER = "org.postgresql.Driver";

    private final String url;
    private final String driver;
    private final String username;
    private final String password;

    public JdbcSettings(String url, String driver, String username, String password) {
        this.url = Objects.requireNonNull(url, "url");
        this.driver = driver;
        this.username = username;
        this.password = password;
    }

    /**
     * clickhouse.url / clickhouse.driver / clickhouse.username / clickhouse.password
     */
    public static JdbcSettings clickHouse(ConfigLoader config) {
        return new JdbcSettings(
                config.require("clickhouse.url"),
                config.get("clickhouse.driver", CLICKHOUSE_DRIVER),
                config.get("clickhouse.username", "default"),
                config.get("clickhouse.password", ""));
    }

    /**
     * postgres.url / postgres.username / postgres.password
     */
    public static JdbcSettings postgres(ConfigLoader config) {
        return new JdbcSettings(
                config.require("postgres.url"),
                config.get("postgres.driver", POSTGRES_DRIVER),
                config.get("postgres.username"),
                config.get("postgres.password"));
    }

    public String getUrl() {
        return url;
    }

    public String getDriver() {
        return driver;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public String toString() {
        // password 는 로그에 남기지 않음
        return "JdbcSettings{url='" + url + "', username='" + username + "'}";
    }
}
