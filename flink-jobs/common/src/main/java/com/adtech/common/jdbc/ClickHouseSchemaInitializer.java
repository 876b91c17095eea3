package com.adtech.common.jdbc;

import com.adtech.common.config.ConfigurationException;
import com.adtech.common.error.SyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * ClickHouse 분석 스키마 초기화 (CREATE ... IF NOT EXISTS)
 * 클래스패스의 {@code clickhouse/schema.sql} 을 문장 단위로 실행합니다.
 */
public class ClickHouseSchemaInitializer {

    private static final Logger LOG = LoggerFactory.getLogger(ClickHouseSchemaInitializer.class);

    public static final String SCHEMA_RESOURCE = "clickhouse/schema.sql";

    private final JdbcConnectionFactory connectionFactory;
    private final String resource;

    public ClickHouseSchemaInitializer(JdbcConnectionFactory connectionFactory) {
        this(connectionFactory, SCHEMA_RESOURCE);
    }

    public ClickHouseSchemaInitializer(JdbcConnectionFactory connectionFactory, String resource) {
        this.connectionFactory = connectionFactory;
        this.resource = resource;
    }

    public void initialize() throws SyncException {
        List<String> statements = loadStatements(resource);
        try (Connection connection = connectionFactory.open();
             Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        } catch (SQLException e) {
            throw SqlErrors.onWrite("Schema initialization failed", e);
        }
        LOG.info("✅ ClickHouse 스키마 초기화 완료: {} statements", statements.size());
    }

    /**
     * SQL 파일을 ';' 기준으로 나눕니다. '--' 로 시작하는 줄은 주석으로 제외합니다.
     */
    static List<String> loadStatements(String resource) {
        InputStream input = ClickHouseSchemaInitializer.class.getClassLoader().getResourceAsStream(resource);
        if (input == null) {
            throw new ConfigurationException("Unable to find " + resource);
        }

        List<String> statements = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("--")) {
                    continue;
                }
                current.append(line).append('\n');
                if (trimmed.endsWith(";")) {
                    String sql = current.toString().trim();
                    statements.add(sql.substring(0, sql.length() - 1).trim());
                    current.setLength(0);
                }
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + resource, e);
        }
        if (current.toString().trim().length() > 0) {
            statements.add(current.toString().trim());
        }
        return statements;
    }
}
