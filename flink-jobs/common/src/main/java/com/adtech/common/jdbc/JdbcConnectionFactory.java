package com.adtech.common.jdbc;

import com.adtech.common.error.ConnectionException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * {@link JdbcSettings} 로 커넥션을 여는 팩토리
 * 연결 실패는 모두 재시도 가능한 {@link ConnectionException} 으로 변환됩니다.
 */
public class JdbcConnectionFactory {

    private final JdbcSettings settings;

    public JdbcConnectionFactory(JdbcSettings settings) {
        this.settings = settings;
    }

    public Connection open() throws ConnectionException {
        try {
            if (settings.getDriver() != null) {
                Class.forName(settings.getDriver());
            }
            return DriverManager.getConnection(settings.getUrl(), settings.getUsername(), settings.getPassword());
        } catch (ClassNotFoundException e) {
            throw new ConnectionException("JDBC driver not found: " + settings.getDriver(), e);
        } catch (SQLException e) {
            throw new ConnectionException("Unable to connect to " + settings.getUrl(), e);
        }
    }

    public JdbcSettings getSettings() {
        return settings;
    }
}
