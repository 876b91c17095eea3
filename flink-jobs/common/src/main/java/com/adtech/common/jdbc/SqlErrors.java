package com.adtech.common.jdbc;

import com.adtech.common.error.ConnectionException;
import com.adtech.common.error.SyncException;
import com.adtech.common.error.WriteException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;

/**
 * SQLException 분류
 * <ul>
 *   <li>SQLState class "08" (connection exception), {@link SQLTransientException}, {@link SQLTimeoutException}
 *       → {@link ConnectionException}</li>
 *   <li>그 외 쓰기 중 발생한 오류 → {@link WriteException}</li>
 * </ul>
 */
public final class SqlErrors {

    private SqlErrors() {
    }

    public static boolean isConnectionFailure(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLTransientException || t instanceof SQLTimeoutException) {
                return true;
            }
            if (t instanceof SQLException) {
                String state = ((SQLException) t).getSQLState();
                if (state != null && state.startsWith("08")) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * 읽기(extract) 단계 오류. 원본 조회 실패는 종류와 관계없이 재시도 대상입니다.
     */
    public static ConnectionException onRead(String context, SQLException e) {
        return new ConnectionException(context + ": " + e.getMessage(), e);
    }

    /**
     * 쓰기(load) 단계 오류 분류
     */
    public static SyncException onWrite(String context, SQLException e) {
        if (isConnectionFailure(e)) {
            return new ConnectionException(context + ": " + e.getMessage(), e);
        }
        return new WriteException(context + ": " + e.getMessage(), e);
    }
}
