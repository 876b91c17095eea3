package com.adtech.stream.sink;

import com.adtech.common.jdbc.JdbcSettings;
import com.adtech.common.model.AnalyticalTable;
import com.adtech.common.transform.AnalyticalRow;
import org.apache.flink.connector.jdbc.JdbcConnectionOptions;
import org.apache.flink.connector.jdbc.JdbcExecutionOptions;
import org.apache.flink.connector.jdbc.JdbcSink;
import org.apache.flink.streaming.api.functions.sink.SinkFunction;

/**
 * ClickHouse Sink 설정
 * ReplacingMergeTree 이므로 INSERT 만 수행 (UPDATE/DELETE 없음).
 * 같은 버전이 다시 들어와도 merge 시 하나로 합쳐지므로 재전달된 이벤트를 다시 써도 안전합니다.
 */
public class ClickHouseSink {

    private ClickHouseSink() {
    }

    /**
     * 분석 테이블 하나를 위한 ClickHouse Sink 생성
     * <p>
     * 이벤트마다 바로 쓰고(batch size 1), maxRetries 회 재시도 후에도 실패하면 task 가 실패하여
     * 마지막 checkpoint 부터 다시 읽습니다.
     */
    public static SinkFunction<AnalyticalRow> createSink(AnalyticalTable table, JdbcSettings clickHouse, int maxRetries) {
        return JdbcSink.sink(
                table.insertSql(),
                new AnalyticalRowStatementBuilder(table),
                executionOptions(maxRetries),
                connectionOptions(clickHouse)
        );
    }

    static JdbcExecutionOptions executionOptions(int maxRetries) {
        return JdbcExecutionOptions.builder()
                                   .withBatchSize(1)
                                   .withBatchIntervalMs(0)
                                   .withMaxRetries(maxRetries)
                                   .build();
    }

    static JdbcConnectionOptions connectionOptions(JdbcSettings clickHouse) {
        return new JdbcConnectionOptions.JdbcConnectionOptionsBuilder()
                .withUrl(clickHouse.getUrl())
                .withDriverName(clickHouse.getDriver())
                .withUsername(clickHouse.getUsername())
                .withPassword(clickHouse.getPassword())
                .build();
    }
}
