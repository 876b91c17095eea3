package com.adtech.batch.watermark;

import com.adtech.common.model.SourceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 메모리 watermark 저장소. 재시작하면 전체 재적재부터 시작합니다.
 * (버전이 붙은 append 이므로 재적재는 결과를 바꾸지 않습니다)
 */
public class InMemoryWatermarkStore implements WatermarkStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryWatermarkStore.class);

    private final Map<SourceTable, Instant> cursors = new ConcurrentHashMap<>();

    @Override
    public Instant get(SourceTable table) {
        return cursors.get(table);
    }

    @Override
    public void set(SourceTable table, Instant cursor) {
        Instant current = cursors.merge(table, cursor, (old, candidate) -> candidate.isAfter(old) ? candidate : old);
        if (!current.equals(cursor)) {
            LOG.warn("⚠️  Watermark 역행 요청 무시: table={}, current={}, requested={}",
                    table.getTableName(), current, cursor);
        }
    }
}
