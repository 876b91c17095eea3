package com.adtech.batch.load;

import com.adtech.common.error.SyncException;
import com.adtech.common.model.AnalyticalTable;
import com.adtech.common.transform.AnalyticalRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * 변환된 페이지를 분석 테이블에 append 합니다 (UPDATE / DELETE 없음).
 * 성공 시에만 {@link LoadResult} 를 반환하며, 실패하면 예외가 그대로 전파되어 watermark 가 보류됩니다.
 */
public class BatchLoader {

    private static final Logger LOG = LoggerFactory.getLogger(BatchLoader.class);

    private final RowWriter writer;

    public BatchLoader(RowWriter writer) {
        this.writer = writer;
    }

    /**
     * @param pageCursor 이 페이지가 적재되면 확정할 수 있는 원본 cursor (microsecond 정밀도, 없으면 null)
     * @return 적재 행 수와 확정된 cursor. 원본 정밀도를 유지해야 하므로 행의 millisecond cursor 를 쓰지 않습니다.
     */
    public LoadResult load(AnalyticalTable table, List<AnalyticalRow> rows, Instant pageCursor) throws SyncException {
        if (rows.isEmpty()) {
            return LoadResult.empty();
        }
        for (AnalyticalRow row : rows) {
            if (row.getTable() != table) {
                throw new IllegalArgumentException("Row for " + row.getTable() + " in a " + table + " batch");
            }
        }

        writer.write(table, rows);

        LOG.debug("적재 완료: table={}, rows={}, cursor={}", table.getTableName(), rows.size(), pageCursor);
        return new LoadResult(rows.size(), pageCursor);
    }
}
