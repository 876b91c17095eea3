package com.adtech.batch.load;

import com.adtech.common.error.SyncException;
import com.adtech.common.model.AnalyticalTable;
import com.adtech.common.transform.AnalyticalRow;

import java.util.List;

/**
 * 분석 테이블 쓰기. 한 번의 호출이 하나의 논리 단위이며, 예외가 나면 어느 행도 확정되지 않은 것으로 봅니다.
 */
public interface RowWriter {

    void write(AnalyticalTable table, List<AnalyticalRow> rows) throws SyncException;
}
