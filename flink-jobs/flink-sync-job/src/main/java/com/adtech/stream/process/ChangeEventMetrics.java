package com.adtech.stream.process;

import com.adtech.stream.decode.ChangeOperation;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.MetricGroup;

/**
 * 테이블별 CDC 처리 카운터 (Flink metric group: table=&lt;이름&gt;)
 * <ul>
 *   <li>processed: 수신한 메시지</li>
 *   <li>inserted / updated / deleted: 분석 row 로 내보낸 이벤트</li>
 *   <li>ignored: 변환 결과가 없는 이벤트 (fact update)</li>
 *   <li>errors: 디코딩 / 변환 실패</li>
 * </ul>
 */
public class ChangeEventMetrics {

    private final Counter processed;
    private final Counter inserted;
    private final Counter updated;
    private final Counter deleted;
    private final Counter ignored;
    private final Counter errors;

    ChangeEventMetrics(MetricGroup operatorGroup, String table) {
        MetricGroup group = operatorGroup.addGroup("table", table);
        this.processed = group.counter("processed");
        this.inserted = group.counter("inserted");
        this.updated = group.counter("updated");
        this.deleted = group.counter("deleted");
        this.ignored = group.counter("ignored");
        this.errors = group.counter("errors");
    }

    void received() {
        processed.inc();
    }

    void emitted(ChangeOperation operation) {
        switch (operation) {
            case CREATE:
                inserted.inc();
                break;
            case UPDATE:
                updated.inc();
                break;
            case DELETE:
                deleted.inc();
                break;
            default:
                break;
        }
    }

    void skipped() {
        ignored.inc();
    }

    void failed() {
        errors.inc();
    }

    public long getProcessed() {
        return processed.getCount();
    }

    public long getInserted() {
        return inserted.getCount();
    }

    public long getUpdated() {
        return updated.getCount();
    }

    public long getDeleted() {
        return deleted.getCount();
    }

    public long getIgnored() {
        return ignored.getCount();
    }

    public long getErrors() {
        return errors.getCount();
    }

    @Override
    public String toString() {
        return "processed=" + getProcessed() + ", inserted=" + getInserted() + ", updated=" + getUpdated()
                + ", deleted=" + getDeleted() + ", ignored=" + getIgnored() + ", errors=" + getErrors();
    }
}
