package com.adtech.stream.process;

import com.adtech.common.model.AnalyticalTable;
import com.adtech.common.model.SourceTable;

import java.io.Serializable;
import java.util.Objects;

/**
 * 토픽 → (원본 테이블, 분석 테이블) 바인딩
 */
public final class TableBinding implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String topic;
    private final SourceTable source;

    public TableBinding(String topic, SourceTable source) {
        this.topic = Objects.requireNonNull(topic, "topic");
        this.source = Objects.requireNonNull(source, "source");
    }

    public String getTopic() {
        return topic;
    }

    public SourceTable getSource() {
        return source;
    }

    public AnalyticalTable getTarget() {
        return source.getTarget();
    }

    /**
     * operator uid / name 에 사용하는 이름 (예: "campaign")
     */
    public String getName() {
        return source.getTableName();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TableBinding)) {
            return false;
        }
        TableBinding that = (TableBinding) o;
        return topic.equals(that.topic) && source == that.source;
    }

    @Override
    public int hashCode() {
        return Objects.hash(topic, source);
    }

    @Override
    public String toString() {
        return topic + " → " + source.getTableName() + " → " + getTarget().getTableName();
    }
}
