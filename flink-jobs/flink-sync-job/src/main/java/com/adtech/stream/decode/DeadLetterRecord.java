package com.adtech.stream.decode;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * dead letter 토픽으로 보내는 레코드
 *
 * <pre>
 * {
 *   "topic": "postgres.public.campaign",
 *   "partition": 0,
 *   "offset": 42,
 *   "table": "campaign",
 *   "error": "DecodeException: Unknown op 'x'",
 *   "payload": "{...원본 메시지...}",
 *   "failed_at": "2024-01-01T00:00:00.123Z"
 * }
 * </pre>
 */
public class DeadLetterRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    @JsonProperty("topic")
    private String topic;

    @JsonProperty("partition")
    private int partition;

    @JsonProperty("offset")
    private long offset;

    @JsonProperty("table")
    private String table;

    @JsonProperty("error")
    private String error;

    @JsonProperty("payload")
    private String payload;

    @JsonProperty("failed_at")
    private Instant failedAt;

    public DeadLetterRecord() {
    }

    public static DeadLetterRecord of(RawChangeMessage message, String table, Exception error, Instant failedAt) {
        DeadLetterRecord record = new DeadLetterRecord();
        record.setTopic(message.getTopic());
        record.setPartition(message.getPartition());
        record.setOffset(message.getOffset());
        record.setTable(table);
        record.setError(error.getClass().getSimpleName() + ": " + error.getMessage());
        record.setPayload(message.getValue() != null
                ? new String(message.getValue(), StandardCharsets.UTF_8)
                : null);
        record.setFailedAt(failedAt);
        return record;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public int getPartition() {
        return partition;
    }

    public void setPartition(int partition) {
        this.partition = partition;
    }

    public long getOffset() {
        return offset;
    }

    public void setOffset(long offset) {
        this.offset = offset;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(Instant failedAt) {
        this.failedAt = failedAt;
    }

    @Override
    public String toString() {
        return "DeadLetterRecord{" +
                "topic='" + topic + '\'' +
                ", partition=" + partition +
                ", offset=" + offset +
                ", error='" + error + '\'' +
                '}';
    }
}
