package com.adtech.stream.decode;

import java.io.Serializable;

/**
 * Kafka 에서 읽은 원본 CDC 메시지
 * 디코딩 실패 시 dead letter 로 원본을 그대로 보낼 수 있도록 topic / partition / offset 과 bytes 를 보존합니다.
 */
public class RawChangeMessage implements Serializable {
    private static final long serialVersionUID = 1L;

    private String topic;
    private int partition;
    private long offset;
    private byte[] value;

    public RawChangeMessage() {
    }

    public RawChangeMessage(String topic, int partition, long offset, byte[] value) {
        this.topic = topic;
        this.partition = partition;
        this.offset = offset;
        this.value = value;
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

    public byte[] getValue() {
        return value;
    }

    public void setValue(byte[] value) {
        this.value = value;
    }

    @Override
    public String toString() {
        return "RawChangeMessage{" +
                "topic='" + topic + '\'' +
                ", partition=" + partition +
                ", offset=" + offset +
                ", bytes=" + (value != null ? value.length : 0) +
                '}';
    }
}
