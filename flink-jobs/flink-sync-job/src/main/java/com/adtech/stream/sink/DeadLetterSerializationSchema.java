package com.adtech.stream.sink;

import com.adtech.stream.decode.DeadLetterRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.apache.flink.api.common.serialization.SerializationSchema;

/**
 * DeadLetterRecord → JSON bytes (failed_at 은 ISO-8601 문자열)
 */
public class DeadLetterSerializationSchema implements SerializationSchema<DeadLetterRecord> {
    private static final long serialVersionUID = 1L;

    private static final ObjectMapper objectMapper;

    static {
        objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public byte[] serialize(DeadLetterRecord record) {
        try {
            return objectMapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize dead letter record " + record, e);
        }
    }
}
