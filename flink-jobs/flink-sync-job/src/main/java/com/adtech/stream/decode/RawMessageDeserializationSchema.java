package com.adtech.stream.decode;

import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.connector.kafka.source.reader.deserializer.KafkaRecordDeserializationSchema;
import org.apache.flink.util.Collector;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Kafka record → {@link RawChangeMessage}
 * <p>
 * JSON 파싱은 하지 않습니다. 디코딩 실패를 decode failure policy 로 처리하려면
 * 실패가 Kafka reader 가 아닌 {@code ChangeEventProcessFunction} 에서 발생해야 하기 때문입니다.
 * value 가 null 인 record (Debezium delete 뒤의 log compaction tombstone)는 건너뜁니다.
 */
public class RawMessageDeserializationSchema implements KafkaRecordDeserializationSchema<RawChangeMessage> {
    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(RawMessageDeserializationSchema.class);

    @Override
    public void deserialize(ConsumerRecord<byte[], byte[]> record, Collector<RawChangeMessage> out) {
        if (record.value() == null) {
            LOG.debug("Kafka tombstone 건너뜀: {}-{}@{}", record.topic(), record.partition(), record.offset());
            return;
        }
        out.collect(new RawChangeMessage(record.topic(), record.partition(), record.offset(), record.value()));
    }

    @Override
    public TypeInformation<RawChangeMessage> getProducedType() {
        return TypeInformation.of(RawChangeMessage.class);
    }
}
