package com.adtech.stream.config;

import com.adtech.stream.decode.DeadLetterRecord;
import com.adtech.stream.sink.DeadLetterSerializationSchema;
import org.apache.flink.connector.base.DeliveryGuarantee;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;

import java.util.Properties;

/**
 * Dead letter Kafka Sink 설정
 * stream.decode.failure.policy=DEAD_LETTER 일 때만 사용됩니다.
 */
public class DeadLetterSinkConfig {

    private DeadLetterSinkConfig() {
    }

    /**
     * AT_LEAST_ONCE: checkpoint 시 flush 되므로 원본 offset 이 commit 되기 전에 dead letter 가 기록됩니다.
     */
    public static KafkaSink<DeadLetterRecord> createSink(StreamSyncConfig config) {
        Properties kafkaProps = new Properties();
        kafkaProps.setProperty("acks", "all");

        return KafkaSink.<DeadLetterRecord>builder()
                        .setBootstrapServers(config.getBootstrapServers())
                        .setRecordSerializer(
                                KafkaRecordSerializationSchema.<DeadLetterRecord>builder()
                                                              .setTopic(config.getDeadLetterTopic())
                                                              .setValueSerializationSchema(new DeadLetterSerializationSchema())
                                                              .build()
                        )
                        .setDeliveryGuarantee(DeliveryGuarantee.AT_LEAST_ONCE)
                        .setKafkaProducerConfig(kafkaProps)
                        .build();
    }
}
