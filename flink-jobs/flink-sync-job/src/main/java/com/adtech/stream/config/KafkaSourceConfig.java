package com.adtech.stream.config;

import com.adtech.stream.decode.RawChangeMessage;
import com.adtech.stream.decode.RawMessageDeserializationSchema;
import com.adtech.stream.process.TableBinding;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;

import java.util.Properties;

/**
 * Kafka Source 설정 클래스
 * 원본 테이블 하나의 Debezium CDC 토픽을 읽어옵니다.
 */
public class KafkaSourceConfig {

    private KafkaSourceConfig() {
    }

    /**
     * 바인딩된 토픽 하나를 읽는 Kafka Source 생성
     * <p>
     * offset 은 checkpoint 가 완료될 때만 commit 됩니다 (checkpoint 이전의 row 는 모두 sink 에 flush 된 상태).
     * commit 된 offset 이 없으면 토픽 처음부터 읽어 Debezium snapshot 을 놓치지 않습니다.
     *
     * @return KafkaSource<RawChangeMessage> - binding 의 토픽에서 읽는 소스
     */
    public static KafkaSource<RawChangeMessage> createSource(StreamSyncConfig config, TableBinding binding) {
        return KafkaSource.<RawChangeMessage>builder()
                          .setBootstrapServers(config.getBootstrapServers())
                          .setTopics(binding.getTopic())
                          .setGroupId(config.getConsumerGroup())
                          .setClientIdPrefix(config.getConsumerGroup() + "-" + binding.getName())
                          // 첫 실행: earliest (snapshot 포함), 재시작: committed offset
                          .setStartingOffsets(OffsetsInitializer.committedOffsets(OffsetResetStrategy.EARLIEST))
                          .setDeserializer(new RawMessageDeserializationSchema())
                          .setProperties(consumerProperties(config))
                          .build();
    }

    static Properties consumerProperties(StreamSyncConfig config) {
        Properties kafkaProps = new Properties();
        kafkaProps.setProperty("max.poll.records", String.valueOf(config.getMaxPollRecords()));
        kafkaProps.setProperty("session.timeout.ms", String.valueOf(config.getSessionTimeoutMs()));
        kafkaProps.setProperty("enable.auto.commit", "false"); // Flink가 offset 관리
        kafkaProps.setProperty("commit.offsets.on.checkpoint", "true");
        return kafkaProps;
    }
}
