package com.adtech.stream.process;

import com.adtech.common.error.SyncException;
import com.adtech.common.transform.AnalyticalRow;
import com.adtech.stream.decode.ChangeEvent;
import com.adtech.stream.decode.ChangeEventDecoder;
import com.adtech.stream.decode.DeadLetterRecord;
import com.adtech.stream.decode.DecodeFailurePolicy;
import com.adtech.stream.decode.RawChangeMessage;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * 토픽 하나의 메시지를 디코딩하고 분석 row 로 변환하는 ProcessFunction
 * <p>
 * 디코딩 / 변환 실패 처리:
 * - HALT: 예외를 던져 task 를 실패시킴. 마지막 checkpoint 이후 offset 은 확정되지 않으므로
 *   재시작 후 같은 메시지에서 다시 멈춥니다.
 * - DEAD_LETTER: {@link #DEAD_LETTER_TAG} side output 으로 원본을 보내고 계속 진행
 * 처리 결과는 {@link ChangeEventMetrics} 카운터로 집계됩니다.
 */
public class ChangeEventProcessFunction extends ProcessFunction<RawChangeMessage, AnalyticalRow> {
    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(ChangeEventProcessFunction.class);

    public static final OutputTag<DeadLetterRecord> DEAD_LETTER_TAG =
            new OutputTag<DeadLetterRecord>("dead-letter") {
            };

    private final TableBinding binding;
    private final DecodeFailurePolicy failurePolicy;
    private final ChangeEventDecoder decoder;
    private final StreamProcessor processor;

    private transient ChangeEventMetrics metrics;

    public ChangeEventProcessFunction(TableBinding binding, DecodeFailurePolicy failurePolicy) {
        this(binding, failurePolicy, new ChangeEventDecoder(), new StreamProcessor());
    }

    ChangeEventProcessFunction(TableBinding binding, DecodeFailurePolicy failurePolicy,
                               ChangeEventDecoder decoder, StreamProcessor processor) {
        this.binding = binding;
        this.failurePolicy = failurePolicy;
        this.decoder = decoder;
        this.processor = processor;
    }

    @Override
    public void open(Configuration parameters) throws Exception {
        super.open(parameters);
        metrics = new ChangeEventMetrics(getRuntimeContext().getMetricGroup(), binding.getName());
    }

    @Override
    public void close() throws Exception {
        if (metrics != null) {
            LOG.info("📊 {} CDC 처리 통계: {}", binding.getName(), metrics);
        }
        super.close();
    }

    @Override
    public void processElement(RawChangeMessage message, Context ctx, Collector<AnalyticalRow> out)
            throws Exception {
        metrics.received();
        ChangeEvent event;
        Optional<AnalyticalRow> row;
        try {
            event = decoder.decode(binding.getSource(), message.getValue());
            row = processor.process(event);
            LOG.debug("✅ CDC 이벤트 변환 성공: {}", event);
        } catch (SyncException e) {
            metrics.failed();
            handleFailure(message, ctx, e);
            return;
        }
        if (row.isPresent()) {
            metrics.emitted(event.getOperation());
            out.collect(row.get());
        } else {
            metrics.skipped();
        }
    }

    ChangeEventMetrics getMetrics() {
        return metrics;
    }

    private void handleFailure(RawChangeMessage message, Context ctx, SyncException error) throws SyncException {
        if (failurePolicy == DecodeFailurePolicy.HALT) {
            LOG.error("❌ CDC 메시지 처리 실패, 파이프라인 중단 (policy=HALT): {}", message, error);
            throw error;
        }
        LOG.error("❌ CDC 메시지 처리 실패, dead letter 로 전송: {}", message, error);
        ctx.output(DEAD_LETTER_TAG, DeadLetterRecord.of(message, binding.getName(), error, Instant.now()));
    }
}
