package com.adtech.stream.process;

import com.adtech.common.error.TransformException;
import com.adtech.common.transform.AnalyticalRow;
import com.adtech.common.transform.RowTransformer;
import com.adtech.stream.decode.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Optional;

/**
 * {@link ChangeEvent} → 분석 row
 * <p>
 * Batch 경로와 같은 {@link RowTransformer} 를 사용하므로 같은 원본 버전은 같은 sync_version 으로 쓰입니다.
 * 같은 이벤트를 다시 처리해도 같은 row 가 나오므로 재전달(replay)은 안전합니다.
 *
 * 처리 규칙:
 * - CREATE / UPDATE: after image 변환
 * - DELETE: before image 로 tombstone (is_deleted=1)
 * - Fact 테이블 UPDATE: fact 는 불변이므로 무시
 */
public class StreamProcessor implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(StreamProcessor.class);

    private final RowTransformer transformer;

    public StreamProcessor() {
        this(new RowTransformer());
    }

    public StreamProcessor(RowTransformer transformer) {
        this.transformer = transformer;
    }

    /**
     * @return 쓸 row. 무시되는 이벤트는 empty
     * @throws TransformException row image 의 필수 컬럼이 없거나 형식이 잘못된 경우
     */
    public Optional<AnalyticalRow> process(ChangeEvent event) throws TransformException {
        switch (event.getOperation()) {
            case CREATE:
                return Optional.of(transformer.transform(event.getTable(), event.getRow()));
            case UPDATE:
                if (!event.getTable().isDimension()) {
                    LOG.warn("⚠️  Fact 테이블 UPDATE 무시: {}", event);
                    return Optional.empty();
                }
                return Optional.of(transformer.transform(event.getTable(), event.getRow()));
            case DELETE:
                return Optional.of(transformer.tombstone(event.getTable(), event.getRow(), event.getSourceTsMs()));
            default:
                throw new TransformException("Unsupported operation: " + event.getOperation());
        }
    }
}
