package com.adtech.stream.process;

import com.adtech.common.config.ConfigurationException;
import com.adtech.common.model.SourceTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 기동 시 한 번 만들어지는 토픽 라우팅 테이블
 * <p>
 * 토픽마다 하나의 파이프라인이 만들어지므로 한 토픽을 두 테이블에 바인딩하는 설정은 거부합니다.
 */
public class TableRegistry {

    private final List<TableBinding> bindings;

    public TableRegistry(Map<SourceTable, String> topics) {
        List<TableBinding> ordered = new ArrayList<>();
        Map<String, TableBinding> index = new HashMap<>();

        // SourceTable 선언 순서 (dimension → fact)
        for (SourceTable table : SourceTable.values()) {
            String topic = topics.get(table);
            if (topic == null) {
                throw new ConfigurationException("No topic configured for table " + table.getTableName());
            }
            TableBinding binding = new TableBinding(topic, table);
            TableBinding previous = index.putIfAbsent(topic, binding);
            if (previous != null) {
                throw new ConfigurationException("Topic " + topic + " is bound to both "
                        + previous.getName() + " and " + table.getTableName());
            }
            ordered.add(binding);
        }

        this.bindings = Collections.unmodifiableList(ordered);
    }

    public List<TableBinding> getBindings() {
        return bindings;
    }
}
