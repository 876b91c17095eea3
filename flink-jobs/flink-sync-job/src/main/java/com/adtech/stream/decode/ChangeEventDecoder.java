package com.adtech.stream.decode;

import com.adtech.common.error.DecodeException;
import com.adtech.common.model.SourceRow;
import com.adtech.common.model.SourceTable;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.io.IOException;
import java.io.Serializable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Debezium CDC 메시지(JSON bytes)를 {@link ChangeEvent} 로 디코딩
 *
 * CDC 이벤트 JSON 구조:
 * <pre>
 * {
 *   "before": {...},      // UPDATE/DELETE 의 변경 전 값
 *   "after": {...},       // CREATE/UPDATE 의 변경 후 값
 *   "source": {
 *     "db": "adtech",
 *     "table": "campaign",
 *     "ts_ms": 1699999999999
 *   },
 *   "op": "c" | "u" | "d" | "r",
 *   "ts_ms": 1699999999999
 * }
 * </pre>
 * JsonConverter 의 schemas.enable=true 형식({"schema": ..., "payload": ...})도 허용합니다.
 * 이 경우 schema 에 선언된 Decimal 컬럼(base64 unscaled 값)은 scale 을 적용해 복원합니다.
 * <p>
 * 모든 검증은 여기서 끝나므로 이후 단계는 image 에 id 가 있고 테이블이 토픽과 일치한다고 가정할 수 있습니다.
 */
public class ChangeEventDecoder implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final String CONNECT_DECIMAL = "org.apache.kafka.connect.data.Decimal";

    private static final ObjectMapper objectMapper;

    static {
        objectMapper = new ObjectMapper();
        // 2.50 의 scale 을 그대로 유지
        objectMapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
        objectMapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    /**
     * @param expectedTable 토픽에 바인딩된 원본 테이블
     * @param payload       Kafka 메시지 value
     * @throws DecodeException JSON 이 잘못되었거나 envelope 이 불완전하거나 테이블이 일치하지 않는 경우
     */
    public ChangeEvent decode(SourceTable expectedTable, byte[] payload) throws DecodeException {
        if (payload == null || payload.length == 0) {
            throw new DecodeException("Empty change message");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed change message: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DecodeException("Unreadable change message", e);
        }
        if (root == null || !root.isObject()) {
            throw new DecodeException("Change message is not a JSON object");
        }

        JsonNode schema = null;
        JsonNode envelope = root;
        if (root.has("payload") && root.has("schema")) {
            schema = root.get("schema");
            envelope = root.get("payload");
            if (envelope == null || !envelope.isObject()) {
                throw new DecodeException("Change message payload is not a JSON object");
            }
        }

        String opCode = textOrNull(envelope.get("op"));
        ChangeOperation operation = ChangeOperation.fromCode(opCode)
                .orElseThrow(() -> new DecodeException("Unknown op: " + opCode));

        SourceTable table = resolveTable(envelope.get("source"), expectedTable);
        long sourceTsMs = sourceTimestamp(envelope);

        String imageField = operation == ChangeOperation.DELETE ? "before" : "after";
        JsonNode image = envelope.get(imageField);
        if (image == null || !image.isObject()) {
            throw new DecodeException("Missing '" + imageField + "' image for op=" + opCode
                    + " on " + table.getTableName());
        }
        JsonNode id = image.get(SourceTable.ID_COLUMN);
        if (id == null || !id.isIntegralNumber()) {
            throw new DecodeException("'" + imageField + "' image has no integral id on " + table.getTableName());
        }

        SourceRow row = new SourceRow(toRowValues(image, decimalScales(schema, imageField)));

        switch (operation) {
            case CREATE:
                return ChangeEvent.create(table, row, sourceTsMs);
            case UPDATE:
                return ChangeEvent.update(table, row, sourceTsMs);
            case DELETE:
            default:
                return ChangeEvent.delete(table, row, sourceTsMs);
        }
    }

    private static SourceTable resolveTable(JsonNode source, SourceTable expectedTable) throws DecodeException {
        if (source == null || !source.isObject()) {
            throw new DecodeException("Missing 'source' block");
        }
        String tableName = textOrNull(source.get("table"));
        if (tableName == null) {
            throw new DecodeException("Missing source.table");
        }
        SourceTable table = SourceTable.fromTableName(tableName)
                .orElseThrow(() -> new DecodeException("Unknown source table: " + tableName));
        if (table != expectedTable) {
            throw new DecodeException("Event for table " + tableName + " arrived on the "
                    + expectedTable.getTableName() + " topic");
        }
        return table;
    }

    private static long sourceTimestamp(JsonNode envelope) throws DecodeException {
        JsonNode source = envelope.get("source");
        JsonNode ts = source.get("ts_ms");
        if (ts == null || !ts.isIntegralNumber()) {
            ts = envelope.get("ts_ms");
        }
        if (ts == null || !ts.isIntegralNumber()) {
            throw new DecodeException("Missing source.ts_ms");
        }
        return ts.longValue();
    }

    /**
     * schema.fields[field=before|after].fields 중 Connect Decimal 컬럼의 scale
     */
    private static Map<String, Integer> decimalScales(JsonNode schema, String imageField) {
        if (schema == null || !schema.has("fields")) {
            return Collections.emptyMap();
        }
        Map<String, Integer> scales = new HashMap<>();
        for (JsonNode envelopeField : schema.get("fields")) {
            if (!imageField.equals(textOrNull(envelopeField.get("field"))) || !envelopeField.has("fields")) {
                continue;
            }
            for (JsonNode column : envelopeField.get("fields")) {
                if (CONNECT_DECIMAL.equals(textOrNull(column.get("name")))) {
                    JsonNode scale = column.path("parameters").path("scale");
                    scales.put(textOrNull(column.get("field")), scale.isMissingNode() ? 0 : scale.asInt());
                }
            }
        }
        return scales;
    }

    private static Map<String, Object> toRowValues(JsonNode image, Map<String, Integer> decimalScales)
            throws DecodeException {
        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = image.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Integer scale = decimalScales.get(field.getKey());
            if (scale != null && field.getValue().isTextual()) {
                values.put(field.getKey(), decodeConnectDecimal(field.getKey(), field.getValue().textValue(), scale));
            } else {
                values.put(field.getKey(), toValue(field.getValue()));
            }
        }
        return values;
    }

    private static BigDecimal decodeConnectDecimal(String column, String base64, int scale) throws DecodeException {
        try {
            return new BigDecimal(new BigInteger(Base64.getDecoder().decode(base64)), scale);
        } catch (IllegalArgumentException e) {
            // NumberFormatException 포함
            throw new DecodeException("Column " + column + " is not a base64 Connect decimal: " + base64, e);
        }
    }

    private static Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isObject()) {
            // io.debezium.data.VariableScaleDecimal 등 구조체 값
            Map<String, Object> nested = new LinkedHashMap<>();
            node.fields().forEachRemaining(e -> nested.put(e.getKey(), toValue(e.getValue())));
            return nested;
        }
        if (node.isArray()) {
            List<Object> items = new ArrayList<>();
            node.forEach(item -> items.add(toValue(item)));
            return items;
        }
        return node.asText();
    }

    private static String textOrNull(JsonNode node) {
        return node != null && node.isTextual() ? node.textValue() : null;
    }
}
