package com.adtech.common.model;

import com.adtech.common.error.TransformException;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 원본 테이블의 한 행 (row image)
 * <p>
 * Batch 경로(JDBC ResultSet)와 Stream 경로(Debezium before/after JSON) 모두 이 타입으로 변환된 뒤
 * 같은 {@code RowTransformer} 를 거칩니다. 두 경로의 값 표현 차이는 여기의 타입 변환 메서드가 흡수합니다.
 *
 * <ul>
 *   <li>timestamp: {@link Instant}, {@link Timestamp}, {@link LocalDateTime}(UTC), epoch millis, ISO-8601 문자열</li>
 *   <li>date: {@link LocalDate}, {@link java.sql.Date}, epoch days (Debezium io.debezium.time.Date), ISO 문자열</li>
 *   <li>decimal: {@link BigDecimal}, Number, 문자열, Debezium {"scale", "value"(base64)} 구조</li>
 * </ul>
 */
public final class SourceRow implements Serializable {
    private static final long serialVersionUID = 1L;

    /** 9999-12-31T23:59:59.999Z. 이보다 큰 숫자 timestamp 는 millis 가 아님 */
    static final long MAX_EPOCH_MILLIS = 253_402_300_799_999L;

    private final LinkedHashMap<String, Object> values;

    public SourceRow(Map<String, ?> values) {
        this.values = new LinkedHashMap<>(Objects.requireNonNull(values, "values"));
    }

    public boolean has(String column) {
        return values.get(column) != null;
    }

    public Object get(String column) {
        return values.get(column);
    }

    public Map<String, Object> asMap() {
        return Collections.unmodifiableMap(values);
    }

    public Long getLong(String column) throws TransformException {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            try {
                return ((BigDecimal) value).longValueExact();
            } catch (ArithmeticException e) {
                throw new TransformException("Column " + column + " is not integral: " + value, e);
            }
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d != Math.rint(d)) {
                throw new TransformException("Column " + column + " is not integral: " + value);
            }
            return (long) d;
        }
        if (value instanceof BigInteger) {
            try {
                return ((BigInteger) value).longValueExact();
            } catch (ArithmeticException e) {
                throw new TransformException("Column " + column + " is out of long range: " + value, e);
            }
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new TransformException("Column " + column + " is not a long: " + value, e);
        }
    }

    public long requireLong(String column) throws TransformException {
        Long value = getLong(column);
        if (value == null) {
            throw new TransformException("Missing required column: " + column);
        }
        return value;
    }

    public String getString(String column) {
        Object value = values.get(column);
        return value != null ? value.toString() : null;
    }

    public BigDecimal getDecimal(String column) throws TransformException {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            return BigDecimal.valueOf(((Number) value).doubleValue());
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Number) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Map) {
            return decodeVariableScaleDecimal(column, (Map<?, ?>) value);
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new TransformException("Column " + column + " is not a decimal: " + value, e);
        }
    }

    public Instant getInstant(String column) throws TransformException {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime().toInstant(ZoneOffset.UTC);
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof Number) {
            // Debezium time.precision.mode=connect: epoch milliseconds
            long epochMillis = ((Number) value).longValue();
            if (Math.abs(epochMillis) > MAX_EPOCH_MILLIS) {
                // adaptive 모드의 epoch micros / nanos
                throw new TransformException("Column " + column + " is not epoch millis: " + value
                        + " (connector must use time.precision.mode=connect)");
            }
            return Instant.ofEpochMilli(epochMillis);
        }
        String text = value.toString().trim();
        try {
            if (text.endsWith("Z")) {
                return Instant.parse(text);
            }
            if (text.indexOf('+') > 0 || text.lastIndexOf('-') > 9) {
                return OffsetDateTime.parse(text.replace(' ', 'T')).toInstant();
            }
            return LocalDateTime.parse(text.replace(' ', 'T')).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new TransformException("Column " + column + " is not a timestamp: " + value, e);
        }
    }

    public LocalDate getDate(String column) throws TransformException {
        Object value = values.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDate) {
            return (LocalDate) value;
        }
        if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        }
        if (value instanceof Number) {
            // io.debezium.time.Date: epoch 이후 일 수
            return LocalDate.ofEpochDay(((Number) value).longValue());
        }
        String text = value.toString().trim();
        try {
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw new TransformException("Column " + column + " is not a date: " + value, e);
        }
    }

    /**
     * Debezium VariableScaleDecimal / decimal.handling.mode=precise 의 JSON 표현
     * <pre>
     * { "scale": 2, "value": "AOY=" }  // base64 인코딩된 unscaled BigInteger
     * </pre>
     */
    private static BigDecimal decodeVariableScaleDecimal(String column, Map<?, ?> complexValue)
            throws TransformException {
        Object encoded = complexValue.get("value");
        Object scaleObj = complexValue.get("scale");
        if (!(encoded instanceof String)) {
            throw new TransformException("Column " + column + " has an unsupported decimal encoding: " + complexValue);
        }
        try {
            byte[] bytes = Base64.getDecoder().decode((String) encoded);
            int scale = scaleObj instanceof Number ? ((Number) scaleObj).intValue() : 0;
            return new BigDecimal(new BigInteger(bytes), scale);
        } catch (IllegalArgumentException e) {
            throw new TransformException("Column " + column + " has an invalid base64 decimal: " + encoded, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SourceRow)) {
            return false;
        }
        return values.equals(((SourceRow) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "SourceRow" + values;
    }
}
