package com.adtech.stream.decode;

import java.util.Optional;

/**
 * Debezium envelope 의 op 코드
 * <p>
 * snapshot read(r)는 원본 테이블에 이미 존재하던 행이므로 CREATE 로 취급합니다.
 */
public enum ChangeOperation {
    CREATE,
    UPDATE,
    DELETE;

    public static Optional<ChangeOperation> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        switch (code) {
            case "c":
            case "r":
                return Optional.of(CREATE);
            case "u":
                return Optional.of(UPDATE);
            case "d":
                return Optional.of(DELETE);
            default:
                return Optional.empty();
        }
    }
}
