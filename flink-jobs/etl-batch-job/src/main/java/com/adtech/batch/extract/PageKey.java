package com.adtech.batch.extract;

import java.time.Instant;
import java.util.Objects;

/**
 * Keyset paging 위치: 직전 페이지 마지막 행의 (cursor, id)
 */
public final class PageKey {

    private final Instant cursor;
    private final long id;

    public PageKey(Instant cursor, long id) {
        this.cursor = Objects.requireNonNull(cursor, "cursor");
        this.id = id;
    }

    public Instant getCursor() {
        return cursor;
    }

    public long getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageKey)) {
            return false;
        }
        PageKey that = (PageKey) o;
        return id == that.id && cursor.equals(that.cursor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cursor, id);
    }

    @Override
    public String toString() {
        return "(" + cursor + ", " + id + ")";
    }
}
