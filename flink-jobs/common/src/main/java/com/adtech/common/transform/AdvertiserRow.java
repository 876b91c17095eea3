package com.adtech.common.transform;

import com.adtech.common.model.AnalyticalTable;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Objects;

/**
 * ClickHouse dim_advertiser 테이블 Row 모델
 *
 * ClickHouse 테이블 스키마:
 * - advertiser_id UInt64
 * - name String
 * - updated_at DateTime64(3, 'UTC')
 * - created_at DateTime64(3, 'UTC')
 * - is_deleted UInt8
 * - sync_version UInt64 (버전 컬럼 - ReplacingMergeTree 중복 제거용)
 */
public final class AdvertiserRow implements AnalyticalRow {
    private static final long serialVersionUID = 1L;

    private final long advertiserId;
    private final String name;
    private final Instant updatedAt;
    private final Instant createdAt;
    private final boolean deleted;
    private final long syncVersion;

    public AdvertiserRow(long advertiserId, String name, Instant updatedAt, Instant createdAt,
                         boolean deleted, long syncVersion) {
        this.advertiserId = advertiserId;
        this.name = Objects.requireNonNull(name, "name");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.deleted = deleted;
        this.syncVersion = syncVersion;
    }

    @Override
    public AnalyticalTable getTable() {
        return AnalyticalTable.DIM_ADVERTISER;
    }

    @Override
    public long getEntityId() {
        return advertiserId;
    }

    @Override
    public Instant getCursor() {
        return updatedAt;
    }

    @Override
    public long getSyncVersion() {
        return syncVersion;
    }

    @Override
    public boolean isDeleted() {
        return deleted;
    }

    public long getAdvertiserId() {
        return advertiserId;
    }

    public String getName() {
        return name;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public void bind(PreparedStatement ps) throws SQLException {
        ps.setLong(1, advertiserId);
        ps.setString(2, name);
        Bindings.setInstant(ps, 3, updatedAt);
        Bindings.setInstant(ps, 4, createdAt);
        Bindings.setFlag(ps, 5, deleted);
        ps.setLong(6, syncVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AdvertiserRow)) {
            return false;
        }
        AdvertiserRow that = (AdvertiserRow) o;
        return advertiserId == that.advertiserId
                && deleted == that.deleted
                && syncVersion == that.syncVersion
                && name.equals(that.name)
                && updatedAt.equals(that.updatedAt)
                && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(advertiserId, name, updatedAt, createdAt, deleted, syncVersion);
    }

    @Override
    public String toString() {
        return "AdvertiserRow{" +
                "advertiserId=" + advertiserId +
                ", name='" + name + '\'' +
                ", updatedAt=" + updatedAt +
                ", deleted=" + deleted +
                ", syncVersion=" + syncVersion +
                '}';
    }
}
