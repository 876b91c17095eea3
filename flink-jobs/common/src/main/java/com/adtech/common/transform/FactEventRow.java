package com.adtech.common.transform;

import com.adtech.common.model.AnalyticalTable;
import com.adtech.common.model.TableKind;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * ClickHouse fact_impressions / fact_clicks 테이블 Row 모델 (두 테이블의 스키마가 동일)
 *
 * ClickHouse 테이블 스키마:
 * - impression_id | click_id UInt64
 * - campaign_id UInt64
 * - event_date Date (event_time 에서 파생)
 * - event_time DateTime64(3, 'UTC')
 * - created_at DateTime64(3, 'UTC')
 * - is_deleted UInt8
 * - sync_version UInt64
 */
public final class FactEventRow implements AnalyticalRow {
    private static final long serialVersionUID = 1L;

    private final AnalyticalTable table;
    private final long eventId;
    private final long campaignId;
    private final LocalDate eventDate;
    private final Instant eventTime;
    private final Instant createdAt;
    private final boolean deleted;
    private final long syncVersion;

    public FactEventRow(AnalyticalTable table, long eventId, long campaignId, LocalDate eventDate,
                        Instant eventTime, Instant createdAt, boolean deleted, long syncVersion) {
        if (table.getKind() != TableKind.FACT) {
            throw new IllegalArgumentException("Not a fact table: " + table);
        }
        this.table = table;
        this.eventId = eventId;
        this.campaignId = campaignId;
        this.eventDate = Objects.requireNonNull(eventDate, "eventDate");
        this.eventTime = Objects.requireNonNull(eventTime, "eventTime");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.deleted = deleted;
        this.syncVersion = syncVersion;
    }

    @Override
    public AnalyticalTable getTable() {
        return table;
    }

    @Override
    public long getEntityId() {
        return eventId;
    }

    @Override
    public Instant getCursor() {
        return createdAt;
    }

    @Override
    public long getSyncVersion() {
        return syncVersion;
    }

    @Override
    public boolean isDeleted() {
        return deleted;
    }

    public long getEventId() {
        return eventId;
    }

    public long getCampaignId() {
        return campaignId;
    }

    public LocalDate getEventDate() {
        return eventDate;
    }

    public Instant getEventTime() {
        return eventTime;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public void bind(PreparedStatement ps) throws SQLException {
        ps.setLong(1, eventId);
        ps.setLong(2, campaignId);
        Bindings.setDate(ps, 3, eventDate);
        Bindings.setInstant(ps, 4, eventTime);
        Bindings.setInstant(ps, 5, createdAt);
        Bindings.setFlag(ps, 6, deleted);
        ps.setLong(7, syncVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FactEventRow)) {
            return false;
        }
        FactEventRow that = (FactEventRow) o;
        return table == that.table
                && eventId == that.eventId
                && campaignId == that.campaignId
                && deleted == that.deleted
                && syncVersion == that.syncVersion
                && eventDate.equals(that.eventDate)
                && eventTime.equals(that.eventTime)
                && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, eventId, campaignId, eventDate, eventTime, createdAt, deleted, syncVersion);
    }

    @Override
    public String toString() {
        return "FactEventRow{" +
                "table=" + table.getTableName() +
                ", eventId=" + eventId +
                ", campaignId=" + campaignId +
                ", eventTime=" + eventTime +
                ", deleted=" + deleted +
                '}';
    }
}
