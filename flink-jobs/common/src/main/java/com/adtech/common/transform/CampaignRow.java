package com.adtech.common.transform;

import com.adtech.common.model.AnalyticalTable;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * ClickHouse dim_campaign 테이블 Row 모델
 *
 * ClickHouse 테이블 스키마:
 * - campaign_id UInt64
 * - name String
 * - bid Decimal(10, 2)
 * - budget Decimal(10, 2)
 * - start_date Nullable(Date)
 * - end_date Nullable(Date)
 * - advertiser_id UInt64 (FK 강제 없음 - 참조 무결성은 source 쪽 불변식)
 * - updated_at DateTime64(3, 'UTC')
 * - created_at DateTime64(3, 'UTC')
 * - is_deleted UInt8
 * - sync_version UInt64
 */
public final class CampaignRow implements AnalyticalRow {
    private static final long serialVersionUID = 1L;

    private final long campaignId;
    private final String name;
    private final BigDecimal bid;
    private final BigDecimal budget;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final long advertiserId;
    private final Instant updatedAt;
    private final Instant createdAt;
    private final boolean deleted;
    private final long syncVersion;

    public CampaignRow(long campaignId, String name, BigDecimal bid, BigDecimal budget,
                       LocalDate startDate, LocalDate endDate, long advertiserId,
                       Instant updatedAt, Instant createdAt, boolean deleted, long syncVersion) {
        this.campaignId = campaignId;
        this.name = Objects.requireNonNull(name, "name");
        this.bid = Objects.requireNonNull(bid, "bid");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.startDate = startDate;
        this.endDate = endDate;
        this.advertiserId = advertiserId;
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.deleted = deleted;
        this.syncVersion = syncVersion;
    }

    @Override
    public AnalyticalTable getTable() {
        return AnalyticalTable.DIM_CAMPAIGN;
    }

    @Override
    public long getEntityId() {
        return campaignId;
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

    public long getCampaignId() {
        return campaignId;
    }

    public String getName() {
        return name;
    }

    public BigDecimal getBid() {
        return bid;
    }

    public BigDecimal getBudget() {
        return budget;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public long getAdvertiserId() {
        return advertiserId;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public void bind(PreparedStatement ps) throws SQLException {
        ps.setLong(1, campaignId);
        ps.setString(2, name);
        Bindings.setDecimal(ps, 3, bid);
        Bindings.setDecimal(ps, 4, budget);
        Bindings.setDate(ps, 5, startDate);
        Bindings.setDate(ps, 6, endDate);
        ps.setLong(7, advertiserId);
        Bindings.setInstant(ps, 8, updatedAt);
        Bindings.setInstant(ps, 9, createdAt);
        Bindings.setFlag(ps, 10, deleted);
        ps.setLong(11, syncVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CampaignRow)) {
            return false;
        }
        CampaignRow that = (CampaignRow) o;
        return campaignId == that.campaignId
                && advertiserId == that.advertiserId
                && deleted == that.deleted
                && syncVersion == that.syncVersion
                && name.equals(that.name)
                && bid.compareTo(that.bid) == 0
                && budget.compareTo(that.budget) == 0
                && Objects.equals(startDate, that.startDate)
                && Objects.equals(endDate, that.endDate)
                && updatedAt.equals(that.updatedAt)
                && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(campaignId, name, bid.stripTrailingZeros(), budget.stripTrailingZeros(),
                startDate, endDate, advertiserId, updatedAt, createdAt, deleted, syncVersion);
    }

    @Override
    public String toString() {
        return "CampaignRow{" +
                "campaignId=" + campaignId +
                ", name='" + name + '\'' +
                ", bid=" + bid +
                ", budget=" + budget +
                ", advertiserId=" + advertiserId +
                ", updatedAt=" + updatedAt +
                ", deleted=" + deleted +
                ", syncVersion=" + syncVersion +
                '}';
    }
}
