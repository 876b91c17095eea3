package com.adtech.common.transform;

import com.adtech.common.error.TransformException;
import com.adtech.common.model.AnalyticalTable;
import com.adtech.common.model.SourceRow;
import com.adtech.common.model.SourceTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * 원본 row image 를 ClickHouse 분석 row 로 변환하는 Transformer
 * Batch ETL Job 과 Flink Sync Job 이 같은 인스턴스 로직을 사용하므로
 * 같은 원본 버전은 두 경로 어디서 오더라도 동일한 분석 row 가 됩니다.
 *
 * 변환 규칙:
 * - Dimension (advertiser, campaign): 설명 컬럼 복사 + updated_at / created_at, sync_version = updated_at
 * - Fact (impressions, clicks): event_time(없으면 created_at) 에서 event_date 파생, sync_version = created_at
 * - Tombstone: is_deleted=1, sync_version = max(삭제된 버전 + 1, source ts_ms)
 * - 모든 timestamp 는 millisecond 로 절삭 (JDBC 는 microsecond, Debezium 은 millisecond)
 *
 * 시계(clock)를 읽지 않는 순수 함수입니다.
 */
public class RowTransformer implements Serializable {
    private static final long serialVersionUID = 1L;

    private static final Logger LOG = LoggerFactory.getLogger(RowTransformer.class);

    private static final BigDecimal ZERO_AMOUNT = new BigDecimal("0.00");

    /**
     * 살아있는 행(create / update / batch 추출 행)을 변환합니다.
     *
     * @throws TransformException id 또는 필수 컬럼이 없거나 형식이 잘못된 경우
     */
    public AnalyticalRow transform(SourceTable table, SourceRow row) throws TransformException {
        switch (table) {
            case ADVERTISER:
                return toAdvertiser(row, false, 0L);
            case CAMPAIGN:
                return toCampaign(row, false, 0L);
            case IMPRESSIONS:
            case CLICKS:
                return toFact(table.getTarget(), row, false, 0L);
            default:
                throw new TransformException("Unsupported source table: " + table);
        }
    }

    /**
     * 삭제 이벤트의 before image 로 tombstone row 를 만듭니다.
     * <p>
     * Dimension 은 key-only image(REPLICA IDENTITY DEFAULT)도 허용합니다.
     * Fact 는 정렬 키(event_date, campaign_id)가 필요하므로 campaign_id, created_at 이 있어야 합니다.
     *
     * @param sourceTsMs 원본 트랜잭션 커밋 시각 (Debezium source.ts_ms)
     */
    public AnalyticalRow tombstone(SourceTable table, SourceRow before, long sourceTsMs) throws TransformException {
        switch (table) {
            case ADVERTISER:
                return toAdvertiser(before, true, sourceTsMs);
            case CAMPAIGN:
                return toCampaign(before, true, sourceTsMs);
            case IMPRESSIONS:
            case CLICKS:
                return toFact(table.getTarget(), before, true, sourceTsMs);
            default:
                throw new TransformException("Unsupported source table: " + table);
        }
    }

    private AdvertiserRow toAdvertiser(SourceRow row, boolean deleted, long sourceTsMs) throws TransformException {
        long id = row.requireLong(SourceTable.ID_COLUMN);
        Stamps stamps = dimensionStamps(row, deleted, sourceTsMs);
        return new AdvertiserRow(
                id,
                nonNullName(row),
                stamps.updatedAt,
                stamps.createdAt,
                deleted,
                stamps.version);
    }

    private CampaignRow toCampaign(SourceRow row, boolean deleted, long sourceTsMs) throws TransformException {
        long id = row.requireLong(SourceTable.ID_COLUMN);
        Stamps stamps = dimensionStamps(row, deleted, sourceTsMs);

        Long advertiserId = row.getLong("advertiser_id");
        if (advertiserId == null) {
            if (!deleted) {
                throw new TransformException("Missing required column: advertiser_id (campaign " + id + ")");
            }
            advertiserId = 0L;
        }

        return new CampaignRow(
                id,
                nonNullName(row),
                amountOrZero(row, "bid"),
                amountOrZero(row, "budget"),
                row.getDate("start_date"),
                row.getDate("end_date"),
                advertiserId,
                stamps.updatedAt,
                stamps.createdAt,
                deleted,
                stamps.version);
    }

    private FactEventRow toFact(AnalyticalTable target, SourceRow row, boolean deleted, long sourceTsMs)
            throws TransformException {
        long id = row.requireLong(SourceTable.ID_COLUMN);

        Long campaignId = row.getLong("campaign_id");
        Instant createdAt = millis(row.getInstant("created_at"));
        if (campaignId == null || createdAt == null) {
            // tombstone 도 원래 행과 같은 정렬 키로 써야 교체되므로 전체 image 가 필요
            throw new TransformException("Fact row " + target.getTableName() + "#" + id
                    + " requires campaign_id and created_at" + (deleted ? " (REPLICA IDENTITY FULL)" : ""));
        }

        Instant eventTime = millis(row.getInstant("event_time"));
        if (eventTime == null) {
            eventTime = createdAt;
        }
        LocalDate eventDate = LocalDate.ofInstant(eventTime, ZoneOffset.UTC);

        long imageVersion = createdAt.toEpochMilli();
        long version = deleted ? tombstoneVersion(imageVersion, sourceTsMs) : imageVersion;

        return new FactEventRow(target, id, campaignId, eventDate, eventTime, createdAt, deleted, version);
    }

    private Stamps dimensionStamps(SourceRow row, boolean deleted, long sourceTsMs) throws TransformException {
        Instant updatedAt = millis(row.getInstant("updated_at"));
        Instant createdAt = millis(row.getInstant("created_at"));

        if (updatedAt == null) {
            updatedAt = createdAt;
        }
        if (createdAt == null) {
            createdAt = updatedAt;
        }

        if (updatedAt == null) {
            if (!deleted) {
                throw new TransformException("Missing updated_at and created_at: " + row);
            }
            // key-only before image: 삭제 시각으로 대체
            Instant deletedAt = Instant.ofEpochMilli(sourceTsMs);
            LOG.debug("Key-only before image, tombstone stamped with source ts_ms {}", sourceTsMs);
            return new Stamps(deletedAt, deletedAt, sourceTsMs);
        }

        long imageVersion = updatedAt.toEpochMilli();
        return new Stamps(updatedAt, createdAt, deleted ? tombstoneVersion(imageVersion, sourceTsMs) : imageVersion);
    }

    static long tombstoneVersion(long imageVersion, long sourceTsMs) {
        return Math.max(imageVersion + 1, sourceTsMs);
    }

    private static String nonNullName(SourceRow row) {
        String name = row.getString("name");
        return name != null ? name : "";
    }

    private static BigDecimal amountOrZero(SourceRow row, String column) throws TransformException {
        BigDecimal value = row.getDecimal(column);
        return value != null ? value : ZERO_AMOUNT;
    }

    private static Instant millis(Instant value) {
        return value != null ? value.truncatedTo(ChronoUnit.MILLIS) : null;
    }

    private static final class Stamps {
        private final Instant updatedAt;
        private final Instant createdAt;
        private final long version;

        private Stamps(Instant updatedAt, Instant createdAt, long version) {
            this.updatedAt = updatedAt;
            this.createdAt = createdAt;
            this.version = version;
        }
    }
}
