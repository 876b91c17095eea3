package com.adtech.common.model;

/**
 * 분석 스키마에서의 테이블 역할
 */
public enum TableKind {
    /** 변경 가능한 엔티티 (advertiser, campaign) - updated_at 으로 버전 관리 */
    DIMENSION,
    /** append-only 이벤트 (impressions, clicks) - created_at 기준 */
    FACT
}
