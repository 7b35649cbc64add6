package com.dwh.pipeline.domain;

/**
 * 파이프라인 체인 단위 (엔티티 패밀리)
 *
 * 패밀리마다 독립된 Stage 체인을 가지며, SALES는 CUSTOMER/PRODUCT 의 Dimensional Assembly 완료를 기다립니다.
 */
public enum EntityFamily {
    CUSTOMER,
    PRODUCT,
    SALES
}
