package com.dwh.pipeline.exception;

/**
 * 오류 분류
 * <p>
 * - STRUCTURAL: 필수 테이블/컬럼 누락, key 충돌. 해당 패밀리 체인만 중단
 * - FORMAT: 잘못된 날짜/숫자/코드. Cleansing 에서 null(또는 기본값) 처리 후 기록
 * - CONSISTENCY: 측정값 불일치. Business Rule 로 자동 보정
 * - REFERENTIAL: Dimension lookup 실패. UNRESOLVED 로 유지
 * - DUPLICATE: 동일 business key 의 복수 버전. dedup 으로 해소되며 오류로 노출하지 않음
 */
public enum ErrorKind {
    STRUCTURAL,
    FORMAT,
    CONSISTENCY,
    REFERENTIAL,
    DUPLICATE,
    INTERNAL
}
