package com.dwh.pipeline.domain.code;

import java.util.List;

/**
 * 소스 시스템 코드 → 표준 설명값 매핑 대상
 */
public interface CodedValue {

    /**
     * 표준화된 설명값 (dimension 에 기록되는 값)
     */
    String label();

    /**
     * 이 값으로 매핑되는 소스 코드 목록 (대소문자 무시)
     */
    List<String> codes();
}
