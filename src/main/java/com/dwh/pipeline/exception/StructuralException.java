package com.dwh.pipeline.exception;

/**
 * 필수 테이블/컬럼 누락처럼 데이터 수준에서 복구할 수 없는 구조적 오류
 */
public class StructuralException extends PipelineException {

    public StructuralException(String message) {
        super(ErrorKind.STRUCTURAL, message);
    }

    public StructuralException(String message, Throwable cause) {
        super(ErrorKind.STRUCTURAL, message, cause);
    }
}
