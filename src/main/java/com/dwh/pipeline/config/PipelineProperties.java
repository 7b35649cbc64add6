package com.dwh.pipeline.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;

import java.time.LocalDate;

/**
 * pipeline.* 설정
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /**
     * Raw Store 스키마 (job parameter rawSchema 가 없을 때 사용)
     */
    private String rawSchema = "raw";

    /**
     * Star schema 출력 스키마
     */
    private String targetSchema = "gold";

    /**
     * 패밀리 Flow 병렬 실행 스레드 수
     */
    private int threads = 3;

    /**
     * 허용 날짜 범위 [minDate, maxDate)
     */
    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate minDate = LocalDate.of(1900, 1, 1);
    @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
    private LocalDate maxDate = LocalDate.of(2050, 1, 1);

    private KeyStrategy keyStrategy = KeyStrategy.RECOMPUTE;

    /**
     * 외부 PostgreSQL. url 이 비어 있으면 embedded PostgreSQL 을 사용합니다.
     */
    private Datasource datasource = new Datasource();

    public enum KeyStrategy {
        /**
         * run 마다 dense key 재계산 (run 간 안정성 보장 없음)
         */
        RECOMPUTE,
        /**
         * append-only key_assignment 테이블을 조회/확장
         */
        PERSISTED
    }

    @Getter
    @Setter
    public static class Datasource {
        private String url;
        private String username;
        private String password;
    }
}
