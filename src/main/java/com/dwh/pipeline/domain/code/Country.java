package com.dwh.pipeline.domain.code;

import java.util.List;

/**
 * ERP 위치 국가 코드. ERP 는 ISO 코드와 국가명을 섞어서 내보내므로 둘 다 코드로 등록합니다.
 */
public enum Country implements CodedValue {

    AUSTRALIA("Australia", "AU", "Australia"),
    CANADA("Canada", "CA", "Canada"),
    FRANCE("France", "FR", "France"),
    GERMANY("Germany", "DE", "Germany"),
    UNITED_KINGDOM("United Kingdom", "GB", "UK", "United Kingdom"),
    UNITED_STATES("United States", "US", "USA", "United States"),
    UNKNOWN("n/a");

    public static final CodeTable<Country> TABLE = CodeTable.of(Country.class, UNKNOWN);

    private final String label;
    private final List<String> codes;

    Country(String label, String... codes) {
        this.label = label;
        this.codes = List.of(codes);
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public List<String> codes() {
        return codes;
    }
}
