package com.dwh.pipeline.domain.code;

import java.util.List;

public enum MaritalStatus implements CodedValue {

    SINGLE("Single", "S"),
    MARRIED("Married", "M"),
    UNKNOWN("n/a");

    public static final CodeTable<MaritalStatus> TABLE = CodeTable.of(MaritalStatus.class, UNKNOWN);

    private final String label;
    private final List<String> codes;

    MaritalStatus(String label, String... codes) {
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
