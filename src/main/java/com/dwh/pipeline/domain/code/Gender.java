package com.dwh.pipeline.domain.code;

import java.util.List;

public enum Gender implements CodedValue {

    FEMALE("Female", "F", "FEMALE"),
    MALE("Male", "M", "MALE"),
    UNKNOWN("n/a");

    public static final CodeTable<Gender> TABLE = CodeTable.of(Gender.class, UNKNOWN);

    private final String label;
    private final List<String> codes;

    Gender(String label, String... codes) {
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

    public boolean isKnown() {
        return this != UNKNOWN;
    }
}
