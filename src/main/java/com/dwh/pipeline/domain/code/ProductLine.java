package com.dwh.pipeline.domain.code;

import java.util.List;

public enum ProductLine implements CodedValue {

    MOUNTAIN("Mountain", "M"),
    ROAD("Road", "R"),
    OTHER_SALES("Other Sales", "S"),
    TOURING("Touring", "T"),
    UNKNOWN("n/a");

    public static final CodeTable<ProductLine> TABLE = CodeTable.of(ProductLine.class, UNKNOWN);

    private final String label;
    private final List<String> codes;

    ProductLine(String label, String... codes) {
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
