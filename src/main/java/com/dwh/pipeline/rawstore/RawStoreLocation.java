package com.dwh.pipeline.rawstore;

/**
 * Raw Store 위치/자격 증명
 *
 * @param jdbcUrl 비어 있으면 애플리케이션 DataSource 를 사용합니다.
 */
public record RawStoreLocation(
        String jdbcUrl,
        String username,
        String password,
        String schema
) {

    public static RawStoreLocation local(String schema) {
        return new RawStoreLocation(null, null, null, schema);
    }

    public boolean isLocal() {
        return jdbcUrl == null || jdbcUrl.isBlank();
    }

    @Override
    public String toString() {
        return (isLocal() ? "local" : jdbcUrl) + "/" + schema;
    }
}
