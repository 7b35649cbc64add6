package com.dwh.pipeline.assembly;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * append-only key_assignment 테이블 기반 key 할당
 * <p>
 * 이미 할당된 business key 는 기존 key 를 재사용하고, 새 business key 는 max + 1 부터 순서대로 추가합니다.
 * 행을 수정하거나 삭제하지 않으므로 run 간 key 가 안정적입니다 (dense 는 보장하지 않음).
 */
@Slf4j
public class PersistedKeyAssigner implements KeyAssigner {

    private final JdbcTemplate jdbcTemplate;
    private final String table;

    public PersistedKeyAssigner(JdbcTemplate jdbcTemplate, String schema) {
        this.jdbcTemplate = jdbcTemplate;
        this.table = schema + ".key_assignment";
        jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
        jdbcTemplate.execute("""
                CREATE TABLE IF NOT EXISTS %s (
                    entity_type    VARCHAR(50)  NOT NULL,
                    business_key   VARCHAR(100) NOT NULL,
                    surrogate_key  INTEGER      NOT NULL,
                    PRIMARY KEY (entity_type, business_key),
                    UNIQUE (entity_type, surrogate_key)
                )
                """.formatted(table));
    }

    @Override
    public synchronized Map<String, Integer> assign(String entityType, List<String> orderedBusinessKeys) {
        Map<String, Integer> existing = new HashMap<>();
        jdbcTemplate.query("SELECT business_key, surrogate_key FROM " + table + " WHERE entity_type = ?",
                rs -> {
                    existing.put(rs.getString("business_key"), rs.getInt("surrogate_key"));
                },
                entityType);

        int next = existing.values().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
        Map<String, Integer> keys = new LinkedHashMap<>();
        List<Object[]> inserts = new ArrayList<>();
        for (String businessKey : orderedBusinessKeys) {
            Integer key = existing.get(businessKey);
            if (key == null) {
                key = next++;
                existing.put(businessKey, key);
                inserts.add(new Object[]{entityType, businessKey, key});
            }
            keys.put(businessKey, key);
        }

        if (!inserts.isEmpty()) {
            jdbcTemplate.batchUpdate(
                    "INSERT INTO " + table + " (entity_type, business_key, surrogate_key) VALUES (?, ?, ?)",
                    inserts);
            log.info("Assigned {} new {} surrogate keys", inserts.size(), entityType);
        }
        return keys;
    }
}
