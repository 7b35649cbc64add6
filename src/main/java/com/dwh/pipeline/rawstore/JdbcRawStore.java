package com.dwh.pipeline.rawstore;

import com.dwh.pipeline.domain.RawRecord;
import com.dwh.pipeline.domain.RawTable;
import com.dwh.pipeline.exception.StructuralException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * JDBC 기반 Raw Store. 모든 값을 문자열 그대로 읽습니다.
 * <p>
 * rowOffset 은 물리적 위치(ctid) 순으로 읽은 순번입니다. 같은 저장 상태에서는 항상 같은 순번이 나오며,
 * 중복 제거의 동점 처리가 이 값에 의존합니다.
 */
@Slf4j
public class JdbcRawStore implements RawStore {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private final JdbcTemplate jdbcTemplate;
    private final String schema;

    public JdbcRawStore(JdbcTemplate jdbcTemplate, String schema) {
        this.jdbcTemplate = jdbcTemplate;
        this.schema = identifier(schema);
    }

    @Override
    public RawTable read(String table) {
        String qualified = schema + "." + identifier(table);
        try {
            RawTable result = jdbcTemplate.query("SELECT * FROM " + qualified + " ORDER BY ctid", rs -> {
                ResultSetMetaData meta = rs.getMetaData();
                List<String> columns = new ArrayList<>(meta.getColumnCount());
                for (int i = 1; i <= meta.getColumnCount(); i++) {
                    columns.add(meta.getColumnLabel(i).toLowerCase(Locale.ROOT));
                }
                List<RawRecord> rows = new ArrayList<>();
                long offset = 0;
                while (rs.next()) {
                    Map<String, String> fields = new HashMap<>();
                    for (int i = 1; i <= columns.size(); i++) {
                        String value = rs.getString(i);
                        if (value != null) {
                            fields.put(columns.get(i - 1), value);
                        }
                    }
                    rows.add(new RawRecord(table, offset++, fields));
                }
                return new RawTable(table, columns, rows);
            });
            log.debug("Read {} rows from {}", result == null ? 0 : result.size(), qualified);
            return result;
        } catch (BadSqlGrammarException e) {
            throw new StructuralException("Raw table '" + qualified + "' is not readable", e);
        }
    }

    private static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new StructuralException("Invalid raw store identifier '" + name + "'");
        }
        return name;
    }
}
