package com.dwh.pipeline.cleansing;

import com.dwh.pipeline.config.PipelineProperties;
import com.dwh.pipeline.domain.code.CodeTable;
import com.dwh.pipeline.domain.code.CodedValue;
import com.dwh.pipeline.exception.ErrorKind;
import com.dwh.pipeline.quality.StageIssues;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * 필드 단위 정규화
 * <p>
 * 데이터 수준의 문제는 예외로 던지지 않고 null(또는 코드 기본값)로 대체한 뒤 QualityIssue 를 남깁니다.
 */
@Component
public class FieldNormalizer {

    private static final DateTimeFormatter ISO_DATE =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter COMPACT_DATE =
            DateTimeFormatter.ofPattern("uuuuMMdd").withResolverStyle(ResolverStyle.STRICT);

    private final LocalDate minDate;
    private final LocalDate maxDate;
    private final Clock clock;

    public FieldNormalizer(PipelineProperties properties, Clock clock) {
        this.minDate = properties.getMinDate();
        this.maxDate = properties.getMaxDate();
        this.clock = clock;
    }

    /**
     * 앞뒤 공백 제거. 빈 문자열은 null
     */
    public String text(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public <E extends Enum<E> & CodedValue> E code(CodeTable<E> table, String raw, Field field, StageIssues issues) {
        String value = text(raw);
        if (value == null) {
            issues.info(field.entity(), field.businessKey(), "code:" + field.column(), ErrorKind.FORMAT,
                    "absent code replaced by '" + table.fallback().label() + "'");
            return table.fallback();
        }
        return table.lookup(value).orElseGet(() -> {
            issues.warning(field.entity(), field.businessKey(), "code:" + field.column(), ErrorKind.FORMAT,
                    "unrecognized code '" + value + "' replaced by '" + table.fallback().label() + "'");
            return table.fallback();
        });
    }

    /**
     * yyyy-MM-dd 날짜
     */
    public LocalDate isoDate(String raw, Field field, StageIssues issues) {
        String value = text(raw);
        if (value == null) {
            return null;
        }
        try {
            return inRange(LocalDate.parse(value, ISO_DATE), value, field, issues);
        } catch (DateTimeParseException e) {
            issues.warning(field.entity(), field.businessKey(), "date:" + field.column(), ErrorKind.FORMAT,
                    "malformed date '" + value + "' replaced by null");
            return null;
        }
    }

    /**
     * yyyyMMdd 정수형 날짜. 0 은 값 없음으로 취급합니다.
     */
    public LocalDate compactDate(String raw, Field field, StageIssues issues) {
        String value = text(raw);
        if (value == null) {
            return null;
        }
        if ("0".equals(value)) {
            issues.info(field.entity(), field.businessKey(), "date:" + field.column(), ErrorKind.FORMAT,
                    "date code 0 means absent");
            return null;
        }
        if (value.length() != 8) {
            issues.warning(field.entity(), field.businessKey(), "date:" + field.column(), ErrorKind.FORMAT,
                    "invalid date code '" + value + "' replaced by null");
            return null;
        }
        try {
            return inRange(LocalDate.parse(value, COMPACT_DATE), value, field, issues);
        } catch (DateTimeParseException e) {
            issues.warning(field.entity(), field.businessKey(), "date:" + field.column(), ErrorKind.FORMAT,
                    "malformed date code '" + value + "' replaced by null");
            return null;
        }
    }

    /**
     * 과거 날짜만 허용 (생년월일 등)
     */
    public LocalDate pastDate(String raw, Field field, StageIssues issues) {
        LocalDate date = isoDate(raw, field, issues);
        if (date != null && date.isAfter(LocalDate.now(clock))) {
            issues.warning(field.entity(), field.businessKey(), "date:" + field.column(), ErrorKind.FORMAT,
                    "future date " + date + " replaced by null");
            return null;
        }
        return date;
    }

    public Integer integer(String raw, Field field, StageIssues issues) {
        String value = text(raw);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            issues.warning(field.entity(), field.businessKey(), "number:" + field.column(), ErrorKind.FORMAT,
                    "non-numeric value '" + value + "' replaced by null");
            return null;
        }
    }

    public BigDecimal decimal(String raw, Field field, StageIssues issues) {
        String value = text(raw);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            issues.warning(field.entity(), field.businessKey(), "number:" + field.column(), ErrorKind.FORMAT,
                    "non-numeric value '" + value + "' replaced by null");
            return null;
        }
    }

    private LocalDate inRange(LocalDate date, String raw, Field field, StageIssues issues) {
        if (date.isBefore(minDate) || !date.isBefore(maxDate)) {
            issues.warning(field.entity(), field.businessKey(), "date:" + field.column(), ErrorKind.FORMAT,
                    "date '" + raw + "' outside [" + minDate + ", " + maxDate + ") replaced by null");
            return null;
        }
        return date;
    }

    /**
     * 정규화 대상 필드의 위치 정보 (issue 기록용)
     */
    public record Field(String entity, Object businessKey, String column) {
    }
}
