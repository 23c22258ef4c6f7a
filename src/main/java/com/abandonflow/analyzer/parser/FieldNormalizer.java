package com.abandonflow.analyzer.parser;

import com.abandonflow.analyzer.config.AbandonAnalysisProperties;
import com.abandonflow.analyzer.model.CallSource;
import com.abandonflow.analyzer.model.DataQualityIssueType;
import com.abandonflow.analyzer.model.DataQualityLog;
import com.abandonflow.analyzer.model.QueueOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Locale;

/**
 * 字段级校验与归一化：号码、时间戳、时长、业务日。
 * 校验失败不抛异常，返回 null / 0，并把原因写进本次分析的 DataQualityLog。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FieldNormalizer {

    private static final int PHONE_KEY_DIGITS = 10;
    private static final int PHONE_MAX_DIGITS = 15;

    /** 带 AM/PM 的 12 小时制，ACD 导出的标准格式；月、日、时允许不补零 */
    private static final List<DateTimeFormatter> TWELVE_HOUR_FORMATTERS = List.of(
            caseInsensitive("M-d-yyyy h:mm:ss a"),
            caseInsensitive("M/d/yyyy h:mm:ss a")
    );

    /** 通用日期时间格式，按优先级尝试。ISO_DATE_TIME 兼容带时区偏移的写法，偏移直接丢弃 */
    private static final List<DateTimeFormatter> DATE_TIME_FORMATTERS = List.of(
            DateTimeFormatter.ISO_DATE_TIME,
            new DateTimeFormatterBuilder()
                    .appendPattern("yyyy-M-d H:mm:ss")
                    .optionalStart()
                    .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
                    .optionalEnd()
                    .toFormatter(Locale.ENGLISH),
            DateTimeFormatter.ofPattern("yyyy-M-d H:mm", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("yyyy/M/d H:mm:ss", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("M-d-yyyy H:mm:ss", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("M/d/yyyy H:mm:ss", Locale.ENGLISH)
    );

    /** 只有日期时按当天 00:00 处理 */
    private static final List<DateTimeFormatter> DATE_ONLY_FORMATTERS = List.of(
            DateTimeFormatter.ofPattern("yyyy-M-d", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("M-d-yyyy", Locale.ENGLISH),
            DateTimeFormatter.ofPattern("M/d/yyyy", Locale.ENGLISH)
    );

    private final AbandonAnalysisProperties properties;
    private final Clock clock;

    /**
     * 去掉非数字字符后取最后 10 位。
     * 少于 10 位或多于 15 位视为无效号码。
     */
    public String normalizePhone(String raw, CallSource source, int rowNumber, DataQualityLog issues) {
        if (raw == null || raw.isBlank()) {
            issues.add(DataQualityIssueType.INVALID_PHONE, source, rowNumber, raw, "Empty phone");
            log.debug("Reject phone at {} row {}: empty", source, rowNumber);
            return null;
        }
        StringBuilder digits = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c >= '0' && c <= '9') {
                digits.append(c);
            }
        }
        if (digits.length() < PHONE_KEY_DIGITS) {
            issues.add(DataQualityIssueType.INVALID_PHONE, source, rowNumber, raw, "Too short: " + raw);
            log.debug("Reject phone at {} row {}: too short ({})", source, rowNumber, raw);
            return null;
        }
        if (digits.length() > PHONE_MAX_DIGITS) {
            issues.add(DataQualityIssueType.INVALID_PHONE, source, rowNumber, raw, "Too long: " + raw);
            log.debug("Reject phone at {} row {}: too long ({})", source, rowNumber, raw);
            return null;
        }
        return digits.substring(digits.length() - PHONE_KEY_DIGITS);
    }

    /**
     * 解析时间戳：含 AM/PM 时走 12 小时制，否则依次尝试通用格式。
     * 超出 [now - pastDays, now + futureDays] 的时间视为脏数据。
     */
    public LocalDateTime normalizeTimestamp(String raw, CallSource source, int rowNumber, DataQualityLog issues) {
        if (raw == null || raw.isBlank()) {
            issues.add(DataQualityIssueType.INVALID_TIMESTAMP, source, rowNumber, raw, "Empty timestamp");
            log.debug("Reject timestamp at {} row {}: empty", source, rowNumber);
            return null;
        }
        String text = raw.trim();
        String upper = text.toUpperCase(Locale.ROOT);
        boolean twelveHour = upper.contains("AM") || upper.contains("PM");

        LocalDateTime parsed = twelveHour
                ? parseDateTime(text, TWELVE_HOUR_FORMATTERS)
                : parseGeneric(text);
        if (parsed == null) {
            issues.add(DataQualityIssueType.INVALID_TIMESTAMP, source, rowNumber, raw, "Unparseable timestamp: " + raw);
            return null;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime min = now.minusDays(properties.getTimestampPastDays());
        LocalDateTime max = now.plusDays(properties.getTimestampFutureDays());
        if (parsed.isBefore(min) || parsed.isAfter(max)) {
            issues.add(DataQualityIssueType.INVALID_TIMESTAMP, source, rowNumber, raw,
                    "Date outside reasonable range: " + raw);
            log.debug("Reject timestamp at {} row {}: {} outside [{}, {}]", source, rowNumber, parsed, min, max);
            return null;
        }
        return parsed;
    }

    /** 6AM-6AM 业务日：凌晨 6 点前的呼叫算前一天 */
    public LocalDate businessDate(LocalDateTime timestamp) {
        if (timestamp.getHour() < properties.getBusinessDayStartHour()) {
            return timestamp.toLocalDate().minusDays(1);
        }
        return timestamp.toLocalDate();
    }

    /**
     * HH:MM:SS 转秒。空值和 00:00:00 为 0；非数字分段按 0 计；
     * 小时 > 24 或分/秒 > 59 时返回 0 并记录问题。
     */
    public int durationSeconds(String raw, CallSource source, int rowNumber, DataQualityLog issues) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        String text = raw.trim();
        if ("00:00:00".equals(text)) {
            return 0;
        }
        String[] parts = text.split(":");
        if (parts.length != 3) {
            issues.add(DataQualityIssueType.INVALID_DURATION, source, rowNumber, raw, "Not HH:MM:SS: " + raw);
            log.debug("Reject duration at {} row {}: {}", source, rowNumber, raw);
            return 0;
        }
        int hours = digitsOrZero(parts[0]);
        int minutes = digitsOrZero(parts[1]);
        int seconds = digitsOrZero(parts[2]);
        if (hours > 24 || minutes > 59 || seconds > 59) {
            issues.add(DataQualityIssueType.INVALID_DURATION, source, rowNumber, raw, "Out of range: " + raw);
            log.debug("Reject duration at {} row {}: out of range {}", source, rowNumber, raw);
            return 0;
        }
        return hours * 3600 + minutes * 60 + seconds;
    }

    public QueueOutcome queueOutcome(String answeredHungup) {
        if (answeredHungup == null) {
            return QueueOutcome.OTHER;
        }
        String value = answeredHungup.trim();
        if (value.equalsIgnoreCase(properties.getInbound().getAnsweredMarker())) {
            return QueueOutcome.ANSWERED;
        }
        if (value.equalsIgnoreCase(properties.getInbound().getHungupMarker())) {
            return QueueOutcome.HUNGUP;
        }
        return QueueOutcome.OTHER;
    }

    private LocalDateTime parseGeneric(String text) {
        LocalDateTime dateTime = parseDateTime(text, DATE_TIME_FORMATTERS);
        if (dateTime != null) {
            return dateTime;
        }
        DateTimeParseException lastError = null;
        for (DateTimeFormatter formatter : DATE_ONLY_FORMATTERS) {
            try {
                return LocalDate.parse(text, formatter).atStartOfDay();
            } catch (DateTimeParseException e) {
                lastError = e;
            }
        }
        log.debug("无法解析时间戳: {} ({})", text, lastError != null ? lastError.getMessage() : "no formatter");
        return null;
    }

    private LocalDateTime parseDateTime(String text, List<DateTimeFormatter> formatters) {
        for (DateTimeFormatter formatter : formatters) {
            try {
                return LocalDateTime.parse(text, formatter);
            } catch (DateTimeParseException e) {
                log.trace("Formatter {} rejected {}: {}", formatter, text, e.getMessage());
            }
        }
        return null;
    }

    private static int digitsOrZero(String part) {
        String p = part.trim();
        if (p.isEmpty()) {
            return 0;
        }
        for (int i = 0; i < p.length(); i++) {
            if (!Character.isDigit(p.charAt(i))) {
                return 0;
            }
        }
        // 超长数字必然越界，交给范围检查
        return p.length() > 9 ? Integer.MAX_VALUE : Integer.parseInt(p);
    }

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH);
    }
}
