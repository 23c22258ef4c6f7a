package com.abandonflow.analyzer.parser;

import com.abandonflow.analyzer.config.AbandonAnalysisProperties;
import com.abandonflow.analyzer.model.CallSource;
import com.abandonflow.analyzer.model.DataQualityIssueType;
import com.abandonflow.analyzer.model.DataQualityLog;
import com.abandonflow.analyzer.model.InboundCallRecord;
import com.abandonflow.analyzer.model.OutboundCallRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * 把 ACD / 外呼导出的工作簿读成强类型记录。
 * 表头只在这里按名称模糊匹配一次，核心逻辑只认字段。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CallLogWorkbookReader {

    // ACD 呼入日志表头
    static final String PHONE = "Phone";
    static final String ANSWERED_HUNGUP = "Answered/Hungup";
    static final String WAIT_TIME = "Wait Time at ACD";
    static final String CALL_TIME = "Call Time";
    static final String QUEUE_NAME = "Queue Name";
    static final String USERNAME = "Username";
    static final String USER_DISPOSITION_CODE = "User Disposition Code";
    static final String USER_TALK_TIME = "User Talk Time";

    // 外呼日志表头
    static final String CALL_TYPE = "Call Type";
    static final String SYSTEM_DISPOSITION = "System Disposition";
    static final String DISPOSITION_CODE = "Disposition Code";
    static final String USER_NAME = "User Name";

    private static final DateTimeFormatter DATE_TIME_TEXT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH);
    private static final DateTimeFormatter TIME_TEXT = DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ENGLISH);

    private final AbandonAnalysisProperties properties;

    public List<InboundCallRecord> readInbound(InputStream in, DataQualityLog issues) {
        CallSource source = CallSource.INBOUND_QUEUE;
        return readSheet(in, source, issues, columns -> InboundCallRecord.builder()
                .rowNumber(columns.rowNumber())
                .phone(columns.get(PHONE))
                .answeredHungup(columns.get(ANSWERED_HUNGUP))
                .waitTime(columns.get(WAIT_TIME))
                .callTime(columns.get(CALL_TIME))
                .queueName(columns.get(QUEUE_NAME))
                .username(columns.get(USERNAME))
                .dispositionCode(columns.get(USER_DISPOSITION_CODE))
                .talkTime(columns.get(USER_TALK_TIME))
                .build(),
                PHONE, ANSWERED_HUNGUP, WAIT_TIME, CALL_TIME, QUEUE_NAME, USERNAME, USER_DISPOSITION_CODE, USER_TALK_TIME);
    }

    public List<OutboundCallRecord> readOutbound(InputStream in, DataQualityLog issues) {
        CallSource source = CallSource.OUTBOUND_DIALER;
        return readSheet(in, source, issues, columns -> OutboundCallRecord.builder()
                .rowNumber(columns.rowNumber())
                .phone(columns.get(PHONE))
                .callType(columns.get(CALL_TYPE))
                .systemDisposition(columns.get(SYSTEM_DISPOSITION))
                .callTime(columns.get(CALL_TIME))
                .dispositionCode(columns.get(DISPOSITION_CODE))
                .userName(columns.get(USER_NAME))
                .talkTime(columns.get(USER_TALK_TIME))
                .build(),
                PHONE, CALL_TYPE, SYSTEM_DISPOSITION, CALL_TIME, DISPOSITION_CODE, USER_NAME, USER_TALK_TIME);
    }

    private <T> List<T> readSheet(InputStream in,
                                  CallSource source,
                                  DataQualityLog issues,
                                  Function<RowColumns, T> mapper,
                                  String... expectedColumns) {
        List<T> result = new ArrayList<>();
        try (Workbook workbook = WorkbookFactory.create(in)) {
            if (workbook.getNumberOfSheets() == 0) {
                log.warn("Workbook for {} has no sheets", source);
                return result;
            }
            Sheet sheet = workbook.getSheetAt(Math.min(properties.getWorkbook().getSheetIndex(),
                    workbook.getNumberOfSheets() - 1));
            DataFormatter formatter = new DataFormatter(Locale.ENGLISH);

            Row header = sheet.getRow(sheet.getFirstRowNum());
            if (header == null) {
                log.warn("Sheet '{}' for {} is empty", sheet.getSheetName(), source);
                return result;
            }
            Map<String, Integer> columnIndex = resolveColumns(header, formatter, source, issues, expectedColumns);

            for (int r = header.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null || isBlank(row, formatter)) {
                    continue;
                }
                Map<String, String> values = new HashMap<>();
                for (Map.Entry<String, Integer> e : columnIndex.entrySet()) {
                    values.put(e.getKey(), cellText(row.getCell(e.getValue()), formatter));
                }
                result.add(mapper.apply(new RowColumns(r + 1, values)));
            }
        } catch (IOException | EncryptedDocumentException | IllegalArgumentException e) {
            throw new CallLogReadException("Cannot read " + source + " workbook: " + e.getMessage(), e);
        }
        log.info("读取 {} 记录 {} 条", source, result.size());
        return result;
    }

    /**
     * 表头匹配：先精确（忽略大小写和首尾空白），再找包含该名称的列。
     * 找不到的列记为 MISSING_COLUMN，对应字段一律取空串。
     */
    private Map<String, Integer> resolveColumns(Row header,
                                                DataFormatter formatter,
                                                CallSource source,
                                                DataQualityLog issues,
                                                String... expectedColumns) {
        List<String> headers = new ArrayList<>();
        for (int c = 0; c < header.getLastCellNum(); c++) {
            headers.add(cellText(header.getCell(c), formatter).toLowerCase(Locale.ROOT));
        }

        Map<String, Integer> index = new HashMap<>();
        for (String expected : expectedColumns) {
            String want = expected.toLowerCase(Locale.ROOT);
            int found = headers.indexOf(want);
            if (found < 0) {
                for (int c = 0; c < headers.size(); c++) {
                    if (headers.get(c).contains(want)) {
                        found = c;
                        break;
                    }
                }
            }
            if (found < 0) {
                issues.add(DataQualityIssueType.MISSING_COLUMN, source, header.getRowNum() + 1, expected,
                        "Column '" + expected + "' not found");
                log.warn("Column '{}' not found in {} header {}", expected, source, headers);
                continue;
            }
            index.put(expected, found);
        }
        return index;
    }

    private static boolean isBlank(Row row, DataFormatter formatter) {
        for (Cell cell : row) {
            if (!cellText(cell, formatter).isEmpty()) {
                return false;
            }
        }
        return true;
    }

    private static String cellText(Cell cell, DataFormatter formatter) {
        if (cell == null) {
            return "";
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        if (type == CellType.NUMERIC) {
            double value = cell.getNumericCellValue();
            if (DateUtil.isCellDateFormatted(cell)) {
                LocalDateTime dt = cell.getLocalDateTimeCellValue();
                // 小于 1 的日期值只有时分秒，通常是等待 / 通话时长
                return value < 1.0 ? dt.format(TIME_TEXT) : dt.format(DATE_TIME_TEXT);
            }
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                // 号码列常被存成数字，避免出现科学计数法
                return BigDecimal.valueOf(value).toBigInteger().toString();
            }
        }
        if (type == CellType.STRING) {
            return cell.getStringCellValue().trim();
        }
        if (type == CellType.BOOLEAN) {
            return String.valueOf(cell.getBooleanCellValue());
        }
        return formatter.formatCellValue(cell).trim();
    }

    /** 一行数据的列值视图 */
    private static final class RowColumns {
        private final int rowNumber;
        private final Map<String, String> values;

        RowColumns(int rowNumber, Map<String, String> values) {
            this.rowNumber = rowNumber;
            this.values = values;
        }

        int rowNumber() {
            return rowNumber;
        }

        String get(String column) {
            return values.getOrDefault(column, "");
        }
    }
}
