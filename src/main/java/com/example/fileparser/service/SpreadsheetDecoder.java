package com.example.fileparser.service;

import com.example.fileparser.model.DecoderVariant;
import com.example.fileparser.support.DecodeException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.FormulaError;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class SpreadsheetDecoder implements TabularDecoder {

    // integral doubles beyond this are left as doubles
    private static final double MAX_EXACT_INTEGRAL = 1e15;

    private final DataFormatter headerFormatter = new DataFormatter();

    @Override
    public DecoderVariant variant() {
        return DecoderVariant.XLSX;
    }

    @Override
    public List<Map<String, Object>> decode(InputStream source, String filename) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(source)) {
            if (workbook.getNumberOfSheets() == 0) {
                log.debug("Workbook {} has no sheets", filename);
                return List.of();
            }
            return decodeSheet(workbook.getSheetAt(0));
        } catch (RuntimeException ex) {
            throw new DecodeException("Failed to read workbook %s".formatted(filename), ex);
        }
    }

    private List<Map<String, Object>> decodeSheet(Sheet sheet) {
        Row headerRow = sheet.getRow(sheet.getFirstRowNum());
        if (headerRow == null) {
            return List.of();
        }

        int firstColumn = Integer.MAX_VALUE;
        int lastColumn = -1;
        for (Row row : sheet) {
            if (row.getFirstCellNum() >= 0) {
                firstColumn = Math.min(firstColumn, row.getFirstCellNum());
                lastColumn = Math.max(lastColumn, row.getLastCellNum());
            }
        }
        if (lastColumn < 0) {
            return List.of();
        }

        List<String> rawHeaders = new ArrayList<>();
        for (int c = firstColumn; c < lastColumn; c++) {
            Cell cell = headerRow.getCell(c);
            rawHeaders.add(cell == null ? null : headerFormatter.formatCellValue(cell));
        }
        List<String> headers = TabularHeaders.normalize(rawHeaders);

        List<Map<String, Object>> records = new ArrayList<>();
        for (int r = headerRow.getRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            Map<String, Object> record = new LinkedHashMap<>(headers.size() * 2);
            boolean blank = true;
            for (int i = 0; i < headers.size(); i++) {
                Object value = cellValue(row.getCell(firstColumn + i));
                blank &= value == null;
                record.put(headers.get(i), value);
            }
            if (!blank) {
                records.add(record);
            }
        }
        return records;
    }

    private static Object cellValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        CellType type = cell.getCellType() == CellType.FORMULA ? cell.getCachedFormulaResultType() : cell.getCellType();
        switch (type) {
            case STRING:
                String text = cell.getStringCellValue();
                return text.isEmpty() ? null : text;
            case NUMERIC:
                if (DateUtil.isCellDateFormatted(cell)) {
                    return cell.getLocalDateTimeCellValue().toString();
                }
                return number(cell.getNumericCellValue());
            case BOOLEAN:
                return cell.getBooleanCellValue();
            case ERROR:
                return FormulaError.forInt(cell.getErrorCellValue()).getString();
            default:
                return null;
        }
    }

    private static Object number(double value) {
        if (value == Math.rint(value) && Math.abs(value) < MAX_EXACT_INTEGRAL) {
            return (long) value;
        }
        return value;
    }
}
