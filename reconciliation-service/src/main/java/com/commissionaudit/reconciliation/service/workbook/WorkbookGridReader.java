package com.commissionaudit.reconciliation.service.workbook;

import com.commissionaudit.common.exception.ValidationException;
import com.commissionaudit.common.exception.WorkbookStructureException;
import com.commissionaudit.reconciliation.config.ProcessingProperties;
import com.commissionaudit.reconciliation.model.TabularGrid;
import com.commissionaudit.reconciliation.model.WorkbookGrids;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decodes an Excel workbook into the detail and summary grids.
 *
 * Sheet choice is by name: the first sheet containing "detail" and the first
 * containing "summary", case-insensitive.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkbookGridReader {

    static final String DETAIL_SHEET = "detail";
    static final String SUMMARY_SHEET = "summary";

    private final ProcessingProperties processingProperties;

    public WorkbookGrids read(InputStream inputStream, String fileName) throws IOException {
        try (Workbook workbook = WorkbookFactory.create(inputStream)) {
            Sheet detail = findSheet(workbook, DETAIL_SHEET);
            Sheet summary = findSheet(workbook, SUMMARY_SHEET);

            // getLastRowNum is 0-based and includes the header row
            int dataRows = detail.getLastRowNum();
            if (dataRows > processingProperties.getMaxRows()) {
                throw new ValidationException("file", String.format(
                        "Detail sheet '%s' has %d rows, maximum is %d",
                        detail.getSheetName(), dataRows, processingProperties.getMaxRows()));
            }

            log.info("📊 {}: detail sheet '{}' ({} rows), summary sheet '{}' ({} rows)",
                    fileName, detail.getSheetName(), detail.getLastRowNum() + 1,
                    summary.getSheetName(), summary.getLastRowNum() + 1);

            return WorkbookGrids.builder()
                    .fileName(fileName)
                    .detail(toGrid(detail))
                    .summary(toGrid(summary))
                    .build();
        }
    }

    private Sheet findSheet(Workbook workbook, String nameFragment) {
        List<String> names = new ArrayList<>();
        for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
            Sheet sheet = workbook.getSheetAt(i);
            names.add(sheet.getSheetName());
            if (sheet.getSheetName().toLowerCase(Locale.ROOT).contains(nameFragment)) {
                return sheet;
            }
        }
        throw new WorkbookStructureException(nameFragment, names);
    }

    private TabularGrid toGrid(Sheet sheet) {
        List<List<Object>> rows = new ArrayList<>();
        for (int r = 0; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null || row.getLastCellNum() < 0) {
                rows.add(List.of());
                continue;
            }

            List<Object> values = new ArrayList<>(row.getLastCellNum());
            for (int c = 0; c < row.getLastCellNum(); c++) {
                values.add(getCellValue(row.getCell(c)));
            }
            rows.add(values);
        }
        return TabularGrid.of(sheet.getSheetName(), rows);
    }

    private Object getCellValue(Cell cell) {
        if (cell == null) return null;

        CellType type = cell.getCellType() == CellType.FORMULA
                ? cell.getCachedFormulaResultType()
                : cell.getCellType();

        return switch (type) {
            case STRING -> cell.getStringCellValue();
            case NUMERIC -> {
                if (DateUtil.isCellDateFormatted(cell)) {
                    yield cell.getLocalDateTimeCellValue().toLocalDate();
                }
                yield cell.getNumericCellValue();
            }
            case BOOLEAN -> cell.getBooleanCellValue();
            default -> null;
        };
    }
}
