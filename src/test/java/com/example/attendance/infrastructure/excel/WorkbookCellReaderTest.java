package com.example.attendance.infrastructure.excel;

import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class WorkbookCellReaderTest {

    private final WorkbookCellReader reader = new WorkbookCellReader();

    @Test
    void eachRunGetsItsOwnFormatter() {
        DataFormatter first = reader.newFormatter();
        DataFormatter second = reader.newFormatter();

        assertThat(first).isNotSameAs(second);
    }

    @Test
    void textAndValueOfTypedCells() throws IOException {
        try (Workbook wb = new XSSFWorkbook()) {
            Sheet sheet = wb.createSheet("S");
            Row row = sheet.createRow(0);
            row.createCell(0).setCellValue("  上班 ");
            row.createCell(1).setCellValue(42d);
            row.createCell(2).setCellValue("   ");
            DataFormatter formatter = reader.newFormatter();

            assertThat(reader.text(formatter, sheet, 0, 0)).isEqualTo("上班");
            assertThat(reader.text(formatter, sheet, 0, 1)).isEqualTo("42");
            assertThat(reader.text(formatter, sheet, 5, 0)).isEmpty();
            assertThat(reader.value(sheet, 0, 1)).isEqualTo(42d);
            assertThat(reader.value(sheet, 0, 2)).isNull();
            assertThat(reader.value(sheet, 0, 9)).isNull();
        }
    }
}
