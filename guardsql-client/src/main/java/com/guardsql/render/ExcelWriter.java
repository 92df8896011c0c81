package com.guardsql.render;

import com.guardsql.util.JdbcValues;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.Map;

/**
 * Single-sheet {@code .xlsx} workbook with a bold header row.
 */
public class ExcelWriter implements ResultWriter {

    @Override
    public void write(ResultTable table, OutputStream out) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("results");
            CellStyle headerStyle = workbook.createCellStyle();
            Font bold = workbook.createFont();
            bold.setBold(true);
            headerStyle.setFont(bold);

            List<String> names = table.columnNames();
            Row header = sheet.createRow(0);
            for (int i = 0; i < names.size(); i++) {
                Cell cell = header.createCell(i);
                cell.setCellValue(names.get(i));
                cell.setCellStyle(headerStyle);
            }

            int r = 1;
            for (Map<String, Object> row : table.getRows()) {
                Row sheetRow = sheet.createRow(r++);
                for (int i = 0; i < names.size(); i++) {
                    Object value = row.get(names.get(i));
                    if (value == null) {
                        continue;
                    }
                    Cell cell = sheetRow.createCell(i);
                    if (value instanceof Number) {
                        cell.setCellValue(((Number) value).doubleValue());
                    } else if (value instanceof Boolean) {
                        cell.setCellValue((Boolean) value);
                    } else {
                        cell.setCellValue(JdbcValues.toText(value));
                    }
                }
            }
            workbook.write(out);
        }
        out.flush();
    }
}
