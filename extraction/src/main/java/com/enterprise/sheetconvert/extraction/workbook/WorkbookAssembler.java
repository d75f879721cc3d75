package com.enterprise.sheetconvert.extraction.workbook;

import com.enterprise.sheetconvert.extraction.ExtractedTable;
import com.enterprise.sheetconvert.extraction.ExtractionResult;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Writes extracted tables into an XLSX workbook, one worksheet per table.
 * Sheets follow document order and are named {@code Table {n} (p{page})}.
 */
public class WorkbookAssembler {

    private static final Logger log = LoggerFactory.getLogger(WorkbookAssembler.class);

    public static final String CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    static final int MIN_COLUMN_CHARS = 6;
    static final int MAX_COLUMN_CHARS = 60;

    public byte[] assemble(ExtractionResult result, String sourceName) throws IOException {
        List<ExtractedTable> tables = result.tables();
        if (tables.isEmpty()) {
            throw new IllegalArgumentException("Nothing to assemble: no tables for " + sourceName);
        }
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            CellStyle headerStyle = createHeaderStyle(workbook);
            CellStyle dataStyle = createDataStyle(workbook);

            int tableNum = 1;
            for (ExtractedTable table : tables) {
                String name = WorkbookUtil.createSafeSheetName(sheetName(tableNum++, table.pageNumber()));
                writeTable(workbook.createSheet(name), table, headerStyle, dataStyle);
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            log.info("Generated workbook for '{}' with {} sheet(s), strategy={}",
                    sourceName, tables.size(), result.strategy());
            return out.toByteArray();
        }
    }

    static String sheetName(int tableNum, int pageNumber) {
        return "Table " + tableNum + " (p" + pageNumber + ")";
    }

    private static void writeTable(XSSFSheet sheet, ExtractedTable table, CellStyle headerStyle, CellStyle dataStyle) {
        int[] widths = new int[table.columnCount()];
        int rowIdx = 0;
        for (List<String> values : table.rows()) {
            Row row = sheet.createRow(rowIdx);
            CellStyle style = (rowIdx == 0) ? headerStyle : dataStyle;
            for (int c = 0; c < values.size(); c++) {
                String text = values.get(c);
                createStyledCell(row, c, text, style);
                widths[c] = Math.max(widths[c], longestLine(text));
            }
            rowIdx++;
        }
        for (int c = 0; c < widths.length; c++) {
            sheet.setColumnWidth(c, columnWidthChars(widths[c]) * 256);
        }
    }

    /**
     * Content length plus padding, clamped to a readable range.
     */
    static int columnWidthChars(int contentChars) {
        return Math.max(MIN_COLUMN_CHARS, Math.min(MAX_COLUMN_CHARS, contentChars + 2));
    }

    private static int longestLine(String text) {
        int longest = 0;
        for (String line : text.split("\n")) {
            longest = Math.max(longest, line.length());
        }
        return longest;
    }

    private static CellStyle createHeaderStyle(XSSFWorkbook wb) {
        XSSFCellStyle style = wb.createCellStyle();
        XSSFFont font = wb.createFont();
        font.setBold(true);
        style.setFont(font);
        style.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setBorderBottom(BorderStyle.THIN);
        return style;
    }

    private static CellStyle createDataStyle(XSSFWorkbook wb) {
        XSSFCellStyle style = wb.createCellStyle();
        style.setWrapText(true);
        return style;
    }

    private static void createStyledCell(Row row, int colIdx, String value, CellStyle style) {
        Cell cell = row.createCell(colIdx);
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }
}
