package com.netcourier.docstruct.service.export;

import com.netcourier.docstruct.model.OutputRow;
import com.netcourier.docstruct.service.DocumentProcessingException;
import com.netcourier.docstruct.service.dedup.DateValues;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Writes the final table to a single {@code Output} sheet. Values holding a recognised date become real date
 * cells shown as {@code DD-MMM-YY}; everything else stays text.
 */
@Component
public class PoiSpreadsheetExporter implements SpreadsheetExporter {

    private static final Logger log = LoggerFactory.getLogger(PoiSpreadsheetExporter.class);
    static final String SHEET_NAME = "Output";
    static final List<String> HEADERS = List.of("Sr No", "Key", "Value", "Comments");
    private static final int[] COLUMN_WIDTHS = {8, 32, 32, 80};

    @Override
    public byte[] export(List<OutputRow> rows) {
        try (Workbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            Styles styles = new Styles(workbook);
            writeHeader(sheet, styles);
            int rowIndex = 1;
            for (OutputRow outputRow : rows == null ? List.<OutputRow>of() : rows) {
                writeRow(sheet.createRow(rowIndex++), outputRow, styles);
            }
            for (int column = 0; column < COLUMN_WIDTHS.length; column++) {
                sheet.setColumnWidth(column, COLUMN_WIDTHS[column] * 256);
            }
            workbook.write(output);
            log.debug("Exported {} rows to spreadsheet", rowIndex - 1);
            return output.toByteArray();
        } catch (IOException e) {
            throw new DocumentProcessingException(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to write spreadsheet", e);
        }
    }

    private void writeHeader(Sheet sheet, Styles styles) {
        Row header = sheet.createRow(0);
        for (int column = 0; column < HEADERS.size(); column++) {
            Cell cell = header.createCell(column);
            cell.setCellValue(HEADERS.get(column));
            cell.setCellStyle(styles.header());
        }
    }

    private void writeRow(Row row, OutputRow outputRow, Styles styles) {
        CellStyle textStyle = outputRow.conflict() ? styles.conflict() : styles.text();
        Cell number = row.createCell(0);
        number.setCellValue(outputRow.srNo());
        number.setCellStyle(textStyle);

        Cell key = row.createCell(1);
        key.setCellValue(outputRow.key());
        key.setCellStyle(textStyle);

        Cell value = row.createCell(2);
        Optional<LocalDate> date = DateValues.parse(outputRow.value());
        if (date.isPresent()) {
            value.setCellValue(date.get());
            value.setCellStyle(outputRow.conflict() ? styles.conflictDate() : styles.date());
        } else {
            value.setCellValue(outputRow.value());
            value.setCellStyle(textStyle);
        }

        Cell comments = row.createCell(3);
        comments.setCellValue(outputRow.comments());
        comments.setCellStyle(textStyle);
    }

    private record Styles(CellStyle header, CellStyle text, CellStyle date, CellStyle conflict, CellStyle conflictDate) {

        Styles(Workbook workbook) {
            this(headerStyle(workbook),
                    textStyle(workbook, false),
                    dateStyle(workbook, false),
                    textStyle(workbook, true),
                    dateStyle(workbook, true));
        }

        private static CellStyle headerStyle(Workbook workbook) {
            Font font = workbook.createFont();
            font.setBold(true);
            CellStyle style = workbook.createCellStyle();
            style.setFont(font);
            return style;
        }

        private static CellStyle textStyle(Workbook workbook, boolean conflict) {
            CellStyle style = workbook.createCellStyle();
            style.setWrapText(true);
            if (conflict) {
                highlight(style);
            }
            return style;
        }

        private static CellStyle dateStyle(Workbook workbook, boolean conflict) {
            CreationHelper helper = workbook.getCreationHelper();
            CellStyle style = textStyle(workbook, conflict);
            style.setDataFormat(helper.createDataFormat().getFormat("dd-mmm-yy"));
            return style;
        }

        private static void highlight(CellStyle style) {
            style.setFillForegroundColor(IndexedColors.LIGHT_YELLOW.getIndex());
            style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        }
    }
}
