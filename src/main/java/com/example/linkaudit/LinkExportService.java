package com.example.linkaudit;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/** Link listing as an .xlsx workbook: one "Links" sheet, File | Text | URL | Type | Error. */
@Slf4j
@Service
public class LinkExportService {

    static final String SHEET = "Links";
    static final List<String> HEADER = List.of("File", "Text", "URL", "Type", "Error");

    /** One row per link, plus one error row for each unreadable file. */
    public List<List<String>> rowsFor(List<FileLinks> linkData) {
        List<List<String>> rows = new ArrayList<>();
        for (FileLinks item : linkData) {
            for (Link link : item.getLinks()) {
                rows.add(List.of(item.getPath(), nz(link.getText()), nz(link.getNormalizedTarget()),
                        link.getType() == null ? "" : link.getType().label(), ""));
            }
            if (item.getError() != null) {
                rows.add(List.of(item.getPath(), "", "", "", item.getError()));
            }
        }
        return rows;
    }

    /** Rows are padded or cut to the header width. */
    public byte[] toXlsx(List<List<String>> rows) throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XSSFSheet sheet = workbook.createSheet(SHEET);
            writeRow(sheet.createRow(0), HEADER);
            int r = 1;
            for (List<String> row : rows) {
                List<String> cells = new ArrayList<>(HEADER.size());
                for (int i = 0; i < HEADER.size(); i++) {
                    cells.add(row != null && i < row.size() ? nz(row.get(i)) : "");
                }
                writeRow(sheet.createRow(r++), cells);
            }
            workbook.write(out);
            log.debug("exported {} link row(s)", rows.size());
            return out.toByteArray();
        }
    }

    private static void writeRow(XSSFRow row, List<String> values) {
        for (int c = 0; c < values.size(); c++) row.createCell(c).setCellValue(values.get(c));
    }

    private static String nz(String s) { return s == null ? "" : s; }
}
