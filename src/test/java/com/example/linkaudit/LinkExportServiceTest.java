package com.example.linkaudit;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class LinkExportServiceTest {

    private final LinkExportService service = new LinkExportService();

    private static List<String> values(Row row) {
        List<String> out = new ArrayList<>();
        for (int c = 0; c < row.getLastCellNum(); c++) out.add(row.getCell(c).getStringCellValue());
        return out;
    }

    @Test
    void rowsListLinksThenFileErrors() {
        List<FileLinks> data = List.of(
                new FileLinks("/s/a.docx", List.of(
                        new Link("Site", "https://example.org/", "https://example.org/", LinkType.EXTERNAL)), null),
                new FileLinks("/s/bad.docx", List.of(), "cannot open"));

        List<List<String>> rows = service.rowsFor(data);

        assertEquals(List.of(
                List.of("/s/a.docx", "Site", "https://example.org/", "external", ""),
                List.of("/s/bad.docx", "", "", "", "cannot open")), rows);
    }

    @Test
    void workbookHasHeaderAndFixedWidthRows() throws Exception {
        List<List<String>> rows = List.of(
                List.of("a.docx", "Text"),
                Arrays.asList("b.docx", null, "u", "internal", "", "extra"));

        byte[] bytes = service.toXlsx(rows);

        try (XSSFWorkbook wb = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            XSSFSheet sheet = wb.getSheet("Links");
            assertNotNull(sheet);
            assertEquals(List.of("File", "Text", "URL", "Type", "Error"), values(sheet.getRow(0)));
            assertEquals(List.of("a.docx", "Text", "", "", ""), values(sheet.getRow(1)));
            assertEquals(List.of("b.docx", "", "u", "internal", ""), values(sheet.getRow(2)));
            assertEquals(2, sheet.getLastRowNum());
        }
    }
}
