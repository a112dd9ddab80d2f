package com.redcapxls.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.redcapxls.form.ConversionMode;
import com.redcapxls.form.FormAssembler;
import com.redcapxls.form.OutputColumn;
import com.redcapxls.form.OutputDocument;
import com.redcapxls.form.OutputHeaderSet;
import com.redcapxls.form.OutputRow;
import com.redcapxls.form.RedcapTable;

import net.lingala.zip4j.ZipFile;
import net.lingala.zip4j.model.FileHeader;

import static org.junit.jupiter.api.Assertions.*;

public class XlsFormWriterTest {

    @TempDir
    Path tempDir;

    private RedcapTable sample;

    @BeforeEach
    public void setup() throws Exception {
        Path csv = Paths.get(getClass().getResource("/redcap/sample_dictionary.csv").toURI());
        sample = new RedcapCsvReader().read(csv);
    }

    private static List<String> rowValues(Row row) {
        List<String> values = new ArrayList<>();
        for (int i = 0; i < row.getLastCellNum(); i++) {
            values.add(row.getCell(i) == null ? "" : row.getCell(i).getStringCellValue());
        }
        return values;
    }

    private static List<String> directoryListing(Path dir) throws IOException {
        List<String> names = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.forEach(f -> names.add(f.getFileName().toString()));
        }
        return names;
    }

    @Test
    public void testZipHoldsOneWorkbookPerForm() throws Exception {
        List<OutputDocument> documents = new FormAssembler(ConversionMode.ZIP_XLS, List.of()).assemble(sample, "sample");
        Path target = tempDir.resolve("sample.zip");

        new XlsFormWriter(WorkbookFormat.XLS, null).write(documents, target, ConversionMode.ZIP_XLS);

        List<String> entries = new ArrayList<>();
        try (ZipFile zipFile = new ZipFile(target.toFile())) {
            for (FileHeader header : zipFile.getFileHeaders()) {
                entries.add(header.getFileName());
            }
            zipFile.extractAll(tempDir.resolve("extracted").toString());
        }
        assertEquals(List.of("demographics.xls", "visit.xls"), entries);

        try (Workbook wb = WorkbookFactory.create(tempDir.resolve("extracted").resolve("visit.xls").toFile())) {
            assertTrue(wb instanceof HSSFWorkbook);
            assertEquals("survey", wb.getSheetName(0));
            assertEquals("choices", wb.getSheetName(1));

            Sheet survey = wb.getSheet("survey");
            assertEquals(List.of("name", "type", "label", "hint", "constraint", "relevant", "required",
                    "calculation", "default", "read_only"), rowValues(survey.getRow(0)));
            assertEquals(9, survey.getLastRowNum());
            assertEquals("begin group", survey.getRow(1).getCell(1).getStringCellValue());
            assertEquals("select_multiple list_0", survey.getRow(2).getCell(1).getStringCellValue());
            assertEquals("selected('race','3')", survey.getRow(3).getCell(5).getStringCellValue());
            assertEquals("${weight} / (${height} * ${height})", survey.getRow(7).getCell(7).getStringCellValue());

            Sheet choices = wb.getSheet("choices");
            assertEquals(List.of("list name", "name", "label"), rowValues(choices.getRow(0)));
            assertEquals(List.of("yes_no", "yes", "Yes"), rowValues(choices.getRow(1)));
            assertEquals(List.of("list_0", "3", "Other"), rowValues(choices.getRow(5)));

            assertTrue(wb.getFontAt(survey.getRow(0).getCell(0).getCellStyle().getFontIndex()).getBold());
        }

        assertEquals(List.of("extracted", "sample.zip"), sortedListing(tempDir));
    }

    @Test
    public void testSingleXlsxWorkbook() throws Exception {
        List<OutputDocument> documents = new FormAssembler(ConversionMode.SINGLE_XLS, List.of()).assemble(sample, "sample");
        Path target = tempDir.resolve("out").resolve("sample.xlsx");

        new XlsFormWriter(WorkbookFormat.XLSX, null).write(documents, target, ConversionMode.SINGLE_XLS);

        try (Workbook wb = WorkbookFactory.create(target.toFile())) {
            assertTrue(wb instanceof XSSFWorkbook);
            Sheet survey = wb.getSheet("survey");
            assertEquals(16, survey.getLastRowNum());
            assertEquals("group_1", survey.getRow(2).getCell(0).getStringCellValue());
            assertEquals("<b>Personal details</b>", survey.getRow(2).getCell(2).getStringCellValue());
            assertEquals("Any comments, \"big\" or small? Please be brief",
                    survey.getRow(15).getCell(2).getStringCellValue());
            assertEquals("end group", survey.getRow(16).getCell(1).getStringCellValue());
        }
        assertEquals(List.of("sample.xlsx"), directoryListing(target.getParent()));
    }

    @Test
    public void testPasswordProtectedArchive() throws Exception {
        List<OutputDocument> documents = new FormAssembler(ConversionMode.ZIP_XLS, List.of()).assemble(sample, "sample");
        Path target = tempDir.resolve("secret.zip");

        new XlsFormWriter(WorkbookFormat.XLS, "s3cret").write(documents, target, ConversionMode.ZIP_XLS);

        assertTrue(ArchiveUtil.isPasswordProtected(target));
    }

    @Test
    public void testExistingOutputIsReplaced() throws Exception {
        List<OutputDocument> documents = new FormAssembler(ConversionMode.SINGLE_XLS, List.of()).assemble(sample, "sample");
        Path target = tempDir.resolve("sample.xls");
        Files.writeString(target, "stale");

        new XlsFormWriter(WorkbookFormat.XLS, null).write(documents, target, ConversionMode.SINGLE_XLS);

        try (Workbook wb = WorkbookFactory.create(target.toFile())) {
            assertNotNull(wb.getSheet("survey"));
        }
    }

    @Test
    public void testFailedWriteLeavesNothingBehind() throws Exception {
        // The xls format has a limit of 256 columns
        List<OutputColumn> columns = new ArrayList<>();
        for (int i = 0; i < 300; i++) {
            columns.add(OutputColumn.passThrough("column " + i));
        }
        OutputHeaderSet headers = new OutputHeaderSet(columns);
        OutputDocument document = new OutputDocument("wide", headers,
                List.of(new OutputRow(new String[300])), FormAssembler.builtInChoices());
        Path target = tempDir.resolve("wide.zip");

        assertThrows(IOException.class, () -> new XlsFormWriter(WorkbookFormat.XLS, null)
                .write(List.of(document), target, ConversionMode.ZIP_XLS));

        assertFalse(Files.exists(target));
        assertTrue(directoryListing(tempDir).isEmpty());
    }

    @Test
    public void testFileNamesAreSanitized() {
        XlsFormWriter writer = new XlsFormWriter(WorkbookFormat.XLSX, null);
        OutputDocument document = new OutputDocument("a/b:c", new OutputHeaderSet(List.of()), List.of(), List.of());

        assertEquals("a_b_c.xlsx", writer.fileName(document));
    }

    private static List<String> sortedListing(Path dir) throws IOException {
        List<String> names = directoryListing(dir);
        names.sort(null);
        return names;
    }
}
