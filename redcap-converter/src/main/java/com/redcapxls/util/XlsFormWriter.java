package com.redcapxls.util;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import com.redcapxls.form.ChoiceEntry;
import com.redcapxls.form.ConversionMode;
import com.redcapxls.form.OutputDocument;
import com.redcapxls.form.OutputRow;

/**
 * Writes XLSForm workbooks with a {@code survey} and a {@code choices} sheet.
 *
 * Output goes to a temporary location next to the target and is moved into
 * place only once it is complete, so a failed run never leaves a partial file.
 */
public class XlsFormWriter {

    public static final String SURVEY_SHEET = "survey";
    public static final String CHOICES_SHEET = "choices";
    public static final List<String> CHOICES_HEADERS = List.of("list name", "name", "label");

    private static final String TEMP_PREFIX = ".redcap2xlsform-";
    private static final int MIN_COLUMN_WIDTH = 12;
    private static final int MAX_COLUMN_WIDTH = 60;

    private final WorkbookFormat format;
    private final String archivePassword;

    public XlsFormWriter(ConverterConfig config) {
        this(config.getWorkbookFormat(), config.getArchivePassword());
    }

    public XlsFormWriter(WorkbookFormat format, String archivePassword) {
        this.format = format;
        this.archivePassword = archivePassword;
    }

    /**
     * Write the documents to the target: a single workbook in
     * {@link ConversionMode#SINGLE_XLS} mode, otherwise a zip archive holding
     * one workbook per document.
     */
    public void write(List<OutputDocument> documents, Path target, ConversionMode mode) throws IOException {
        Path absoluteTarget = target.toAbsolutePath();
        Path directory = absoluteTarget.getParent();
        Files.createDirectories(directory);

        if (mode == ConversionMode.SINGLE_XLS) {
            if (documents.size() != 1) {
                throw new IllegalArgumentException("Single workbook mode expects one document, got " + documents.size());
            }
            writeSingle(documents.get(0), absoluteTarget, directory);
        } else {
            writeArchive(documents, absoluteTarget, directory);
        }
        LoggingUtil.info("Wrote " + absoluteTarget);
    }

    private void writeSingle(OutputDocument document, Path target, Path directory) throws IOException {
        Path temp = Files.createTempFile(directory, TEMP_PREFIX, format.getExtension());
        try {
            writeWorkbook(document, temp);
            moveIntoPlace(temp, target);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void writeArchive(List<OutputDocument> documents, Path target, Path directory) throws IOException {
        Path tempDir = Files.createTempDirectory(directory, TEMP_PREFIX);
        try {
            Path formsDir = Files.createDirectory(tempDir.resolve("forms"));
            List<Path> workbooks = new ArrayList<>();
            for (OutputDocument document : documents) {
                Path workbook = formsDir.resolve(fileName(document));
                if (Files.exists(workbook)) {
                    throw new IOException("Two forms map to the same file name: " + workbook.getFileName());
                }
                writeWorkbook(document, workbook);
                workbooks.add(workbook);
            }

            Path archive = tempDir.resolve("archive.zip");
            ArchiveUtil.archiveFiles(workbooks, archive, archivePassword);
            moveIntoPlace(archive, target);
        } finally {
            deleteRecursively(tempDir);
        }
    }

    /**
     * File name of a document inside the archive.
     */
    public String fileName(OutputDocument document) {
        return document.getName().replaceAll("[\\\\/:*?\"<>|]", "_") + format.getExtension();
    }

    /**
     * Write one document as a workbook at the given path.
     */
    public void writeWorkbook(OutputDocument document, Path path) throws IOException {
        LoggingUtil.debug("Writing workbook " + path.getFileName() + " for form '" + document.getName() + "'");

        try (Workbook wb = createWorkbook();
             OutputStream out = Files.newOutputStream(path)) {
            CellStyle headerStyle = createHeaderStyle(wb);

            Sheet surveySheet = wb.createSheet(SURVEY_SHEET);
            List<List<String>> surveyRows = new ArrayList<>();
            for (OutputRow row : document.getRows()) {
                surveyRows.add(row.getCells());
            }
            fillSheet(surveySheet, document.getHeaders().getNames(), surveyRows, headerStyle);

            Sheet choicesSheet = wb.createSheet(CHOICES_SHEET);
            List<List<String>> choiceRows = new ArrayList<>();
            for (ChoiceEntry choice : document.getChoices()) {
                choiceRows.add(List.of(choice.getListName(), choice.getName(), choice.getLabel()));
            }
            fillSheet(choicesSheet, CHOICES_HEADERS, choiceRows, headerStyle);

            wb.write(out);
        } catch (RuntimeException e) {
            // POI reports sheet limits and bad content as unchecked exceptions
            throw new IOException("Failed to write workbook " + path + ": " + e.getMessage(), e);
        }
    }

    private Workbook createWorkbook() {
        return format == WorkbookFormat.XLSX ? new XSSFWorkbook() : new HSSFWorkbook();
    }

    private static CellStyle createHeaderStyle(Workbook wb) {
        CellStyle style = wb.createCellStyle();
        Font headerFont = wb.createFont();
        headerFont.setBold(true);
        style.setFont(headerFont);
        return style;
    }

    private static void fillSheet(Sheet sheet, List<String> headers, List<List<String>> rows, CellStyle headerStyle) {
        int[] widths = new int[headers.size()];

        Row headerRow = sheet.createRow(0);
        for (int i = 0; i < headers.size(); i++) {
            Cell cell = headerRow.createCell(i);
            cell.setCellValue(headers.get(i));
            cell.setCellStyle(headerStyle);
            widths[i] = headers.get(i).length();
        }

        int rowIndex = 1;
        for (List<String> values : rows) {
            Row row = sheet.createRow(rowIndex++);
            for (int i = 0; i < values.size() && i < headers.size(); i++) {
                String value = values.get(i);
                if (value == null || value.isEmpty()) {
                    continue;
                }
                row.createCell(i).setCellValue(value);
                widths[i] = Math.max(widths[i], longestLine(value));
            }
        }

        for (int i = 0; i < widths.length; i++) {
            int chars = Math.min(MAX_COLUMN_WIDTH, Math.max(MIN_COLUMN_WIDTH, widths[i] + 2));
            sheet.setColumnWidth(i, chars * 256);
        }
        sheet.createFreezePane(0, 1);
    }

    private static int longestLine(String value) {
        int longest = 0;
        for (String line : value.split("\n")) {
            longest = Math.max(longest, line.length());
        }
        return longest;
    }

    private static void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            LoggingUtil.debug("Atomic move not supported, replacing " + target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = new ArrayList<>();
            walk.sorted(Comparator.reverseOrder()).forEach(paths::add);
        }
        for (Path path : paths) {
            Files.deleteIfExists(path);
        }
    }
}
