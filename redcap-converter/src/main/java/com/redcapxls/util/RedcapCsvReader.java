package com.redcapxls.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.redcapxls.form.RedcapTable;

/**
 * Reads a REDCap data dictionary export.
 *
 * The file is UTF-8 with an optional byte order mark. Quoted cells may hold
 * commas, doubled quotes and line breaks, which REDCap uses freely in labels
 * and choice definitions.
 */
public class RedcapCsvReader {

    private static final char QUOTE = '"';
    private static final char SEPARATOR = ',';
    private static final char BOM = '\uFEFF';

    public RedcapTable read(Path csvFile) throws IOException {
        LoggingUtil.info("Reading REDCap data dictionary: " + csvFile);
        try (BufferedReader reader = Files.newBufferedReader(csvFile, StandardCharsets.UTF_8)) {
            RedcapTable table = read(reader);
            LoggingUtil.info("Read " + table.getRows().size() + " row(s) with "
                    + table.getHeaders().size() + " column(s)");
            return table;
        }
    }

    public RedcapTable read(Reader reader) throws IOException {
        List<List<String>> records = parseRecords(reader);
        if (records.isEmpty()) {
            throw new IOException("REDCap file is empty, no header row found");
        }

        List<String> headers = new ArrayList<>();
        for (String header : records.get(0)) {
            headers.add(header.trim());
        }

        return new RedcapTable(headers, records.subList(1, records.size()));
    }

    /**
     * Split the whole input into records of cells. Records with only empty
     * cells are dropped.
     */
    List<List<String>> parseRecords(Reader reader) throws IOException {
        List<List<String>> records = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean inQuotes = false;
        boolean pendingQuote = false;

        int read = reader.read();
        // Remove BOM if present (EF BB BF in UTF-8)
        if (read == BOM) {
            LoggingUtil.debug("Removed BOM from header line");
            read = reader.read();
        }

        for (; read != -1; read = reader.read()) {
            char c = (char) read;

            if (inQuotes) {
                if (pendingQuote) {
                    pendingQuote = false;
                    if (c == QUOTE) {
                        // Doubled quote inside a quoted cell
                        cell.append(QUOTE);
                        continue;
                    }
                    inQuotes = false;
                } else if (c == QUOTE) {
                    pendingQuote = true;
                    continue;
                } else {
                    cell.append(c);
                    continue;
                }
            }

            if (c == QUOTE && cell.length() == 0) {
                inQuotes = true;
            } else if (c == SEPARATOR) {
                current.add(cell.toString());
                cell.setLength(0);
            } else if (c == '\n') {
                current.add(cell.toString());
                cell.setLength(0);
                addRecord(records, current);
                current = new ArrayList<>();
            } else if (c != '\r') {
                cell.append(c);
            }
        }

        if (inQuotes && !pendingQuote) {
            throw new IOException("Unterminated quoted cell in record " + (records.size() + 1));
        }

        if (cell.length() > 0 || !current.isEmpty()) {
            current.add(cell.toString());
            addRecord(records, current);
        }
        return records;
    }

    private static void addRecord(List<List<String>> records, List<String> record) {
        for (String value : record) {
            if (!value.isEmpty()) {
                records.add(record);
                return;
            }
        }
    }
}
