package com.redcapxls.util;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import com.redcapxls.form.ConversionException;
import com.redcapxls.form.ConversionMode;
import com.redcapxls.form.CrossFormReferenceException;
import com.redcapxls.form.FormAssembler;
import com.redcapxls.form.OutputDocument;
import com.redcapxls.form.RedcapTable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line entry point: converts a REDCap data dictionary CSV into
 * XLSForm workbooks.
 */
@Command(name = "redcap2xlsform", mixinStandardHelpOptions = true, version = "redcap2xlsform 1.0",
        description = "Convert a REDCap data dictionary (CSV) to XLSForm.")
public class RedcapToXlsForm implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CROSS_FORM_REFERENCE = 1;
    public static final int EXIT_FAILURE = 2;

    @Parameters(index = "0", paramLabel = "FILENAME", description = "REDCap data dictionary CSV file")
    Path filename;

    @Option(names = {"-s", "--savefile"},
            description = "Output file (default: input file with .zip, or the workbook extension in single_xls mode)")
    Path saveFile;

    @Option(names = {"-m", "--mode"}, converter = ModeConverter.class, defaultValue = "zip_xls",
            description = "zip_xls: one workbook per form in a zip archive; single_xls: one workbook (default: ${DEFAULT-VALUE})")
    ConversionMode mode = ConversionMode.ZIP_XLS;

    @Option(names = {"-c", "--copycolumn"}, arity = "0..*", paramLabel = "COLUMN",
            description = "REDCap columns to copy unchanged into the survey sheet")
    List<String> copyColumns = new ArrayList<>();

    @Option(names = {"--config"}, description = "JSON configuration file")
    String configFile;

    static class ModeConverter implements ITypeConverter<ConversionMode> {
        @Override
        public ConversionMode convert(String value) {
            try {
                return ConversionMode.fromName(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    public static void main(String[] args) {
        int exit = new CommandLine(new RedcapToXlsForm()).execute(args);
        System.exit(exit);
    }

    @Override
    public Integer call() {
        ConverterConfig config;
        try {
            config = configFile != null ? ConverterConfig.loadFromFile(configFile) : ConverterConfig.loadDefault();
        } catch (IOException e) {
            LoggingUtil.error("Cannot load configuration: " + e.getMessage());
            return EXIT_FAILURE;
        }
        LoggingUtil.initialize(config);

        XlsFormWriter writer = new XlsFormWriter(config);
        Path target = saveFile != null ? saveFile : defaultSaveFile(filename, mode, config.getWorkbookFormat());
        LoggingUtil.info("Converting " + filename + " to " + target + " (" + mode + ")");

        try {
            RedcapTable table = new RedcapCsvReader().read(filename);
            FormAssembler assembler = new FormAssembler(mode,
                    copyColumns == null ? List.of() : copyColumns, config.getLogicKeywordMode());
            List<OutputDocument> documents = assembler.assemble(table, documentName(target));
            writer.write(documents, target, mode);
        } catch (CrossFormReferenceException e) {
            LoggingUtil.error(e.getMessage());
            return EXIT_CROSS_FORM_REFERENCE;
        } catch (ConversionException e) {
            LoggingUtil.error(e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            LoggingUtil.error("I/O error: " + e.getMessage(), e);
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            LoggingUtil.error("Unexpected error: " + e.getMessage(), e);
            return EXIT_FAILURE;
        }

        LoggingUtil.info("Conversion finished");
        return EXIT_OK;
    }

    /**
     * The input path with its extension replaced by {@code .zip}, or by the
     * workbook extension in single workbook mode.
     */
    static Path defaultSaveFile(Path input, ConversionMode mode, WorkbookFormat format) {
        String extension = mode == ConversionMode.ZIP_XLS ? ".zip" : format.getExtension();
        String name = input.getFileName().toString();
        return input.resolveSibling(stripExtension(name) + extension);
    }

    /**
     * Document name in single workbook mode: the output file name without extension.
     */
    static String documentName(Path target) {
        return stripExtension(target.getFileName().toString());
    }

    private static String stripExtension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
