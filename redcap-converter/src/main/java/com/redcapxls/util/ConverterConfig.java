package com.redcapxls.util;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.redcapxls.expr.LogicKeywordMode;

/**
 * Converter settings, read from JSON.
 *
 * Values are layered: the defaults below, then the bundled
 * {@value #DEFAULT_RESOURCE} resource, then an optional user file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConverterConfig {

    public static final String DEFAULT_RESOURCE = "redcap2xlsform.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    // Logging configuration
    @JsonProperty("loggingLevel")
    private String loggingLevel = "INFO";

    @JsonProperty("consoleLoggingEnabled")
    private boolean consoleLoggingEnabled = true;

    @JsonProperty("fileLoggingEnabled")
    private boolean fileLoggingEnabled = false;

    @JsonProperty("logFileName")
    private String logFileName = "redcap2xlsform.log";

    // Output configuration
    @JsonProperty("workbookFormat")
    private WorkbookFormat workbookFormat = WorkbookFormat.XLS;

    @JsonProperty("normalizeLogicKeywords")
    private boolean normalizeLogicKeywords = false;

    @JsonProperty("archivePassword")
    private String archivePassword = null;

    /**
     * Default constructor for Jackson.
     */
    public ConverterConfig() {
    }

    /**
     * Defaults overlaid with the bundled resource, when present on the classpath.
     */
    public static ConverterConfig loadDefault() throws IOException {
        ConverterConfig config = new ConverterConfig();
        try (InputStream in = ConverterConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in != null) {
                MAPPER.readerForUpdating(config).readValue(in);
            }
        }
        return config;
    }

    /**
     * Bundled defaults overlaid with the given file. Settings the file leaves
     * out keep their default values.
     *
     * @param filename path to a JSON configuration file
     * @throws IOException if the file is missing or is not valid JSON
     */
    public static ConverterConfig loadFromFile(String filename) throws IOException {
        File file = new File(filename);
        if (!file.exists()) {
            throw new IOException("Configuration file not found: " + filename);
        }

        ConverterConfig config = loadDefault();
        MAPPER.readerForUpdating(config).readValue(file);
        return config;
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public void setLoggingLevel(String loggingLevel) {
        this.loggingLevel = loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public void setConsoleLoggingEnabled(boolean consoleLoggingEnabled) {
        this.consoleLoggingEnabled = consoleLoggingEnabled;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public void setFileLoggingEnabled(boolean fileLoggingEnabled) {
        this.fileLoggingEnabled = fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }

    public void setLogFileName(String logFileName) {
        this.logFileName = logFileName;
    }

    public WorkbookFormat getWorkbookFormat() {
        return workbookFormat;
    }

    public void setWorkbookFormat(WorkbookFormat workbookFormat) {
        this.workbookFormat = workbookFormat;
    }

    public boolean isNormalizeLogicKeywords() {
        return normalizeLogicKeywords;
    }

    public void setNormalizeLogicKeywords(boolean normalizeLogicKeywords) {
        this.normalizeLogicKeywords = normalizeLogicKeywords;
    }

    public String getArchivePassword() {
        return archivePassword;
    }

    public void setArchivePassword(String archivePassword) {
        this.archivePassword = archivePassword;
    }

    @JsonIgnore
    public LogicKeywordMode getLogicKeywordMode() {
        return normalizeLogicKeywords ? LogicKeywordMode.LOWER_CASE : LogicKeywordMode.PRESERVE;
    }
}
