package com.exprsolve.util;

import java.io.*;
import java.util.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * SolverConfig - Handles loading solver configuration from JSON.
 * Defaults come from the bundled expression-solver.json; a file named by the
 * exprsolve.config system property overrides them.
 */
public class SolverConfig {

    public static final String DEFAULT_RESOURCE = "expression-solver.json";
    public static final String CONFIG_PROPERTY = "exprsolve.config";

    public static final int MIN_SIGNIFICANT_DIGITS = 1;
    public static final int MAX_SIGNIFICANT_DIGITS = 17;

    // Logging configuration
    private String loggingLevel = "INFO";
    private boolean consoleLoggingEnabled = true;
    private LoggingUtil.ConsoleOutputMode consoleOutputMode = LoggingUtil.ConsoleOutputMode.ALL_TO_ERR;
    private boolean fileLoggingEnabled = false;
    private String logFileName = "expression-solver.log";

    // Output configuration
    private int significantDigits = 6;

    // Extra names for registered functions, alias -> function
    private Map<String, String> functionAliases = new LinkedHashMap<>();

    /**
     * Default constructor
     */
    public SolverConfig() {
    }

    /**
     * Constructor that loads from file
     */
    public SolverConfig(String configFilePath) throws IOException {
        loadFromFile(configFilePath);
    }

    /**
     * Build the configuration the command line uses: bundled defaults, then
     * the override file if one is named.
     */
    public static SolverConfig load(String overridePath) throws IOException {
        SolverConfig config = new SolverConfig();
        config.loadFromResource(DEFAULT_RESOURCE);
        if (overridePath != null && !overridePath.isEmpty()) {
            config.loadFromFile(overridePath);
        }
        return config;
    }

    public void loadFromFile(String configFilePath) throws IOException {
        File configFile = new File(configFilePath);
        if (!configFile.exists()) {
            LoggingUtil.warn("Solver config file not found: " + configFilePath);
            LoggingUtil.info("Using default solver configuration");
            return;
        }

        ObjectMapper mapper = new ObjectMapper();
        apply(mapper.readTree(configFile));
    }

    public void loadFromResource(String resourceName) throws IOException {
        try (InputStream in = SolverConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in == null) {
                LoggingUtil.debug("Config resource not found, using built-in defaults: " + resourceName);
                return;
            }
            ObjectMapper mapper = new ObjectMapper();
            apply(mapper.readTree(in));
        }
    }

    private void apply(JsonNode configJson) {
        if (configJson.has("logging")) {
            JsonNode loggingNode = configJson.get("logging");

            if (loggingNode.has("level")) {
                loggingLevel = loggingNode.get("level").asText();
            }

            if (loggingNode.has("console")) {
                consoleLoggingEnabled = loggingNode.get("console").asBoolean();
            }

            if (loggingNode.has("consoleOutput")) {
                String modeString = loggingNode.get("consoleOutput").asText().toUpperCase();
                try {
                    consoleOutputMode = LoggingUtil.ConsoleOutputMode.valueOf(modeString);
                } catch (IllegalArgumentException e) {
                    LoggingUtil.warn("Invalid console output mode: " + modeString + ", using " + consoleOutputMode);
                }
            }

            if (loggingNode.has("file")) {
                fileLoggingEnabled = loggingNode.get("file").asBoolean();
            }

            if (loggingNode.has("filename")) {
                logFileName = loggingNode.get("filename").asText();
            }
        }

        if (configJson.has("output")) {
            JsonNode outputNode = configJson.get("output");

            if (outputNode.has("significantDigits")) {
                int digits = outputNode.get("significantDigits").asInt();
                if (isValidSignificantDigits(digits)) {
                    significantDigits = digits;
                } else {
                    LoggingUtil.warn("Invalid significantDigits: " + digits + ", using " + significantDigits);
                }
            }
        }

        if (configJson.has("functions")) {
            JsonNode aliasesNode = configJson.get("functions").path("aliases");
            aliasesNode.fields().forEachRemaining(entry ->
                    functionAliases.put(entry.getKey(), entry.getValue().asText()));
        }

        logConfiguration();
    }

    private void logConfiguration() {
        LoggingUtil.debug("Logging Level: " + loggingLevel);
        LoggingUtil.debug("Console Logging: " + consoleLoggingEnabled + " (" + consoleOutputMode + ")");
        LoggingUtil.debug("File Logging: " + (fileLoggingEnabled ? logFileName : "disabled"));
        LoggingUtil.debug("Significant Digits: " + significantDigits);
        LoggingUtil.debug("Function Aliases: " + functionAliases);
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

    public LoggingUtil.ConsoleOutputMode getConsoleOutputMode() {
        return consoleOutputMode;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }

    public int getSignificantDigits() {
        return significantDigits;
    }

    public void setSignificantDigits(int significantDigits) {
        if (!isValidSignificantDigits(significantDigits)) {
            throw new IllegalArgumentException("significantDigits must be between " + MIN_SIGNIFICANT_DIGITS
                    + " and " + MAX_SIGNIFICANT_DIGITS + ", got " + significantDigits);
        }
        this.significantDigits = significantDigits;
    }

    public Map<String, String> getFunctionAliases() {
        return Collections.unmodifiableMap(functionAliases);
    }

    private static boolean isValidSignificantDigits(int digits) {
        return digits >= MIN_SIGNIFICANT_DIGITS && digits <= MAX_SIGNIFICANT_DIGITS;
    }
}
