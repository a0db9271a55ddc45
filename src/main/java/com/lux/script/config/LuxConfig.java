package com.lux.script.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lux.debug.Debug;
import com.lux.debug.DebugLevel;

/**
 * Settings for the CLI and REPL.
 *
 * Defaults live in the classpath resource {@code lux-defaults.json}; a user
 * file only needs the keys it changes:
 *
 * <pre>
 * { "prompt": "lux> ", "errorFormat": "json", "logLevel": "DEBUG" }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class LuxConfig {
    public static final String DEFAULTS_RESOURCE = "/lux-defaults.json";

    public static final String FORMAT_TEXT = "text";
    public static final String FORMAT_JSON = "json";
    public static final String LOG_OFF = "OFF";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonProperty("prompt")
    private String prompt = "> ";

    @JsonProperty("echoValues")
    private boolean echoValues = true;

    @JsonProperty("errorFormat")
    private String errorFormat = FORMAT_TEXT;

    @JsonProperty("logLevel")
    private String logLevel = LOG_OFF;

    public LuxConfig() {}

    /** The bundled defaults. */
    public static LuxConfig defaults() {
        LuxConfig config = new LuxConfig();
        try (InputStream in = LuxConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                Debug.get().w("lux.config", DEFAULTS_RESOURCE + " not on classpath, using built-in defaults");
                return config;
            }
            MAPPER.readerForUpdating(config).readValue(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + DEFAULTS_RESOURCE, e);
        }
        config.validate();
        return config;
    }

    /**
     * The defaults overlaid with the keys present in {@code file}.
     *
     * @throws UncheckedIOException when the file cannot be read, is not JSON,
     *         or holds a value the setters reject
     */
    public static LuxConfig load(Path file) {
        LuxConfig config = defaults();
        try (InputStream in = Files.newInputStream(file)) {
            MAPPER.readerForUpdating(config).readValue(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config " + file, e);
        }
        config.validate();
        Debug.get().d("lux.config", "loaded " + file + ": " + config);
        return config;
    }

    void validate() {
        if (prompt == null) prompt = "";
        setErrorFormat(errorFormat);
        setLogLevel(logLevel);
    }

    // -------------------------
    // Properties
    // -------------------------

    public String getPrompt() { return prompt; }
    public void setPrompt(String prompt) { this.prompt = (prompt == null) ? "" : prompt; }

    public boolean isEchoValues() { return echoValues; }
    public void setEchoValues(boolean echoValues) { this.echoValues = echoValues; }

    public String getErrorFormat() { return errorFormat; }

    public void setErrorFormat(String errorFormat) {
        String f = (errorFormat == null) ? "" : errorFormat.trim().toLowerCase(Locale.ROOT);
        if (!FORMAT_TEXT.equals(f) && !FORMAT_JSON.equals(f)) {
            throw new IllegalArgumentException("errorFormat must be 'text' or 'json', got '" + errorFormat + "'");
        }
        this.errorFormat = f;
    }

    public String getLogLevel() { return logLevel; }

    public void setLogLevel(String logLevel) {
        String l = (logLevel == null) ? LOG_OFF : logLevel.trim().toUpperCase(Locale.ROOT);
        if (!LOG_OFF.equals(l)) {
            try {
                DebugLevel.valueOf(l);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("logLevel must be OFF, TRACE, DEBUG, INFO, WARN or ERROR, got '" + logLevel + "'", e);
            }
        }
        this.logLevel = l;
    }

    /** The minimum level to log, or null when logging is off. */
    @JsonIgnore
    public DebugLevel debugLevel() {
        return LOG_OFF.equals(logLevel) ? null : DebugLevel.valueOf(logLevel);
    }

    @JsonIgnore
    public boolean isJsonErrors() {
        return FORMAT_JSON.equals(errorFormat);
    }

    @Override
    public String toString() {
        return "LuxConfig{prompt='" + prompt + "', echoValues=" + echoValues
                + ", errorFormat=" + errorFormat + ", logLevel=" + logLevel + "}";
    }
}
