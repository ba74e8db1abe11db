package com.github.droe;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Properties;

import com.github.droe.parser.ParserConfig;
import com.github.droe.parser.ParserConfig.BlockStyle;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

public class ConfigReader {

    public static final String DEFAULT_FILE = "droe.cfg";

    static Config readConfig() {
        return readConfig(Path.of(DEFAULT_FILE));
    }

    /**
     * Reads {@code file} as a properties file. A missing file gives the defaults.
     */
    public static Config readConfig(Path file) {
        var config = new Config();
        if (!Files.exists(file)) {
            return config;
        }
        Properties properties = new Properties();
        try (InputStream in = Files.newInputStream(file)) {
            properties.load(in);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read config " + file + ": " + e.getMessage(), e);
        }
        return readConfig(properties);
    }

    public static Config readConfig(Properties properties) {
        var config = new Config();
        Arrays.stream(properties.getProperty("lookupPath", "").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(config.lookupPath::add);

        var blockStyle = properties.getProperty("blockStyle", "sentinel").trim();
        try {
            config.blockStyle = BlockStyle.valueOf(blockStyle.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown blockStyle '" + blockStyle + "', expected sentinel or indentation", e);
        }

        var hashComments = properties.getProperty("hashComments", "true").trim().toLowerCase(Locale.ROOT);
        if (!hashComments.equals("true") && !hashComments.equals("false")) {
            throw new IllegalArgumentException("hashComments must be true or false but was '" + hashComments + "'");
        }
        config.hashComments = Boolean.parseBoolean(hashComments);
        return config;
    }

    @Getter
    @ToString
    @Accessors(fluent = true)
    public static class Config {
        private final List<String> lookupPath = new ArrayList<>();
        private BlockStyle blockStyle = BlockStyle.SENTINEL;
        private boolean hashComments = true;

        public ParserConfig parserConfig() {
            return ParserConfig.builder()
                    .blockStyle(blockStyle)
                    .hashComments(hashComments)
                    .build();
        }

        public void applyConfig(ConfigTarget ct) {
            ct.setLookupPath(lookupPath);
            ct.setParserConfig(parserConfig());
        }
    }

    public interface ConfigTarget {
        void setLookupPath(List<String> lookupPath);
        void setParserConfig(ParserConfig parserConfig);
    }

}
