package com.github.droe;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.github.droe.parser.ParserConfig;
import com.github.droe.parser.ParserConfig.BlockStyle;

public class ConfigReaderTest {

    @TempDir
    Path dir;

    @Test
    public void testMissingFileGivesDefaults() {
        var config = ConfigReader.readConfig(dir.resolve("absent.cfg"));
        assertEquals(List.of(), config.lookupPath());
        assertEquals(BlockStyle.SENTINEL, config.blockStyle());
        assertTrue(config.hashComments());
    }

    @Test
    public void testReadFile() throws IOException {
        var file = dir.resolve(ConfigReader.DEFAULT_FILE);
        Files.writeString(file, """
                lookupPath = lib, vendor/modules ,
                blockStyle = Indentation
                hashComments = false
                """);
        var config = ConfigReader.readConfig(file);
        assertEquals(List.of("lib", "vendor/modules"), config.lookupPath());
        assertEquals(BlockStyle.INDENTATION, config.parserConfig().blockStyle());
        assertFalse(config.parserConfig().hashComments());
    }

    @Test
    public void testInvalidValues() {
        var badStyle = new Properties();
        badStyle.setProperty("blockStyle", "braces");
        assertThrows(IllegalArgumentException.class, () -> ConfigReader.readConfig(badStyle));

        var badFlag = new Properties();
        badFlag.setProperty("hashComments", "sometimes");
        assertThrows(IllegalArgumentException.class, () -> ConfigReader.readConfig(badFlag));
    }

    @Test
    public void testApplyConfig() {
        var properties = new Properties();
        properties.setProperty("lookupPath", "lib");
        var target = new RecordingTarget();
        ConfigReader.readConfig(properties).applyConfig(target);
        assertEquals(List.of("lib"), target.lookupPath);
        assertEquals(BlockStyle.SENTINEL, target.parserConfig.blockStyle());
    }

    private static class RecordingTarget implements ConfigReader.ConfigTarget {
        List<String> lookupPath;
        ParserConfig parserConfig;

        @Override
        public void setLookupPath(List<String> lookupPath) {
            this.lookupPath = lookupPath;
        }

        @Override
        public void setParserConfig(ParserConfig parserConfig) {
            this.parserConfig = parserConfig;
        }
    }
}
