package org.nmlkit.config;

import com.typesafe.config.ConfigFactory;
import org.nmlkit.junit.extensions.logging.LogWatchExtension;
import org.nmlkit.model.WriteOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for NamelistConfig to verify the configuration priority hierarchy:
 * 1. Environment variables
 * 2. System properties
 * 3. Configuration file
 * 4. Default reference configuration (lowest priority)
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class NamelistConfigTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("nmlkit.write.column-width");
        System.clearProperty("nmlkit.write.indent");
        ConfigFactory.invalidateCaches();
    }

    private static Path resource(String name) throws URISyntaxException {
        return Paths.get(NamelistConfigTest.class.getResource("/" + name).toURI());
    }

    @Test
    @DisplayName("Missing file falls back to the reference defaults")
    void load_missingFileShouldUseDefaults(@TempDir Path dir) {
        // Act
        NamelistConfig config = NamelistConfig.load(dir.resolve("absent.conf"));

        // Assert
        WriteOptions write = config.writeOptions();
        WriteOptions defaults = WriteOptions.defaults();
        assertEquals(defaults.columnWidth(), write.columnWidth());
        assertEquals(defaults.indent(), write.indent());
        assertEquals(defaults.uppercase(), write.uppercase());
        assertEquals(defaults.defaultStartIndex(), write.defaultStartIndex());
        assertNull(write.floatPrecision());
        assertEquals(ReadOptions.defaults(), config.readOptions());
    }

    @Test
    @DisplayName("File settings override the reference defaults")
    void load_fileShouldOverrideDefaults() throws URISyntaxException {
        // Act
        NamelistConfig config = NamelistConfig.load(resource("test-nmlkit.conf"));

        // Assert
        assertEquals(100, config.writeOptions().columnWidth());
        assertTrue(config.writeOptions().uppercase());
        assertEquals("    ", config.writeOptions().indent(), "Keys absent from the file keep their default");
        assertEquals(Set.of('!'), config.readOptions().commentChars());
    }

    @Test
    @DisplayName("System property should override file configuration")
    void load_systemPropertyShouldOverrideFile() throws URISyntaxException {
        // Arrange
        System.setProperty("nmlkit.write.column-width", "132");
        ConfigFactory.invalidateCaches();

        // Act
        NamelistConfig config = NamelistConfig.load(resource("test-nmlkit.conf"));

        // Assert
        assertEquals(132, config.writeOptions().columnWidth());
        assertTrue(config.writeOptions().uppercase());
    }

    @Test
    void load_directoryIsIgnored(@TempDir Path dir) throws Exception {
        Files.createDirectories(dir.resolve("nmlkit.conf"));

        NamelistConfig config = NamelistConfig.load(dir.resolve("nmlkit.conf"));

        assertEquals(72, config.writeOptions().columnWidth());
    }

    @Test
    void of_shouldFallBackToReference() {
        NamelistConfig config = NamelistConfig.of(ConfigFactory.parseString("nmlkit.write.repeat-counter = true"));

        assertTrue(config.writeOptions().repeatCounter());
        assertEquals(72, config.writeOptions().columnWidth());
        assertTrue(config.config().hasPath("nmlkit.logging.default-level"));
    }

    @Test
    void readOptions_shouldParseCommentCharacters() {
        NamelistConfig config = NamelistConfig.of(ConfigFactory.parseString(
                "nmlkit.read { comment-chars = \"!;\", non-delimited-strings = false }"));

        ReadOptions options = config.readOptions();

        assertEquals(Set.of('!', ';'), options.commentChars());
        assertFalse(options.nonDelimitedStrings());
        assertEquals(ReadOptions.IN_MEMORY, options.fileName());
    }
}
