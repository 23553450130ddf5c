package com.mathtext.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Constructor;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PipelineConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testDefaults() {
        PipelineConfig config = PipelineConfig.defaults();

        assertNotNull(config);
        assertEquals(Constants.DEFAULT_PLACEHOLDER_MARKER, config.getPlaceholderMarker());
        assertFalse(config.isLenientDollar());
        assertTrue(config.isMergeAdjacentMath());
        assertTrue(config.isFoldNewlinesInMath());
        assertEquals(Constants.UNLIMITED_LENGTH, config.getPlainTextMaxLength());
    }

    @Test
    void testSetters() {
        PipelineConfig config = new PipelineConfig();

        config.setPlaceholderMarker("<math>");
        config.setLenientDollar(true);
        config.setMergeAdjacentMath(false);
        config.setFoldNewlinesInMath(false);
        config.setPlainTextMaxLength(Constants.STEP_SHARE_MAX_LENGTH);

        assertEquals("<math>", config.getPlaceholderMarker());
        assertTrue(config.isLenientDollar());
        assertFalse(config.isMergeAdjacentMath());
        assertFalse(config.isFoldNewlinesInMath());
        assertEquals(150, config.getPlainTextMaxLength());
    }

    @Test
    void testFromProperties() {
        Properties properties = new Properties();
        properties.setProperty(PipelineConfig.KEY_PLACEHOLDER_MARKER, "[公式]");
        properties.setProperty(PipelineConfig.KEY_LENIENT_DOLLAR, " TRUE ");
        properties.setProperty(PipelineConfig.KEY_MERGE_ADJACENT, "false");
        properties.setProperty(PipelineConfig.KEY_PLAIN_MAX_LENGTH, "200");

        PipelineConfig config = PipelineConfig.fromProperties(properties);

        assertEquals("[公式]", config.getPlaceholderMarker());
        assertTrue(config.isLenientDollar());
        assertFalse(config.isMergeAdjacentMath());
        assertTrue(config.isFoldNewlinesInMath());
        assertEquals(Constants.QUESTION_SHARE_MAX_LENGTH, config.getPlainTextMaxLength());
    }

    @Test
    void testFromNullPropertiesUsesDefaults() {
        PipelineConfig config = PipelineConfig.fromProperties(null);
        assertEquals(Constants.DEFAULT_PLACEHOLDER_MARKER, config.getPlaceholderMarker());
    }

    @Test
    void testInvalidBooleanRejected() {
        Properties properties = new Properties();
        properties.setProperty(PipelineConfig.KEY_FOLD_NEWLINES, "yes");

        PipelineConfigException exception = assertThrows(PipelineConfigException.class,
            () -> PipelineConfig.fromProperties(properties));

        assertEquals(PipelineConfig.KEY_FOLD_NEWLINES, exception.getKey());
        assertEquals("yes", exception.getValue());
        assertTrue(exception.getMessage().contains(PipelineConfig.KEY_FOLD_NEWLINES));
    }

    @Test
    void testInvalidLengthRejected() {
        Properties negative = new Properties();
        negative.setProperty(PipelineConfig.KEY_PLAIN_MAX_LENGTH, "-1");
        assertThrows(PipelineConfigException.class, () -> PipelineConfig.fromProperties(negative));

        Properties notNumber = new Properties();
        notNumber.setProperty(PipelineConfig.KEY_PLAIN_MAX_LENGTH, "ten");
        PipelineConfigException exception = assertThrows(PipelineConfigException.class,
            () -> PipelineConfig.fromProperties(notNumber));
        assertEquals("ten", exception.getValue());
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path file = tempDir.resolve("mtp.properties");
        Files.writeString(file, "mtp.placeholder.marker=<f>\nmtp.segment.lenient-dollar=true\n", StandardCharsets.UTF_8);

        PipelineConfig config = PipelineConfig.load(file);

        assertEquals("<f>", config.getPlaceholderMarker());
        assertTrue(config.isLenientDollar());
    }

    @Test
    void testConstantValues() {
        assertEquals("[formula]", Constants.DEFAULT_PLACEHOLDER_MARKER);
        assertEquals(200, Constants.QUESTION_SHARE_MAX_LENGTH);
        assertEquals(150, Constants.STEP_SHARE_MAX_LENGTH);
        assertEquals("...", Constants.ELLIPSIS);
        assertEquals("-", Constants.STDIN_ARGUMENT);
    }

    @Test
    void testConstantsPrivateConstructorReachableByReflection() throws Exception {
        Constructor<Constants> constructor = Constants.class.getDeclaredConstructor();
        constructor.setAccessible(true);
        assertNotNull(constructor.newInstance());
    }
}
