package com.ttennebkram.cookieflip;

import com.ttennebkram.cookieflip.config.CookieFlipConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class CookieFlipAppTest {

    @Test
    void testNoArgumentsUsesBundledConfig() throws Exception {
        CookieFlipConfig config = CookieFlipApp.parseArgs(new String[0]);

        assertEquals("SVM", config.classifier.type);
        assertEquals("resources", config.data.resourceDir);
    }

    @Test
    void testCommandLineOverridesConfig(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("c.json");
        Files.write(file, "{\"classifier\": {\"type\": \"Bayes\"}, \"output\": {\"delayMs\": 7}}"
                .getBytes(StandardCharsets.UTF_8));

        CookieFlipConfig config = CookieFlipApp.parseArgs(new String[]{
                "--config", file.toString(), "--classifier", "kNN", "--resources", "imgs",
                "--output", "", "--delay", "0"});

        assertEquals("kNN", config.classifier.type);
        assertEquals("imgs", config.data.resourceDir);
        assertEquals("", config.output.dir);
        assertEquals(0, config.output.delayMs);
    }

    @Test
    void testHelpReturnsNull() throws Exception {
        assertNull(CookieFlipApp.parseArgs(new String[]{"--help"}));
    }

    @Test
    void testBadArgumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> CookieFlipApp.parseArgs(new String[]{"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> CookieFlipApp.parseArgs(new String[]{"--delay"}));
        assertThrows(IllegalArgumentException.class, () -> CookieFlipApp.parseArgs(new String[]{"--delay", "soon"}));
        assertThrows(IllegalArgumentException.class, () -> CookieFlipApp.parseArgs(new String[]{"--type", "kNN"}));
    }
}
