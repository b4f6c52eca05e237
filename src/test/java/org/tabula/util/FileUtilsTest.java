package org.tabula.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void testFindFiles_recursiveAndSorted() throws IOException {
        Files.createDirectories(tempDir.resolve("sub/deeper"));
        Files.writeString(tempDir.resolve("b.csv"), "x");
        Files.writeString(tempDir.resolve("a.json"), "{}");
        Files.writeString(tempDir.resolve("sub/deeper/c.xlsx"), "");

        List<Path> files = FileUtils.findFiles(tempDir, null);

        assertEquals(List.of(tempDir.resolve("a.json"), tempDir.resolve("b.csv"), tempDir.resolve("sub/deeper/c.xlsx")),
                files);
    }

    @Test
    void testFindFiles_withGlobFilter() throws IOException {
        Files.writeString(tempDir.resolve("keep.csv"), "x");
        Files.writeString(tempDir.resolve("drop.json"), "{}");

        List<Path> files = FileUtils.findFiles(tempDir, "glob:*.csv");

        assertEquals(1, files.size());
        assertTrue(files.get(0).endsWith("keep.csv"));
    }

    @Test
    void testFindFiles_missingDirIsEmpty() throws IOException {
        assertTrue(FileUtils.findFiles(tempDir.resolve("nope"), null).isEmpty());
    }

    @Test
    void testNameParts() {
        Path path = Path.of("dir", "report.2024.CSV");

        assertEquals("report.2024", FileUtils.stem(path));
        assertEquals("csv", FileUtils.extension(path));
        assertEquals(".csv", FileUtils.fileType(path));
        assertEquals("", FileUtils.extension(Path.of("README")));
        assertEquals("", FileUtils.fileType(Path.of(".hidden")));
    }

    @Test
    void testRelativeTo_outsideBaseFallsBackToFileName() {
        Path base = tempDir.resolve("in");

        assertEquals(Path.of("sub", "a.csv"), FileUtils.relativeTo(base.resolve("sub/a.csv"), base));
        assertEquals(Path.of("a.csv"), FileUtils.relativeTo(tempDir.resolve("elsewhere/a.csv"), base));
    }
}
