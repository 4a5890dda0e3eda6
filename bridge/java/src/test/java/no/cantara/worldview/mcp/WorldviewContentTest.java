package no.cantara.worldview.mcp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/** Unit tests for WorldviewContent — numbered reads and writes. */
class WorldviewContentTest {

    @Test void numbersEveryLine(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("worldview.wvf");
        Files.writeString(file, "Power\n  .core\n    - corrupts\n");
        assertEquals("   1│Power\n   2│  .core\n   3│    - corrupts", WorldviewContent.readNumbered(file));
    }

    @Test void keepsBlankLines() {
        assertEquals("   1│a\n   2│\n   3│b", WorldviewContent.numbered("a\n\nb\n"));
    }

    @Test void missingFileHasHint(@TempDir Path dir) throws IOException {
        assertEquals(WorldviewContent.MISSING_FILE_MESSAGE, WorldviewContent.readNumbered(dir.resolve("none.wvf")));
    }

    @Test void missingFileReadsEmpty(@TempDir Path dir) throws IOException {
        assertEquals("", WorldviewContent.readOrEmpty(dir.resolve("none.wvf")));
    }

    @Test void writeCreatesParentDirectories(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("notes/worldview.wvf");
        WorldviewContent.write(file, "Power\n");
        assertEquals("Power\n", Files.readString(file));
    }
}
