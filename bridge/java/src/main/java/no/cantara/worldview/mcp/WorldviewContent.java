package no.cantara.worldview.mcp;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads and writes the served Worldview file.
 */
public final class WorldviewContent {

    private WorldviewContent() {}

    static final String MISSING_FILE_MESSAGE =
        "File does not exist yet. Use edit_worldview with edits to create it.";

    /**
     * Current file contents, or the empty string when the file has not been created yet.
     */
    public static String readOrEmpty(Path file) throws IOException {
        if (!Files.exists(file)) {
            return "";
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    /**
     * File contents with each line prefixed by its right-aligned number, e.g. {@code "   1│Power"}.
     */
    public static String readNumbered(Path file) throws IOException {
        if (!Files.exists(file)) {
            return MISSING_FILE_MESSAGE;
        }
        return numbered(Files.readString(file, StandardCharsets.UTF_8));
    }

    static String numbered(String content) {
        List<String> lines = content.lines().toList();
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(String.format("%4d│%s", i + 1, lines.get(i)));
        }
        return sb.toString();
    }

    public static void write(Path file, String content) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }
}
