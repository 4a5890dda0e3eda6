package no.cantara.worldview.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.modelcontextprotocol.spec.McpSchema;
import no.cantara.worldview.WorldviewValidator;
import no.cantara.worldview.model.ValidationError;
import no.cantara.worldview.model.ValidationWarning;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Pure mapping functions: Worldview validation and edit types ↔ MCP schema types.
 * No I/O.
 */
public final class WorldviewMapper {

    private WorldviewMapper() {}

    private static final ObjectMapper JSON = new ObjectMapper();

    static final String READ_TOOL     = "read_worldview";
    static final String EDIT_TOOL     = "edit_worldview";
    static final String VALIDATE_TOOL = "validate_worldview";

    // ── Slug / URIs ───────────────────────────────────────────────────────────────

    public static String documentSlug(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String s = (dot > 0 ? name.substring(0, dot) : name).toLowerCase();
        s = s.replaceAll("\\s+", "-");
        s = s.replaceAll("[^a-z0-9\\-]", "");
        return s.isEmpty() ? "worldview" : s;
    }

    public static String documentUri(String slug) {
        return "worldview://" + slug + "/document";
    }

    // ── Resource ──────────────────────────────────────────────────────────────────

    public static McpSchema.Resource buildDocumentResource(String slug, Path file) {
        McpSchema.Annotations annotations = new McpSchema.Annotations(
            List.of(McpSchema.Role.ASSISTANT, McpSchema.Role.USER), 1.0, null);
        return new McpSchema.Resource(
            documentUri(slug),
            slug,
            "Worldview document",                         // title
            "Concept / facet / claim knowledge file " + file.getFileName(),
            "text/plain",
            null,                                         // size
            annotations,
            null                                          // meta
        );
    }

    // ── Tools ─────────────────────────────────────────────────────────────────────

    public static McpSchema.Tool buildReadTool() {
        return McpSchema.Tool.builder()
            .name(READ_TOOL)
            .description("Read the current contents of the Worldview file. Returns the file contents with "
                + "line numbers prefixed (e.g. '   1│content'). Read before editing to see the current state.")
            .inputSchema(objectSchema(Map.of(), List.of()))
            .build();
    }

    public static McpSchema.Tool buildEditTool() {
        Map<String, Object> edit = Map.of(
            "type", "object",
            "properties", Map.of(
                "old_string", Map.of("type", "string",
                    "description", "Exact string to find (must be unique in file). Include full lines with indentation."),
                "new_string", Map.of("type", "string",
                    "description", "String to replace it with. Use an empty string to delete.")),
            "required", List.of("old_string", "new_string"));
        Map<String, Object> properties = Map.of(
            "edits", Map.of(
                "type", "array",
                "description", "Search/replace operations applied in order",
                "items", edit));
        return McpSchema.Tool.builder()
            .name(EDIT_TOOL)
            .description("Apply search/replace edits to the Worldview file. Each old_string must match exactly "
                + "once; an empty file is created with a single edit whose old_string is empty. The result is "
                + "validated before writing and rejected if it contains any error. Warnings do not block the write.")
            .inputSchema(objectSchema(properties, List.of("edits")))
            .build();
    }

    public static McpSchema.Tool buildValidateTool() {
        Map<String, Object> properties = Map.of(
            "text", Map.of("type", "string",
                "description", "Worldview text to validate. Omit to validate the served file."));
        return McpSchema.Tool.builder()
            .name(VALIDATE_TOOL)
            .description("Validate Worldview text, or the served file, and return a JSON report of errors and warnings.")
            .inputSchema(objectSchema(properties, List.of()))
            .build();
    }

    private static McpSchema.JsonSchema objectSchema(Map<String, Object> properties, List<String> required) {
        return new McpSchema.JsonSchema("object", properties, required, false,
            Collections.emptyMap(), Collections.emptyMap());
    }

    // ── Arguments ─────────────────────────────────────────────────────────────────

    /**
     * Reads the {@code edits} argument of the edit tool. Missing strings are kept as {@code null}
     * so that {@link WorldviewEditor} can report which edit is incomplete.
     */
    @SuppressWarnings("unchecked")
    public static List<WorldviewEditor.Edit> parseEdits(Map<String, Object> arguments) {
        Object raw = arguments != null ? arguments.get("edits") : null;
        if (!(raw instanceof List<?> list)) {
            throw new WorldviewEditor.EditException("Error: 'edits' array is required");
        }
        List<WorldviewEditor.Edit> edits = new ArrayList<>();
        for (Object item : list) {
            Map<String, Object> m = item instanceof Map ? (Map<String, Object>) item : Map.of();
            edits.add(new WorldviewEditor.Edit(stringOrNull(m.get("old_string")), stringOrNull(m.get("new_string"))));
        }
        return edits;
    }

    private static String stringOrNull(Object value) {
        return value instanceof String s ? s : null;
    }

    // ── Results ───────────────────────────────────────────────────────────────────

    public static McpSchema.CallToolResult textResult(String text, boolean isError) {
        return McpSchema.CallToolResult.builder()
            .addTextContent(text)
            .isError(isError)
            .build();
    }

    public static String editSummary(int editCount, WorldviewValidator.ValidationResult result) {
        String base = "Successfully applied " + editCount + " edit" + (editCount == 1 ? "" : "s") + ".";
        if (!result.hasWarnings()) {
            return base + " File validated.";
        }
        StringBuilder sb = new StringBuilder(base).append(" Warnings:");
        result.warnings().forEach(w -> sb.append('\n').append(w.render()));
        return sb.toString();
    }

    public static String rejection(WorldviewValidator.ValidationResult result) {
        StringBuilder sb = new StringBuilder("Validation failed - file not modified:");
        result.errors().forEach(e -> sb.append('\n').append(e.render()));
        if (result.hasWarnings()) {
            sb.append("\nWarnings:");
            result.warnings().forEach(w -> sb.append('\n').append(w.render()));
        }
        return sb.toString();
    }

    public static String buildReportJson(WorldviewValidator.ValidationResult result) {
        ObjectNode root = JSON.createObjectNode();
        root.put("valid", result.isValid());
        root.put("line_count", result.lines().size());
        ArrayNode errors = root.putArray("errors");
        for (ValidationError e : result.errors()) {
            errors.add(issue(e.line(), kind(e), e.message()));
        }
        ArrayNode warnings = root.putArray("warnings");
        for (ValidationWarning w : result.warnings()) {
            warnings.add(issue(w.line(), kind(w), w.message()));
        }
        try {
            return JSON.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static ObjectNode issue(int line, String kind, String message) {
        ObjectNode node = JSON.createObjectNode();
        node.put("line", line);
        node.put("kind", kind);
        node.put("message", message);
        return node;
    }

    /** Kind name of an error or warning, e.g. {@code OrphanClaim}. */
    static String kind(Object issue) {
        return issue.getClass().getSimpleName();
    }
}
