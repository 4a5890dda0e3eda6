package no.cantara.worldview.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import no.cantara.worldview.WorldviewValidator;
import no.cantara.worldview.model.ValidationError;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/** Unit tests for WorldviewMapper — pure mapping functions, no I/O. */
class WorldviewMapperTest {

    private final ObjectMapper om = new ObjectMapper();

    // ── slug / uri ────────────────────────────────────────────────────────────────

    @Test void slugFromFileName() {
        assertEquals("my-worldview", WorldviewMapper.documentSlug(Path.of("/tmp/My Worldview.wvf")));
    }

    @Test void slugFallsBackWhenNothingIsLeft() {
        assertEquals("worldview", WorldviewMapper.documentSlug(Path.of("!!!.wvf")));
    }

    @Test void documentUriUsesWorldviewScheme() {
        assertEquals("worldview://beliefs/document", WorldviewMapper.documentUri("beliefs"));
    }

    @Test void documentResource() {
        McpSchema.Resource r = WorldviewMapper.buildDocumentResource("beliefs", Path.of("beliefs.wvf"));
        assertEquals("worldview://beliefs/document", r.uri());
        assertEquals("text/plain", r.mimeType());
        assertEquals(1.0, r.annotations().priority().doubleValue());
    }

    // ── tools ─────────────────────────────────────────────────────────────────────

    @Test void editToolRequiresEdits() {
        McpSchema.Tool tool = WorldviewMapper.buildEditTool();
        assertEquals("edit_worldview", tool.name());
        assertEquals(List.of("edits"), tool.inputSchema().required());
        assertTrue(tool.inputSchema().properties().containsKey("edits"));
    }

    @Test void validateToolTextIsOptional() {
        McpSchema.Tool tool = WorldviewMapper.buildValidateTool();
        assertTrue(tool.inputSchema().required().isEmpty());
        assertTrue(tool.inputSchema().properties().containsKey("text"));
    }

    // ── parseEdits ────────────────────────────────────────────────────────────────

    @Test void parsesEdits() {
        Map<String, Object> args = Map.of("edits", List.of(
            Map.of("old_string", "a", "new_string", "b"),
            Map.of("old_string", "c", "new_string", "")));
        assertEquals(List.of(new WorldviewEditor.Edit("a", "b"), new WorldviewEditor.Edit("c", "")),
            WorldviewMapper.parseEdits(args));
    }

    @Test void missingEditsArrayIsAnError() {
        assertThrows(WorldviewEditor.EditException.class, () -> WorldviewMapper.parseEdits(Map.of()));
        assertThrows(WorldviewEditor.EditException.class, () -> WorldviewMapper.parseEdits(null));
    }

    @Test void nonStringFieldsBecomeNull() {
        Map<String, Object> entry = new HashMap<>();
        entry.put("old_string", 42);
        List<WorldviewEditor.Edit> edits = WorldviewMapper.parseEdits(Map.of("edits", List.of(entry)));
        assertNull(edits.get(0).oldString());
        assertNull(edits.get(0).newString());
    }

    // ── results ───────────────────────────────────────────────────────────────────

    @Test void reportJsonForInvalidDocument() throws Exception {
        WorldviewValidator.ValidationResult result = WorldviewValidator.validate("Power\n  .core\n    - ^ x &Nope");
        JsonNode body = om.readTree(WorldviewMapper.buildReportJson(result));
        assertFalse(body.get("valid").asBoolean());
        assertEquals(3, body.get("line_count").asInt());
        assertEquals(1, body.get("errors").size());
        assertEquals("InvalidReferenceFormat", body.get("errors").get(0).get("kind").asText());
        assertEquals(3, body.get("errors").get(0).get("line").asInt());
        assertEquals("StandaloneModifier", body.get("warnings").get(0).get("kind").asText());
    }

    @Test void reportJsonForValidDocument() throws Exception {
        JsonNode body = om.readTree(WorldviewMapper.buildReportJson(
            WorldviewValidator.validate("Power\n  .core\n    - corrupts")));
        assertTrue(body.get("valid").asBoolean());
        assertEquals(0, body.get("errors").size());
        assertEquals(0, body.get("warnings").size());
    }

    @Test void kindIsTheRecordName() {
        assertEquals("OrphanClaim", WorldviewMapper.kind(new ValidationError.OrphanClaim(1)));
    }

    @Test void editSummaryPluralises() {
        WorldviewValidator.ValidationResult ok = WorldviewValidator.validate("Power\n  .core\n    - corrupts");
        assertEquals("Successfully applied 1 edit. File validated.", WorldviewMapper.editSummary(1, ok));
        assertEquals("Successfully applied 2 edits. File validated.", WorldviewMapper.editSummary(2, ok));
    }

    @Test void editSummaryListsWarnings() {
        WorldviewValidator.ValidationResult warned = WorldviewValidator.validate("Power\n  .core\n    - ^ x");
        assertEquals("Successfully applied 1 edit. Warnings:\n"
            + "line 3: standalone modifier '^' has no preceding term to modify",
            WorldviewMapper.editSummary(1, warned));
    }

    @Test void rejectionListsErrors() {
        WorldviewValidator.ValidationResult bad = WorldviewValidator.validate("Power");
        assertEquals("Validation failed - file not modified:\nline 1: concept 'Power' has no facets",
            WorldviewMapper.rejection(bad));
    }
}
