package no.cantara.worldview;

import no.cantara.worldview.model.ValidationError;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TokenTableTest {

    private static final Map<String, Object> MINIMAL = Map.of(
            "brief_forms", List.of(
                    Map.of("symbol", "="),
                    Map.of("symbol", "->", "meaning", "flows into")),
            "modifiers", List.of(Map.of("symbol", "!")),
            "inline_elements", List.of(
                    Map.of("symbol", "|", "name", "condition"),
                    Map.of("symbol", "@", "name", "source"),
                    Map.of("symbol", "&", "name", "reference")),
            "evolution", Map.of("supersession", Map.of("open", "[<=", "close", "]"))
    );

    private static Map<String, Object> minimalWith(String key, Object value) {
        Map<String, Object> m = new HashMap<>(MINIMAL);
        m.put(key, value);
        return m;
    }

    @Test
    void bundledTableHasOperatorsInPrecedenceOrder() {
        List<String> symbols = TokenTable.defaults().briefForms().stream().map(TokenTable.BriefForm::symbol).toList();
        assertEquals(List.of("=>", "<=", "<>", "><", "//", "vs", "~", "="), symbols);
    }

    @Test
    void bundledTableModifiers() {
        TokenTable tokens = TokenTable.defaults();
        assertTrue(tokens.isModifier("v"));
        assertFalse(tokens.isSymbolicModifier("v"));
        assertTrue(tokens.isSymbolicModifier("^"));
        assertEquals(5, tokens.modifiers().size());
    }

    @Test
    void bundledTableMarkers() {
        TokenTable tokens = TokenTable.defaults();
        assertEquals('|', tokens.conditionMarker());
        assertEquals('@', tokens.sourceMarker());
        assertEquals('&', tokens.referenceMarker());
        assertEquals("[<=", tokens.evolutionOpen());
        assertEquals("]", tokens.evolutionClose());
    }

    @Test
    void defaultsAreLoadedOnce() {
        assertSame(TokenTable.defaults(), TokenTable.defaults());
    }

    @Test
    void stripsAllTrailingGlyphs() {
        TokenTable tokens = TokenTable.defaults();
        assertEquals("abuse", tokens.stripModifiers("abuse^!"));
        assertEquals("love", tokens.stripModifiers("love"));
        assertEquals("", tokens.stripModifiers("?"));
    }

    @Test
    void endsWithOperator() {
        TokenTable tokens = TokenTable.defaults();
        assertTrue(tokens.endsWithOperator("=>"));
        assertTrue(tokens.endsWithOperator("vs"));
        assertTrue(tokens.endsWithOperator("a=>"));
        assertFalse(tokens.endsWithOperator("trust"));
        assertFalse(tokens.endsWithOperator("obvs"));
    }

    @Test
    void longerOperatorsSortFirst() {
        TokenTable tokens = TokenTable.fromMap(MINIMAL);
        assertEquals("->", tokens.briefForms().get(0).symbol());
        assertEquals("flows into", tokens.briefForms().get(0).meaning());
    }

    @Test
    void customTableDrivesValidation() {
        TokenTable tokens = TokenTable.fromMap(MINIMAL);
        WorldviewValidator.ValidationResult result =
                WorldviewValidator.validate("Power\n  .core\n    - power ->", tokens);
        assertEquals(List.of(new ValidationError.BriefFormMissingRightOperand(3, "->")), result.errors());
    }

    @Test
    void parsesYaml() {
        String yaml = """
                brief_forms:
                  - symbol: "=>"
                modifiers:
                  - symbol: "?"
                inline_elements:
                  - {symbol: "|", name: condition}
                  - {symbol: "@", name: source}
                  - {symbol: "&", name: reference}
                evolution:
                  supersession: {open: "[<=", close: "]"}
                """;
        TokenTable tokens = TokenTable.parse(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
        assertEquals(1, tokens.briefForms().size());
        assertTrue(tokens.isSymbolicModifier("?"));
        assertFalse(tokens.isModifier("!"));
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tokens.yaml");
        try (var is = TokenTable.class.getResourceAsStream(TokenTable.BUNDLED_RESOURCE)) {
            Files.write(file, is.readAllBytes());
        }
        assertEquals(8, TokenTable.load(file).briefForms().size());
    }

    @Test
    void rejectsEmptyBriefForms() {
        assertThrows(IllegalArgumentException.class, () -> TokenTable.fromMap(minimalWith("brief_forms", List.of())));
    }

    @Test
    void rejectsMissingSymbol() {
        assertThrows(IllegalArgumentException.class,
                () -> TokenTable.fromMap(minimalWith("modifiers", List.of(Map.of("meaning", "loud")))));
    }

    @Test
    void rejectsMultiCharacterModifier() {
        assertThrows(IllegalArgumentException.class,
                () -> TokenTable.fromMap(minimalWith("modifiers", List.of(Map.of("symbol", "!!")))));
    }

    @Test
    void rejectsMissingInlineElement() {
        assertThrows(IllegalArgumentException.class,
                () -> TokenTable.fromMap(minimalWith("inline_elements", List.of(Map.of("symbol", "|", "name", "condition")))));
    }

    @Test
    void rejectsMissingEvolution() {
        assertThrows(IllegalArgumentException.class, () -> TokenTable.fromMap(minimalWith("evolution", Map.of())));
    }

    @Test
    void rejectsEmptyDocument() {
        assertThrows(IllegalArgumentException.class,
                () -> TokenTable.parse(new ByteArrayInputStream(new byte[0])));
    }

    @Test
    void wrongShapeIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TokenTable.parse(yaml("brief_forms: \"=>\"\n")));
        assertTrue(e.getMessage().contains("'brief_forms' must be a list"));
        assertThrows(IllegalArgumentException.class, () -> TokenTable.parse(yaml("modifiers: [\"?\"]\n")));
        assertThrows(IllegalArgumentException.class, () -> TokenTable.parse(yaml("evolution: [1, 2]\n")));
        assertThrows(IllegalArgumentException.class, () -> TokenTable.parse(yaml("just a sentence\n")));
    }

    @Test
    void malformedYamlIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TokenTable.parse(yaml("brief_forms: [\n  - : :")));
        assertTrue(e.getMessage().startsWith("tokens: invalid YAML"));
    }

    private static ByteArrayInputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }
}
