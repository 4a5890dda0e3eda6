package no.cantara.worldview;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup table of the Worldview token set: brief-form operators, modifier glyphs,
 * inline element markers and the evolution marker delimiters.
 *
 * <p>Loaded from a tokens.yaml description. The bundled table is read once per process through
 * {@link #defaults()}; set the {@value #TOKENS_PROPERTY} system property to load an external file instead.
 * Instances are never mutated and can be shared between threads.
 */
public final class TokenTable {

    private static final Logger log = LoggerFactory.getLogger(TokenTable.class);

    public static final String TOKENS_PROPERTY = "worldview.tokens";
    static final String BUNDLED_RESOURCE = "/worldview/tokens.yaml";

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public record BriefForm(String symbol, String meaning, String example) {}

    public record Modifier(String symbol, String meaning, String example) {
        /** Glyph modifiers may be written as a suffix; letter modifiers only as a standalone token. */
        public boolean symbolic() {
            return !Character.isLetter(symbol.charAt(0));
        }
    }

    private final List<BriefForm> briefForms;
    private final List<Modifier> modifiers;
    private final Set<String> modifierSymbols;
    private final Set<String> symbolicModifiers;
    private final char conditionMarker;
    private final char sourceMarker;
    private final char referenceMarker;
    private final String evolutionOpen;
    private final String evolutionClose;

    TokenTable(List<BriefForm> briefForms, List<Modifier> modifiers,
               char conditionMarker, char sourceMarker, char referenceMarker,
               String evolutionOpen, String evolutionClose) {
        // Longest first so that no operator is matched as part of a longer one; stable for equal lengths.
        List<BriefForm> ordered = new ArrayList<>(briefForms);
        ordered.sort(Comparator.comparingInt((BriefForm b) -> b.symbol().length()).reversed());
        this.briefForms = List.copyOf(ordered);
        this.modifiers = List.copyOf(modifiers);

        Set<String> all = new LinkedHashSet<>();
        Set<String> symbolic = new LinkedHashSet<>();
        for (Modifier m : modifiers) {
            all.add(m.symbol());
            if (m.symbolic()) symbolic.add(m.symbol());
        }
        this.modifierSymbols = Set.copyOf(all);
        this.symbolicModifiers = Set.copyOf(symbolic);

        this.conditionMarker = conditionMarker;
        this.sourceMarker = sourceMarker;
        this.referenceMarker = referenceMarker;
        this.evolutionOpen = evolutionOpen;
        this.evolutionClose = evolutionClose;
    }

    // ── Loading ───────────────────────────────────────────────────────────────────

    private static final class DefaultHolder {
        static final TokenTable INSTANCE = loadDefault();
    }

    /**
     * The process-wide table, loaded on first use.
     */
    public static TokenTable defaults() {
        return DefaultHolder.INSTANCE;
    }

    private static TokenTable loadDefault() {
        String override = System.getProperty(TOKENS_PROPERTY);
        try {
            if (override != null && !override.isBlank()) {
                log.debug("Loading token table from {}", override);
                try {
                    return load(Path.of(override));
                } catch (IOException | IllegalArgumentException e) {
                    log.error("Could not load token table {}, using the bundled table: {}", override, e.getMessage());
                }
            }
            try (InputStream is = TokenTable.class.getResourceAsStream(BUNDLED_RESOURCE)) {
                if (is == null) {
                    throw new IllegalStateException("Bundled token table not found: " + BUNDLED_RESOURCE);
                }
                log.debug("Loading bundled token table {}", BUNDLED_RESOURCE);
                return parse(is);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read token table", e);
        }
    }

    public static TokenTable load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is);
        }
    }

    /**
     * Reads a tokens.yaml document. Malformed YAML and documents of the wrong shape are both
     * reported as {@link IllegalArgumentException}.
     */
    public static TokenTable parse(InputStream is) {
        Object data;
        try {
            data = YAML.load(is);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("tokens: invalid YAML: " + e.getMessage(), e);
        }
        if (data == null) {
            throw new IllegalArgumentException("tokens: document is empty");
        }
        return fromMap(map(data, "document"));
    }

    public static TokenTable fromMap(Map<String, Object> data) {
        List<Map<String, Object>> bfMaps = listOfMaps(data.get("brief_forms"), "brief_forms");
        List<Map<String, Object>> modMaps = listOfMaps(data.get("modifiers"), "modifiers");
        List<Map<String, Object>> inlineMaps = listOfMaps(data.get("inline_elements"), "inline_elements");
        Map<String, Object> evolution = data.get("evolution") == null ? Map.of() : map(data.get("evolution"), "evolution");

        if (bfMaps.isEmpty()) {
            throw new IllegalArgumentException("tokens: 'brief_forms' must not be empty");
        }
        if (modMaps.isEmpty()) {
            throw new IllegalArgumentException("tokens: 'modifiers' must not be empty");
        }

        List<BriefForm> briefForms = bfMaps.stream()
                .map(m -> new BriefForm(requiredSymbol(m, "brief_forms"), text(m.get("meaning")), text(m.get("example"))))
                .toList();
        List<Modifier> modifiers = modMaps.stream()
                .map(m -> new Modifier(requiredSymbol(m, "modifiers"), text(m.get("meaning")), text(m.get("example"))))
                .toList();
        for (Modifier m : modifiers) {
            if (m.symbol().length() != 1) {
                throw new IllegalArgumentException("tokens: modifier '" + m.symbol() + "' must be a single character");
            }
        }

        Map<String, Object> supersession = evolution.get("supersession") == null
                ? Map.of() : map(evolution.get("supersession"), "evolution.supersession");
        String open = text(supersession.get("open"));
        String close = text(supersession.get("close"));
        if (open == null || open.isBlank() || close == null || close.isBlank()) {
            throw new IllegalArgumentException("tokens: 'evolution.supersession' requires 'open' and 'close'");
        }

        return new TokenTable(briefForms, modifiers,
                inlineMarker(inlineMaps, "condition"),
                inlineMarker(inlineMaps, "source"),
                inlineMarker(inlineMaps, "reference"),
                open, close);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object value, String key) {
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("tokens: '" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static List<Map<String, Object>> listOfMaps(Object value, String key) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException("tokens: '" + key + "' must be a list");
        }
        List<Map<String, Object>> entries = new ArrayList<>();
        for (Object item : list) {
            entries.add(map(item, key + "[]"));
        }
        return entries;
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }

    private static String requiredSymbol(Map<String, Object> entry, String section) {
        Object symbol = entry.get("symbol");
        if (symbol == null || symbol.toString().isBlank()) {
            throw new IllegalArgumentException("tokens: every entry in '" + section + "' requires a 'symbol'");
        }
        return symbol.toString();
    }

    private static char inlineMarker(List<Map<String, Object>> inlineMaps, String name) {
        for (Map<String, Object> m : inlineMaps) {
            if (name.equals(m.get("name"))) {
                String symbol = requiredSymbol(m, "inline_elements");
                if (symbol.length() != 1) {
                    throw new IllegalArgumentException("tokens: inline element '" + name + "' must be a single character");
                }
                return symbol.charAt(0);
            }
        }
        throw new IllegalArgumentException("tokens: missing inline element '" + name + "'");
    }

    // ── Lookups ───────────────────────────────────────────────────────────────────

    /** Brief forms in matching precedence order. */
    public List<BriefForm> briefForms() { return briefForms; }

    public List<Modifier> modifiers() { return modifiers; }

    public char conditionMarker() { return conditionMarker; }
    public char sourceMarker() { return sourceMarker; }
    public char referenceMarker() { return referenceMarker; }
    public String evolutionOpen() { return evolutionOpen; }
    public String evolutionClose() { return evolutionClose; }

    public boolean isInlineMarker(char c) {
        return c == conditionMarker || c == sourceMarker || c == referenceMarker;
    }

    /** True for a token that is exactly one modifier, letter modifiers included. */
    public boolean isModifier(String token) {
        return modifierSymbols.contains(token);
    }

    /** True for a token that is exactly one glyph modifier. */
    public boolean isSymbolicModifier(String token) {
        return symbolicModifiers.contains(token);
    }

    /** The glyph modifier a token ends with, or {@code null}. */
    public String symbolicSuffix(String token) {
        if (token.isEmpty()) return null;
        String last = token.substring(token.length() - 1);
        return symbolicModifiers.contains(last) ? last : null;
    }

    /** Removes every trailing glyph modifier. */
    public String stripModifiers(String token) {
        String s = token;
        while (symbolicSuffix(s) != null) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    /**
     * True when a token ends in a brief-form operator. Word operators such as {@code vs} must be
     * the whole token; symbolic ones may close a longer token ({@code a=>}).
     */
    public boolean endsWithOperator(String token) {
        return briefForms.stream().anyMatch(b -> Character.isLetter(b.symbol().charAt(0))
                ? token.equals(b.symbol())
                : token.endsWith(b.symbol()));
    }
}
