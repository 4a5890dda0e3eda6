package no.cantara.worldview;

import no.cantara.worldview.model.BriefFormUsage;
import no.cantara.worldview.model.ClaimData;
import no.cantara.worldview.model.EvolutionMarker;
import no.cantara.worldview.model.ModifierUsage;

import java.util.ArrayList;
import java.util.List;

/**
 * Decomposes a claim body (prefix already stripped) into a {@link ClaimData}.
 *
 * <p>Parsing never fails. Malformed input produces empty fields and is reported later by
 * {@link ClaimSyntaxValidator}. The steps run in a fixed order: evolution marker, inline
 * elements, brief forms, modifiers. The last two only look at the core claim text.
 */
public final class ClaimParser {

    private ClaimParser() {}

    public static ClaimData parse(String body) {
        return parse(body, TokenTable.defaults());
    }

    public static ClaimData parse(String body, TokenTable tokens) {
        String remainder = body;
        EvolutionMarker evolution = null;

        // ── 1. evolution marker ──────────────────────────────────────────────────────
        int open = remainder.indexOf(tokens.evolutionOpen());
        if (open >= 0) {
            int close = remainder.indexOf(tokens.evolutionClose(), open + tokens.evolutionOpen().length());
            if (close >= 0) {
                evolution = new EvolutionMarker(
                        remainder.substring(open + tokens.evolutionOpen().length(), close).strip());
                // No space is reinserted: "a [<= b] c" becomes "ac".
                remainder = remainder.substring(0, open).strip()
                        + remainder.substring(close + tokens.evolutionClose().length()).strip();
            }
        }

        // ── 2. inline elements ───────────────────────────────────────────────────────
        InlineScan scan = new InlineScan(tokens);
        scan.run(remainder);

        // ── 3 + 4. brief forms and modifiers on the core text ────────────────────────
        List<BriefFormUsage> briefForms = extractBriefForms(scan.text, tokens);
        List<ModifierUsage> modifiers = extractModifiers(scan.text, tokens);

        return new ClaimData(scan.text, scan.conditions, scan.sources, scan.references,
                briefForms, modifiers, evolution);
    }

    /**
     * Left-to-right scan over the claim body. The first marker closes the claim text; free text
     * between later markers becomes a condition.
     */
    private static final class InlineScan {
        private final TokenTable tokens;
        private final StringBuilder segment = new StringBuilder();
        private boolean inClaim = true;
        private String text = "";
        private final List<String> conditions = new ArrayList<>();
        private final List<String> sources = new ArrayList<>();
        private final List<String> references = new ArrayList<>();

        InlineScan(TokenTable tokens) {
            this.tokens = tokens;
        }

        void run(String input) {
            int i = 0;
            while (i < input.length()) {
                char c = input.charAt(i++);
                if (c == tokens.conditionMarker()) {
                    flush();
                } else if (c == tokens.sourceMarker() || c == tokens.referenceMarker()) {
                    flush();
                    int start = i;
                    while (i < input.length() && input.charAt(i) != ' ' && !tokens.isInlineMarker(input.charAt(i))) {
                        i++;
                    }
                    String token = input.substring(start, i).strip();
                    if (!token.isEmpty()) {
                        (c == tokens.sourceMarker() ? sources : references).add(token);
                    }
                } else {
                    segment.append(c);
                }
            }
            finish();
        }

        private void flush() {
            if (inClaim) {
                text = segment.toString().strip();
                inClaim = false;
            } else if (!segment.toString().isBlank()) {
                conditions.add(segment.toString().strip());
            }
            segment.setLength(0);
        }

        private void finish() {
            if (inClaim) {
                text = segment.toString().strip();
            } else if (!segment.toString().isBlank() && sources.isEmpty() && references.isEmpty()) {
                conditions.add(segment.toString().strip());
            }
            // Text trailing a source or reference is dropped.
            segment.setLength(0);
        }
    }

    // ── Brief forms ───────────────────────────────────────────────────────────────

    static List<BriefFormUsage> extractBriefForms(String text, TokenTable tokens) {
        List<BriefFormUsage> usages = new ArrayList<>();
        for (TokenTable.BriefForm form : tokens.briefForms()) {
            String op = form.symbol();
            boolean word = Character.isLetter(op.charAt(0));
            int from = 0;
            int at;
            while ((at = text.indexOf(op, from)) >= 0) {
                from = at + op.length();
                if (word && !isStandaloneWord(text, at, op.length())) continue;
                if (op.equals("=") && !isBareEquals(text, at)) continue;
                if (insideLiteral(text, at, op.length(), tokens.evolutionOpen())) continue;
                usages.add(new BriefFormUsage(op,
                        tokens.stripModifiers(lastToken(text.substring(0, at))),
                        tokens.stripModifiers(firstToken(text.substring(at + op.length())))));
            }
        }
        return usages;
    }

    private static boolean isBareEquals(String text, int at) {
        char before = at > 0 ? text.charAt(at - 1) : ' ';
        char after = at + 1 < text.length() ? text.charAt(at + 1) : ' ';
        return before != '<' && before != '>' && after != '>';
    }

    // An unclosed or repeated evolution opener stays in the claim text; its "<=" is not a brief form.
    private static boolean insideLiteral(String text, int at, int length, String literal) {
        int from = Math.max(0, at + length - literal.length());
        for (int start = text.indexOf(literal, from); start >= 0 && start <= at; start = text.indexOf(literal, start + 1)) {
            if (at + length <= start + literal.length()) return true;
        }
        return false;
    }

    // Word operators such as "vs" only count as their own token, never inside a word.
    private static boolean isStandaloneWord(String text, int at, int length) {
        boolean startOk = at == 0 || Character.isWhitespace(text.charAt(at - 1));
        int end = at + length;
        boolean endOk = end == text.length() || Character.isWhitespace(text.charAt(end));
        return startOk && endOk;
    }

    private static String lastToken(String s) {
        String[] parts = s.strip().split("\\s+");
        return parts[parts.length - 1];
    }

    private static String firstToken(String s) {
        return s.strip().split("\\s+")[0];
    }

    // ── Modifiers ─────────────────────────────────────────────────────────────────

    static List<ModifierUsage> extractModifiers(String text, TokenTable tokens) {
        List<ModifierUsage> usages = new ArrayList<>();
        List<String> words = tokenize(text);
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            String suffix = tokens.symbolicSuffix(word);
            if (suffix != null && word.length() > 1) {
                usages.add(new ModifierUsage(suffix, word.substring(0, word.length() - 1)));
            }
            if (i > 0 && tokens.isModifier(word)) {
                String previous = words.get(i - 1);
                if (!tokens.endsWithOperator(previous)) {
                    usages.add(new ModifierUsage(word, tokens.stripModifiers(previous)));
                }
            }
        }
        return usages;
    }

    static List<String> tokenize(String text) {
        String stripped = text.strip();
        return stripped.isEmpty() ? List.of() : List.of(stripped.split("\\s+"));
    }
}
