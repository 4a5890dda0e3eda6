package no.cantara.worldview;

import no.cantara.worldview.model.LineType;
import no.cantara.worldview.model.ParsedLine;
import no.cantara.worldview.model.ValidationError;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies the lines of a Worldview document into concepts, facets, claims and blanks.
 *
 * <p>Classification and error recording are coupled: a line with a bad prefix or indentation is
 * reported and then treated as {@link LineType.Blank}, so it never contributes to the structure.
 */
public final class WorldviewParser {

    static final int CONCEPT_INDENT = 0;
    static final int FACET_INDENT = 2;
    static final int CLAIM_INDENT = 4;
    static final char FACET_PREFIX = '.';
    static final char CLAIM_PREFIX = '-';

    private WorldviewParser() {}

    /**
     * Classifies every line of {@code text}, appending classification errors to {@code errors}.
     */
    public static List<ParsedLine> parse(String text, TokenTable tokens, List<ValidationError> errors) {
        List<ParsedLine> lines = new ArrayList<>();
        List<String> raw = text.lines().toList();
        for (int i = 0; i < raw.size(); i++) {
            int lineNumber = i + 1;
            lines.add(new ParsedLine(lineNumber, raw.get(i), classify(raw.get(i), lineNumber, tokens, errors)));
        }
        return List.copyOf(lines);
    }

    static LineType classify(String line, int lineNumber, TokenTable tokens, List<ValidationError> errors) {
        if (line.isBlank()) {
            return new LineType.Blank();
        }

        int indent = leadingSpaces(line);
        String content = line.strip();

        switch (indent) {
            case CONCEPT_INDENT -> {
                if (content.isEmpty()) {
                    errors.add(new ValidationError.EmptyConceptName(lineNumber));
                    return new LineType.Blank();
                }
                return new LineType.Concept(content);
            }
            case FACET_INDENT -> {
                if (content.charAt(0) != FACET_PREFIX) {
                    errors.add(new ValidationError.MissingFacetPrefix(lineNumber));
                    return new LineType.Blank();
                }
                String name = content.substring(1).strip();
                if (name.isEmpty()) {
                    // Still a facet: it keeps its place in the hierarchy.
                    errors.add(new ValidationError.EmptyFacetName(lineNumber));
                }
                return new LineType.Facet(name);
            }
            case CLAIM_INDENT -> {
                if (content.charAt(0) != CLAIM_PREFIX) {
                    errors.add(new ValidationError.MissingClaimPrefix(lineNumber));
                    return new LineType.Blank();
                }
                return new LineType.Claim(ClaimParser.parse(content.substring(1).strip(), tokens));
            }
            default -> {
                if (indent == 1 || indent == 3) {
                    errors.add(new ValidationError.InvalidIndentation(lineNumber, "0, 2, or 4", indent));
                } else {
                    errors.add(new ValidationError.UnexpectedIndentation(lineNumber, indent));
                }
                return new LineType.Blank();
            }
        }
    }

    static int leadingSpaces(String line) {
        int n = 0;
        while (n < line.length() && line.charAt(n) == ' ') {
            n++;
        }
        return n;
    }
}
