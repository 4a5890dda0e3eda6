package no.cantara.worldview;

import no.cantara.worldview.model.LineType;
import no.cantara.worldview.model.ParsedLine;
import no.cantara.worldview.model.ValidationError;
import no.cantara.worldview.model.ValidationWarning;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Validates a Worldview document.
 *
 * <p>Runs three passes over the same line sequence: classification, structure, then claim syntax
 * against the reference index of the whole document. The document is always processed to the end;
 * every problem found is returned in one {@link ValidationResult}.
 */
public class WorldviewValidator {

    /**
     * Immutable result of validating a document.
     *
     * @param errors   Problems that make the document invalid, in the order found.
     * @param warnings Constructs that are permitted but suspicious.
     * @param lines    One parsed line per input line.
     */
    public record ValidationResult(List<ValidationError> errors,
                                   List<ValidationWarning> warnings,
                                   List<ParsedLine> lines) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
            lines = List.copyOf(lines);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public boolean hasWarnings() { return !warnings.isEmpty(); }

        /**
         * Human-readable report, one {@code line <n>: <message>} entry per problem.
         */
        public String render() {
            StringBuilder sb = new StringBuilder();
            if (isValid()) {
                sb.append("Valid Worldview document");
                if (hasWarnings()) {
                    sb.append(" with ").append(warnings.size()).append(" warning(s):\n");
                    warnings.forEach(w -> sb.append("  ").append(w.render()).append('\n'));
                } else {
                    sb.append('\n');
                }
                return sb.toString();
            }
            sb.append("Invalid Worldview document (").append(errors.size()).append(" error(s)):\n");
            errors.forEach(e -> sb.append("  ").append(e.render()).append('\n'));
            if (hasWarnings()) {
                sb.append("Additionally, ").append(warnings.size()).append(" warning(s):\n");
                warnings.forEach(w -> sb.append("  ").append(w.render()).append('\n'));
            }
            return sb.toString();
        }

        @Override
        public String toString() {
            return render();
        }
    }

    public static ValidationResult validate(String text) {
        return validate(text, TokenTable.defaults());
    }

    public static ValidationResult validate(String text, TokenTable tokens) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        List<ParsedLine> lines = WorldviewParser.parse(text, tokens, errors);
        StructureValidator.validate(lines, errors);

        Set<String> references = ReferenceIndex.build(lines);
        for (ParsedLine line : lines) {
            if (line.lineType() instanceof LineType.Claim claim) {
                ClaimSyntaxValidator.validate(line.lineNumber(), claim.claim(), references, tokens, errors, warnings);
            }
        }

        return new ValidationResult(errors, warnings, lines);
    }

    /**
     * Reads a UTF-8 file and validates it. Read failures propagate and are never reported as validation errors.
     */
    public static ValidationResult validateFile(Path path) throws IOException {
        return validateFile(path, TokenTable.defaults());
    }

    public static ValidationResult validateFile(Path path, TokenTable tokens) throws IOException {
        return validate(Files.readString(path, StandardCharsets.UTF_8), tokens);
    }
}
