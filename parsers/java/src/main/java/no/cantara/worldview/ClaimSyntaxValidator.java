package no.cantara.worldview;

import no.cantara.worldview.model.BriefFormUsage;
import no.cantara.worldview.model.ClaimData;
import no.cantara.worldview.model.ValidationError;
import no.cantara.worldview.model.ValidationWarning;

import java.util.List;
import java.util.Set;

/**
 * Checks the inline elements of a single parsed claim.
 */
public final class ClaimSyntaxValidator {

    private ClaimSyntaxValidator() {}

    /**
     * @param line       1-based line number of the claim
     * @param claim      the parsed claim
     * @param references every {@code Concept.facet} declared in the document
     */
    public static void validate(int line, ClaimData claim, Set<String> references, TokenTable tokens,
                                List<ValidationError> errors, List<ValidationWarning> warnings) {
        if (claim.text().isEmpty()) {
            errors.add(new ValidationError.EmptyClaimText(line));
        }
        for (String condition : claim.conditions()) {
            if (condition.isEmpty()) errors.add(new ValidationError.EmptyCondition(line));
        }
        for (String source : claim.sources()) {
            if (source.isEmpty()) errors.add(new ValidationError.EmptySource(line));
        }

        for (String reference : claim.references()) {
            if (reference.isEmpty()) {
                errors.add(new ValidationError.EmptyReference(line));
            } else if (reference.indexOf('.') < 0) {
                errors.add(new ValidationError.InvalidReferenceFormat(line, reference));
            } else if (!references.contains(reference)) {
                errors.add(new ValidationError.UndefinedReference(line, reference));
            }
        }

        for (BriefFormUsage usage : claim.briefForms()) {
            if (usage.leftOperand().isEmpty()) {
                errors.add(new ValidationError.BriefFormMissingLeftOperand(line, usage.operator()));
            }
            if (usage.rightOperand().isEmpty()) {
                errors.add(new ValidationError.BriefFormMissingRightOperand(line, usage.operator()));
            }
        }

        checkEvolution(line, claim, tokens, errors);
        checkStandaloneModifiers(line, claim.text(), tokens, warnings);
    }

    private static void checkEvolution(int line, ClaimData claim, TokenTable tokens, List<ValidationError> errors) {
        String text = claim.text();
        int open = text.indexOf(tokens.evolutionOpen());
        if (open >= 0) {
            int close = text.indexOf(tokens.evolutionClose(), open + tokens.evolutionOpen().length());
            if (close < 0) {
                errors.add(new ValidationError.UnclosedEvolutionMarker(line));
            } else {
                // A complete marker still in the text means the claim carried more than one.
                errors.add(new ValidationError.MalformedEvolutionMarker(line,
                        text.substring(open, close + tokens.evolutionClose().length())));
            }
        }
        if (claim.hasEvolution() && claim.evolution().priorBelief().isEmpty()) {
            errors.add(new ValidationError.EmptyEvolutionMarker(line));
        }
    }

    private static void checkStandaloneModifiers(int line, String text, TokenTable tokens,
                                                 List<ValidationWarning> warnings) {
        List<String> words = ClaimParser.tokenize(text);
        for (int i = 0; i < words.size(); i++) {
            String word = words.get(i);
            if (!tokens.isSymbolicModifier(word)) continue;
            if (i == 0) {
                warnings.add(new ValidationWarning.StandaloneModifier(line, word, null));
            } else if (tokens.endsWithOperator(words.get(i - 1))) {
                warnings.add(new ValidationWarning.StandaloneModifier(line, word, words.get(i - 1)));
            }
        }
    }
}
