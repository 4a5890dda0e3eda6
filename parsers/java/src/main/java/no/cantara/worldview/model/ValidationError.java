package no.cantara.worldview.model;

/**
 * A problem that makes a Worldview document invalid.
 *
 * <p>The set of kinds is closed; callers can match exhaustively on the nested records.
 * Every kind carries the 1-based line it was found on.
 */
public sealed interface ValidationError {

    int line();

    String message();

    default String render() {
        return "line " + line() + ": " + message();
    }

    // ── Classification ────────────────────────────────────────────────────────────

    record InvalidIndentation(int line, String expected, int found) implements ValidationError {
        public String message() {
            return "invalid indentation (expected " + expected + " spaces, found " + found + ")";
        }
    }

    record UnexpectedIndentation(int line, int found) implements ValidationError {
        public String message() { return "unexpected indentation level (" + found + " spaces)"; }
    }

    record MissingFacetPrefix(int line) implements ValidationError {
        public String message() { return "facet must have '.' prefix"; }
    }

    record MissingClaimPrefix(int line) implements ValidationError {
        public String message() { return "claim must have '-' prefix"; }
    }

    record EmptyConceptName(int line) implements ValidationError {
        public String message() { return "concept name cannot be empty"; }
    }

    record EmptyFacetName(int line) implements ValidationError {
        public String message() { return "facet name cannot be empty"; }
    }

    // ── Structure ─────────────────────────────────────────────────────────────────

    record OrphanFacet(int line) implements ValidationError {
        public String message() { return "orphan facet (no preceding concept)"; }
    }

    record OrphanClaim(int line) implements ValidationError {
        public String message() { return "orphan claim (no preceding facet)"; }
    }

    record ConceptWithoutFacets(int line, String concept) implements ValidationError {
        public String message() { return "concept '" + concept + "' has no facets"; }
    }

    record FacetWithoutClaims(int line, String facet) implements ValidationError {
        public String message() { return "facet '" + facet + "' has no claims"; }
    }

    // ── Claim syntax ──────────────────────────────────────────────────────────────

    record EmptyClaimText(int line) implements ValidationError {
        public String message() { return "empty claim text"; }
    }

    record EmptyCondition(int line) implements ValidationError {
        public String message() { return "empty condition (standalone '|')"; }
    }

    record EmptySource(int line) implements ValidationError {
        public String message() { return "empty source (standalone '@')"; }
    }

    record EmptyReference(int line) implements ValidationError {
        public String message() { return "empty reference (standalone '&')"; }
    }

    record InvalidReferenceFormat(int line, String reference) implements ValidationError {
        public String message() {
            return "invalid reference format '" + reference + "' (expected &Concept.facet)";
        }
    }

    record UndefinedReference(int line, String reference) implements ValidationError {
        public String message() {
            return "reference '" + reference + "' does not match any Concept.facet in this document";
        }
    }

    record BriefFormMissingLeftOperand(int line, String operator) implements ValidationError {
        public String message() { return "brief form '" + operator + "' is missing its left operand"; }
    }

    record BriefFormMissingRightOperand(int line, String operator) implements ValidationError {
        public String message() { return "brief form '" + operator + "' is missing its right operand"; }
    }

    record UnclosedEvolutionMarker(int line) implements ValidationError {
        public String message() { return "unclosed evolution marker ('[<=' without ']')"; }
    }

    record EmptyEvolutionMarker(int line) implements ValidationError {
        public String message() { return "evolution marker has no prior belief ('[<=]')"; }
    }

    record MalformedEvolutionMarker(int line, String marker) implements ValidationError {
        public String message() {
            return "malformed evolution marker '" + marker + "' (only one '[<= ...]' per claim)";
        }
    }
}
