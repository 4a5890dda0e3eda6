package no.cantara.worldview.model;

/**
 * A construct that is permitted but suspicious. Warnings never make a document invalid.
 */
public sealed interface ValidationWarning {

    int line();

    String message();

    default String render() {
        return "line " + line() + ": " + message();
    }

    /**
     * A modifier glyph standing on its own with nothing sensible to modify.
     *
     * @param precedingToken the operator token it follows, or {@code null} when it opens the claim
     */
    record StandaloneModifier(int line, String modifier, String precedingToken) implements ValidationWarning {
        public String message() {
            if (precedingToken == null) {
                return "standalone modifier '" + modifier + "' has no preceding term to modify";
            }
            return "standalone modifier '" + modifier + "' follows operator '" + precedingToken
                    + "' instead of a term";
        }
    }
}
