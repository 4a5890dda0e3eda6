package no.cantara.worldview.model;

/**
 * Classification of a single document line. Every line has exactly one type.
 */
public sealed interface LineType {

    /** Empty line, whitespace only, or a malformed line that was rejected during classification. */
    record Blank() implements LineType {}

    /** Unindented concept name. */
    record Concept(String name) implements LineType {}

    /** Two-space indented facet, {@code '.'} prefix stripped. */
    record Facet(String name) implements LineType {}

    /** Four-space indented claim, {@code '-'} prefix stripped and parsed. */
    record Claim(ClaimData claim) implements LineType {}
}
