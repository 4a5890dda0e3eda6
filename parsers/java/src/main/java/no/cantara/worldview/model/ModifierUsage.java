package no.cantara.worldview.model;

/**
 * A modifier glyph and the term it inflects.
 */
public record ModifierUsage(
        String symbol,
        String attachedTo
) {}
