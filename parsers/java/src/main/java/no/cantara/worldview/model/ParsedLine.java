package no.cantara.worldview.model;

/**
 * One input line with its 1-based number, original text and classification.
 */
public record ParsedLine(
        int lineNumber,
        String raw,
        LineType lineType
) {}
