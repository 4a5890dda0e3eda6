package no.cantara.worldview.model;

/**
 * A brief-form operator found in claim text. Either operand may be empty, which signals a missing operand.
 */
public record BriefFormUsage(
        String operator,
        String leftOperand,
        String rightOperand
) {}
