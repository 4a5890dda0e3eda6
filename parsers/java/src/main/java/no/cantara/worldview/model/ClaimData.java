package no.cantara.worldview.model;

import java.util.List;

/**
 * A claim decomposed into its core text and inline elements.
 *
 * <p>{@code text} may be empty; that is reported by the validator, not rejected by the parser.
 * {@code evolution} is {@code null} unless a closed {@code [<= ...]} marker was found.
 */
public record ClaimData(
        String text,
        List<String> conditions,
        List<String> sources,
        List<String> references,
        List<BriefFormUsage> briefForms,
        List<ModifierUsage> modifiers,
        EvolutionMarker evolution
) {
    public ClaimData {
        text = text != null ? text : "";
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
        sources = sources != null ? List.copyOf(sources) : List.of();
        references = references != null ? List.copyOf(references) : List.of();
        briefForms = briefForms != null ? List.copyOf(briefForms) : List.of();
        modifiers = modifiers != null ? List.copyOf(modifiers) : List.of();
    }

    public boolean hasEvolution() { return evolution != null; }
}
