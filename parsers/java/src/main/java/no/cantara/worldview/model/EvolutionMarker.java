package no.cantara.worldview.model;

/**
 * The prior belief recorded by a {@code [<= ...]} supersession marker. May be empty.
 */
public record EvolutionMarker(String priorBelief) {}
