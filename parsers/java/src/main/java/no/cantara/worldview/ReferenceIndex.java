package no.cantara.worldview;

import no.cantara.worldview.model.LineType;
import no.cantara.worldview.model.ParsedLine;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects every {@code Concept.facet} target declared in a document.
 *
 * <p>Built from a full scan before any claim is checked, so a reference may point to a
 * facet declared further down.
 */
public final class ReferenceIndex {

    private ReferenceIndex() {}

    public static Set<String> build(List<ParsedLine> lines) {
        Set<String> targets = new LinkedHashSet<>();
        String concept = null;
        for (ParsedLine line : lines) {
            if (line.lineType() instanceof LineType.Concept c) {
                concept = c.name();
            } else if (line.lineType() instanceof LineType.Facet f && concept != null) {
                targets.add(concept + "." + f.name());
            }
        }
        return Set.copyOf(targets);
    }
}
