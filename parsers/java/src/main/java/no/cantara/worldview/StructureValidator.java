package no.cantara.worldview;

import no.cantara.worldview.model.LineType;
import no.cantara.worldview.model.ParsedLine;
import no.cantara.worldview.model.ValidationError;

import java.util.List;

/**
 * Checks the concept / facet / claim hierarchy of a classified document.
 *
 * <p>Walks the lines once, tracking the open concept and facet. A parent is checked for
 * children when the next parent of the same level (or the end of the document) closes it.
 */
public final class StructureValidator {

    private StructureValidator() {}

    private record Open(int line, String name) {}

    public static void validate(List<ParsedLine> lines, List<ValidationError> errors) {
        Open concept = null;
        Open facet = null;
        boolean conceptHasFacet = false;
        boolean facetHasClaim = false;

        for (ParsedLine line : lines) {
            LineType type = line.lineType();
            if (type instanceof LineType.Concept c) {
                closeConcept(concept, conceptHasFacet, errors);
                closeFacet(facet, facetHasClaim, errors);
                concept = new Open(line.lineNumber(), c.name());
                facet = null;
                conceptHasFacet = false;
                facetHasClaim = false;
            } else if (type instanceof LineType.Facet f) {
                if (concept == null) {
                    errors.add(new ValidationError.OrphanFacet(line.lineNumber()));
                } else {
                    conceptHasFacet = true;
                }
                closeFacet(facet, facetHasClaim, errors);
                facet = new Open(line.lineNumber(), f.name());
                facetHasClaim = false;
            } else if (type instanceof LineType.Claim) {
                if (facet == null) {
                    errors.add(new ValidationError.OrphanClaim(line.lineNumber()));
                } else {
                    facetHasClaim = true;
                }
            }
        }

        closeConcept(concept, conceptHasFacet, errors);
        closeFacet(facet, facetHasClaim, errors);
    }

    private static void closeConcept(Open concept, boolean hasFacet, List<ValidationError> errors) {
        if (concept != null && !hasFacet) {
            errors.add(new ValidationError.ConceptWithoutFacets(concept.line(), concept.name()));
        }
    }

    private static void closeFacet(Open facet, boolean hasClaim, List<ValidationError> errors) {
        if (facet != null && !hasClaim) {
            errors.add(new ValidationError.FacetWithoutClaims(facet.line(), facet.name()));
        }
    }
}
