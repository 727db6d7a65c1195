package de.bycsitsm.agenda.grid;

/**
 * Turns placements into presentation units.
 */
public interface PlacementFormatter {

    /** Label of cells continuing a placement from an earlier row. */
    String CONTINUATION_LABEL = "^";

    /**
     * Formats the first cell of a placement.
     */
    PresentationUnit format(Placement placement);

    /**
     * Formats a cell continuing a placement from an earlier row.
     */
    default PresentationUnit formatContinuation(Placement placement) {
        return new PresentationUnit(CONTINUATION_LABEL, null, placement.visualClass());
    }
}
