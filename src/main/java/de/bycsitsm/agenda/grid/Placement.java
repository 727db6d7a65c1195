package de.bycsitsm.agenda.grid;

import de.bycsitsm.agenda.occasion.Occasion;
import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * The association of one occasion with one grid column. A single placement is shared by every
 * cell the occasion covers, so a visual class assigned to it is visible from all of them.
 */
public final class Placement {

    private final Occasion occasion;
    private final int column;
    private final LocalDateTime firstSlot;
    private @Nullable String visualClass;

    Placement(Occasion occasion, int column, LocalDateTime firstSlot) {
        this.occasion = occasion;
        this.column = column;
        this.firstSlot = firstSlot;
    }

    public Occasion occasion() {
        return occasion;
    }

    public int column() {
        return column;
    }

    /**
     * The slot of the first cell holding this placement. Equals the occasion start unless the
     * occasion began before the grid.
     */
    public LocalDateTime firstSlot() {
        return firstSlot;
    }

    public @Nullable String visualClass() {
        return visualClass;
    }

    /**
     * Assigns the visual class unless one is already set; the first assignment wins.
     *
     * @return whether the class was assigned
     */
    boolean assignVisualClass(String visualClass) {
        if (this.visualClass != null) {
            return false;
        }
        this.visualClass = visualClass;
        return true;
    }

    @Override
    public String toString() {
        return "Placement[" + occasion + ", column=" + column + "]";
    }
}
