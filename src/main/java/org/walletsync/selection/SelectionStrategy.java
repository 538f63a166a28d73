package org.walletsync.selection;

import java.util.Set;

/**
 * Coin selection algorithm. Implementations must be pure: no I/O, no state between calls.
 */
public interface SelectionStrategy {

    String getId();

    String getName();

    String getDescription();

    /** Returns tags describing what the strategy optimizes for, e.g. "privacy", "fees". */
    Set<String> getTags();

    SelectionResult select(SelectionContext context);

}
