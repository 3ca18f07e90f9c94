// =============================================================================
// EcoCollect - Next Stop Selection Strategy
// =============================================================================
package com.ecocollect.optimizer.routing;

import com.ecocollect.optimizer.model.CollectionPoint;

import java.util.List;

/**
 * Picks which unvisited point extends a partial tour.
 */
public interface NextStopSelector {
    
    /**
     * Select the next stop.
     *
     * @param current   last stop added to the tour
     * @param unvisited remaining points in original input order, never empty
     * @return index into {@code unvisited} of the chosen point
     */
    int selectNext(CollectionPoint current, List<CollectionPoint> unvisited);
    
    /**
     * Short name reported in logs.
     */
    String name();
}
