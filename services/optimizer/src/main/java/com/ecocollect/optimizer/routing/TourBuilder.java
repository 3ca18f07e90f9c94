// =============================================================================
// EcoCollect - Tour Builder
// =============================================================================
package com.ecocollect.optimizer.routing;

import com.ecocollect.optimizer.model.CollectionPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Greedy tour construction: start at the first input point, then keep
 * appending whatever the {@link NextStopSelector} picks until every point is
 * visited.
 * <p>
 * <b>Precondition:</b> every point must be routable (see
 * {@link EligibilityFilter}). Points with missing or non-finite coordinates
 * are not re-checked here.
 * <p>
 * The result is a permutation of the input and depends only on input order
 * and coordinates. Cost is O(n²) distance evaluations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TourBuilder {
    
    private final NextStopSelector selector;
    
    /**
     * Build a visiting order over the given points.
     *
     * @param points routable points, in input order
     * @return the same points in visiting order; empty for empty input
     */
    public List<CollectionPoint> buildTour(List<CollectionPoint> points) {
        if (points.isEmpty()) {
            return Collections.emptyList();
        }
        
        List<CollectionPoint> tour = new ArrayList<>(points.size());
        // Removal keeps the remaining points in input order, which the tie-break relies on
        List<CollectionPoint> unvisited = new ArrayList<>(points);
        
        tour.add(unvisited.remove(0));
        
        while (!unvisited.isEmpty()) {
            CollectionPoint current = tour.get(tour.size() - 1);
            int next = selector.selectNext(current, unvisited);
            tour.add(unvisited.remove(next));
        }
        
        log.debug("Built tour: strategy={}, stops={}", selector.name(), tour.size());
        return tour;
    }
}
