// =============================================================================
// EcoCollect - Nearest Neighbour Selection
// =============================================================================
package com.ecocollect.optimizer.routing;

import com.ecocollect.optimizer.model.CollectionPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Chooses the closest unvisited point.
 * <p>
 * Ties resolve to the earliest point in input order: the scan is linear and
 * only a strictly smaller distance replaces the current best.
 */
@Component
@RequiredArgsConstructor
public class NearestNeighborSelector implements NextStopSelector {
    
    private final DistanceMetric metric;
    
    @Override
    public int selectNext(CollectionPoint current, List<CollectionPoint> unvisited) {
        double minDistance = Double.POSITIVE_INFINITY;
        int nearestIndex = 0;
        
        for (int i = 0; i < unvisited.size(); i++) {
            double distance = metric.distance(current, unvisited.get(i));
            if (distance < minDistance) {
                minDistance = distance;
                nearestIndex = i;
            }
        }
        
        return nearestIndex;
    }
    
    @Override
    public String name() {
        return "nearest-neighbor";
    }
}
