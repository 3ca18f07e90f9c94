// =============================================================================
// EcoCollect - Euclidean Distance Metric
// =============================================================================
package com.ecocollect.optimizer.routing;

import com.ecocollect.optimizer.model.CollectionPoint;
import org.springframework.stereotype.Component;

/**
 * Straight-line distance over raw latitude/longitude degrees, treated as a
 * flat plane.
 * <p>
 * Known limitation: there is no geodesic correction, so a degree of longitude
 * counts the same as a degree of latitude. Good enough for nearest-neighbour
 * comparisons within a city, not for absolute distances. Swapping in a
 * haversine metric would change the ordering of some tours.
 */
@Component
public class EuclideanDistanceMetric implements DistanceMetric {
    
    @Override
    public double distance(CollectionPoint a, CollectionPoint b) {
        double latDiff = a.getLatitude() - b.getLatitude();
        double lonDiff = a.getLongitude() - b.getLongitude();
        return Math.sqrt(latDiff * latDiff + lonDiff * lonDiff);
    }
}
