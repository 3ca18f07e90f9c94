// =============================================================================
// EcoCollect - Distance Metric
// =============================================================================
package com.ecocollect.optimizer.routing;

import com.ecocollect.optimizer.model.CollectionPoint;

/**
 * Travel cost between two routable points.
 * <p>
 * Implementations must be symmetric, non-negative and zero exactly when both
 * points share coordinates.
 */
public interface DistanceMetric {
    
    double distance(CollectionPoint a, CollectionPoint b);
}
