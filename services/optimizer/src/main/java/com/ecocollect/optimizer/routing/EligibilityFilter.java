// =============================================================================
// EcoCollect - Eligibility Filter
// =============================================================================
package com.ecocollect.optimizer.routing;

import com.ecocollect.optimizer.model.CollectionPoint;
import lombok.experimental.UtilityClass;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Drops points that cannot be routed: missing, NaN or infinite coordinates.
 * Relative order of the remaining points is preserved.
 */
@UtilityClass
public class EligibilityFilter {
    
    public List<CollectionPoint> eligible(Collection<CollectionPoint> points) {
        return points.stream()
                .filter(CollectionPoint::isRoutable)
                .collect(Collectors.toList());
    }
}
