// =============================================================================
// EcoCollect - Route Formatter
// =============================================================================
package com.ecocollect.optimizer.routing;

import com.ecocollect.optimizer.dto.RouteStop;
import com.ecocollect.optimizer.model.CollectionPoint;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Numbers a tour from 1 and copies each point's attributes onto its stop.
 */
@Component
public class RouteFormatter {
    
    public List<RouteStop> format(List<CollectionPoint> tour) {
        List<RouteStop> stops = new ArrayList<>(tour.size());
        
        for (int i = 0; i < tour.size(); i++) {
            CollectionPoint point = tour.get(i);
            stops.add(RouteStop.builder()
                    .order(i + 1)
                    .binId(point.getId())
                    .location(point.getLocation())
                    .category(point.getCategory())
                    .latitude(point.getLatitude())
                    .longitude(point.getLongitude())
                    .areaId(point.getAreaId())
                    .build());
        }
        
        return stops;
    }
}
