// =============================================================================
// EcoCollect - Route Optimizer Service
// =============================================================================
package com.ecocollect.optimizer.service;

import com.ecocollect.optimizer.config.OptimizerProperties;
import com.ecocollect.optimizer.dto.RouteOptimizeResponse;
import com.ecocollect.optimizer.dto.RouteStop;
import com.ecocollect.optimizer.model.CollectionPoint;
import com.ecocollect.optimizer.repository.CollectionPointRepository;
import com.ecocollect.optimizer.routing.EligibilityFilter;
import com.ecocollect.optimizer.routing.RouteFormatter;
import com.ecocollect.optimizer.routing.TourBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.Collections;
import java.util.List;

/**
 * Builds a collection route over the bins of one area (or all bins).
 * <p>
 * Fetches bins from the store, drops the ones without usable coordinates,
 * then runs the tour builder and formatter. An empty selection is reported
 * with a message instead of a route.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RouteOptimizerService {
    
    static final String NO_BINS_MESSAGE = "No bins found for the specified area";
    static final String NO_ROUTABLE_BINS_MESSAGE = "No bins with valid coordinates found";
    
    private final OptimizerProperties properties;
    private final CollectionPointRepository repository;
    private final TourBuilder tourBuilder;
    private final RouteFormatter routeFormatter;
    
    /**
     * Optimize the visiting order for an area.
     *
     * @param areaId area filter; {@code null} or blank selects every bin
     * @return ordered stops, or an empty route with an explanatory message
     */
    public RouteOptimizeResponse optimize(String areaId) {
        long startTime = System.currentTimeMillis();
        String area = (areaId == null || areaId.isBlank()) ? null : areaId.trim();
        String areaLabel = area != null ? area : RouteOptimizeResponse.ALL_AREAS;
        
        List<CollectionPoint> bins = area != null
                ? repository.findByAreaId(area)
                : repository.findAll();
        
        if (bins.isEmpty()) {
            log.warn("No bins to route: areaId={}", areaLabel);
            return emptyRoute(areaLabel, NO_BINS_MESSAGE);
        }
        
        List<CollectionPoint> routable = EligibilityFilter.eligible(bins);
        
        if (routable.size() < bins.size()) {
            log.warn("Skipping bins without valid coordinates: areaId={}, skipped={}",
                    areaLabel, bins.size() - routable.size());
        }
        
        if (routable.isEmpty()) {
            return emptyRoute(areaLabel, NO_ROUTABLE_BINS_MESSAGE);
        }
        
        if (routable.size() > properties.getMaxPoints()) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY,
                    "Too many bins to route: " + routable.size() + " (limit " + properties.getMaxPoints() + ")");
        }
        
        List<RouteStop> stops = routeFormatter.format(tourBuilder.buildTour(routable));
        
        log.info("Route optimization complete: areaId={}, stops={}, elapsedMs={}",
                areaLabel, stops.size(), System.currentTimeMillis() - startTime);
        
        return RouteOptimizeResponse.builder()
                .optimizedRoute(stops)
                .totalBins(stops.size())
                .areaId(areaLabel)
                .build();
    }
    
    private RouteOptimizeResponse emptyRoute(String areaLabel, String message) {
        return RouteOptimizeResponse.builder()
                .optimizedRoute(Collections.emptyList())
                .totalBins(0)
                .areaId(areaLabel)
                .message(message)
                .build();
    }
}
