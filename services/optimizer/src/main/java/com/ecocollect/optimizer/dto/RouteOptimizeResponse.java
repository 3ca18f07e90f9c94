// =============================================================================
// EcoCollect - Route Optimize Response DTO
// =============================================================================
package com.ecocollect.optimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Response DTO for route optimization.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteOptimizeResponse {
    
    /**
     * Label echoed when no area filter was applied.
     */
    public static final String ALL_AREAS = "all";
    
    /**
     * Stops in visiting order.
     */
    private List<RouteStop> optimizedRoute;
    
    /**
     * Number of stops in the route.
     */
    private int totalBins;
    
    /**
     * Area filter that was applied, or {@value #ALL_AREAS}.
     */
    private String areaId;
    
    /**
     * Explanation when there was nothing to route.
     */
    private String message;
}
