// =============================================================================
// EcoCollect - Route Optimize Request DTO
// =============================================================================
package com.ecocollect.optimizer.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for route optimization.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteOptimizeRequest {
    
    /**
     * Area to restrict the route to. Absent or blank means all bins.
     */
    @Size(max = 100, message = "Area ID must be at most 100 characters")
    private String areaId;
}
