// =============================================================================
// EcoCollect - Route Stop DTO
// =============================================================================
package com.ecocollect.optimizer.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

/**
 * A bin annotated with its 1-based position in a computed route.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteStop {
    
    private int order;
    private String binId;
    private String location;
    private String category;
    private Double latitude;
    private Double longitude;
    private String areaId;
}
