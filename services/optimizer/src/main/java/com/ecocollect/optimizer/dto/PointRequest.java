// =============================================================================
// EcoCollect - Point Upsert Request DTO
// =============================================================================
package com.ecocollect.optimizer.dto;

import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for creating or replacing a bin. The bin ID comes from the path.
 * Coordinates may be omitted; such bins are stored but skipped by routing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PointRequest {
    
    @Size(max = 200, message = "Location must be at most 200 characters")
    private String location;
    
    @Size(max = 50, message = "Category must be at most 50 characters")
    private String category;
    
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    private Double latitude;
    
    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    private Double longitude;
    
    @Size(max = 100, message = "Area ID must be at most 100 characters")
    private String areaId;
}
