// =============================================================================
// EcoCollect - Collection Point
// =============================================================================
package com.ecocollect.optimizer.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A collectable location (bin) as held by the point store.
 * <p>
 * Coordinates are nullable: a point without both of them stays in the store
 * but is never routed.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CollectionPoint {
    
    /**
     * Unique bin identifier.
     */
    @JsonProperty("binId")
    String id;
    
    /**
     * Free-text location label.
     */
    String location;
    
    /**
     * Free-text waste category tag.
     */
    String category;
    
    Double latitude;
    
    Double longitude;
    
    /**
     * Optional area the bin belongs to, used for pre-filtering only.
     */
    String areaId;
    
    /**
     * Whether both coordinates are present and finite.
     */
    @JsonIgnore
    public boolean isRoutable() {
        return latitude != null && longitude != null
                && Double.isFinite(latitude) && Double.isFinite(longitude);
    }
}
