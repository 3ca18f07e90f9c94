// =============================================================================
// EcoCollect - Collection Point Repository
// =============================================================================
package com.ecocollect.optimizer.repository;

import com.ecocollect.optimizer.model.CollectionPoint;

import java.util.List;
import java.util.Optional;

/**
 * Storage for bins. Listings come back in a stable order so that routes built
 * from them are reproducible.
 */
public interface CollectionPointRepository {
    
    List<CollectionPoint> findAll();
    
    List<CollectionPoint> findByAreaId(String areaId);
    
    Optional<CollectionPoint> findById(String id);
    
    /**
     * Insert or replace the bin with the same ID. A replaced bin keeps its
     * original position in listings.
     *
     * @return the bin that was replaced, empty when the ID was new
     */
    Optional<CollectionPoint> save(CollectionPoint point);
    
    boolean deleteById(String id);
    
    long count();
}
