// =============================================================================
// EcoCollect - In-Memory Collection Point Repository
// =============================================================================
package com.ecocollect.optimizer.repository;

import com.ecocollect.optimizer.model.CollectionPoint;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Insertion-ordered, thread-safe bin store. Readers get snapshot copies.
 */
@Repository
public class InMemoryCollectionPointRepository implements CollectionPointRepository {
    
    private final Map<String, CollectionPoint> points = new LinkedHashMap<>();
    
    @Override
    public synchronized List<CollectionPoint> findAll() {
        return new ArrayList<>(points.values());
    }
    
    @Override
    public synchronized List<CollectionPoint> findByAreaId(String areaId) {
        return points.values().stream()
                .filter(point -> Objects.equals(areaId, point.getAreaId()))
                .collect(Collectors.toList());
    }
    
    @Override
    public synchronized Optional<CollectionPoint> findById(String id) {
        return Optional.ofNullable(points.get(id));
    }
    
    @Override
    public synchronized Optional<CollectionPoint> save(CollectionPoint point) {
        Objects.requireNonNull(point.getId(), "Bin ID is required");
        return Optional.ofNullable(points.put(point.getId(), point));
    }
    
    @Override
    public synchronized boolean deleteById(String id) {
        return points.remove(id) != null;
    }
    
    @Override
    public synchronized long count() {
        return points.size();
    }
}
