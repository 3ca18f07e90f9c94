package com.ecocollect.optimizer.repository;

import com.ecocollect.optimizer.model.CollectionPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ecocollect.optimizer.testutil.TestPoints.ids;
import static com.ecocollect.optimizer.testutil.TestPoints.point;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryCollectionPointRepositoryTest {
    
    private InMemoryCollectionPointRepository repository;
    
    @BeforeEach
    void setUp() {
        repository = new InMemoryCollectionPointRepository();
        repository.save(point("B-1", 1.0, 1.0, "NORTH"));
        repository.save(point("B-2", 2.0, 2.0, "SOUTH"));
        repository.save(point("B-3", 3.0, 3.0, "NORTH"));
    }
    
    @Test
    @DisplayName("Listings follow insertion order")
    void testInsertionOrder() {
        assertEquals(List.of("B-1", "B-2", "B-3"), ids(repository.findAll()));
        assertEquals(List.of("B-1", "B-3"), ids(repository.findByAreaId("NORTH")));
        assertTrue(repository.findByAreaId("EAST").isEmpty());
    }
    
    @Test
    @DisplayName("Saving an existing ID replaces it in place")
    void testUpsertKeepsPosition() {
        repository.save(point("B-1", 9.0, 9.0, "SOUTH"));
        
        assertEquals(3, repository.count());
        assertEquals(List.of("B-1", "B-2", "B-3"), ids(repository.findAll()));
        assertEquals(9.0, repository.findById("B-1").orElseThrow().getLatitude());
        assertEquals(List.of("B-1", "B-2"), ids(repository.findByAreaId("SOUTH")));
    }
    
    @Test
    @DisplayName("Save returns the replaced bin, or nothing for a new ID")
    void testSaveReportsReplacement() {
        CollectionPoint original = repository.findById("B-2").orElseThrow();
        
        assertEquals(original, repository.save(point("B-2", 5.0, 5.0, "SOUTH")).orElseThrow());
        assertFalse(repository.save(point("B-9", 1.0, 1.0, "EAST")).isPresent());
        assertTrue(repository.save(point("B-9", 2.0, 2.0, "EAST")).isPresent());
    }
    
    @Test
    @DisplayName("Delete reports whether a bin was removed")
    void testDelete() {
        assertTrue(repository.deleteById("B-2"));
        assertFalse(repository.deleteById("B-2"));
        assertFalse(repository.findById("B-2").isPresent());
        assertEquals(2, repository.count());
    }
    
    @Test
    @DisplayName("Returned lists are snapshots")
    void testSnapshot() {
        List<CollectionPoint> snapshot = repository.findAll();
        repository.save(point("B-4", 4.0, 4.0, null));
        
        assertEquals(3, snapshot.size());
    }
    
    @Test
    @DisplayName("Bin without ID is rejected")
    void testRejectsMissingId() {
        assertThrows(NullPointerException.class,
                () -> repository.save(CollectionPoint.builder().location("nowhere").build()));
    }
}
