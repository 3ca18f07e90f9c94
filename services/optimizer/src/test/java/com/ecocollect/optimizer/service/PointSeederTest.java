package com.ecocollect.optimizer.service;

import com.ecocollect.optimizer.config.OptimizerProperties;
import com.ecocollect.optimizer.model.CollectionPoint;
import com.ecocollect.optimizer.repository.InMemoryCollectionPointRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.UncheckedIOException;
import java.util.List;

import static com.ecocollect.optimizer.testutil.TestPoints.ids;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PointSeederTest {
    
    private OptimizerProperties properties;
    private InMemoryCollectionPointRepository repository;
    private PointSeeder seeder;
    
    @BeforeEach
    void setUp() {
        properties = new OptimizerProperties();
        repository = new InMemoryCollectionPointRepository();
        seeder = new PointSeeder(properties, repository, new DefaultResourceLoader(), new ObjectMapper());
    }
    
    @Test
    @DisplayName("Seed file entries are stored, entries without binId are skipped")
    void testSeedFromResource() {
        int seeded = seeder.seed(new ClassPathResource("seed/mixed-bins.json"));
        
        assertEquals(3, seeded);
        assertEquals(List.of("T-1", "T-2", "T-3"), ids(repository.findAll()));
        
        CollectionPoint unmapped = repository.findById("T-2").orElseThrow();
        assertNull(unmapped.getLatitude());
        assertFalse(unmapped.isRoutable());
        assertEquals("NORTH", unmapped.getAreaId());
    }
    
    @Test
    @DisplayName("Default seed loads the sample bins on startup")
    void testRunLoadsConfiguredLocation() {
        seeder.run(new DefaultApplicationArguments());
        
        assertEquals(8, repository.count());
        assertEquals(2, repository.findByAreaId("DEHIWALA").size());
    }
    
    @Test
    @DisplayName("Disabled seeding leaves the store empty")
    void testDisabled() {
        properties.getSeed().setEnabled(false);
        
        seeder.run(new DefaultApplicationArguments());
        
        assertEquals(0, repository.count());
    }
    
    @Test
    @DisplayName("Missing seed file fails startup")
    void testMissingResource() {
        properties.getSeed().setLocation("classpath:seed/does-not-exist.json");
        
        assertThrows(UncheckedIOException.class, () -> seeder.run(new DefaultApplicationArguments()));
    }
}
