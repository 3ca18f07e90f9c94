// =============================================================================
// EcoCollect - Sample Bin Seeder
// =============================================================================
package com.ecocollect.optimizer.service;

import com.ecocollect.optimizer.config.OptimizerProperties;
import com.ecocollect.optimizer.model.CollectionPoint;
import com.ecocollect.optimizer.repository.CollectionPointRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Upserts the sample bins from {@code optimizer.seed.location} at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PointSeeder implements ApplicationRunner {
    
    private static final TypeReference<List<CollectionPoint>> BIN_LIST = new TypeReference<>() {};
    
    private final OptimizerProperties properties;
    private final CollectionPointRepository repository;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    
    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getSeed().isEnabled()) {
            log.info("Bin seeding disabled");
            return;
        }
        
        String location = properties.getSeed().getLocation();
        int seeded = seed(resourceLoader.getResource(location));
        log.info("Seeded bins: count={}, source={}", seeded, location);
    }
    
    /**
     * Read a JSON array of bins and upsert each one.
     *
     * @return number of bins written
     */
    int seed(Resource resource) {
        List<CollectionPoint> bins;
        try (InputStream in = resource.getInputStream()) {
            bins = objectMapper.readValue(in, BIN_LIST);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bin seed " + resource.getDescription(), e);
        }
        
        int seeded = 0;
        for (CollectionPoint bin : bins) {
            if (bin.getId() == null || bin.getId().isBlank()) {
                log.warn("Skipping seed entry without binId: location={}", bin.getLocation());
                continue;
            }
            repository.save(bin);
            log.debug("Created/updated bin: binId={}, location={}", bin.getId(), bin.getLocation());
            seeded++;
        }
        return seeded;
    }
}
