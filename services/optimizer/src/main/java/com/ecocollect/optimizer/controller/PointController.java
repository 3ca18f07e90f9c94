// =============================================================================
// EcoCollect - Point Controller
// =============================================================================
package com.ecocollect.optimizer.controller;

import com.ecocollect.optimizer.dto.PointRequest;
import com.ecocollect.optimizer.model.CollectionPoint;
import com.ecocollect.optimizer.repository.CollectionPointRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST controller for the bins that routes are built from.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/points")
@RequiredArgsConstructor
@Tag(name = "Collection Points", description = "Bin registry used by route optimization")
public class PointController {
    
    private final CollectionPointRepository repository;
    
    @GetMapping
    @Operation(summary = "List bins", description = "Lists all bins, optionally restricted to one area")
    public List<CollectionPoint> list(@RequestParam(required = false) String areaId) {
        if (areaId == null || areaId.isBlank()) {
            return repository.findAll();
        }
        return repository.findByAreaId(areaId.trim());
    }
    
    @GetMapping("/{binId}")
    @Operation(summary = "Get bin")
    public CollectionPoint get(@PathVariable String binId) {
        return repository.findById(binId)
                .orElseThrow(() -> notFound(binId));
    }
    
    @PutMapping("/{binId}")
    @Operation(summary = "Create or replace bin")
    public ResponseEntity<CollectionPoint> upsert(
            @PathVariable String binId,
            @Valid @RequestBody PointRequest request) {
        
        CollectionPoint saved = CollectionPoint.builder()
                .id(binId)
                .location(request.getLocation())
                .category(request.getCategory())
                .latitude(request.getLatitude())
                .longitude(request.getLongitude())
                .areaId(request.getAreaId())
                .build();
        boolean exists = repository.save(saved).isPresent();
        
        log.info("Bin {}: binId={}, areaId={}", exists ? "updated" : "created", binId, saved.getAreaId());
        return ResponseEntity.status(exists ? HttpStatus.OK : HttpStatus.CREATED).body(saved);
    }
    
    @DeleteMapping("/{binId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Delete bin")
    public void delete(@PathVariable String binId) {
        if (!repository.deleteById(binId)) {
            throw notFound(binId);
        }
        log.info("Bin deleted: binId={}", binId);
    }
    
    private static ResponseStatusException notFound(String binId) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Bin not found: " + binId);
    }
}
