// =============================================================================
// EcoCollect - Route Controller
// =============================================================================
package com.ecocollect.optimizer.controller;

import com.ecocollect.optimizer.dto.RouteOptimizeRequest;
import com.ecocollect.optimizer.dto.RouteOptimizeResponse;
import com.ecocollect.optimizer.service.RouteOptimizerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for route optimization endpoints.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/routes")
@RequiredArgsConstructor
@Tag(name = "Route Optimization", description = "Collection route planning endpoints")
public class RouteController {
    
    private final RouteOptimizerService optimizerService;
    
    /**
     * Generate an optimized collection route.
     *
     * @param request optional area filter; omitted body means all bins
     * @return bins in visiting order, numbered from 1
     */
    @PostMapping("/optimize")
    @Operation(
            summary = "Optimize collection route",
            description = "Orders the bins of an area with a nearest-neighbour heuristic"
    )
    public ResponseEntity<RouteOptimizeResponse> optimize(
            @Valid @RequestBody(required = false) RouteOptimizeRequest request) {
        
        String areaId = request != null ? request.getAreaId() : null;
        log.info("Route optimize request: areaId={}", areaId);
        
        return ResponseEntity.ok(optimizerService.optimize(areaId));
    }
    
    /**
     * Health check endpoint.
     *
     * @return Health status
     */
    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Check optimizer service health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("healthy", "Optimizer service is running"));
    }
    
    /**
     * Simple health response.
     */
    public record HealthResponse(String status, String message) {}
}
