// =============================================================================
// EcoCollect - Optimizer Configuration Properties
// =============================================================================
package com.ecocollect.optimizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the optimizer service.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {
    
    /**
     * Maximum number of routable points accepted in one optimization.
     * Tour construction is quadratic in this number.
     */
    private int maxPoints = 1000;
    
    /**
     * Startup seeding of the point store.
     */
    private Seed seed = new Seed();
    
    @Data
    public static class Seed {
        
        /**
         * Whether sample bins are loaded at startup.
         */
        private boolean enabled = true;
        
        /**
         * Resource holding a JSON array of bins.
         */
        private String location = "classpath:seed/bins.json";
    }
}
