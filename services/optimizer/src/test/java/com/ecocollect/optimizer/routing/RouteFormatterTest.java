package com.ecocollect.optimizer.routing;

import com.ecocollect.optimizer.dto.RouteStop;
import com.ecocollect.optimizer.model.CollectionPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ecocollect.optimizer.testutil.TestPoints.point;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RouteFormatterTest {
    
    private final RouteFormatter formatter = new RouteFormatter();
    
    @Test
    @DisplayName("Stops are numbered from 1 in tour order")
    void testOrderNumbering() {
        List<CollectionPoint> tour = List.of(
                point("C", 2.0, 0.0),
                point("A", 0.0, 0.0),
                point("B", 1.0, 0.0));
        
        List<RouteStop> stops = formatter.format(tour);
        
        assertEquals(3, stops.size());
        for (int i = 0; i < stops.size(); i++) {
            assertEquals(i + 1, stops.get(i).getOrder());
            assertEquals(tour.get(i).getId(), stops.get(i).getBinId());
        }
    }
    
    @Test
    @DisplayName("Every point attribute is carried onto the stop")
    void testAttributesCopied() {
        CollectionPoint bin = CollectionPoint.builder()
                .id("BIN-006")
                .location("Dehiwala Zoo")
                .category("organic")
                .latitude(6.8566)
                .longitude(79.8779)
                .areaId("DEHIWALA")
                .build();
        
        RouteStop stop = formatter.format(List.of(bin)).get(0);
        
        assertEquals(1, stop.getOrder());
        assertEquals("BIN-006", stop.getBinId());
        assertEquals("Dehiwala Zoo", stop.getLocation());
        assertEquals("organic", stop.getCategory());
        assertEquals(6.8566, stop.getLatitude());
        assertEquals(79.8779, stop.getLongitude());
        assertEquals("DEHIWALA", stop.getAreaId());
    }
    
    @Test
    @DisplayName("Missing area stays missing")
    void testAbsentAreaId() {
        assertNull(formatter.format(List.of(point("A", 0.0, 0.0))).get(0).getAreaId());
    }
    
    @Test
    @DisplayName("Empty tour formats to no stops")
    void testEmptyTour() {
        assertTrue(formatter.format(List.of()).isEmpty());
    }
}
