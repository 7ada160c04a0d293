// =============================================================================
// DeliveryEase - Route Controller
// =============================================================================
package com.deliveryease.optimizer.controller;

import com.deliveryease.optimizer.dto.RoutePlanRequest;
import com.deliveryease.optimizer.dto.RoutePlanResponse;
import com.deliveryease.optimizer.engine.RouteOptimizationException;
import com.deliveryease.optimizer.service.RouteOptimizerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for route optimization endpoints.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/routes")
@RequiredArgsConstructor
@Tag(name = "Route Optimization", description = "Genetic delivery route planning endpoints")
public class RouteController {

    private final RouteOptimizerService optimizerService;

    /**
     * Plan a route from the depot.
     *
     * @param request Route plan request with stops and optional overrides
     * @return Route plan with stops in delivery order
     */
    @PostMapping("/optimize/depot")
    @Operation(
            summary = "Plan route from depot",
            description = "Orders a delivery batch into a round trip from the depot using a genetic algorithm"
    )
    public ResponseEntity<RoutePlanResponse> planFromDepot(
            @Valid @RequestBody RoutePlanRequest request) {

        log.info("Depot route plan request: stops={}", request.getStops().size());

        return ResponseEntity.ok(optimizerService.planFromDepot(request));
    }

    /**
     * Re-plan a route from the driver's live position.
     *
     * @param request Route plan request with stops and the current position
     * @return Route plan with the stop nearest the driver first
     */
    @PostMapping("/optimize/current-position")
    @Operation(
            summary = "Re-plan route from current position",
            description = "Orders the remaining stops starting at the driver's live position, returning to the depot"
    )
    public ResponseEntity<RoutePlanResponse> planFromCurrentPosition(
            @Valid @RequestBody RoutePlanRequest request) {

        log.info("Current-position route plan request: stops={}", request.getStops().size());

        return ResponseEntity.ok(optimizerService.planFromCurrentPosition(request));
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
     * Map optimizer contract failures to 400 responses; a failed search is a 500.
     */
    @ExceptionHandler(RouteOptimizationException.class)
    public ResponseEntity<ProblemDetail> handleOptimizationError(RouteOptimizationException ex) {
        HttpStatus status;
        if (RouteOptimizationException.REASON_SEARCH_FAILED.equals(ex.getReasonCode())) {
            log.error("Route optimization failed: {}", ex.getMessage(), ex);
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        } else {
            log.warn("Rejected route plan request: {}", ex.getMessage());
            status = HttpStatus.BAD_REQUEST;
        }
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(status == HttpStatus.BAD_REQUEST ? "Invalid route plan request" : "Route optimization failed");
        problem.setProperty("reasonCode", ex.getReasonCode());
        return ResponseEntity.status(status).body(problem);
    }

    /**
     * Simple health response.
     */
    public record HealthResponse(String status, String message) {}
}
