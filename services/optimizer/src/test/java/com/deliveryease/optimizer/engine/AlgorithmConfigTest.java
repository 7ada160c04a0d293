// =============================================================================
// DeliveryEase - Algorithm Configuration Tests
// =============================================================================
package com.deliveryease.optimizer.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AlgorithmConfig Tests")
class AlgorithmConfigTest {

    @Test
    @DisplayName("Defaults match the documented values")
    void testDefaults() {
        AlgorithmConfig config = AlgorithmConfig.defaults();

        assertEquals(100, config.getPopulationSize());
        assertEquals(500, config.getMaxGenerations());
        assertEquals(0.02, config.getMutationRate());
        assertEquals(1.0, config.getCrossoverRate());
        assertEquals(10, config.getEliteCount());
        assertEquals(0.001, config.getConvergenceThreshold());
        assertTrue(config.isDualRouteComparison());
        assertEquals(50, config.getStagnationLimit());
        assertEquals(5, config.getTournamentSize());
        assertEquals(10, config.getRefinementIterations());
        assertNull(config.getSeedLabel());
        assertNull(config.getRandomSeed());
        assertSame(config, config.validate());
    }

    @Test
    @DisplayName("Out-of-range values are rejected")
    void testValidation() {
        assertInvalid(AlgorithmConfig.builder().populationSize(1).build());
        assertInvalid(AlgorithmConfig.builder().maxGenerations(-1).build());
        assertInvalid(AlgorithmConfig.builder().mutationRate(-0.1).build());
        assertInvalid(AlgorithmConfig.builder().mutationRate(Double.NaN).build());
        assertInvalid(AlgorithmConfig.builder().crossoverRate(1.01).build());
        assertInvalid(AlgorithmConfig.builder().eliteCount(101).build());
        assertInvalid(AlgorithmConfig.builder().eliteCount(-1).build());
        assertInvalid(AlgorithmConfig.builder().convergenceThreshold(-0.5).build());
        assertInvalid(AlgorithmConfig.builder().tournamentSize(0).build());
        assertInvalid(AlgorithmConfig.builder().refinementIterations(-1).build());
    }

    @Test
    @DisplayName("Boundary values are accepted")
    void testBoundaries() {
        assertDoesNotThrow(() -> AlgorithmConfig.builder()
                .populationSize(2)
                .maxGenerations(0)
                .mutationRate(0.0)
                .crossoverRate(1.0)
                .eliteCount(2)
                .convergenceThreshold(0.0)
                .stagnationLimit(0)
                .tournamentSize(1)
                .refinementIterations(0)
                .build()
                .validate());
    }

    private static void assertInvalid(AlgorithmConfig config) {
        RouteOptimizationException ex = assertThrows(RouteOptimizationException.class, config::validate);
        assertEquals(RouteOptimizationException.REASON_INVALID_CONFIG, ex.getReasonCode());
        assertTrue(ex.getMessage().startsWith("[INVALID_ALGORITHM_CONFIG]"));
    }
}
