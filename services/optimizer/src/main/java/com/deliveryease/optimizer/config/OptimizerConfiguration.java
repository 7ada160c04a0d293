// =============================================================================
// DeliveryEase - Optimizer Bean Configuration
// =============================================================================
package com.deliveryease.optimizer.config;

import com.deliveryease.optimizer.engine.RouteOptimizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the framework-free optimization engine into the application context.
 */
@Configuration
public class OptimizerConfiguration {

    private static final int PARENT_SEARCH_THREADS = 2;

    /**
     * Pool for the two parent searches of a dual-route run.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService routeSearchExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(PARENT_SEARCH_THREADS, runnable -> {
            Thread thread = new Thread(runnable, "route-search-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    public RouteOptimizer routeOptimizer(OptimizerProperties properties, ExecutorService routeSearchExecutor) {
        return new RouteOptimizer(
                properties.toCostModel(),
                properties.isParallelParents() ? routeSearchExecutor : null);
    }
}
