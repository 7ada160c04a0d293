// =============================================================================
// DeliveryEase - Dual Route Comparator
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.RouteComparison;
import com.deliveryease.optimizer.model.RouteComparison.CrossoverSummary;
import com.deliveryease.optimizer.model.RouteComparison.ParentRoute;
import com.deliveryease.optimizer.model.SelectedRoute;
import com.deliveryease.optimizer.model.Stop;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.SplittableRandom;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs two asymmetrically configured searches, recombines their winners
 * with a bounded number of order crossovers and keeps the shortest route.
 */
@Slf4j
public class DualRouteComparator {

    static final String ROUTE_A_SEED = "route_a";
    static final String ROUTE_B_SEED = "route_b";

    private static final int MIN_POPULATION = 2;
    private static final double REFINEMENT_CROSSOVER_RATE = 1.0;

    private final RouteEvaluator evaluator;
    private final AlgorithmConfig baseConfig;
    private final SplittableRandom random;
    private final CancellationToken cancellation;
    private final Executor executor;

    /**
     * @param executor runs the two parent searches concurrently; when null
     *                 they run one after the other on the calling thread
     */
    public DualRouteComparator(RouteEvaluator evaluator,
                               AlgorithmConfig baseConfig,
                               SplittableRandom random,
                               CancellationToken cancellation,
                               Executor executor) {
        this.evaluator = evaluator;
        this.baseConfig = baseConfig.validate();
        this.random = random;
        this.cancellation = cancellation;
        this.executor = executor;
    }

    /**
     * Parent A: smaller population, calmer mutation.
     */
    static AlgorithmConfig parentAConfig(AlgorithmConfig base) {
        int population = Math.max(MIN_POPULATION, (int) Math.floor(base.getPopulationSize() * 0.8));
        return base.toBuilder()
                .populationSize(population)
                .mutationRate(base.getMutationRate() * 0.8)
                .eliteCount(Math.min(base.getEliteCount(), population))
                .seedLabel(ROUTE_A_SEED)
                .build();
    }

    /**
     * Parent B: larger population, livelier mutation, slightly less crossover.
     */
    static AlgorithmConfig parentBConfig(AlgorithmConfig base) {
        int population = Math.max(MIN_POPULATION, (int) Math.floor(base.getPopulationSize() * 1.2));
        return base.toBuilder()
                .populationSize(population)
                .mutationRate(Math.min(1.0, base.getMutationRate() * 1.2))
                .crossoverRate(base.getCrossoverRate() * 0.9)
                .eliteCount(Math.min(base.getEliteCount(), population))
                .seedLabel(ROUTE_B_SEED)
                .build();
    }

    public DualRouteOutcome run(List<Stop> stops) {
        AlgorithmConfig configA = parentAConfig(baseConfig);
        AlgorithmConfig configB = parentBConfig(baseConfig);
        SplittableRandom randomA = random.split();
        SplittableRandom randomB = random.split();

        SearchResult routeA;
        SearchResult routeB;
        if (executor == null) {
            routeA = search(configA, randomA, cancellation, stops);
            routeB = search(configB, randomB, cancellation, stops);
        } else {
            // a failed parent stops its sibling at the next generation
            CancellationToken.Flag abort = CancellationToken.flag();
            CancellationToken parentToken = () ->
                    abort.isCancellationRequested() || cancellation.isCancellationRequested();
            CompletableFuture<SearchResult> futureA = CompletableFuture
                    .supplyAsync(() -> search(configA, randomA, parentToken, stops), executor)
                    .whenComplete((result, error) -> abortOnFailure(abort, error));
            CompletableFuture<SearchResult> futureB = CompletableFuture
                    .supplyAsync(() -> search(configB, randomB, parentToken, stops), executor)
                    .whenComplete((result, error) -> abortOnFailure(abort, error));
            await(CompletableFuture.allOf(futureA, futureB));
            routeA = futureA.join();
            routeB = futureB.join();
        }
        return compare(routeA, routeB);
    }

    /**
     * Refines between the two parent routes and picks the shortest of
     * parent A, parent B and the refined route. Parent B stays fixed while
     * the running best evolves. Parent A wins only when strictly shorter.
     */
    DualRouteOutcome compare(SearchResult routeA, SearchResult routeB) {
        RouteScore scoreA = evaluator.score(routeA.getRoute());
        RouteScore scoreB = evaluator.score(routeB.getRoute());

        log.debug("Parent routes: A={}km (fitness {}), B={}km (fitness {})",
                format(scoreA.getDistanceKm()), format(scoreA.getFitness()),
                format(scoreB.getDistanceKm()), format(scoreB.getFitness()));

        GeneticOperators operators = new GeneticOperators(random);
        List<Stop> refined = routeA.getRoute();
        RouteScore refinedScore = scoreA;
        int iterations = baseConfig.getRefinementIterations();

        for (int iteration = 1; iteration <= iterations; iteration++) {
            List<Stop> offspring = operators.orderCrossover(refined, routeB.getRoute(), REFINEMENT_CROSSOVER_RATE);
            RouteScore offspringScore = evaluator.score(offspring);
            if (offspringScore.getDistanceKm() < refinedScore.getDistanceKm()) {
                refined = List.copyOf(offspring);
                refinedScore = offspringScore;
                log.debug("Crossover iteration {}/{}: new best {}km",
                        iteration, iterations, format(refinedScore.getDistanceKm()));
            } else {
                log.debug("Crossover iteration {}/{}: offspring {}km, no improvement",
                        iteration, iterations, format(offspringScore.getDistanceKm()));
            }
        }

        double parentBest = Math.min(scoreA.getDistanceKm(), scoreB.getDistanceKm());
        SelectedRoute selected;
        List<Stop> route;
        RouteScore chosen;
        if (refinedScore.getDistanceKm() < parentBest) {
            selected = SelectedRoute.CROSSOVER;
            route = refined;
            chosen = refinedScore;
        } else if (scoreA.getDistanceKm() < scoreB.getDistanceKm()) {
            selected = SelectedRoute.A;
            route = routeA.getRoute();
            chosen = scoreA;
        } else {
            selected = SelectedRoute.B;
            route = routeB.getRoute();
            chosen = scoreB;
        }

        RouteComparison comparison = RouteComparison.builder()
                .routeA(parent(routeA, scoreA))
                .routeB(parent(routeB, scoreB))
                .selectedRoute(selected)
                .distanceImprovement(Math.max(0.0, parentBest - chosen.getDistanceKm()))
                .fitnessImprovement(chosen.getFitness() - Math.max(scoreA.getFitness(), scoreB.getFitness()))
                .crossover(CrossoverSummary.builder()
                        .iterations(iterations)
                        .finalDistanceKm(refinedScore.getDistanceKm())
                        .finalFitness(refinedScore.getFitness())
                        .improvedFromParents(selected == SelectedRoute.CROSSOVER)
                        .build())
                .build();

        return new DualRouteOutcome(
                route,
                chosen.getDistanceKm(),
                chosen.getFitness(),
                Math.max(routeA.getGenerationCount(), routeB.getGenerationCount()),
                comparison,
                routeA.isCancelled() || routeB.isCancelled());
    }

    private SearchResult search(AlgorithmConfig config,
                                SplittableRandom parentRandom,
                                CancellationToken token,
                                List<Stop> stops) {
        return new GeneticSearch(evaluator, config, parentRandom, token).run(stops);
    }

    private static void abortOnFailure(CancellationToken.Flag abort, Throwable error) {
        if (error != null) {
            abort.cancel();
        }
    }

    /**
     * Waits for both parents; the first failure is rethrown once neither is running.
     */
    private static void await(CompletableFuture<Void> parents) {
        try {
            parents.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new RouteOptimizationException(
                    RouteOptimizationException.REASON_SEARCH_FAILED, "parent search failed", e.getCause());
        }
    }

    private static ParentRoute parent(SearchResult result, RouteScore score) {
        return ParentRoute.builder()
                .stops(result.getRoute())
                .totalDistanceKm(score.getDistanceKm())
                .fitnessScore(score.getFitness())
                .generationCount(result.getGenerationCount())
                .build();
    }

    private static String format(double value) {
        return String.format("%.2f", value);
    }
}
