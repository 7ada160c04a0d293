// =============================================================================
// DeliveryEase - Genetic Search Loop
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.Stop;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * One genetic search over a fixed set of stops: seed, then evolve with
 * elitism, tournament selection, order crossover and swap mutation until the
 * best distance stagnates, the generation cap is hit, or cancellation is
 * requested.
 */
@Slf4j
public class GeneticSearch {

    private static final int PROGRESS_LOG_INTERVAL = 100;

    private final RouteEvaluator evaluator;
    private final AlgorithmConfig config;
    private final CancellationToken cancellation;
    private final PopulationSeeder seeder;
    private final GeneticOperators operators;

    public GeneticSearch(RouteEvaluator evaluator,
                         AlgorithmConfig config,
                         RandomGenerator random,
                         CancellationToken cancellation) {
        this.evaluator = evaluator;
        this.config = config.validate();
        this.cancellation = cancellation;
        this.seeder = new PopulationSeeder(evaluator, random);
        this.operators = new GeneticOperators(random);
    }

    /**
     * Runs the search and returns the fittest route of the last population.
     */
    public SearchResult run(List<Stop> stops) {
        List<List<Stop>> population = seeder.seed(stops, config);
        double bestDistance = Double.POSITIVE_INFINITY;
        int stagnation = 0;
        TerminationReason reason = TerminationReason.GENERATION_LIMIT;

        int generation;
        for (generation = 0; generation < config.getMaxGenerations(); generation++) {
            if (cancellation.isCancellationRequested()) {
                reason = TerminationReason.CANCELLED;
                log.debug("Search cancelled: seed={}, generation={}, bestDistance={}km",
                        config.getSeedLabel(), generation, format(bestDistance));
                break;
            }

            RouteScore[] scores = evaluate(population);
            double currentBest = Double.POSITIVE_INFINITY;
            for (RouteScore score : scores) {
                currentBest = Math.min(currentBest, score.getDistanceKm());
            }

            if (Math.abs(bestDistance - currentBest) < config.getConvergenceThreshold()) {
                stagnation++;
            } else {
                stagnation = 0;
                bestDistance = currentBest;
            }

            if (stagnation > config.getStagnationLimit()) {
                reason = TerminationReason.CONVERGED;
                log.debug("Search converged: seed={}, generation={}, bestDistance={}km",
                        config.getSeedLabel(), generation, format(bestDistance));
                break;
            }

            population = evolve(population, fitnessOf(scores));

            if (generation % PROGRESS_LOG_INTERVAL == 0) {
                log.debug("Generation {}: seed={}, bestDistance={}km",
                        generation, config.getSeedLabel(), format(bestDistance));
            }
        }

        RouteScore[] finalScores = evaluate(population);
        int fittest = 0;
        for (int i = 1; i < finalScores.length; i++) {
            if (finalScores[i].getFitness() > finalScores[fittest].getFitness()) {
                fittest = i;
            }
        }

        return new SearchResult(
                List.copyOf(population.get(fittest)),
                generation,
                finalScores[fittest].getDistanceKm(),
                reason);
    }

    /**
     * Next generation: elites carried over verbatim, the rest bred from
     * tournament winners.
     */
    List<List<Stop>> evolve(List<List<Stop>> population, double[] fitness) {
        int size = config.getPopulationSize();
        List<List<Stop>> next = new ArrayList<>(size);

        Integer[] ranked = new Integer[population.size()];
        for (int i = 0; i < ranked.length; i++) {
            ranked[i] = i;
        }
        Arrays.sort(ranked, Comparator.comparingDouble((Integer i) -> fitness[i]).reversed());

        int elites = Math.min(config.getEliteCount(), ranked.length);
        for (int i = 0; i < elites; i++) {
            next.add(population.get(ranked[i]));
        }

        while (next.size() < size) {
            List<Stop> parent1 = population.get(operators.tournamentSelect(fitness, config.getTournamentSize()));
            List<Stop> parent2 = population.get(operators.tournamentSelect(fitness, config.getTournamentSize()));
            List<Stop> offspring = operators.orderCrossover(parent1, parent2, config.getCrossoverRate());
            next.add(operators.swapMutation(offspring, config.getMutationRate()));
        }
        return next;
    }

    private RouteScore[] evaluate(List<List<Stop>> population) {
        RouteScore[] scores = new RouteScore[population.size()];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = evaluator.score(population.get(i));
        }
        return scores;
    }

    private static double[] fitnessOf(RouteScore[] scores) {
        double[] fitness = new double[scores.length];
        for (int i = 0; i < scores.length; i++) {
            fitness[i] = scores[i].getFitness();
        }
        return fitness;
    }

    private static String format(double km) {
        return String.format("%.2f", km);
    }
}
