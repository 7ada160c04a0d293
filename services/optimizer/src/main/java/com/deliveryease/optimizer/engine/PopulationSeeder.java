// =============================================================================
// DeliveryEase - Initial Population Seeder
// =============================================================================
package com.deliveryease.optimizer.engine;

import com.deliveryease.optimizer.model.Stop;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SplittableRandom;
import java.util.TreeMap;
import java.util.random.RandomGenerator;

/**
 * Builds the first generation of a search from a mix of constructive
 * heuristics and shuffles. Every strategy leans towards opening the route
 * with the stop nearest the start.
 */
public class PopulationSeeder {

    static final int CONSTRUCTIVE_ROUTES = 1;
    static final int LOOKAHEAD_ROUTES = 14;
    static final int PRIORITY_ROUTES = 5;
    static final int SEEDED_ROUTES = 5;

    static final double SEEDED_NEAREST_FIRST_PROBABILITY = 0.8;
    static final double RANDOM_NEAREST_FIRST_PROBABILITY = 0.7;

    private static final double CONSTRUCTIVE_RETURN_WEIGHT = 0.3;
    private static final double LOOKAHEAD_WEIGHT = 0.3;
    private static final double LOOKAHEAD_RETURN_WEIGHT = 0.5;
    private static final int CLOSING_STOPS = 2;
    private static final long SEED_MIX = 0x9E3779B97F4A7C15L;

    private final RouteEvaluator evaluator;
    private final RandomGenerator random;

    public PopulationSeeder(RouteEvaluator evaluator, RandomGenerator random) {
        this.evaluator = evaluator;
        this.random = random;
    }

    /**
     * Creates {@code config.populationSize} routes over {@code stops}.
     * Seeded shuffles are only produced when the config carries a seed label.
     */
    public List<List<Stop>> seed(List<Stop> stops, AlgorithmConfig config) {
        int size = config.getPopulationSize();
        List<List<Stop>> population = new ArrayList<>(size);

        int seededRoutes = config.getSeedLabel() != null ? SEEDED_ROUTES : 0;
        int constructiveEnd = CONSTRUCTIVE_ROUTES;
        int lookaheadEnd = constructiveEnd + LOOKAHEAD_ROUTES;
        int priorityEnd = lookaheadEnd + PRIORITY_ROUTES;
        int seededEnd = priorityEnd + seededRoutes;

        for (int i = 0; i < size; i++) {
            if (i < constructiveEnd) {
                population.add(constructiveRoute(stops));
            } else if (i < lookaheadEnd) {
                population.add(lookaheadRoute(stops));
            } else if (i < priorityEnd) {
                population.add(priorityRoute(stops));
            } else if (i < seededEnd) {
                population.add(seededRoute(stops, config.getSeedLabel(), i));
            } else {
                population.add(randomRoute(stops));
            }
        }
        return population;
    }

    /**
     * Greedy nearest neighbour that, for the last two picks, also weighs the
     * distance back to the depot.
     */
    List<Stop> constructiveRoute(List<Stop> stops) {
        List<Stop> remaining = new ArrayList<>(stops);
        List<Stop> route = new ArrayList<>(stops.size());
        if (remaining.isEmpty()) {
            return route;
        }
        Stop current = remaining.remove(evaluator.nearestToStartIndex(remaining));
        route.add(current);

        while (!remaining.isEmpty()) {
            boolean closing = remaining.size() <= CLOSING_STOPS;
            int bestIndex = 0;
            double bestScore = Double.POSITIVE_INFINITY;
            for (int i = 0; i < remaining.size(); i++) {
                Stop candidate = remaining.get(i);
                double score = evaluator.distance(current, candidate);
                if (closing) {
                    score += CONSTRUCTIVE_RETURN_WEIGHT * evaluator.returnDistance(candidate);
                }
                if (score < bestScore) {
                    bestScore = score;
                    bestIndex = i;
                }
            }
            current = remaining.remove(bestIndex);
            route.add(current);
        }
        return route;
    }

    /**
     * Nearest neighbour with one step of lookahead: a candidate is cheaper
     * when it leaves a short hop to some other remaining stop.
     */
    List<Stop> lookaheadRoute(List<Stop> stops) {
        List<Stop> remaining = new ArrayList<>(stops);
        List<Stop> route = new ArrayList<>(stops.size());
        if (remaining.isEmpty()) {
            return route;
        }
        Stop current = remaining.remove(evaluator.nearestToStartIndex(remaining));
        route.add(current);

        while (!remaining.isEmpty()) {
            boolean closing = remaining.size() <= CLOSING_STOPS;
            int bestIndex = 0;
            double bestScore = Double.POSITIVE_INFINITY;
            for (int i = 0; i < remaining.size(); i++) {
                Stop candidate = remaining.get(i);
                double score = evaluator.distance(current, candidate)
                        + LOOKAHEAD_WEIGHT * nextHop(candidate, remaining);
                if (closing) {
                    score += LOOKAHEAD_RETURN_WEIGHT * evaluator.returnDistance(candidate);
                }
                if (score < bestScore) {
                    bestScore = score;
                    bestIndex = i;
                }
            }
            current = remaining.remove(bestIndex);
            route.add(current);
        }
        return route;
    }

    /**
     * Opens with the nearest stop, then walks priority tiers from highest to
     * lowest using nearest neighbour inside each tier.
     */
    List<Stop> priorityRoute(List<Stop> stops) {
        List<Stop> route = new ArrayList<>(stops.size());
        if (stops.isEmpty()) {
            return route;
        }
        List<Stop> remaining = new ArrayList<>(stops);
        Stop current = remaining.remove(evaluator.nearestToStartIndex(remaining));
        route.add(current);

        TreeMap<Integer, List<Stop>> tiers = new TreeMap<>();
        for (Stop stop : remaining) {
            tiers.computeIfAbsent(stop.effectivePriority(), p -> new ArrayList<>()).add(stop);
        }
        for (List<Stop> tier : tiers.values()) {
            while (!tier.isEmpty()) {
                int nearest = 0;
                double nearestDistance = Double.POSITIVE_INFINITY;
                for (int i = 0; i < tier.size(); i++) {
                    double d = evaluator.distance(current, tier.get(i));
                    if (d < nearestDistance) {
                        nearestDistance = d;
                        nearest = i;
                    }
                }
                current = tier.remove(nearest);
                route.add(current);
            }
        }
        return route;
    }

    /**
     * Reproducible shuffle driven by the seed label and slot index, so two
     * searches with different labels start from decorrelated pools.
     */
    List<Stop> seededRoute(List<Stop> stops, String seedLabel, int index) {
        SplittableRandom seeded = new SplittableRandom(seedLabel.hashCode() * SEED_MIX + index);
        return biasedShuffle(stops, seeded, SEEDED_NEAREST_FIRST_PROBABILITY);
    }

    List<Stop> randomRoute(List<Stop> stops) {
        return biasedShuffle(stops, random, RANDOM_NEAREST_FIRST_PROBABILITY);
    }

    private List<Stop> biasedShuffle(List<Stop> stops, RandomGenerator generator, double nearestFirstProbability) {
        List<Stop> route = new ArrayList<>(stops);
        if (route.size() < 2) {
            return route;
        }
        if (generator.nextDouble() < nearestFirstProbability) {
            Collections.swap(route, 0, evaluator.nearestToStartIndex(route));
            shuffle(route, 1, generator);
        } else {
            shuffle(route, 0, generator);
        }
        return route;
    }

    /**
     * Fisher-Yates over positions {@code from} to the end.
     */
    private static void shuffle(List<Stop> route, int from, RandomGenerator generator) {
        for (int i = route.size() - 1; i > from; i--) {
            int j = from + generator.nextInt(i - from + 1);
            Collections.swap(route, i, j);
        }
    }

    private double nextHop(Stop candidate, List<Stop> remaining) {
        double min = Double.POSITIVE_INFINITY;
        for (Stop other : remaining) {
            if (other != candidate) {
                min = Math.min(min, evaluator.distance(candidate, other));
            }
        }
        return Double.isInfinite(min) ? 0.0 : min;
    }
}
